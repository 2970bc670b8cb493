package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a feature as persisted in {@code feature.json}.
 * <p>
 * {@code pending} and {@code ready} are accepted on read as synonyms of {@code backlog};
 * writes always emit the canonical value.
 */
public enum FeatureStatus {
    BACKLOG("backlog"),
    IN_PROGRESS("in_progress"),
    WAITING_APPROVAL("waiting_approval"),
    VERIFIED("verified");

    private final String value;

    FeatureStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** True for statuses the auto-mode loop may pick up. */
    public boolean isPending() {
        return this == BACKLOG;
    }

    @JsonCreator
    public static FeatureStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return BACKLOG;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "backlog":
            case "pending":
            case "ready":
                return BACKLOG;
            case "in_progress":
                return IN_PROGRESS;
            case "waiting_approval":
                return WAITING_APPROVAL;
            case "verified":
                return VERIFIED;
            default:
                throw new IllegalArgumentException("Unknown feature status: " + raw);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
