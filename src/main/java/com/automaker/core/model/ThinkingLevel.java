package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Reasoning intensity requested for a feature, mapped to an extended-thinking token budget.
 */
public enum ThinkingLevel {
    NONE("none", null),
    LOW("low", 4_096),
    MEDIUM("medium", 16_384),
    HIGH("high", 65_536),
    ULTRATHINK("ultrathink", 262_144);

    private final String value;
    private final Integer budgetTokens;

    ThinkingLevel(String value, Integer budgetTokens) {
        this.value = value;
        this.budgetTokens = budgetTokens;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Token budget, or null when extended thinking is off. */
    public Integer budgetTokens() {
        return budgetTokens;
    }

    @JsonCreator
    public static ThinkingLevel fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ThinkingLevel level : values()) {
            if (level.value.equals(normalized)) {
                return level;
            }
        }
        return NONE;
    }
}
