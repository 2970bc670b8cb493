package com.automaker.core.model;

/**
 * Thrown when an operation would start a second execution for a feature that is already running.
 */
public class FeatureAlreadyRunningException extends AutomakerException {

    private final String featureId;

    public FeatureAlreadyRunningException(String featureId) {
        super("Feature " + featureId + " is already running");
        this.featureId = featureId;
    }

    public String getFeatureId() {
        return featureId;
    }
}
