package com.automaker.core.model;

/**
 * Thrown when a requested status change is not allowed from the feature's current status.
 */
public class InvalidTransitionException extends AutomakerException {

    public InvalidTransitionException(String featureId, FeatureStatus from, FeatureStatus to) {
        super("Feature %s cannot move from %s to %s".formatted(featureId, from, to));
    }
}
