package com.automaker.core.model;

/**
 * Thrown when a feature id has no {@code feature.json} in the project.
 */
public class FeatureNotFoundException extends AutomakerException {

    public FeatureNotFoundException(String featureId) {
        super("Feature " + featureId + " not found");
    }
}
