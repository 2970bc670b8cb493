package com.automaker.core.provider;

/**
 * A model reference after alias expansion.
 *
 * @param requested the id or alias as written on the feature
 * @param modelId   the concrete model id passed to the provider
 * @param family    vendor family of {@code modelId}
 */
public record ResolvedModel(String requested, String modelId, ModelFamily family) {

    public boolean supportsThinking() {
        return family == ModelFamily.CLAUDE;
    }
}
