package com.automaker.core.provider;

/**
 * Vendor family a model id belongs to. Each family is served by exactly one provider.
 */
public enum ModelFamily {
    CLAUDE("claude"),
    CODEX("codex");

    private final String providerName;

    ModelFamily(String providerName) {
        this.providerName = providerName;
    }

    public String providerName() {
        return providerName;
    }
}
