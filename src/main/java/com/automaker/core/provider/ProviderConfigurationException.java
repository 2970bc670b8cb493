package com.automaker.core.provider;

import com.automaker.core.model.AutomakerException;

/**
 * Missing credentials, a missing CLI, an unknown model or a provider/model family mismatch.
 * Raised before any provider call where it can be detected.
 */
public class ProviderConfigurationException extends AutomakerException {

    public static final String AUTHENTICATION = "authentication";
    public static final String CONFIGURATION = "configuration";

    private final String errorType;

    public ProviderConfigurationException(String message, String errorType) {
        super(message);
        this.errorType = errorType;
    }

    public ProviderConfigurationException(String message, String errorType, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType;
    }
}
