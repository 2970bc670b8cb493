package com.automaker.core.provider;

import com.automaker.core.model.AutomakerException;

/**
 * The provider reported an error mid-stream or its process exited abnormally.
 */
public class AgentExecutionException extends AutomakerException {

    private final String errorType;

    public AgentExecutionException(String message, String errorType) {
        super(message);
        this.errorType = errorType;
    }

    /** "authentication" or "execution". */
    public String getErrorType() {
        return errorType;
    }
}
