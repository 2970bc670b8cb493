package com.automaker.core.context;

import com.automaker.core.model.AutomakerException;

/**
 * Thrown when feature metadata or a transcript cannot be read or written.
 */
public class ContextStoreException extends AutomakerException {

    public ContextStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
