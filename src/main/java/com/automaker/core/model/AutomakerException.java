package com.automaker.core.model;

/**
 * Base class for errors the engine surfaces to callers of the control surface.
 */
public class AutomakerException extends RuntimeException {

    public AutomakerException(String message) {
        super(message);
    }

    public AutomakerException(String message, Throwable cause) {
        super(message, cause);
    }
}
