package com.automaker.core.model;

/**
 * Thrown when the auto-mode loop is started while it is already running.
 */
public class AutoModeAlreadyRunningException extends AutomakerException {

    public AutoModeAlreadyRunningException(String projectPath) {
        super("Auto mode is already running for " + projectPath + "; stop it first");
    }
}
