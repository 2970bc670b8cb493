package com.automaker.core.model;

/**
 * Outcome of one agent run for a feature.
 *
 * @param passes  true when the agent left the feature in a passing state
 * @param message short human-readable description
 * @param stopped true when the run was cancelled by the user; never an error
 */
public record RunResult(boolean passes, String message, boolean stopped) {

    public static final String STOPPED_MESSAGE = "stopped by user";

    public static RunResult passed(String message) {
        return new RunResult(true, message, false);
    }

    public static RunResult failed(String message) {
        return new RunResult(false, message, false);
    }

    public static RunResult cancelledByUser() {
        return new RunResult(false, STOPPED_MESSAGE, true);
    }
}
