package com.automaker.core.events;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Event type names and factories for everything the engine publishes.
 */
public final class AutoModeEvents {

    public static final String STARTED = "auto_mode_started";
    public static final String STOPPED = "auto_mode_stopped";
    public static final String IDLE = "auto_mode_idle";
    public static final String FEATURE_START = "auto_mode_feature_start";
    public static final String PROGRESS = "auto_mode_progress";
    public static final String TOOL = "auto_mode_tool";
    public static final String PHASE = "auto_mode_phase";
    public static final String FEATURE_COMPLETE = "auto_mode_feature_complete";
    public static final String ERROR = "auto_mode_error";

    public static final String ERROR_TYPE_AUTHENTICATION = "authentication";
    public static final String ERROR_TYPE_CONFIGURATION = "configuration";
    public static final String ERROR_TYPE_EXECUTION = "execution";

    private AutoModeEvents() {}

    public static AutomakerEvent started(String projectPath, int maxConcurrency) {
        return of(STARTED, projectPath, null, Map.of(
                "message", "Auto mode started with max " + maxConcurrency + " concurrent features",
                "maxConcurrency", maxConcurrency));
    }

    public static AutomakerEvent stopped(String projectPath, int stillRunning) {
        return of(STOPPED, projectPath, null, Map.of(
                "message", "Auto mode stopped",
                "runningFeatures", stillRunning));
    }

    public static AutomakerEvent idle(String projectPath) {
        return of(IDLE, projectPath, null, Map.of(
                "message", "No pending features - auto mode idle"));
    }

    public static AutomakerEvent featureStart(String projectPath, String featureId, String title,
                                              String worktreePath, String branchName) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("title", title);
        if (worktreePath != null) payload.put("worktreePath", worktreePath);
        if (branchName != null) payload.put("branchName", branchName);
        return of(FEATURE_START, projectPath, featureId, payload);
    }

    public static AutomakerEvent progress(String projectPath, String featureId, String content) {
        return of(PROGRESS, projectPath, featureId, Map.of("content", content));
    }

    public static AutomakerEvent tool(String projectPath, String featureId, String toolName,
                                      Map<String, Object> input) {
        return of(TOOL, projectPath, featureId, Map.of(
                "tool", toolName,
                "input", input == null ? Map.of() : input));
    }

    public static AutomakerEvent phase(String projectPath, String featureId, String phase, String message) {
        return of(PHASE, projectPath, featureId, Map.of("phase", phase, "message", message));
    }

    public static AutomakerEvent featureComplete(String projectPath, String featureId,
                                                 boolean passes, String message) {
        return of(FEATURE_COMPLETE, projectPath, featureId, Map.of(
                "passes", passes,
                "message", message == null ? "" : message));
    }

    public static AutomakerEvent error(String projectPath, String featureId, String error, String errorType) {
        return of(ERROR, projectPath, featureId, Map.of(
                "error", error == null ? "Unknown error" : error,
                "errorType", errorType));
    }

    private static AutomakerEvent of(String type, String projectPath, String featureId,
                                     Map<String, Object> payload) {
        return new AutomakerEvent(type, projectPath, featureId, payload, Instant.now());
    }
}
