package com.automaker.core.engine;

import com.automaker.core.context.FeatureContextStore;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureStatus;
import com.automaker.core.provider.StatusToolLauncher;
import com.automaker.core.state.FeatureStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The status tool agents call when they finish a feature.
 *
 * <p>Used by the stdio tool server, which the agent CLI calls directly, and by the runner, which
 * sees the same call in the agent's message stream; both write the same transition. A skip-tests
 * feature reported as verified is recorded as waiting_approval. Agents may not move a feature
 * back to backlog.
 */
public class FeatureStatusTool {

    private static final Logger log = LoggerFactory.getLogger(FeatureStatusTool.class);

    public static final String NAME = StatusToolLauncher.TOOL_NAME;

    public static final String DESCRIPTION = "Update the status of the feature you are working on. "
            + "Call this instead of editing feature files. If the feature has skipTests=true, verified is "
            + "recorded as waiting_approval for manual review. Always include a summary of what was done.";

    public static final String INPUT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "featureId": {"type": "string", "description": "The ID of the feature to update"},
                "status": {
                  "type": "string",
                  "enum": ["in_progress", "waiting_approval", "verified"],
                  "description": "The new status. verified becomes waiting_approval when skipTests=true."
                },
                "summary": {"type": "string", "description": "What was implemented and which files changed"}
              },
              "required": ["featureId", "status"]
            }
            """;

    private final FeatureContextStore store;

    public FeatureStatusTool(FeatureContextStore store) {
        this.store = store;
    }

    /**
     * Handles a tool call from outside the engine: the feature is looked up by the id in the
     * arguments.
     *
     * @return a one-line confirmation for the agent
     * @throws IllegalArgumentException when an argument is missing or invalid
     * @throws com.automaker.core.model.FeatureNotFoundException when no such feature exists
     */
    public String call(String projectPath, Map<String, Object> arguments) {
        Object featureId = arguments.get("featureId");
        if (featureId == null || featureId.toString().isBlank()) {
            throw new IllegalArgumentException("featureId is required");
        }
        Feature feature = store.loadFeature(projectPath, featureId.toString());
        return apply(projectPath, feature, arguments);
    }

    /**
     * Applies the requested status to {@code feature}.
     *
     * @throws IllegalArgumentException when the status is missing, unknown or backlog
     */
    public String apply(String projectPath, Feature feature, Map<String, Object> arguments) {
        Object rawStatus = arguments.get("status");
        if (rawStatus == null || rawStatus.toString().isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        FeatureStatus requested = FeatureStatus.fromValue(rawStatus.toString());
        if (requested == FeatureStatus.BACKLOG) {
            throw new IllegalArgumentException("agents may not move " + feature.id() + " back to backlog");
        }
        FeatureStatus effective = FeatureStateMachine.reportedStatus(feature, requested);
        Object summary = arguments.get("summary");
        store.updateFeatureStatus(projectPath, feature.id(), effective,
                summary == null ? null : summary.toString(), null);
        log.info("Agent set {} to {}", feature.id(), effective);

        String message = "Updated feature " + feature.id() + " to " + effective.value();
        if (effective != requested) {
            message += " (requested " + requested.value() + "; the feature skips automated tests)";
        }
        return message;
    }
}
