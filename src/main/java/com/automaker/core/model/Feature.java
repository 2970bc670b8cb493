package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A unit of work on the project backlog, read from {@code .automaker/features/<id>/feature.json}.
 * <p>
 * The record is a read view. Writes go through
 * {@link com.automaker.core.context.FeatureContextStore}, which patches the JSON document in place
 * so fields owned by other tools survive.
 *
 * @param id             stable identifier, also the feature directory name
 * @param category       free-text grouping shown on the board
 * @param description    what the feature should do
 * @param steps          ordered implementation or verification steps
 * @param status         current lifecycle status
 * @param priority       optional ordering hint, lower runs first
 * @param provider       preferred provider name, "claude" or "codex" (nullable, derived from the model)
 * @param model          preferred model id or alias (nullable, falls back to the configured default)
 * @param thinkingLevel  reasoning intensity
 * @param skipTests      when true a successful run goes to human review instead of verified
 * @param imagePaths     attached images
 * @param spec           optional free-text specification
 * @param worktreePath   absolute path of the bound worktree (runtime)
 * @param branchName     feature branch of the bound worktree (runtime)
 * @param baseBranch     branch the worktree was created from (runtime)
 * @param startedAt      when the last run started (runtime)
 * @param updatedAt      last status change (runtime)
 * @param justFinishedAt set when the feature enters waiting_approval (runtime)
 * @param summary        summary reported by the agent (runtime)
 * @param error          last failure message (runtime)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Feature(
    String id,
    String category,
    String description,
    List<String> steps,
    FeatureStatus status,
    Integer priority,
    String provider,
    String model,
    ThinkingLevel thinkingLevel,
    boolean skipTests,
    List<FeatureImage> imagePaths,
    String spec,
    String worktreePath,
    String branchName,
    String baseBranch,
    Instant startedAt,
    Instant updatedAt,
    Instant justFinishedAt,
    String summary,
    String error
) implements Serializable {

    public Feature {
        steps = steps == null ? List.of() : List.copyOf(steps);
        imagePaths = imagePaths == null ? List.of() : List.copyOf(imagePaths);
        status = status == null ? FeatureStatus.BACKLOG : status;
        thinkingLevel = thinkingLevel == null ? ThinkingLevel.NONE : thinkingLevel;
    }

    /** Creates a backlog feature with only the user-supplied identity fields. */
    public static Feature backlog(String id, String category, String description, List<String> steps) {
        return new Feature(id, category, description, steps, FeatureStatus.BACKLOG, null, null, null,
                ThinkingLevel.NONE, false, List.of(), null, null, null, null,
                null, null, null, null, null);
    }

    /** First line of the description, used for titles and commit messages. */
    public String title() {
        if (description == null || description.isBlank()) {
            return id;
        }
        String firstLine = description.strip().lines().findFirst().orElse(id);
        return firstLine.length() > 72 ? firstLine.substring(0, 72) : firstLine;
    }
}
