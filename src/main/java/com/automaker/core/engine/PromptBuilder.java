package com.automaker.core.engine;

import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureImage;

import java.util.List;

/**
 * Builds agent prompts for features. Pure functions, no Spring dependencies.
 */
public final class PromptBuilder {

    public static final String STATUS_TOOL = FeatureStatusTool.NAME;

    static final String ANALYSIS_PROMPT = """
            Analyze this project and provide a summary of:
            1. Project structure and architecture
            2. Main technologies and frameworks used
            3. Key components and their responsibilities
            4. Build and test commands
            5. Any existing conventions or patterns

            Format your response as a structured markdown document.""";

    private PromptBuilder() {}

    public static String build(Feature feature, ProjectNotes notes) {
        var sb = new StringBuilder();
        appendFeature(sb, feature);
        appendNotes(sb, notes);
        appendInstructions(sb, feature);
        appendImages(sb, feature.imagePaths());
        return sb.toString();
    }

    /** Prompt for continuing from a saved transcript. */
    public static String buildResume(Feature feature, ProjectNotes notes, String previousTranscript) {
        var sb = new StringBuilder();
        sb.append("## Continuing Feature Implementation\n\n");
        appendFeature(sb, feature);
        appendNotes(sb, notes);
        sb.append("## Previous Context\n\n");
        sb.append("The following is the output from a previous implementation attempt. ");
        sb.append("Continue from where you left off:\n\n");
        sb.append(previousTranscript).append("\n\n");
        appendInstructions(sb, feature);
        sb.append("Review the previous work and continue the implementation. ");
        sb.append("If the feature appears complete, verify it works correctly.\n");
        appendImages(sb, feature.imagePaths());
        return sb.toString();
    }

    /** Prompt for additional user instructions on top of previous work. */
    public static String buildFollowUp(Feature feature, ProjectNotes notes, String previousTranscript,
                                       String instructions, List<FeatureImage> images) {
        var sb = new StringBuilder();
        sb.append("## Follow-up on Feature Implementation\n\n");
        appendFeature(sb, feature);
        appendNotes(sb, notes);
        if (previousTranscript != null && !previousTranscript.isBlank()) {
            sb.append("## Previous Agent Work\n\n");
            sb.append("The following is the output from the previous implementation attempt:\n\n");
            sb.append(previousTranscript).append("\n\n");
        }
        sb.append("## Follow-up Instructions\n\n");
        sb.append(instructions).append("\n\n");
        sb.append("## Task\n\n");
        sb.append("Address the follow-up instructions above. ");
        sb.append("Review the previous work and make the requested changes or fixes.\n\n");
        appendStatusInstructions(sb, feature);
        appendImages(sb, images);
        return sb.toString();
    }

    private static void appendFeature(StringBuilder sb, Feature feature) {
        sb.append("## Feature Implementation Task\n\n");
        sb.append("**Feature ID:** ").append(feature.id()).append("\n");
        if (feature.category() != null && !feature.category().isBlank()) {
            sb.append("**Category:** ").append(feature.category()).append("\n");
        }
        sb.append("**Description:** ").append(feature.description()).append("\n\n");

        if (feature.spec() != null && !feature.spec().isBlank()) {
            sb.append("**Specification:**\n").append(feature.spec()).append("\n\n");
        }
        if (!feature.steps().isEmpty()) {
            sb.append("**Steps:**\n");
            for (int i = 0; i < feature.steps().size(); i++) {
                sb.append(i + 1).append(". ").append(feature.steps().get(i)).append("\n");
            }
            sb.append("\n");
        }
    }

    private static void appendNotes(StringBuilder sb, ProjectNotes notes) {
        if (notes == null) {
            return;
        }
        if (notes.memory() != null && !notes.memory().isBlank()) {
            sb.append("## Project Memory\n\n");
            sb.append("Lessons learned from previous agent runs. Review them to avoid repeating past mistakes.\n\n");
            sb.append("<agent-memory>\n").append(notes.memory().strip()).append("\n</agent-memory>\n\n");
            sb.append("If you resolve a new issue that took significant debugging effort, add it to ");
            sb.append("`.automaker/memory.md` as a short entry: issue title, problem, solution.\n\n");
        }
        if (!notes.contextFiles().isEmpty()) {
            sb.append("## Project Context Files\n\n");
            sb.append("Read these files in `.automaker/context/` for project-specific rules:\n\n");
            for (ProjectNotes.ContextFile file : notes.contextFiles()) {
                sb.append("### ").append(file.name());
                if (file.totalLines() > 0) {
                    sb.append(" (").append(file.totalLines()).append(" lines)");
                }
                sb.append("\n\n```\n").append(file.preview()).append("\n```\n\n");
            }
        }
    }

    private static void appendInstructions(StringBuilder sb, Feature feature) {
        sb.append("## Instructions\n\n");
        sb.append("Implement this feature by:\n");
        sb.append("1. First, explore the codebase to understand the existing structure\n");
        sb.append("2. Plan your implementation approach\n");
        sb.append("3. Write the necessary code changes\n");
        if (feature.skipTests()) {
            sb.append("4. Skip automated tests for this feature; it will be reviewed manually\n");
        } else {
            sb.append("4. Add or update tests as needed and make sure they pass\n");
        }
        sb.append("5. Ensure the code follows existing patterns and conventions\n\n");
        appendStatusInstructions(sb, feature);
    }

    private static void appendStatusInstructions(StringBuilder sb, Feature feature) {
        sb.append("When done, call the `").append(STATUS_TOOL).append("` tool with featureId `")
                .append(feature.id()).append("`, ");
        if (feature.skipTests()) {
            sb.append("status `waiting_approval`");
        } else {
            sb.append("status `verified` once everything works (or `waiting_approval` if it needs review)");
        }
        sb.append(", and a summary of what you implemented and any notes for the developer.\n");
    }

    private static void appendImages(StringBuilder sb, List<FeatureImage> images) {
        if (images == null || images.isEmpty()) {
            return;
        }
        sb.append("\n## Reference Images\n\n");
        sb.append("The following images are attached for reference:\n");
        for (FeatureImage image : images) {
            sb.append("- ").append(image.path()).append("\n");
        }
    }
}
