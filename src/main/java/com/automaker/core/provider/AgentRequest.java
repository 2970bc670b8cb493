package com.automaker.core.provider;

import com.automaker.core.model.FeatureImage;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a provider needs for one conversation.
 *
 * @param prompt         full prompt text
 * @param model          resolved model
 * @param workDir        absolute working directory for the agent
 * @param projectPath    project whose feature files the status tool writes; null leaves the tool out
 * @param allowedTools   capability allow-list
 * @param maxTurns       turn cap, where the backend supports one
 * @param thinkingBudget extended-thinking token budget, or null
 * @param images         images to attach as native content blocks, paths absolute
 * @param cancellation   token observed between messages
 */
public record AgentRequest(
    String prompt,
    ResolvedModel model,
    Path workDir,
    String projectPath,
    List<String> allowedTools,
    int maxTurns,
    Integer thinkingBudget,
    List<FeatureImage> images,
    CancellationToken cancellation
) {
    public AgentRequest {
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        images = images == null ? List.of() : List.copyOf(images);
    }
}
