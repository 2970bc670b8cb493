package com.automaker.dispatch.api;

/**
 * Body for the per-feature endpoints.
 *
 * @param useWorktrees nullable; run and resume default to true
 */
public record FeatureRequest(String projectPath, String featureId, Boolean useWorktrees) {

    public boolean worktreesOrDefault() {
        return useWorktrees == null || useWorktrees;
    }
}
