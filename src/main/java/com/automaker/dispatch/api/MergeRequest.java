package com.automaker.dispatch.api;

import com.automaker.core.worktree.WorktreeManager;

/**
 * Body for POST /api/v1/auto-mode/merge-feature. Missing options fall back to
 * {@link WorktreeManager.MergeOptions#defaults()}.
 */
public record MergeRequest(String projectPath, String featureId, Options options) {

    public record Options(Boolean cleanup, Boolean deleteBranch, Boolean squash, String message) {}

    public WorktreeManager.MergeOptions toMergeOptions() {
        var defaults = WorktreeManager.MergeOptions.defaults();
        if (options == null) {
            return defaults;
        }
        return new WorktreeManager.MergeOptions(
                options.cleanup() != null ? options.cleanup() : defaults.cleanup(),
                options.deleteBranch() != null ? options.deleteBranch() : defaults.deleteBranch(),
                options.squash() != null ? options.squash() : defaults.squash(),
                options.message() != null ? options.message() : defaults.message());
    }
}
