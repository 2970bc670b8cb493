package com.automaker.core.worktree;

import com.automaker.core.model.AutomakerException;

/**
 * Thrown when a git operation on a feature worktree fails and cannot degrade gracefully,
 * e.g. a merge conflict or a failed checkout of the base branch.
 */
public class WorktreeException extends AutomakerException {

    public WorktreeException(String message) {
        super(message);
    }

    public WorktreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
