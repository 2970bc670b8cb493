package com.automaker.core.engine;

import com.automaker.core.model.RunResult;
import com.automaker.core.provider.CancellationToken;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Runtime record of one in-flight operation on a feature. At most one exists per featureId,
 * enforced by {@link RunningFeatureRegistry}.
 */
public final class ExecutionContext {

    /** What the context is doing; runs, resumes and follow-ups drive an agent. */
    public enum Kind {
        RUN, RESUME, FOLLOW_UP, VERIFY, COMMIT, MERGE, REVERT, ANALYSIS
    }

    private final String featureId;
    private final String projectPath;
    private final Kind kind;
    private final boolean autoMode;
    private final Instant startedAt = Instant.now();
    private final CancellationToken cancellation = new CancellationToken();
    private final CompletableFuture<RunResult> completion = new CompletableFuture<>();

    private volatile Path worktreePath;
    private volatile String branchName;

    public ExecutionContext(String featureId, String projectPath, Kind kind, boolean autoMode) {
        this.featureId = featureId;
        this.projectPath = projectPath;
        this.kind = kind;
        this.autoMode = autoMode;
    }

    /** Binds the worktree once it is known; a null path means running in the project root. */
    public void bindWorktree(Path worktreePath, String branchName) {
        this.worktreePath = worktreePath;
        this.branchName = branchName;
    }

    /** Directory the agent works in. */
    public Path workDir() {
        Path wt = worktreePath;
        return wt != null ? wt : Path.of(projectPath).toAbsolutePath().normalize();
    }

    public String featureId() { return featureId; }
    public String projectPath() { return projectPath; }
    public Kind kind() { return kind; }
    public boolean isAutoMode() { return autoMode; }
    public Instant startedAt() { return startedAt; }
    public CancellationToken cancellation() { return cancellation; }
    public Path worktreePath() { return worktreePath; }
    public String branchName() { return branchName; }

    /** Completes with the run's result once the context leaves the running set. */
    public CompletableFuture<RunResult> completion() { return completion; }

    public String projectName() {
        Path fileName = Path.of(projectPath).getFileName();
        return fileName != null ? fileName.toString() : projectPath;
    }
}
