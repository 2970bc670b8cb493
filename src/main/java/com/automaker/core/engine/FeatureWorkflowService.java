package com.automaker.core.engine;

import com.automaker.core.config.AutomakerProperties;
import com.automaker.core.context.ContextStoreException;
import com.automaker.core.context.FeatureContextStore;
import com.automaker.core.events.AutoModeEvents;
import com.automaker.core.events.EventBus;
import com.automaker.core.logging.MdcContext;
import com.automaker.core.metrics.AutomakerMetrics;
import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureImage;
import com.automaker.core.model.FeatureNotFoundException;
import com.automaker.core.model.FeatureStatus;
import com.automaker.core.model.InvalidTransitionException;
import com.automaker.core.model.RunResult;
import com.automaker.core.provider.AgentExecutionException;
import com.automaker.core.provider.ProviderConfigurationException;
import com.automaker.core.state.FeatureStateMachine;
import com.automaker.core.verify.VerificationRunner;
import com.automaker.core.worktree.WorktreeException;
import com.automaker.core.worktree.WorktreeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Per-feature lifecycle operations: run, resume, follow-up, verify, commit, merge, revert and stop.
 *
 * <p>Every operation that touches a feature registers an {@link ExecutionContext} first, so a
 * second concurrent operation on the same feature fails with
 * {@link com.automaker.core.model.FeatureAlreadyRunningException} before any git or provider work
 * happens. Long-running operations return the context immediately and report completion through
 * the {@link EventBus}; ordinary execution errors never escape the worker thread. They end up in
 * the transcript, an error event and a {@code waiting_approval} status.
 */
@Service
public class FeatureWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(FeatureWorkflowService.class);

    static final long STOP_AWAIT_SECONDS = 30;

    private final FeatureContextStore store;
    private final WorktreeManager worktrees;
    private final ExecutionRunner runner;
    private final VerificationRunner verificationRunner;
    private final RunningFeatureRegistry registry;
    private final EventBus eventBus;
    private final AutomakerMetrics metrics;
    private final AutomakerProperties properties;
    private final ExecutorService executor;

    public FeatureWorkflowService(FeatureContextStore store,
                                  WorktreeManager worktrees,
                                  ExecutionRunner runner,
                                  VerificationRunner verificationRunner,
                                  RunningFeatureRegistry registry,
                                  EventBus eventBus,
                                  AutomakerMetrics metrics,
                                  AutomakerProperties properties,
                                  @Qualifier("featureExecutor") ExecutorService executor) {
        this.store = store;
        this.worktrees = worktrees;
        this.runner = runner;
        this.verificationRunner = verificationRunner;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.executor = executor;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // AGENT RUNS
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Starts a fresh run of the feature in the background.
     *
     * @throws FeatureNotFoundException if the feature does not exist
     * @throws com.automaker.core.model.FeatureAlreadyRunningException if it is already running
     */
    public ExecutionContext runFeature(String projectPath, String featureId, boolean useWorktrees,
                                       boolean autoMode) {
        Feature feature = store.loadFeature(projectPath, featureId);
        FeatureStateMachine.requireTransition(featureId, feature.status(), FeatureStatus.IN_PROGRESS);
        ExecutionContext ctx = new ExecutionContext(featureId, projectPath, ExecutionContext.Kind.RUN, autoMode);
        submit(ctx, () -> executeAgentRun(ctx, useWorktrees, false, RunRequest.initial()));
        return ctx;
    }

    /**
     * Continues a feature from its saved transcript. A run that ends with the feature still in
     * progress is resubmitted up to {@code automaker.auto-mode.max-resume-attempts} times.
     */
    public ExecutionContext resumeFeature(String projectPath, String featureId, boolean useWorktrees) {
        Feature feature = store.loadFeature(projectPath, featureId);
        FeatureStateMachine.requireTransition(featureId, feature.status(), FeatureStatus.IN_PROGRESS);
        ExecutionContext ctx = new ExecutionContext(featureId, projectPath, ExecutionContext.Kind.RESUME, false);
        submit(ctx, () -> {
            String transcript = store.readTranscript(projectPath, featureId).orElse("");
            RunRequest request = transcript.isBlank() ? RunRequest.initial() : RunRequest.resume(transcript);
            return executeAgentRun(ctx, useWorktrees, true, request);
        });
        return ctx;
    }

    /** Runs the agent again with additional user instructions on top of previous work. */
    public ExecutionContext followUpFeature(String projectPath, String featureId, String instructions,
                                            List<FeatureImage> images, boolean useWorktrees) {
        if (instructions == null || instructions.isBlank()) {
            throw new IllegalArgumentException("Follow-up instructions are required");
        }
        Feature feature = store.loadFeature(projectPath, featureId);
        FeatureStateMachine.requireTransition(featureId, feature.status(), FeatureStatus.IN_PROGRESS);
        ExecutionContext ctx = new ExecutionContext(featureId, projectPath, ExecutionContext.Kind.FOLLOW_UP, false);
        submit(ctx, () -> {
            String transcript = store.readTranscript(projectPath, featureId).orElse("");
            return executeAgentRun(ctx, useWorktrees, false, RunRequest.followUp(transcript, instructions, images));
        });
        return ctx;
    }

    private RunResult executeAgentRun(ExecutionContext ctx, boolean useWorktrees, boolean retryOnEarlyEnd,
                                      RunRequest request) {
        String projectPath = ctx.projectPath();
        String featureId = ctx.featureId();
        try {
            Feature feature = store.loadFeature(projectPath, featureId);
            bindWorkspace(ctx, feature, useWorktrees);
            feature = store.markStarted(projectPath, featureId);
            eventBus.publish(AutoModeEvents.featureStart(projectPath, featureId, feature.title(),
                    ctx.worktreePath() != null ? ctx.worktreePath().toString() : null, ctx.branchName()));

            RunResult result = runner.run(ctx, feature, request);
            if (retryOnEarlyEnd) {
                result = retryWhileInProgress(ctx, result);
            }
            return complete(ctx, store.loadFeature(projectPath, featureId), result);
        } catch (ProviderConfigurationException e) {
            return fail(ctx, e.getMessage(), e.getErrorType());
        } catch (AgentExecutionException e) {
            return fail(ctx, e.getMessage(), e.getErrorType());
        } catch (RuntimeException e) {
            if (ctx.cancellation().isCancelled()) {
                log.info("Feature {} stopped: {}", featureId, e.getMessage());
                return complete(ctx, null, RunResult.cancelledByUser());
            }
            log.error("Feature {} failed: {}", featureId, e.getMessage(), e);
            return fail(ctx, e.getMessage(), AutoModeEvents.ERROR_TYPE_EXECUTION);
        }
    }

    private RunResult retryWhileInProgress(ExecutionContext ctx, RunResult result) {
        String projectPath = ctx.projectPath();
        String featureId = ctx.featureId();
        int maxAttempts = properties.getAutoMode().getMaxResumeAttempts();
        int attempt = 0;
        while (!result.stopped() && !result.passes() && attempt < maxAttempts) {
            Feature current = store.loadFeature(projectPath, featureId);
            if (current.status() != FeatureStatus.IN_PROGRESS) {
                break;
            }
            attempt++;
            metrics.recordAutoRetry();
            String marker = "\n\n🔄 Auto-retry #" + attempt + " - Continuing implementation...\n\n";
            log.info("Feature {} ended its turn while in progress, auto-retry {}/{}", featureId, attempt, maxAttempts);
            store.appendTranscript(projectPath, featureId, marker);
            eventBus.publish(AutoModeEvents.progress(projectPath, featureId, marker));
            String transcript = store.readTranscript(projectPath, featureId).orElse("");
            result = runner.run(ctx, current, RunRequest.resume(transcript));
        }
        return result;
    }

    /**
     * Binds the context to the feature's worktree. An existing bound worktree is reused; otherwise
     * one is created when worktrees are enabled and the project is a git repository. Creation
     * failures degrade to running in the project root.
     */
    private void bindWorkspace(ExecutionContext ctx, Feature feature, boolean useWorktrees) {
        if (feature.worktreePath() != null && Files.isDirectory(Path.of(feature.worktreePath()))) {
            ctx.bindWorktree(Path.of(feature.worktreePath()), feature.branchName());
            return;
        }
        if (!useWorktrees || !properties.getWorktrees().isEnabled()) {
            return;
        }
        Path root = projectRoot(ctx.projectPath());
        if (!worktrees.isGitRepository(root)) {
            log.info("{} is not a git repository, running {} without a worktree", root, feature.id());
            return;
        }
        String branch = feature.branchName() != null ? feature.branchName() : worktrees.getBranchName(feature.id());
        WorktreeManager.WorktreeResult wt = worktrees.ensureWorktree(root, feature.id(), branch);
        if (wt.isolated()) {
            ctx.bindWorktree(wt.path(), wt.branchName());
            String base = feature.baseBranch() != null ? feature.baseBranch() : wt.baseBranch();
            store.updateWorktree(ctx.projectPath(), feature.id(), wt.path().toString(), wt.branchName(), base);
        }
    }

    /**
     * Writes the post-run status and publishes feature-complete. A summary the agent reported
     * through the status tool is kept; otherwise the run's own summary is recorded.
     */
    private RunResult complete(ExecutionContext ctx, Feature feature, RunResult result) {
        Optional<FeatureStatus> next = feature == null
                ? Optional.empty()
                : FeatureStateMachine.statusAfterRun(feature, result);
        String summary = feature != null && feature.summary() != null ? null : result.message();
        next.ifPresent(status -> store.updateFeatureStatus(ctx.projectPath(), ctx.featureId(), status,
                summary, null));
        metrics.recordFeatureRun(result.stopped() ? "stopped" : result.passes() ? "passed" : "failed");
        eventBus.publish(AutoModeEvents.featureComplete(ctx.projectPath(), ctx.featureId(),
                result.passes(), result.message()));
        log.info("Feature {} finished: passes={}, status={}", ctx.featureId(), result.passes(),
                next.map(FeatureStatus::value).orElse("unchanged"));
        return result;
    }

    /** Records an error in the transcript and status, and publishes it. */
    private RunResult fail(ExecutionContext ctx, String message, String errorType) {
        String projectPath = ctx.projectPath();
        String featureId = ctx.featureId();
        String error = message == null ? "Unknown error" : message;
        log.warn("Feature {} failed ({}): {}", featureId, errorType, error);
        if (store.findFeature(projectPath, featureId).isPresent()) {
            try {
                store.appendTranscript(projectPath, featureId, "\n\n❌ ERROR: " + error + "\n\n");
            } catch (ContextStoreException e) {
                log.error("Could not record error in transcript for {}: {}", featureId, e.getMessage());
            }
            store.updateFeatureStatus(projectPath, featureId, FeatureStateMachine.statusAfterError(), null, error);
        }
        metrics.recordFeatureRun("error");
        eventBus.publish(AutoModeEvents.error(projectPath, featureId, error, errorType));
        return RunResult.failed(error);
    }

    // ══════════════════════════════════════════════════════════════════════════
    // VERIFY / COMMIT / MERGE / REVERT
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Runs the configured verification commands in the background. Passing moves the feature to
     * verified, failing to waiting_approval.
     */
    public ExecutionContext verifyFeature(String projectPath, String featureId) {
        Feature feature = store.loadFeature(projectPath, featureId);
        if (feature.status() == FeatureStatus.BACKLOG) {
            throw new InvalidTransitionException(featureId, feature.status(), FeatureStatus.VERIFIED);
        }
        ExecutionContext ctx = new ExecutionContext(featureId, projectPath, ExecutionContext.Kind.VERIFY, false);
        submit(ctx, () -> {
            try {
                Feature current = store.loadFeature(projectPath, featureId);
                bindWorkspace(ctx, current, false);
                eventBus.publish(AutoModeEvents.featureStart(projectPath, featureId, current.title(),
                        ctx.worktreePath() != null ? ctx.worktreePath().toString() : null, ctx.branchName()));
                store.appendTranscript(projectPath, featureId,
                        "\n✅ Verifying implementation for: " + current.title() + "\n");
                eventBus.publish(AutoModeEvents.phase(projectPath, featureId, "verification",
                        "Verifying implementation for: " + current.title()));

                VerificationRunner.VerificationReport report = verificationRunner.verify(ctx.workDir());
                if (ctx.cancellation().isCancelled()) {
                    return complete(ctx, null, RunResult.cancelledByUser());
                }
                String verdict = report.allPassed()
                        ? ExecutionRunner.VERIFICATION_PASSED
                        : ExecutionRunner.VERIFICATION_FAILED;
                store.appendTranscript(projectPath, featureId, report.summary() + "\n" + verdict);
                eventBus.publish(AutoModeEvents.progress(projectPath, featureId, verdict));

                FeatureStatus status = FeatureStateMachine.statusAfterVerification(report.allPassed());
                String message = report.allPassed()
                        ? "All verification checks passed"
                        : "Verification failed at: " + report.failedCheck();
                store.updateFeatureStatus(projectPath, featureId, status, message, null);
                metrics.recordFeatureRun(report.allPassed() ? "passed" : "failed");
                eventBus.publish(AutoModeEvents.featureComplete(projectPath, featureId, report.allPassed(), message));
                return report.allPassed() ? RunResult.passed(message) : RunResult.failed(message);
            } catch (RuntimeException e) {
                log.error("Verification of {} failed: {}", featureId, e.getMessage(), e);
                return fail(ctx, e.getMessage(), AutoModeEvents.ERROR_TYPE_EXECUTION);
            }
        });
        return ctx;
    }

    /**
     * Stages and commits the feature's changes and marks it verified.
     *
     * @return the commit hash, or null when there was nothing to commit
     */
    public String commitFeature(String projectPath, String featureId) {
        ExecutionContext ctx = registerSync(projectPath, featureId, ExecutionContext.Kind.COMMIT);
        RunResult result = RunResult.failed("commit failed");
        try {
            Feature feature = store.loadFeature(projectPath, featureId);
            FeatureStateMachine.requireTransition(featureId, feature.status(), FeatureStatus.VERIFIED);
            bindWorkspace(ctx, feature, false);
            eventBus.publish(AutoModeEvents.phase(projectPath, featureId, "action", "Committing changes to git..."));

            String hash = worktrees.commit(ctx.workDir(), commitMessage(feature));
            store.updateFeatureStatus(projectPath, featureId, FeatureStatus.VERIFIED);
            result = RunResult.passed("Changes committed successfully");
            eventBus.publish(AutoModeEvents.featureComplete(projectPath, featureId, true, result.message()));
            return hash;
        } catch (RuntimeException e) {
            eventBus.publish(AutoModeEvents.error(projectPath, featureId, e.getMessage(),
                    AutoModeEvents.ERROR_TYPE_EXECUTION));
            throw e;
        } finally {
            release(ctx, result);
        }
    }

    /**
     * Merges the feature branch into the base branch it was created from. Uncommitted work in the
     * worktree is committed first. A conflict aborts the merge and leaves status and worktree as-is.
     */
    public WorktreeManager.MergeResult mergeFeature(String projectPath, String featureId,
                                                    WorktreeManager.MergeOptions options) {
        ExecutionContext ctx = registerSync(projectPath, featureId, ExecutionContext.Kind.MERGE);
        RunResult result = RunResult.failed("merge failed");
        try {
            Feature feature = store.loadFeature(projectPath, featureId);
            FeatureStateMachine.requireMergeable(feature);
            Path root = projectRoot(projectPath);
            String branch = feature.branchName() != null ? feature.branchName() : worktrees.getBranchName(featureId);

            if (feature.worktreePath() != null) {
                Path wt = Path.of(feature.worktreePath());
                if (Files.isDirectory(wt) && worktrees.hasUncommittedChanges(wt)) {
                    worktrees.commit(wt, commitMessage(feature));
                }
            }

            eventBus.publish(AutoModeEvents.progress(projectPath, featureId, "Merging feature branch into "
                    + (feature.baseBranch() != null ? feature.baseBranch() : "current branch") + "...\n"));
            WorktreeManager.MergeResult merged = worktrees.mergeWorktree(root, featureId, branch,
                    feature.baseBranch(), options != null ? options : WorktreeManager.MergeOptions.defaults());

            store.clearWorktree(projectPath, featureId);
            store.updateFeatureStatus(projectPath, featureId, FeatureStatus.VERIFIED);
            result = RunResult.passed("Feature merged into " + merged.intoBranch());
            eventBus.publish(AutoModeEvents.featureComplete(projectPath, featureId, true, result.message()));
            return merged;
        } catch (WorktreeException e) {
            metrics.recordWorktreeOperation("merge", false);
            eventBus.publish(AutoModeEvents.error(projectPath, featureId, e.getMessage(),
                    AutoModeEvents.ERROR_TYPE_EXECUTION));
            throw e;
        } finally {
            release(ctx, result);
        }
    }

    /**
     * Discards all work for the feature: removes its worktree and branch, deletes the transcript
     * and moves it back to backlog.
     *
     * @return the removed worktree path, or null when there was none
     */
    public Path revertFeature(String projectPath, String featureId) {
        ExecutionContext ctx = registerSync(projectPath, featureId, ExecutionContext.Kind.REVERT);
        RunResult result = RunResult.failed("revert failed");
        try {
            Feature feature = store.loadFeature(projectPath, featureId);
            Path removed = removeFeatureWorktree(projectPath, feature);
            store.clearWorktree(projectPath, featureId);
            store.updateFeatureStatus(projectPath, featureId, FeatureStatus.BACKLOG);
            store.deleteContext(projectPath, featureId);
            result = RunResult.failed("Feature reverted - all changes discarded");
            eventBus.publish(AutoModeEvents.featureComplete(projectPath, featureId, false, result.message()));
            log.info("Feature {} reverted", featureId);
            return removed;
        } catch (WorktreeException e) {
            eventBus.publish(AutoModeEvents.error(projectPath, featureId, e.getMessage(),
                    AutoModeEvents.ERROR_TYPE_EXECUTION));
            throw e;
        } finally {
            release(ctx, result);
        }
    }

    private Path removeFeatureWorktree(String projectPath, Feature feature) {
        Path root = projectRoot(projectPath);
        if (!worktrees.isGitRepository(root)) {
            return null;
        }
        Path worktreePath = feature.worktreePath() != null
                ? Path.of(feature.worktreePath())
                : worktrees.getWorktreePath(root, feature.id());
        String branch = feature.branchName() != null ? feature.branchName() : worktrees.getBranchName(feature.id());
        return worktrees.removeWorktree(root, worktreePath, branch, true);
    }

    private static String commitMessage(Feature feature) {
        return "feat: " + feature.title();
    }

    // ══════════════════════════════════════════════════════════════════════════
    // STOP / DELETE / QUERIES
    // ══════════════════════════════════════════════════════════════════════════

    /** Signals the feature's cancellation token; returns false when it is not running. */
    public boolean stopFeature(String featureId) {
        return registry.stop(featureId);
    }

    public List<RunningAgent> getRunningAgents() {
        return registry.snapshot().stream().map(RunningAgent::of).toList();
    }

    public boolean isRunning(String featureId) {
        return registry.isRunning(featureId);
    }

    public boolean contextExists(String projectPath, String featureId) {
        return store.contextExists(projectPath, featureId);
    }

    public WorktreeManager.WorktreeStatus getWorktreeStatus(String projectPath, String featureId) {
        Feature feature = store.loadFeature(projectPath, featureId);
        return worktrees.status(workDirOf(projectPath, feature), feature.baseBranch());
    }

    public String getFileDiffs(String projectPath, String featureId) {
        Feature feature = store.loadFeature(projectPath, featureId);
        return worktrees.diff(workDirOf(projectPath, feature), feature.baseBranch());
    }

    /** Feature worktrees of the project; the main working tree is not included. */
    public List<WorktreeManager.WorktreeInfo> listWorktrees(String projectPath) {
        Path root = projectRoot(projectPath);
        if (!worktrees.isGitRepository(root)) {
            return List.of();
        }
        return worktrees.listWorktrees(root).stream()
                .filter(info -> !info.path().equals(root))
                .toList();
    }

    /**
     * Deletes a feature entirely: stops it if running, removes its worktree and branch, then
     * deletes its directory.
     */
    public void deleteFeature(String projectPath, String featureId) {
        Optional<ExecutionContext> running = registry.get(featureId);
        if (running.isPresent()) {
            running.get().cancellation().cancel();
            awaitCompletion(running.get());
        }
        Feature feature = store.loadFeature(projectPath, featureId);
        removeFeatureWorktree(projectPath, feature);
        store.deleteFeature(projectPath, featureId);
        log.info("Feature {} deleted", featureId);
    }

    private static void awaitCompletion(ExecutionContext ctx) {
        try {
            ctx.completion().get(STOP_AWAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for " + ctx.featureId() + " to stop", e);
        } catch (TimeoutException e) {
            log.warn("Feature {} did not stop within {}s", ctx.featureId(), STOP_AWAIT_SECONDS);
        } catch (ExecutionException e) {
            log.warn("Feature {} ended with {}", ctx.featureId(), e.getCause().getMessage());
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // PROJECT ANALYSIS
    // ══════════════════════════════════════════════════════════════════════════

    /** Starts a read-only analysis session for the project in the background. */
    public ExecutionContext analyzeProject(String projectPath) {
        String analysisId = "analysis-" + System.currentTimeMillis();
        ExecutionContext ctx = new ExecutionContext(analysisId, projectPath, ExecutionContext.Kind.ANALYSIS, false);
        submit(ctx, () -> {
            try {
                eventBus.publish(AutoModeEvents.featureStart(projectPath, analysisId, "Project analysis", null, null));
                eventBus.publish(AutoModeEvents.phase(projectPath, analysisId, "planning", "Analyzing project structure..."));
                String analysis = runner.analyze(ctx);
                if (analysis == null) {
                    eventBus.publish(AutoModeEvents.featureComplete(projectPath, analysisId, false,
                            RunResult.STOPPED_MESSAGE));
                    return RunResult.cancelledByUser();
                }
                eventBus.publish(AutoModeEvents.featureComplete(projectPath, analysisId, true,
                        "Project analysis completed"));
                return RunResult.passed("Project analysis completed");
            } catch (ProviderConfigurationException e) {
                eventBus.publish(AutoModeEvents.error(projectPath, analysisId, e.getMessage(), e.getErrorType()));
                return RunResult.failed(e.getMessage());
            } catch (AgentExecutionException e) {
                eventBus.publish(AutoModeEvents.error(projectPath, analysisId, e.getMessage(), e.getErrorType()));
                return RunResult.failed(e.getMessage());
            } catch (RuntimeException e) {
                log.error("Project analysis failed: {}", e.getMessage(), e);
                eventBus.publish(AutoModeEvents.error(projectPath, analysisId, e.getMessage(),
                        AutoModeEvents.ERROR_TYPE_EXECUTION));
                return RunResult.failed(e.getMessage());
            }
        });
        return ctx;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ══════════════════════════════════════════════════════════════════════════

    interface Task {
        RunResult call();
    }

    /**
     * Registers the context and runs {@code task} on the executor. The context is released and
     * completed when the task ends, whatever the outcome.
     */
    private void submit(ExecutionContext ctx, Task task) {
        registry.register(ctx);
        try {
            executor.execute(() -> {
                MdcContext.setFeature(ctx.projectPath(), ctx.featureId());
                RunResult result = RunResult.failed("execution aborted");
                try {
                    result = task.call();
                } catch (RuntimeException e) {
                    log.error("Unhandled failure in {} of {}: {}", ctx.kind(), ctx.featureId(), e.getMessage(), e);
                    result = RunResult.failed(e.getMessage());
                } finally {
                    release(ctx, result);
                    MdcContext.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            release(ctx, RunResult.failed("executor is shut down"));
            throw e;
        }
    }

    private ExecutionContext registerSync(String projectPath, String featureId, ExecutionContext.Kind kind) {
        if (store.findFeature(projectPath, featureId).isEmpty()) {
            throw new FeatureNotFoundException(featureId);
        }
        ExecutionContext ctx = new ExecutionContext(featureId, projectPath, kind, false);
        registry.register(ctx);
        return ctx;
    }

    private void release(ExecutionContext ctx, RunResult result) {
        registry.remove(ctx);
        ctx.completion().complete(result);
    }

    private static Path projectRoot(String projectPath) {
        return Path.of(projectPath).toAbsolutePath().normalize();
    }

    private static Path workDirOf(String projectPath, Feature feature) {
        if (feature.worktreePath() != null && Files.isDirectory(Path.of(feature.worktreePath()))) {
            return Path.of(feature.worktreePath());
        }
        return projectRoot(projectPath);
    }
}
