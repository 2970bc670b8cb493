package com.automaker.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for auto-mode execution.
 */
@Service
public class AutomakerMetrics {

    private final MeterRegistry registry;

    public AutomakerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a finished feature run.
     *
     * @param outcome "passed", "failed", "stopped" or "error"
     */
    public void recordFeatureRun(String outcome) {
        Counter.builder("automaker.feature.runs")
                .description("Feature runs by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordExecutionDuration(String provider, long ms) {
        Timer.builder("automaker.feature.duration")
                .tag("provider", provider)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records worktree operations.
     *
     * @param operation "ensure", "reuse", "merge" or "remove"
     * @param success   whether the operation succeeded
     */
    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("automaker.worktree.operations")
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordMergeConflict() {
        Counter.builder("automaker.worktree.merge_conflicts")
                .description("Feature merges aborted on conflict")
                .register(registry)
                .increment();
    }

    public void recordAutoRetry() {
        Counter.builder("automaker.feature.auto_retries")
                .description("Resume attempts after the agent ended early")
                .register(registry)
                .increment();
    }

    public void recordSchedulerLaunch() {
        Counter.builder("automaker.scheduler.launches")
                .description("Features launched by the auto-mode loop")
                .register(registry)
                .increment();
    }
}
