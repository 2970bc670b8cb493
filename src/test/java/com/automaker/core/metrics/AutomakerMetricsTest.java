package com.automaker.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AutomakerMetricsTest {

    private SimpleMeterRegistry registry;
    private AutomakerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AutomakerMetrics(registry);
    }

    @Test
    void featureRunsAreCountedByOutcome() {
        metrics.recordFeatureRun("passed");
        metrics.recordFeatureRun("passed");
        metrics.recordFeatureRun("stopped");

        assertEquals(2, registry.get("automaker.feature.runs").tag("outcome", "passed").counter().count());
        assertEquals(1, registry.get("automaker.feature.runs").tag("outcome", "stopped").counter().count());
    }

    @Test
    void durationIsTaggedByProvider() {
        metrics.recordExecutionDuration("codex", 1_500);

        var timer = registry.get("automaker.feature.duration").tag("provider", "codex").timer();
        assertEquals(1, timer.count());
    }

    @Test
    void worktreeOperationsCarrySuccessTag() {
        metrics.recordWorktreeOperation("merge", false);
        metrics.recordMergeConflict();

        assertEquals(1, registry.get("automaker.worktree.operations")
                .tags("operation", "merge", "success", "false").counter().count());
        assertEquals(1, registry.get("automaker.worktree.merge_conflicts").counter().count());
    }
}
