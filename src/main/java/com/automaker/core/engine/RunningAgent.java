package com.automaker.core.engine;

import java.time.Instant;
import java.util.Locale;

/**
 * Snapshot of a running execution for status reporting.
 */
public record RunningAgent(
    String featureId,
    String projectPath,
    String projectName,
    boolean isAutoMode,
    String kind,
    String worktreePath,
    Instant startedAt
) {
    static RunningAgent of(ExecutionContext ctx) {
        return new RunningAgent(ctx.featureId(), ctx.projectPath(), ctx.projectName(), ctx.isAutoMode(),
                ctx.kind().name().toLowerCase(Locale.ROOT), ctx.worktreePath() == null ? null : ctx.worktreePath().toString(),
                ctx.startedAt());
    }
}
