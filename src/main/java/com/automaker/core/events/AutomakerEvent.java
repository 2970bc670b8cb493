package com.automaker.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the auto-mode engine, used for SSE streaming and CLI progress output.
 *
 * @param eventType   one of the {@link AutoModeEvents} type strings (e.g. "auto_mode_progress")
 * @param projectPath the project the event belongs to (nullable for loop-level events before start)
 * @param featureId   the feature this event relates to (nullable for loop-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record AutomakerEvent(
    String eventType,
    String projectPath,
    String featureId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
