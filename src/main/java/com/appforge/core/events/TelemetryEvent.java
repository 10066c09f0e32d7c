package com.appforge.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle or failure event emitted while orchestrating runs, jobs and sandboxes.
 *
 * @param eventType dotted event name, e.g. "stage.completed" or "breaker.transition"
 * @param runId     run the event belongs to; null for process-level events
 * @param stage     graph node or component that emitted it; nullable
 * @param payload   event-specific data
 * @param timestamp when the event happened
 */
public record TelemetryEvent(
    String eventType,
    String runId,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
