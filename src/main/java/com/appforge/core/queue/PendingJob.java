package com.appforge.core.queue;

import java.time.Instant;
import java.util.Map;

/**
 * A deferred sandbox operation.
 *
 * @param id            job identifier
 * @param operationType rate-limit operation type the job needs admission for
 * @param action        handler key, see {@link JobHandler#action()}
 * @param payload       handler input (JSON-compatible values only)
 * @param priority      ordering hint within the operation type
 * @param enqueuedAt    FIFO key
 * @param attempts      failed executions so far; admission denials do not count
 * @param maxAttempts   attempts after which the job is FAILED
 * @param status        lifecycle status
 * @param lastError     message of the most recent failure
 * @param claimedAt     when the current PROCESSING claim was taken
 * @param finishedAt    when the job reached COMPLETED or FAILED
 */
public record PendingJob(
    String id,
    String operationType,
    String action,
    Map<String, Object> payload,
    JobPriority priority,
    Instant enqueuedAt,
    int attempts,
    int maxAttempts,
    JobStatus status,
    String lastError,
    Instant claimedAt,
    Instant finishedAt
) {

    public PendingJob {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}
