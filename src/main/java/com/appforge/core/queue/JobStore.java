package com.appforge.core.queue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable job records. Status changes are conditional on the current status so
 * that two sweepers can never both own a job.
 */
public interface JobStore {

    void insert(PendingJob job);

    Optional<PendingJob> findById(String id);

    /** PENDING jobs ordered by operation type, priority rank, enqueue time, id. */
    List<PendingJob> findPending();

    /**
     * PENDING to PROCESSING.
     *
     * @return false when the job is no longer PENDING (claimed elsewhere or finished)
     */
    boolean claim(String id, Instant now);

    /** PROCESSING to COMPLETED. */
    boolean complete(String id, Instant now);

    /** PROCESSING back to PENDING without touching {@code attempts}. */
    boolean release(String id);

    /**
     * PROCESSING to PENDING (or FAILED when {@code terminal}) with the attempt count and error recorded.
     */
    boolean recordFailure(String id, int attempts, String error, boolean terminal, Instant now);

    /** Returns PROCESSING jobs claimed before {@code claimedBefore} to PENDING. */
    int requeueStale(Instant claimedBefore);

    Map<JobStatus, Long> countByStatus();

    Optional<Instant> oldestPendingEnqueuedAt();

    /** Deletes up to {@code limit} COMPLETED/FAILED jobs finished before {@code cutoff}. */
    int deleteFinishedBefore(Instant cutoff, int limit);
}
