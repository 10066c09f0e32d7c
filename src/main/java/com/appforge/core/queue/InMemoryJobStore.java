package com.appforge.core.queue;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

public class InMemoryJobStore implements JobStore {

    static final Comparator<PendingJob> SWEEP_ORDER = Comparator
            .comparing(PendingJob::operationType)
            .thenComparingInt(j -> j.priority().rank())
            .thenComparing(PendingJob::enqueuedAt)
            .thenComparing(PendingJob::id);

    private final ConcurrentHashMap<String, PendingJob> jobs = new ConcurrentHashMap<>();

    @Override
    public void insert(PendingJob job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Duplicate job id " + job.id());
        }
    }

    @Override
    public Optional<PendingJob> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<PendingJob> findPending() {
        return jobs.values().stream()
                .filter(j -> j.status() == JobStatus.PENDING)
                .sorted(SWEEP_ORDER)
                .toList();
    }

    @Override
    public boolean claim(String id, Instant now) {
        return transition(id, JobStatus.PENDING, j -> copy(j, j.attempts(), JobStatus.PROCESSING, j.lastError(), now, null));
    }

    @Override
    public boolean complete(String id, Instant now) {
        return transition(id, JobStatus.PROCESSING, j -> copy(j, j.attempts(), JobStatus.COMPLETED, j.lastError(), null, now));
    }

    @Override
    public boolean release(String id) {
        return transition(id, JobStatus.PROCESSING, j -> copy(j, j.attempts(), JobStatus.PENDING, j.lastError(), null, null));
    }

    @Override
    public boolean recordFailure(String id, int attempts, String error, boolean terminal, Instant now) {
        JobStatus next = terminal ? JobStatus.FAILED : JobStatus.PENDING;
        return transition(id, JobStatus.PROCESSING, j -> copy(j, attempts, next, error, null, terminal ? now : null));
    }

    @Override
    public int requeueStale(Instant claimedBefore) {
        int count = 0;
        for (PendingJob job : jobs.values()) {
            if (job.status() == JobStatus.PROCESSING && job.claimedAt() != null
                    && job.claimedAt().isBefore(claimedBefore) && release(job.id())) {
                count++;
            }
        }
        return count;
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        var counts = new EnumMap<JobStatus, Long>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        jobs.values().forEach(j -> counts.merge(j.status(), 1L, Long::sum));
        return counts;
    }

    @Override
    public Optional<Instant> oldestPendingEnqueuedAt() {
        return jobs.values().stream()
                .filter(j -> j.status() == JobStatus.PENDING)
                .map(PendingJob::enqueuedAt)
                .min(Comparator.naturalOrder());
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff, int limit) {
        List<String> doomed = jobs.values().stream()
                .filter(j -> j.status().isTerminal() && j.finishedAt() != null && j.finishedAt().isBefore(cutoff))
                .limit(limit)
                .map(PendingJob::id)
                .toList();
        doomed.forEach(jobs::remove);
        return doomed.size();
    }

    private boolean transition(String id, JobStatus expected, UnaryOperator<PendingJob> change) {
        var changed = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (k, current) -> {
            if (current.status() != expected) {
                return current;
            }
            changed.set(true);
            return change.apply(current);
        });
        return changed.get();
    }

    private static PendingJob copy(PendingJob j, int attempts, JobStatus status, String lastError,
                                   Instant claimedAt, Instant finishedAt) {
        return new PendingJob(j.id(), j.operationType(), j.action(), j.payload(), j.priority(), j.enqueuedAt(),
                attempts, j.maxAttempts(), status, lastError, claimedAt, finishedAt);
    }
}
