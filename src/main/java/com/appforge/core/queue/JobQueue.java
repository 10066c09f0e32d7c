package com.appforge.core.queue;

import com.appforge.core.admission.AdmissionDeniedException;
import com.appforge.core.admission.CircuitOpenException;
import com.appforge.core.breaker.CircuitBreaker;
import com.appforge.core.events.TelemetryEmitter;
import com.appforge.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Durable backlog of sandbox operations that could not be admitted immediately.
 * <p>
 * A sweep walks PENDING jobs per operation type in priority-then-FIFO order.
 * Each job is claimed (PENDING to PROCESSING) before its handler runs, so
 * overlapping sweeps, in this process or another replica, never execute the same
 * job twice. The first admission denial for an operation type ends that type's
 * pass: the window is spent, and later jobs would only be denied too.
 */
@Service
public class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JobStore store;
    private final CircuitBreaker circuitBreaker;
    private final QueueProperties properties;
    private final TelemetryEmitter telemetry;
    private final Clock clock;
    private final Supplier<Collection<JobHandler>> handlers;

    /** Guards against overlapping sweeps inside one process; claims cover the rest. */
    private final AtomicBoolean sweeping = new AtomicBoolean(false);

    @Autowired
    public JobQueue(JobStore store, CircuitBreaker circuitBreaker, QueueProperties properties,
                    TelemetryEmitter telemetry, Clock clock, ObjectProvider<JobHandler> handlers) {
        this(store, circuitBreaker, properties, telemetry, clock, () -> handlers.orderedStream().toList());
    }

    JobQueue(JobStore store, CircuitBreaker circuitBreaker, QueueProperties properties,
             TelemetryEmitter telemetry, Clock clock, Supplier<Collection<JobHandler>> handlers) {
        this.store = store;
        this.circuitBreaker = circuitBreaker;
        this.properties = properties;
        this.telemetry = telemetry;
        this.clock = clock;
        this.handlers = handlers;
    }

    public String enqueue(String operationType, String action, Map<String, Object> payload) {
        return enqueue(operationType, action, payload, JobPriority.NORMAL);
    }

    /**
     * Persists a deferred operation.
     *
     * @return the new job id
     */
    public String enqueue(String operationType, String action, Map<String, Object> payload, JobPriority priority) {
        String id = "JOB-" + UUID.randomUUID();
        var job = new PendingJob(id, operationType, action, payload, priority, now(),
                0, properties.getMaxAttempts(), JobStatus.PENDING, null, null, null);
        store.insert(job);
        log.info("Enqueued job {} ({} / {}, priority {})", id, operationType, action, priority);
        telemetry.jobEvent(id, operationType, JobStatus.PENDING.name());
        return id;
    }

    public Optional<PendingJob> find(String jobId) {
        return store.findById(jobId);
    }

    /**
     * One pass over the backlog.
     *
     * @return number of jobs that reached a new outcome (completed or failed attempt)
     */
    public int sweep() {
        if (!sweeping.compareAndSet(false, true)) {
            log.debug("Sweep already running in this process; skipping");
            return 0;
        }
        try {
            return doSweep();
        } finally {
            sweeping.set(false);
        }
    }

    private int doSweep() {
        int requeued = store.requeueStale(now().minus(properties.getProcessingLease()));
        if (requeued > 0) {
            log.warn("Requeued {} jobs whose processing claim expired", requeued);
        }

        if (!circuitBreaker.isCallPermitted()) {
            log.info("Circuit breaker is {}; skipping sweep", circuitBreaker.state().state());
            return 0;
        }

        Map<String, JobHandler> handlersByAction = handlers.get().stream()
                .collect(Collectors.toMap(JobHandler::action, Function.identity(), (a, b) -> a));

        Map<String, List<PendingJob>> byOperation = store.findPending().stream()
                .collect(Collectors.groupingBy(PendingJob::operationType, LinkedHashMap::new, Collectors.toList()));

        int processed = 0;
        Set<String> exhausted = new HashSet<>();
        boolean circuitOpen = false;

        for (var entry : byOperation.entrySet()) {
            String operationType = entry.getKey();
            for (PendingJob job : entry.getValue()) {
                if (circuitOpen || exhausted.contains(operationType)) {
                    break;
                }
                if (!store.claim(job.id(), now())) {
                    log.debug("Job {} already claimed elsewhere", job.id());
                    continue;
                }
                Outcome outcome = execute(job, handlersByAction.get(job.action()));
                switch (outcome) {
                    case DONE -> processed++;
                    case RATE_LIMITED -> exhausted.add(operationType);
                    case CIRCUIT_OPEN -> circuitOpen = true;
                }
            }
            if (circuitOpen) {
                break;
            }
        }

        log.info("Sweep processed {} jobs (rate-limited types: {}, circuit open: {})",
                processed, exhausted, circuitOpen);
        telemetry.sweepCompleted(processed);
        return processed;
    }

    private enum Outcome { DONE, RATE_LIMITED, CIRCUIT_OPEN }

    private Outcome execute(PendingJob job, JobHandler handler) {
        MdcContext.setJob(job.id());
        try {
            if (handler == null) {
                fail(job, "No handler registered for action '" + job.action() + "'", true);
                return Outcome.DONE;
            }
            handler.handle(job);
            store.complete(job.id(), now());
            log.info("Job {} completed", job.id());
            telemetry.jobEvent(job.id(), job.operationType(), JobStatus.COMPLETED.name());
            return Outcome.DONE;
        } catch (AdmissionDeniedException e) {
            store.release(job.id());
            log.info("Job {} deferred again: {}", job.id(), e.getMessage());
            return e instanceof CircuitOpenException ? Outcome.CIRCUIT_OPEN : Outcome.RATE_LIMITED;
        } catch (RuntimeException e) {
            fail(job, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), false);
            return Outcome.DONE;
        } finally {
            MdcContext.clearJob();
        }
    }

    private void fail(PendingJob job, String error, boolean permanent) {
        int attempts = job.attempts() + 1;
        boolean terminal = permanent || attempts >= job.maxAttempts();
        store.recordFailure(job.id(), attempts, truncate(error), terminal, now());
        if (terminal) {
            log.error("Job {} failed permanently after {} attempts: {}", job.id(), attempts, error);
            telemetry.jobEvent(job.id(), job.operationType(), JobStatus.FAILED.name());
        } else {
            log.warn("Job {} attempt {}/{} failed: {}", job.id(), attempts, job.maxAttempts(), error);
            telemetry.jobEvent(job.id(), job.operationType(), "RETRY");
        }
    }

    public QueueStats stats() {
        Duration oldest = store.oldestPendingEnqueuedAt()
                .map(at -> Duration.between(at, now()))
                .orElse(null);
        return new QueueStats(store.countByStatus(), oldest);
    }

    /**
     * Deletes finished jobs older than the retention period, one batch per call.
     */
    public int cleanup() {
        Instant cutoff = now().minus(properties.getRetention());
        int deleted = store.deleteFinishedBefore(cutoff, properties.getCleanupBatchSize());
        if (deleted > 0) {
            log.info("Cleaned up {} finished jobs older than {}", deleted, properties.getRetention());
        }
        return deleted;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String truncate(String error) {
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
