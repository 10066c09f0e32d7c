package com.appforge.core.engine;

import com.appforge.core.admission.CircuitOpenException;
import com.appforge.core.admission.RateLimitExceededException;
import com.appforge.core.breaker.CircuitBreaker;
import com.appforge.core.config.AgentProperties;
import com.appforge.core.events.TelemetryEmitter;
import com.appforge.core.graph.AgentRunGraph;
import com.appforge.core.logging.MdcContext;
import com.appforge.core.model.AgentRun;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.GenerationRequest;
import com.appforge.core.model.RunFailure;
import com.appforge.core.model.RunStage;
import com.appforge.core.model.ValidationMode;
import com.appforge.core.queue.JobQueue;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.ratelimit.OperationTypes;
import com.appforge.core.state.AgentRunState;
import com.appforge.core.store.AgentRunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for generation runs: creates the run record, drives the agent graph
 * off the caller's thread, and parks runs that admission control deferred as
 * {@code resume_run} jobs.
 */
@Service
public class AgentRunEngine {

    private static final Logger log = LoggerFactory.getLogger(AgentRunEngine.class);

    public static final String RESUME_ACTION = "resume_run";

    private final AgentRunGraph graph;
    private final AgentRunStore runStore;
    private final JobQueue jobQueue;
    private final TelemetryEmitter telemetry;
    private final AgentProperties properties;
    private final TaskExecutor runExecutor;
    private final Clock clock;

    public AgentRunEngine(AgentRunGraph graph, AgentRunStore runStore, JobQueue jobQueue,
                          TelemetryEmitter telemetry, AgentProperties properties,
                          @Qualifier("runExecutor") TaskExecutor runExecutor, Clock clock) {
        this.graph = graph;
        this.runStore = runStore;
        this.jobQueue = jobQueue;
        this.telemetry = telemetry;
        this.properties = properties;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    /**
     * Records a new run and starts it in the background.
     *
     * @return the run as first persisted (stage PLANNING, or QUEUED when the run pool is full)
     */
    public AgentRun requestGeneration(GenerationRequest request) {
        AgentRun run = createRun(request);
        try {
            runExecutor.execute(() -> executeRun(run.id(), AdmissionLane.LIVE));
        } catch (TaskRejectedException e) {
            log.warn("Run pool is full; queueing run {}", run.id());
            return park(run, OperationTypes.SANDBOX_COMMAND);
        }
        return run;
    }

    /**
     * Records a new run and drives it to DONE, ERROR or QUEUED on the calling thread.
     */
    public AgentRun generate(GenerationRequest request) {
        AgentRun run = createRun(request);
        return executeRun(run.id(), AdmissionLane.LIVE);
    }

    public Optional<AgentRun> getRunStatus(String runId) {
        return runStore.findById(runId);
    }

    public List<AgentRun> recentRuns(int limit) {
        return runStore.findRecent(limit);
    }

    /**
     * Runs or resumes the graph for a stored run. Finished runs are returned unchanged.
     * <p>
     * A LIVE run that gets deferred is parked as a {@code resume_run} job. A QUEUED
     * (sweep) run that gets deferred again rethrows the denial so the queue keeps
     * the job pending without spending an attempt.
     */
    public AgentRun executeRun(String runId, AdmissionLane lane) {
        MdcContext.setRun(runId);
        try {
            AgentRun run = runStore.findById(runId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown run " + runId));
            if (run.stage().isTerminal()) {
                log.info("Run {} already {}", runId, run.stage());
                return run;
            }

            log.info("Executing run {} on the {} lane from stage {}", runId, lane, run.stage());
            AgentRunState finalState;
            try {
                finalState = graph.execute(run, lane);
            } catch (RuntimeException e) {
                log.error("Run {} aborted", runId, e);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                telemetry.failure(runId, "engine", ErrorKind.INTERNAL, message);
                AgentRun failed = latest(run).withFailure(
                        new RunFailure(ErrorKind.INTERNAL, message, "engine", 1, null), now());
                runStore.save(failed);
                telemetry.runFinished(runId, RunStage.ERROR.name(), failed.repairCount());
                return failed;
            }

            AgentRun updated = latest(run);
            if (finalState.stage() == RunStage.QUEUED) {
                return onDeferred(updated, finalState, lane);
            }
            log.info("Run {} finished in {} after {} repair(s)", runId, updated.stage(), updated.repairCount());
            telemetry.runFinished(runId, updated.stage().name(), updated.repairCount());
            return updated;
        } finally {
            MdcContext.clearRun();
        }
    }

    /**
     * Generates a run id in the format RUN-YYYY-xxxxxxxx.
     */
    public String generateRunId() {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("RUN-%d-%s", year, UUID.randomUUID().toString().substring(0, 8));
    }

    private AgentRun createRun(GenerationRequest request) {
        if (request.projectId() == null || request.projectId().isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (request.request() == null || request.request().isBlank()) {
            throw new IllegalArgumentException("request is required");
        }
        Instant now = now();
        String runId = generateRunId();
        String fragmentId = "FRAG-" + UUID.randomUUID().toString().substring(0, 8);
        ValidationMode mode = request.mode() != null ? request.mode() : properties.getDefaultMode();
        var run = new AgentRun(runId, request.projectId(), fragmentId, request.request(), mode,
                RunStage.PLANNING, request.framework(), null, List.of(), false, null, null, 0, false,
                null, null, blankToNull(request.previousFragmentId()), now, now);
        runStore.save(run);
        telemetry.runCreated(runId, request.projectId(), fragmentId);
        log.info("Created run {} for project {} (fragment {}, mode {})", runId, request.projectId(), fragmentId, mode);
        return run;
    }

    private AgentRun onDeferred(AgentRun run, AgentRunState state, AdmissionLane lane) {
        String operation = state.deferralOperation().isEmpty()
                ? OperationTypes.SANDBOX_COMMAND : state.deferralOperation();
        if (lane == AdmissionLane.QUEUED) {
            Duration retryAfter = Duration.ofMillis(state.retryAfterMs());
            if (state.deferralKind().orElse(ErrorKind.RATE_LIMIT_EXCEEDED) == ErrorKind.CIRCUIT_OPEN) {
                throw new CircuitOpenException(CircuitBreaker.SANDBOX, retryAfter);
            }
            throw new RateLimitExceededException(operation, retryAfter);
        }
        return park(run, operation);
    }

    private AgentRun park(AgentRun run, String operationType) {
        String jobId = jobQueue.enqueue(operationType, RESUME_ACTION, Map.of("runId", run.id()));
        AgentRun queued = run.withPendingJob(jobId, now());
        runStore.save(queued);
        log.info("Run {} queued as job {} ({})", run.id(), jobId, operationType);
        return queued;
    }

    private AgentRun latest(AgentRun fallback) {
        return runStore.findById(fallback.id()).orElse(fallback);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
