package com.appforge.core.events;

import com.appforge.core.metrics.AppForgeMetrics;
import com.appforge.core.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Single entry point the orchestration core uses to report what happened.
 * <p>
 * Every call logs, updates Micrometer meters and publishes a {@link TelemetryEvent}.
 * Nothing here may influence control flow, so every method swallows and logs
 * its own failures.
 */
@Service
public class TelemetryEmitter {

    private static final Logger log = LoggerFactory.getLogger(TelemetryEmitter.class);

    private final EventBus eventBus;
    private final AppForgeMetrics metrics;
    private final Clock clock;

    public TelemetryEmitter(EventBus eventBus, AppForgeMetrics metrics, Clock clock) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void runCreated(String runId, String projectId, String fragmentId) {
        emit("run.created", runId, null, Map.of("projectId", projectId, "fragmentId", fragmentId));
    }

    public void stageEntered(String runId, String stage) {
        emit("stage.entered", runId, stage, Map.of());
    }

    public void stageCompleted(String runId, String stage, String runStage, long elapsedMs) {
        safely(() -> metrics.recordStageDuration(stage, elapsedMs));
        emit("stage.completed", runId, stage, Map.of("runStage", runStage, "elapsedMs", elapsedMs));
    }

    public void runFinished(String runId, String runStage, int repairCount) {
        safely(() -> {
            metrics.recordRunResult(runStage);
            metrics.recordRepairCount(repairCount);
        });
        emit("run.finished", runId, null, Map.of("runStage", runStage, "repairCount", repairCount));
    }

    /**
     * Records a failure of any kind. Transient failures log at WARN, fatal ones at ERROR.
     */
    public void failure(String runId, String stage, ErrorKind kind, String message) {
        if (kind.isTransient()) {
            log.warn("[{}] {} in {}: {}", runId, kind, stage, message);
        } else {
            log.error("[{}] {} in {}: {}", runId, kind, stage, message);
        }
        safely(() -> metrics.recordFailure(kind.name(), stage));
        var payload = new LinkedHashMap<String, Object>();
        payload.put("kind", kind.name());
        payload.put("transient", kind.isTransient());
        payload.put("message", message != null ? message : "");
        emit("run.failure", runId, stage, payload);
    }

    public void admission(String operationType, boolean allowed) {
        safely(() -> metrics.recordAdmission(operationType, allowed));
        if (!allowed) {
            emit("admission.denied", null, "rate_limiter", Map.of("operationType", operationType));
        }
    }

    public void breakerTransition(String from, String to, int consecutiveFailures) {
        log.info("Circuit breaker {} -> {} (consecutiveFailures={})", from, to, consecutiveFailures);
        safely(() -> metrics.recordBreakerTransition(from, to));
        emit("breaker.transition", null, "circuit_breaker",
                Map.of("from", from, "to", to, "consecutiveFailures", consecutiveFailures));
    }

    public void jobEvent(String jobId, String operationType, String status) {
        safely(() -> metrics.recordJobOutcome(status));
        emit("job." + status.toLowerCase(Locale.ROOT), null, "job_queue",
                Map.of("jobId", jobId, "operationType", operationType));
    }

    public void sweepCompleted(int processed) {
        safely(() -> metrics.recordSweep(processed));
        emit("queue.swept", null, "job_queue", Map.of("processed", processed));
    }

    public void commandCompleted(String runId, String operationType, long elapsedMs, boolean passed) {
        safely(() -> metrics.recordCommandDuration(operationType, elapsedMs));
        if (runId != null) {
            emit("sandbox.command", runId, "sandbox", Map.of("elapsedMs", elapsedMs, "passed", passed));
        }
    }

    /** Incremental command output for live followers of a run. Not logged above DEBUG. */
    public void commandOutput(String runId, String channel, String chunk) {
        if (runId != null) {
            emit("sandbox.output", runId, "sandbox", Map.of("channel", channel, "chunk", chunk));
        }
    }

    private void emit(String eventType, String runId, String stage, Map<String, Object> payload) {
        safely(() -> eventBus.publish(new TelemetryEvent(eventType, runId, stage, payload, clock.instant())));
    }

    private void safely(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Telemetry emission failed: {}", e.getMessage(), e);
        }
    }
}
