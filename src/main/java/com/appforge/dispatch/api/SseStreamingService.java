package com.appforge.dispatch.api;

import com.appforge.core.events.EventBus;
import com.appforge.core.model.AgentRun;
import com.appforge.core.events.TelemetryEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} run subscriptions to {@link SseEmitter} instances.
 * <p>
 * Emitters complete on their own once the run publishes {@code run.finished}.
 * A run that has already finished gets its final status replayed and the stream
 * closed straight away.
 * Heartbeat comments keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;
    static final String RUN_FINISHED = "run.finished";

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed for run {}: {}", registration.runId, e.getMessage());
            }
        }
    }

    /**
     * Creates an emitter that streams events for one run until it finishes.
     */
    public SseEmitter createEmitter(String runId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(runId, event -> sendEvent(emitter, event));
        var registration = new EmitterRegistration(runId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", runId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", runId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for run {}: {}", runId, e.getMessage());
        }

        log.info("SSE emitter created for run {} (timeout={}ms)", runId, timeoutMs);
        return emitter;
    }

    /**
     * Creates an emitter for a run that has already reached DONE or ERROR. It carries
     * a single {@code run.finished} event and is complete when returned.
     */
    public SseEmitter finishedEmitter(AgentRun run) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        sendFinished(emitter, run);
        log.debug("Run {} already {}; SSE stream closed after final status", run.id(), run.stage());
        return emitter;
    }

    /**
     * Sends the final status of a finished run and completes the emitter. Does nothing
     * if the emitter was already completed by the live {@code run.finished} event.
     */
    public void sendFinished(SseEmitter emitter, AgentRun run) {
        sendEvent(emitter, new TelemetryEvent(RUN_FINISHED, run.id(), null,
                Map.of("runStage", run.stage().name(), "repairCount", run.repairCount()), run.updatedAt()));
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    static Map<String, Object> toData(TelemetryEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("runId", event.runId());
        if (event.stage() != null) {
            data.put("stage", event.stage());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void sendEvent(SseEmitter emitter, TelemetryEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.eventType()).data(toData(event)));
            if (RUN_FINISHED.equals(event.eventType())) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for run {}: {}",
                    event.eventType(), event.runId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(String runId, SseEmitter emitter, EventBus.Subscription subscription) {}
}
