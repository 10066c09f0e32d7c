package com.appforge.sandbox;

import com.appforge.core.admission.AdmissionDeniedException;
import com.appforge.core.admission.AdmissionGate;
import com.appforge.core.events.TelemetryEmitter;
import com.appforge.core.model.GeneratedFile;
import com.appforge.core.model.ValidationReport;
import com.appforge.core.queue.JobQueue;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.ratelimit.OperationTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates, reuses, runs commands in and tears down sandbox sessions.
 * <p>
 * Every upstream call goes through the {@link AdmissionGate}. Denials surface as
 * {@link AdmissionDeniedException}; {@link #acquire} turns them into a queued job
 * for callers that prefer a pending answer over an exception.
 */
@Service
public class SandboxLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(SandboxLifecycleManager.class);

    public static final String PROVISION_ACTION = "provision_sandbox";

    private final SandboxProvider provider;
    private final SandboxSessionStore sessionStore;
    private final AdmissionGate admissionGate;
    private final JobQueue jobQueue;
    private final SandboxProperties properties;
    private final TelemetryEmitter telemetry;
    private final Clock clock;
    private final Sleeper sleeper;

    /** Backoff hook, replaced in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public SandboxLifecycleManager(SandboxProvider provider, SandboxSessionStore sessionStore,
                                   AdmissionGate admissionGate, JobQueue jobQueue,
                                   SandboxProperties properties, TelemetryEmitter telemetry, Clock clock) {
        this(provider, sessionStore, admissionGate, jobQueue, properties, telemetry, clock,
                d -> Thread.sleep(d.toMillis()));
    }

    SandboxLifecycleManager(SandboxProvider provider, SandboxSessionStore sessionStore,
                            AdmissionGate admissionGate, JobQueue jobQueue, SandboxProperties properties,
                            TelemetryEmitter telemetry, Clock clock, Sleeper sleeper) {
        this.provider = provider;
        this.sessionStore = sessionStore;
        this.admissionGate = admissionGate;
        this.jobQueue = jobQueue;
        this.properties = properties;
        this.telemetry = telemetry;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Outcome of {@link #acquire}: either a running session or the job that will create it.
     */
    public record SandboxAcquisition(SandboxSession session, String jobId, Duration retryAfter) {
        public boolean isReady() {
            return session != null;
        }
    }

    /**
     * Returns the owner's running session, creating one when none exists.
     *
     * @throws AdmissionDeniedException when creation is rate-limited or the circuit is open
     * @throws SandboxException         when the upstream fails or another caller is mid-provisioning
     */
    public SandboxSession getOrCreate(String ownerEntityId, String imageTag, AdmissionLane lane) {
        Optional<SandboxSession> existing = sessionStore.findActiveByOwner(ownerEntityId);
        if (existing.isPresent()) {
            SandboxSession session = existing.get();
            if (session.status() == SandboxStatus.RUNNING) {
                sessionStore.touch(session.id(), now());
                log.debug("Reusing sandbox {} for {}", session.id(), ownerEntityId);
                return session;
            }
            if (!abandonIfStale(session)) {
                throw new SandboxException("Sandbox for " + ownerEntityId + " is still provisioning", false);
            }
        }

        Instant now = now();
        var provisioning = new SandboxSession("SBX-" + UUID.randomUUID(), ownerEntityId, null, imageTag,
                SandboxStatus.PROVISIONING, now, now);
        if (!sessionStore.insert(provisioning)) {
            // Lost the race for this owner; use the winner's session if it is ready
            return sessionStore.findActiveByOwner(ownerEntityId)
                    .filter(s -> s.status() == SandboxStatus.RUNNING)
                    .orElseThrow(() -> new SandboxException(
                            "Sandbox for " + ownerEntityId + " is still provisioning", false));
        }

        String handle;
        try {
            handle = admissionGate.call(OperationTypes.SANDBOX_CREATE, lane, () -> createWithRetry(imageTag));
        } catch (RuntimeException e) {
            sessionStore.updateStatus(provisioning.id(), SandboxStatus.PROVISIONING, SandboxStatus.FAILED, null, now());
            throw e;
        }

        if (!sessionStore.updateStatus(provisioning.id(), SandboxStatus.PROVISIONING, SandboxStatus.RUNNING,
                handle, now())) {
            destroyQuietly(handle);
            throw new SandboxException("Sandbox " + provisioning.id() + " was abandoned during provisioning", false);
        }
        log.info("Sandbox {} running for {} (template {})", provisioning.id(), ownerEntityId, imageTag);
        return sessionStore.findById(provisioning.id()).orElseThrow();
    }

    /**
     * Like {@link #getOrCreate} for live callers, but queues a provisioning job
     * instead of failing when admission is denied.
     */
    public SandboxAcquisition acquire(String ownerEntityId, String imageTag) {
        try {
            return new SandboxAcquisition(getOrCreate(ownerEntityId, imageTag, AdmissionLane.LIVE), null, null);
        } catch (AdmissionDeniedException e) {
            String jobId = jobQueue.enqueue(OperationTypes.SANDBOX_CREATE, PROVISION_ACTION,
                    Map.of("ownerEntityId", ownerEntityId, "imageTag", imageTag));
            telemetry.failure(null, "sandbox_create", e.kind(), e.getMessage());
            return new SandboxAcquisition(null, jobId, e.getRetryAfter());
        }
    }

    /**
     * Runs one command and returns its structured report. Timeouts are reported as
     * failed runs, never thrown.
     *
     * @param runId run the command belongs to, for telemetry; null outside a run
     */
    public ValidationReport run(String runId, SandboxSession session, String command, Duration timeout,
                                OutputSink sink, AdmissionLane lane) {
        SandboxSession current = requireRunning(session.id());
        CommandResult result = admissionGate.call(OperationTypes.SANDBOX_COMMAND, lane,
                () -> provider.runCommand(current.handle(), command, timeout, sink));
        sessionStore.touch(current.id(), now());

        boolean passed = result.exitCode() == 0 && !result.timedOut();
        telemetry.commandCompleted(runId, OperationTypes.SANDBOX_COMMAND, result.durationMs(), passed);
        if (result.timedOut()) {
            log.warn("Command '{}' in sandbox {} timed out after {}s", command, current.id(), timeout.toSeconds());
            String stderr = result.stderr() + "\nCommand timed out after " + timeout.toSeconds() + "s and was killed";
            return new ValidationReport(command, result.stdout(), stderr.strip(),
                    ValidationReport.TIMEOUT_EXIT_CODE, false, true);
        }
        return new ValidationReport(command, result.stdout(), result.stderr(), result.exitCode(), passed, false);
    }

    public void writeFiles(String runId, SandboxSession session, List<GeneratedFile> files, AdmissionLane lane) {
        SandboxSession current = requireRunning(session.id());
        Instant started = clock.instant();
        admissionGate.run(OperationTypes.SANDBOX_COMMAND, lane,
                () -> provider.writeFiles(current.handle(), files, properties.getCommandTimeout()));
        sessionStore.touch(current.id(), now());
        telemetry.commandCompleted(runId, OperationTypes.SANDBOX_COMMAND,
                Duration.between(started, clock.instant()).toMillis(), true);
        log.info("Wrote {} files to sandbox {}", files.size(), current.id());
    }

    /**
     * Stops the session and destroys the upstream sandbox. Stopping a session that
     * is already stopped or failed does nothing.
     */
    public void stop(String sessionId) {
        SandboxSession session = sessionStore.findById(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown sandbox session " + sessionId));
        if (!session.status().isActive()) {
            log.debug("Sandbox {} already {}", sessionId, session.status());
            return;
        }
        if (session.status() == SandboxStatus.PROVISIONING) {
            sessionStore.updateStatus(sessionId, SandboxStatus.PROVISIONING, SandboxStatus.FAILED, null, now());
            return;
        }
        provider.destroy(session.handle());
        sessionStore.updateStatus(sessionId, SandboxStatus.RUNNING, SandboxStatus.STOPPED, null, now());
        log.info("Sandbox {} stopped", sessionId);
    }

    /**
     * Reassigns a running session to another owner without touching the sandbox itself.
     *
     * @throws SandboxOwnershipConflictException when the new owner already has an active session
     */
    public SandboxSession transfer(String sessionId, String newOwnerEntityId) {
        SandboxSession session = requireRunning(sessionId);
        if (session.ownerEntityId().equals(newOwnerEntityId)) {
            return session;
        }
        if (!sessionStore.transfer(sessionId, newOwnerEntityId, now())) {
            throw new SandboxOwnershipConflictException(
                    newOwnerEntityId + " already owns an active sandbox");
        }
        log.info("Sandbox {} transferred from {} to {}", sessionId, session.ownerEntityId(), newOwnerEntityId);
        return sessionStore.findById(sessionId).orElseThrow();
    }

    public Optional<SandboxSession> find(String sessionId) {
        return sessionStore.findById(sessionId);
    }

    public Optional<SandboxSession> findActive(String ownerEntityId) {
        return sessionStore.findActiveByOwner(ownerEntityId);
    }

    public boolean isProviderAvailable() {
        return provider.isAvailable();
    }

    private SandboxSession requireRunning(String sessionId) {
        SandboxSession session = sessionStore.findById(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown sandbox session " + sessionId));
        if (session.status() != SandboxStatus.RUNNING) {
            throw new IllegalStateException("Sandbox " + sessionId + " is " + session.status() + ", not RUNNING");
        }
        return session;
    }

    private String createWithRetry(String imageTag) {
        int maxAttempts = Math.max(properties.getCreateMaxAttempts(), 1);
        for (int attempt = 1; ; attempt++) {
            try {
                return provider.create(imageTag);
            } catch (RuntimeException e) {
                boolean permanent = SandboxErrorClassifier.isPermanent(e);
                if (permanent || attempt >= maxAttempts) {
                    log.error("Sandbox creation failed after {} attempt(s): {}", attempt, e.getMessage());
                    throw e instanceof SandboxException ? e : new SandboxException(e.getMessage(), e, permanent);
                }
                Duration backoff = properties.createBackoff(attempt);
                log.warn("Sandbox creation attempt {}/{} failed ({}); retrying in {}ms",
                        attempt, maxAttempts, e.getMessage(), backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SandboxException("Interrupted during sandbox creation backoff", ie, false);
                }
            }
        }
    }

    private boolean abandonIfStale(SandboxSession session) {
        if (session.createdAt().plus(properties.getProvisioningTimeout()).isAfter(now())) {
            return false;
        }
        log.warn("Sandbox {} stuck in PROVISIONING since {}; marking FAILED", session.id(), session.createdAt());
        return sessionStore.updateStatus(session.id(), SandboxStatus.PROVISIONING, SandboxStatus.FAILED, null, now());
    }

    private void destroyQuietly(String handle) {
        try {
            provider.destroy(handle);
        } catch (RuntimeException e) {
            log.warn("Failed to destroy orphaned sandbox {}: {}", handle, e.getMessage());
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
