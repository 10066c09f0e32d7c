package com.appforge.core.breaker;

import com.appforge.core.admission.CircuitOpenException;
import com.appforge.core.events.TelemetryEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.function.Supplier;

/**
 * Three-state circuit breaker guarding the sandbox upstream.
 * <p>
 * State lives in a {@link CircuitBreakerStore} shared by every replica; each
 * transition is a compare-and-set on the stored version, retried on conflict.
 * The half-open probe is claimed by flipping {@code probeInFlight} in that same
 * compare-and-set, so at most one probe is outstanding across the fleet. A probe
 * not reported within the configured lease is presumed lost.
 * <p>
 * Callers either use {@link #execute(Supplier)} or the explicit
 * {@link #acquire()} / {@link #onSuccess} / {@link #onFailure} / {@link #release}
 * protocol when something else (the rate limiter) may still veto the call after
 * the breaker admitted it.
 */
@Service
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final String SANDBOX = "sandbox";

    private static final int MAX_CAS_RETRIES = 32;

    private final String name;
    private final CircuitBreakerStore store;
    private final CircuitBreakerProperties properties;
    private final TelemetryEmitter telemetry;
    private final Clock clock;

    public CircuitBreaker(CircuitBreakerStore store, CircuitBreakerProperties properties,
                          TelemetryEmitter telemetry, Clock clock) {
        this(SANDBOX, store, properties, telemetry, clock);
    }

    CircuitBreaker(String name, CircuitBreakerStore store, CircuitBreakerProperties properties,
                   TelemetryEmitter telemetry, Clock clock) {
        this.name = name;
        this.store = store;
        this.properties = properties;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    /**
     * Admission token. {@code probe} is true for the single half-open trial call.
     */
    public record Permit(boolean probe, Instant claimedAt) {}

    /**
     * Runs {@code operation} through the breaker.
     *
     * @throws CircuitOpenException when the circuit is open or another probe is in flight
     */
    public <T> T execute(Supplier<T> operation) {
        Permit permit = acquire();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            onFailure(permit, e);
            throw e;
        }
        onSuccess(permit);
        return result;
    }

    /**
     * Claims permission for one upstream call.
     *
     * @throws CircuitOpenException when calls are currently short-circuited
     */
    public Permit acquire() {
        for (int attempt = 0; attempt < MAX_CAS_RETRIES; attempt++) {
            CircuitBreakerState s = store.load(name);
            Instant now = now();

            switch (s.state()) {
                case CLOSED:
                    return new Permit(false, now);
                case OPEN:
                    if (now.isBefore(s.nextProbeAt())) {
                        throw new CircuitOpenException(name, Duration.between(now, s.nextProbeAt()));
                    }
                    if (store.compareAndSet(s, s.probeClaimed(now))) {
                        telemetry.breakerTransition(CircuitState.OPEN.name(), CircuitState.HALF_OPEN.name(),
                                s.consecutiveFailures());
                        return new Permit(true, now);
                    }
                    break;
                case HALF_OPEN:
                    if (s.probeInFlight() && !probeLeaseExpired(s, now)) {
                        throw new CircuitOpenException(name, leaseRemaining(s, now));
                    }
                    if (s.probeInFlight()) {
                        log.warn("Half-open probe claimed at {} never reported back; reclaiming", s.probeStartedAt());
                    }
                    if (store.compareAndSet(s, s.probeClaimed(now))) {
                        log.info("Circuit '{}' admitted half-open probe", name);
                        return new Permit(true, now);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown circuit state " + s.state());
            }
        }
        throw new CircuitOpenException(name, Duration.ofSeconds(1));
    }

    public void onSuccess(Permit permit) {
        for (int attempt = 0; attempt < MAX_CAS_RETRIES; attempt++) {
            CircuitBreakerState s = store.load(name);
            if (permit.probe() && s.state() == CircuitState.HALF_OPEN && ownsProbe(s, permit)) {
                if (store.compareAndSet(s, s.closed())) {
                    telemetry.breakerTransition(CircuitState.HALF_OPEN.name(), CircuitState.CLOSED.name(), 0);
                    return;
                }
            } else if (s.state() == CircuitState.CLOSED && s.consecutiveFailures() > 0) {
                if (store.compareAndSet(s, s.withFailures(0))) {
                    return;
                }
            } else {
                // Late success from a call admitted before the circuit opened
                return;
            }
        }
        log.warn("Circuit '{}' could not record success after {} attempts", name, MAX_CAS_RETRIES);
    }

    public void onFailure(Permit permit, Throwable cause) {
        for (int attempt = 0; attempt < MAX_CAS_RETRIES; attempt++) {
            CircuitBreakerState s = store.load(name);
            Instant now = now();

            if (permit.probe() && s.state() == CircuitState.HALF_OPEN && ownsProbe(s, permit)) {
                int reopens = s.reopenCount() + 1;
                Instant probeAt = now.plus(properties.cooldownFor(reopens));
                if (store.compareAndSet(s, s.opened(now, probeAt, s.consecutiveFailures() + 1, reopens))) {
                    log.warn("Circuit '{}' probe failed ({}); reopening until {}", name, describe(cause), probeAt);
                    telemetry.breakerTransition(CircuitState.HALF_OPEN.name(), CircuitState.OPEN.name(),
                            s.consecutiveFailures() + 1);
                    return;
                }
            } else if (s.state() == CircuitState.CLOSED) {
                int failures = s.consecutiveFailures() + 1;
                CircuitBreakerState next = failures >= properties.getFailureThreshold()
                        ? s.opened(now, now.plus(properties.cooldownFor(0)), failures, 0)
                        : s.withFailures(failures);
                if (store.compareAndSet(s, next)) {
                    if (next.state() == CircuitState.OPEN) {
                        log.warn("Circuit '{}' opened after {} consecutive failures (last: {})",
                                name, failures, describe(cause));
                        telemetry.breakerTransition(CircuitState.CLOSED.name(), CircuitState.OPEN.name(), failures);
                    } else {
                        log.debug("Circuit '{}' failure {}/{}", name, failures, properties.getFailureThreshold());
                    }
                    return;
                }
            } else {
                // Already open, or a stale probe outcome: nothing to count
                return;
            }
        }
        log.warn("Circuit '{}' could not record failure after {} attempts", name, MAX_CAS_RETRIES);
    }

    /**
     * Gives back a permit that was never used against the upstream, e.g. because
     * the rate limiter refused the call afterwards. Records no outcome.
     */
    public void release(Permit permit) {
        if (!permit.probe()) {
            return;
        }
        for (int attempt = 0; attempt < MAX_CAS_RETRIES; attempt++) {
            CircuitBreakerState s = store.load(name);
            if (s.state() != CircuitState.HALF_OPEN || !ownsProbe(s, permit)) {
                return;
            }
            if (store.compareAndSet(s, s.probeReleased())) {
                log.debug("Circuit '{}' probe released unused", name);
                return;
            }
        }
    }

    /**
     * Whether a call would currently be let through, without claiming anything.
     */
    public boolean isCallPermitted() {
        CircuitBreakerState s = store.load(name);
        Instant now = now();
        return switch (s.state()) {
            case CLOSED -> true;
            case OPEN -> !now.isBefore(s.nextProbeAt());
            case HALF_OPEN -> !s.probeInFlight() || probeLeaseExpired(s, now);
        };
    }

    public CircuitBreakerState state() {
        return store.load(name);
    }

    /**
     * Forces the breaker CLOSED with a zero failure count.
     */
    public void reset() {
        for (int attempt = 0; attempt < MAX_CAS_RETRIES; attempt++) {
            CircuitBreakerState s = store.load(name);
            if (store.compareAndSet(s, s.closed())) {
                log.info("Circuit '{}' manually reset from {}", name, s.state());
                if (s.state() != CircuitState.CLOSED) {
                    telemetry.breakerTransition(s.state().name(), CircuitState.CLOSED.name(), 0);
                }
                return;
            }
        }
        throw new IllegalStateException("Could not reset circuit '" + name + "' under contention");
    }

    public String getName() {
        return name;
    }

    /** Millisecond precision so that instants survive a round trip through the store. */
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private boolean ownsProbe(CircuitBreakerState s, Permit permit) {
        return s.probeInFlight() && permit.claimedAt().equals(s.probeStartedAt());
    }

    private boolean probeLeaseExpired(CircuitBreakerState s, Instant now) {
        return s.probeStartedAt() == null || !now.isBefore(s.probeStartedAt().plus(properties.getProbeLease()));
    }

    private Duration leaseRemaining(CircuitBreakerState s, Instant now) {
        Duration remaining = Duration.between(now, s.probeStartedAt().plus(properties.getProbeLease()));
        Duration cap = properties.getCooldown();
        return remaining.compareTo(cap) > 0 ? cap : remaining;
    }

    private static String describe(Throwable cause) {
        return cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : "unknown";
    }
}
