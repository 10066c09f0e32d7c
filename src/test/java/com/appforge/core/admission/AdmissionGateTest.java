package com.appforge.core.admission;

import com.appforge.core.breaker.CircuitBreaker;
import com.appforge.core.breaker.CircuitBreakerProperties;
import com.appforge.core.breaker.CircuitState;
import com.appforge.core.breaker.InMemoryCircuitBreakerStore;
import com.appforge.core.events.TelemetryEmitter;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.ratelimit.InMemoryRateLimitStore;
import com.appforge.core.ratelimit.RateLimitProperties;
import com.appforge.core.ratelimit.RateLimiter;
import com.appforge.support.MutableClock;
import com.appforge.support.TestTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionGateTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private InMemoryRateLimitStore rateLimitStore;
    private AdmissionGate gate;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        TelemetryEmitter telemetry = TestTelemetry.emitter(clock);

        var breakerProps = new CircuitBreakerProperties();
        breakerProps.setFailureThreshold(2);
        breakerProps.setCooldown(Duration.ofSeconds(30));
        breaker = new CircuitBreaker(new InMemoryCircuitBreakerStore(), breakerProps, telemetry, clock);

        var limitProps = new RateLimitProperties();
        limitProps.setLimits(Map.of("create", 2));
        limitProps.setQueueReserveFraction(0.0);
        rateLimitStore = new InMemoryRateLimitStore();
        gate = new AdmissionGate(breaker, new RateLimiter(rateLimitStore, limitProps, telemetry, clock));
    }

    @Test
    @DisplayName("runs the upstream call when both checks pass")
    void passesThrough() {
        assertEquals("sbx-1", gate.call("create", AdmissionLane.LIVE, () -> "sbx-1"));
    }

    @Test
    @DisplayName("rate-limit denial throws with the retry delay and never calls upstream")
    void rateLimitDenied() {
        var calls = new AtomicInteger();
        gate.run("create", AdmissionLane.LIVE, calls::incrementAndGet);
        gate.run("create", AdmissionLane.LIVE, calls::incrementAndGet);

        var ex = assertThrows(RateLimitExceededException.class,
                () -> gate.run("create", AdmissionLane.LIVE, calls::incrementAndGet));

        assertEquals(2, calls.get());
        assertEquals("create", ex.getOperationType());
        assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, ex.kind());
        assertEquals(Duration.ofHours(1), ex.getRetryAfter());
        assertEquals(0, breaker.state().consecutiveFailures());
    }

    @Test
    @DisplayName("upstream exceptions count against the breaker and propagate unchanged")
    void upstreamFailureCounts() {
        var boom = new IllegalStateException("boom");
        var thrown = assertThrows(IllegalStateException.class,
                () -> gate.call("create", AdmissionLane.LIVE, () -> { throw boom; }));

        assertSame(boom, thrown);
        assertEquals(1, breaker.state().consecutiveFailures());
    }

    @Test
    @DisplayName("an open circuit consumes no rate-limit budget")
    void openCircuitCostsNoBudget() {
        for (int i = 0; i < 2; i++) {
            assertThrows(IllegalStateException.class, () -> gate.call("create", AdmissionLane.LIVE, () -> {
                throw new IllegalStateException("down");
            }));
        }
        assertEquals(CircuitState.OPEN, breaker.state().state());

        var ex = assertThrows(CircuitOpenException.class, () -> gate.call("create", AdmissionLane.LIVE, () -> "x"));

        assertEquals(ErrorKind.CIRCUIT_OPEN, ex.kind());
        assertEquals(2, rateLimitStore.find("create").orElseThrow().count());
    }

    @Test
    @DisplayName("a probe denied by the rate limiter is released for the next caller")
    void deniedProbeReleased() {
        for (int i = 0; i < 2; i++) {
            assertThrows(IllegalStateException.class, () -> gate.call("create", AdmissionLane.LIVE, () -> {
                throw new IllegalStateException("down");
            }));
        }
        clock.advance(Duration.ofSeconds(30));

        assertThrows(RateLimitExceededException.class, () -> gate.call("create", AdmissionLane.LIVE, () -> "x"));

        assertEquals(CircuitState.HALF_OPEN, breaker.state().state());
        assertFalse(breaker.state().probeInFlight());
    }
}
