package com.appforge.core.breaker;

import java.time.Instant;

/**
 * Persisted state of one breaker. {@code version} increases on every write and is
 * the compare-and-set token; {@code probeInFlight} is the half-open mutual-exclusion flag.
 *
 * @param name                upstream the breaker guards
 * @param state               CLOSED, OPEN or HALF_OPEN
 * @param consecutiveFailures failures since the last success
 * @param openedAt            when the breaker last opened; null while CLOSED
 * @param nextProbeAt         earliest time a probe may be admitted; null while CLOSED
 * @param probeInFlight       true while exactly one probe call is outstanding
 * @param probeStartedAt      when the outstanding probe was claimed
 * @param reopenCount         failed probes since the breaker last closed; drives cooldown backoff
 * @param version             optimistic-lock version
 */
public record CircuitBreakerState(
    String name,
    CircuitState state,
    int consecutiveFailures,
    Instant openedAt,
    Instant nextProbeAt,
    boolean probeInFlight,
    Instant probeStartedAt,
    int reopenCount,
    long version
) {

    public static CircuitBreakerState initial(String name) {
        return new CircuitBreakerState(name, CircuitState.CLOSED, 0, null, null, false, null, 0, 0L);
    }

    CircuitBreakerState closed() {
        return new CircuitBreakerState(name, CircuitState.CLOSED, 0, null, null, false, null, 0, version + 1);
    }

    CircuitBreakerState withFailures(int failures) {
        return new CircuitBreakerState(name, state, failures, openedAt, nextProbeAt,
                probeInFlight, probeStartedAt, reopenCount, version + 1);
    }

    CircuitBreakerState opened(Instant now, Instant probeAt, int failures, int reopens) {
        return new CircuitBreakerState(name, CircuitState.OPEN, failures, now, probeAt, false, null, reopens, version + 1);
    }

    CircuitBreakerState probeClaimed(Instant now) {
        return new CircuitBreakerState(name, CircuitState.HALF_OPEN, consecutiveFailures, openedAt, nextProbeAt,
                true, now, reopenCount, version + 1);
    }

    CircuitBreakerState probeReleased() {
        return new CircuitBreakerState(name, CircuitState.HALF_OPEN, consecutiveFailures, openedAt, nextProbeAt,
                false, null, reopenCount, version + 1);
    }
}
