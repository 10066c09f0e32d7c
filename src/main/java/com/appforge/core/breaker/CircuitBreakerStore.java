package com.appforge.core.breaker;

/**
 * Durable, shared breaker state with optimistic concurrency.
 */
public interface CircuitBreakerStore {

    /** Returns the stored state, creating a CLOSED record on first use. */
    CircuitBreakerState load(String name);

    /**
     * Writes {@code next} only if the stored version still equals {@code expected.version()}.
     *
     * @return false when another caller wrote first
     */
    boolean compareAndSet(CircuitBreakerState expected, CircuitBreakerState next);
}
