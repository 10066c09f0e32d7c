package com.appforge.core.breaker;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryCircuitBreakerStore implements CircuitBreakerStore {

    private final ConcurrentHashMap<String, CircuitBreakerState> states = new ConcurrentHashMap<>();

    @Override
    public CircuitBreakerState load(String name) {
        return states.computeIfAbsent(name, CircuitBreakerState::initial);
    }

    @Override
    public boolean compareAndSet(CircuitBreakerState expected, CircuitBreakerState next) {
        var written = new AtomicBoolean(false);
        states.compute(expected.name(), (k, current) -> {
            long currentVersion = current != null ? current.version() : 0L;
            if (currentVersion != expected.version()) {
                return current;
            }
            written.set(true);
            return next;
        });
        return written.get();
    }
}
