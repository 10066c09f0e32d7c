package com.appforge.core.ratelimit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process {@link RateLimitStore}. Atomic per key through
 * {@link ConcurrentHashMap#compute}, but invisible to other replicas.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private final ConcurrentHashMap<String, RateLimitWindow> windows = new ConcurrentHashMap<>();

    @Override
    public Optional<RateLimitWindow> find(String operationType) {
        return Optional.ofNullable(windows.get(operationType));
    }

    @Override
    public boolean openWindow(String operationType, Instant expectedStart, Instant newStart, int limit) {
        var opened = new AtomicBoolean(false);
        windows.compute(operationType, (k, current) -> {
            Instant currentStart = current != null ? current.windowStart() : null;
            if (!Objects.equals(currentStart, expectedStart)) {
                return current;
            }
            opened.set(true);
            return new RateLimitWindow(operationType, newStart, 0, limit);
        });
        return opened.get();
    }

    @Override
    public boolean tryIncrement(String operationType, Instant windowStart, int ceiling) {
        var taken = new AtomicBoolean(false);
        windows.computeIfPresent(operationType, (k, current) -> {
            if (!current.windowStart().equals(windowStart) || current.count() >= ceiling) {
                return current;
            }
            taken.set(true);
            return new RateLimitWindow(operationType, current.windowStart(), current.count() + 1, current.limit());
        });
        return taken.get();
    }

    @Override
    public List<RateLimitWindow> findAll() {
        return new ArrayList<>(windows.values());
    }

    @Override
    public int deleteWindowsStartedBefore(Instant cutoff) {
        int before = windows.size();
        windows.values().removeIf(w -> w.windowStart().isBefore(cutoff));
        return before - windows.size();
    }
}
