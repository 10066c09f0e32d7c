package com.appforge.core.ratelimit;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of rate-limit windows. Every mutation is a conditional update so
 * concurrent processes cannot both pass the same check.
 */
public interface RateLimitStore {

    Optional<RateLimitWindow> find(String operationType);

    /**
     * Starts a fresh window with a zero count.
     *
     * @param expectedStart start of the window being replaced, or null when none exists yet
     * @return false when another caller replaced or created the window first
     */
    boolean openWindow(String operationType, Instant expectedStart, Instant newStart, int limit);

    /**
     * Increments the counter only while the window is still {@code windowStart} and
     * the count is below {@code ceiling}.
     *
     * @return true when this call took a slot
     */
    boolean tryIncrement(String operationType, Instant windowStart, int ceiling);

    List<RateLimitWindow> findAll();

    int deleteWindowsStartedBefore(Instant cutoff);
}
