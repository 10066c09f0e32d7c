package com.appforge.core.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Counter for one operation type in its current fixed window.
 */
public record RateLimitWindow(
    String operationType,
    Instant windowStart,
    int count,
    int limit
) {

    public boolean isExpired(Instant now, Duration window) {
        return !now.isBefore(windowStart.plus(window));
    }

    public Duration remaining(Instant now, Duration window) {
        return Duration.between(now, windowStart.plus(window));
    }
}
