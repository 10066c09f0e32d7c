package com.appforge.core.ratelimit;

import java.time.Instant;

/**
 * Health-view snapshot of one operation type's window.
 */
public record RateLimitUsage(
    String operationType,
    int count,
    int limit,
    Instant windowStart,
    int remaining
) {

    public double utilization() {
        return limit <= 0 ? 1.0 : (double) count / limit;
    }
}
