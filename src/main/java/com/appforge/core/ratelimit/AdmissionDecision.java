package com.appforge.core.ratelimit;

import java.time.Duration;

/**
 * Result of {@link RateLimiter#admit}: allowed, or denied with the time left in the window.
 */
public record AdmissionDecision(boolean allowed, Duration retryAfter) {

    private static final AdmissionDecision ALLOWED = new AdmissionDecision(true, Duration.ZERO);

    public static AdmissionDecision allow() {
        return ALLOWED;
    }

    public static AdmissionDecision deny(Duration retryAfter) {
        return new AdmissionDecision(false, retryAfter.isNegative() ? Duration.ZERO : retryAfter);
    }
}
