package com.appforge.core.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "appforge.rate-limit")
public class RateLimitProperties {

    private Duration window = Duration.ofHours(1);

    /** Per-operation limits per window. Operations not listed use {@link #defaultLimit}. */
    private Map<String, Integer> limits = new LinkedHashMap<>(Map.of(
            OperationTypes.SANDBOX_CREATE, 100,
            OperationTypes.SANDBOX_COMMAND, 2000));

    private int defaultLimit = 1000;

    /** Share of each window that live callers may not consume, kept for queued work. */
    private double queueReserveFraction = 0.2;

    public int limitFor(String operationType) {
        Integer limit = limits.get(operationType);
        return limit != null ? limit : defaultLimit;
    }

    /**
     * Ceiling for live callers: the limit minus the queue reserve, rounded so the
     * reserve never exceeds the configured fraction.
     */
    public int liveCeilingFor(String operationType) {
        int limit = limitFor(operationType);
        int reserve = (int) Math.floor(limit * queueReserveFraction);
        return Math.max(limit - reserve, 0);
    }

    public Duration getWindow() { return window; }
    public void setWindow(Duration window) { this.window = window; }
    public Map<String, Integer> getLimits() { return limits; }
    public void setLimits(Map<String, Integer> limits) { this.limits = limits; }
    public int getDefaultLimit() { return defaultLimit; }
    public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }
    public double getQueueReserveFraction() { return queueReserveFraction; }

    public void setQueueReserveFraction(double queueReserveFraction) {
        if (queueReserveFraction < 0 || queueReserveFraction >= 1) {
            throw new IllegalArgumentException("queue-reserve-fraction must be in [0, 1): " + queueReserveFraction);
        }
        this.queueReserveFraction = queueReserveFraction;
    }
}
