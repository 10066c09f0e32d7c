package com.appforge.core.breaker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "appforge.circuit-breaker")
public class CircuitBreakerProperties {

    private int failureThreshold = 5;
    private Duration cooldown = Duration.ofSeconds(60);
    private double backoffMultiplier = 2.0;
    private Duration maxCooldown = Duration.ofMinutes(15);

    /** A probe not reported within this time is presumed lost and another caller may probe. */
    private Duration probeLease = Duration.ofMinutes(5);

    /**
     * Cooldown after the breaker opens for the {@code reopenCount}-th time in a row
     * (0 for the first opening), capped at {@link #maxCooldown}.
     */
    public Duration cooldownFor(int reopenCount) {
        double factor = Math.pow(backoffMultiplier, Math.max(reopenCount, 0));
        double millis = cooldown.toMillis() * factor;
        if (millis >= maxCooldown.toMillis()) {
            return maxCooldown;
        }
        return Duration.ofMillis((long) millis);
    }

    public int getFailureThreshold() { return failureThreshold; }
    public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
    public Duration getCooldown() { return cooldown; }
    public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    public Duration getMaxCooldown() { return maxCooldown; }
    public void setMaxCooldown(Duration maxCooldown) { this.maxCooldown = maxCooldown; }
    public Duration getProbeLease() { return probeLease; }
    public void setProbeLease(Duration probeLease) { this.probeLease = probeLease; }
}
