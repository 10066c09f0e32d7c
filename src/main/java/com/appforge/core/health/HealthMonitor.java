package com.appforge.core.health;

import com.appforge.core.breaker.CircuitState;
import com.appforge.core.ratelimit.RateLimitUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Periodic alerting on the orchestration health view.
 */
@Component
@ConditionalOnProperty(name = "appforge.queue.scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final HealthCheckService healthCheckService;
    private final HealthProperties properties;

    public HealthMonitor(HealthCheckService healthCheckService, HealthProperties properties) {
        this.healthCheckService = healthCheckService;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${appforge.health.check-interval:PT5M}",
            initialDelayString = "${appforge.health.check-interval:PT5M}")
    public void check() {
        try {
            List<String> alerts = evaluate(healthCheckService.orchestrationHealth());
            if (alerts.isEmpty()) {
                log.debug("Orchestration health check passed");
            }
        } catch (RuntimeException e) {
            log.error("Orchestration health check failed: {}", e.getMessage(), e);
        }
    }

    /** Logs and returns the alerts raised by one snapshot. */
    List<String> evaluate(OrchestrationHealth health) {
        var alerts = new ArrayList<String>();
        if (health.breakerState() == CircuitState.OPEN) {
            String alert = "Circuit breaker OPEN after " + health.consecutiveFailures()
                    + " consecutive failures; next probe at " + health.nextProbeAt();
            log.error("ALERT: {}", alert);
            alerts.add(alert);
        }
        for (RateLimitUsage usage : health.rateLimitUsageByOperation()) {
            if (usage.utilization() > properties.getUsageAlertThreshold()) {
                String alert = String.format("Rate limit for %s at %.0f%% (%d/%d)",
                        usage.operationType(), usage.utilization() * 100, usage.count(), usage.limit());
                log.warn("ALERT: {}", alert);
                alerts.add(alert);
            }
        }
        return alerts;
    }
}
