package com.appforge.dispatch.api;

import com.appforge.core.health.HealthCheckService;
import com.appforge.core.health.HealthStatus;
import com.appforge.core.health.OrchestrationHealth;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: Component checks plus the orchestration snapshot.
     * Returns 200 unless a component is DOWN, then 503.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        var checks = healthCheckService.checkAll();
        boolean anyDown = false;

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);

            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("components", components);
        result.put("orchestration", toBody(healthCheckService.orchestrationHealth()));

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }

    private static Map<String, Object> toBody(OrchestrationHealth health) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("breaker_state", health.breakerState().name());
        body.put("consecutive_failures", health.consecutiveFailures());
        body.put("next_probe_at", health.nextProbeAt() != null ? health.nextProbeAt().toString() : null);

        Map<String, Object> usage = new LinkedHashMap<>();
        for (var window : health.rateLimitUsageByOperation()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("count", window.count());
            entry.put("limit", window.limit());
            entry.put("remaining", window.remaining());
            entry.put("window_start", window.windowStart() != null ? window.windowStart().toString() : null);
            usage.put(window.operationType(), entry);
        }
        body.put("rate_limits", usage);

        Map<String, Long> depth = new LinkedHashMap<>();
        health.queueDepthByStatus().forEach((status, count) -> depth.put(status.name(), count));
        body.put("queue_depth", depth);
        body.put("oldest_pending_age_seconds",
                health.oldestPendingAge() != null ? health.oldestPendingAge().toSeconds() : null);
        return body;
    }
}
