package com.appforge.core.health;

import com.appforge.core.breaker.CircuitBreaker;
import com.appforge.core.breaker.CircuitBreakerState;
import com.appforge.core.queue.JobQueue;
import com.appforge.core.queue.QueueStats;
import com.appforge.core.ratelimit.RateLimiter;
import com.appforge.sandbox.SandboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final JobQueue jobQueue;
    private final SandboxProvider sandboxProvider;
    private final DataSource dataSource;

    public HealthCheckService(
            CircuitBreaker circuitBreaker,
            RateLimiter rateLimiter,
            JobQueue jobQueue,
            @Autowired(required = false) SandboxProvider sandboxProvider,
            @Autowired(required = false) DataSource dataSource) {
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.jobQueue = jobQueue;
        this.sandboxProvider = sandboxProvider;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkSandboxProvider());
        results.add(checkCircuitBreaker());
        return results;
    }

    /** Breaker state, window usage and queue depth. */
    public OrchestrationHealth orchestrationHealth() {
        CircuitBreakerState breaker = circuitBreaker.state();
        QueueStats stats = jobQueue.stats();
        return new OrchestrationHealth(
                breaker.state(),
                breaker.consecutiveFailures(),
                breaker.nextProbeAt(),
                rateLimiter.usage(),
                stats.depthByStatus(),
                stats.oldestPendingAge());
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No shared store configured; limits and breaker state are per-process", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkSandboxProvider() {
        if (sandboxProvider == null) {
            return new HealthStatus("sandbox", HealthStatus.Status.DOWN,
                    "No SandboxProvider configured", Map.of());
        }
        String providerName = sandboxProvider.getClass().getSimpleName();
        try {
            if (sandboxProvider.isAvailable()) {
                return new HealthStatus("sandbox", HealthStatus.Status.UP,
                        providerName + " available", Map.of("provider", providerName));
            }
            return new HealthStatus("sandbox", HealthStatus.Status.DOWN,
                    providerName + " not reachable", Map.of("provider", providerName));
        } catch (RuntimeException e) {
            log.warn("Sandbox health check failed: {}", e.getMessage());
            return new HealthStatus("sandbox", HealthStatus.Status.DOWN,
                    "Sandbox error: " + e.getMessage(), Map.of("provider", providerName));
        }
    }

    private HealthStatus checkCircuitBreaker() {
        CircuitBreakerState state = circuitBreaker.state();
        var metadata = Map.of(
                "state", state.state().name(),
                "consecutiveFailures", String.valueOf(state.consecutiveFailures()));
        return switch (state.state()) {
            case CLOSED -> new HealthStatus("circuitBreaker", HealthStatus.Status.UP,
                    "Circuit closed", metadata);
            case HALF_OPEN -> new HealthStatus("circuitBreaker", HealthStatus.Status.DEGRADED,
                    "Circuit half-open; probing upstream", metadata);
            case OPEN -> new HealthStatus("circuitBreaker", HealthStatus.Status.DEGRADED,
                    "Circuit open until " + state.nextProbeAt(), metadata);
        };
    }
}
