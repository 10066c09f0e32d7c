package com.appforge.dispatch.api;

import com.appforge.core.breaker.CircuitState;
import com.appforge.core.health.HealthCheckService;
import com.appforge.core.health.HealthStatus;
import com.appforge.core.health.OrchestrationHealth;
import com.appforge.core.queue.JobStatus;
import com.appforge.core.ratelimit.RateLimitUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        Map<JobStatus, Long> depth = new LinkedHashMap<>();
        depth.put(JobStatus.PENDING, 3L);
        depth.put(JobStatus.PROCESSING, 0L);
        depth.put(JobStatus.COMPLETED, 12L);
        depth.put(JobStatus.FAILED, 1L);
        when(healthCheckService.orchestrationHealth()).thenReturn(new OrchestrationHealth(
                CircuitState.OPEN, 5, Instant.parse("2026-03-01T10:05:00Z"),
                List.of(new RateLimitUsage("sandbox_create", 45, 50, Instant.parse("2026-03-01T10:00:00Z"), 5)),
                depth, Duration.ofSeconds(90)));
    }

    @Test
    @DisplayName("GET /health returns 200 with components and orchestration snapshot")
    void healthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("database", HealthStatus.Status.UP, "Connected", Map.of("driver", "PostgreSQL")),
                new HealthStatus("sandbox", HealthStatus.Status.DEGRADED, "Circuit open", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.database.status").value("UP"))
                .andExpect(jsonPath("$.components.database.metadata.driver").value("PostgreSQL"))
                .andExpect(jsonPath("$.components.sandbox.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.sandbox.metadata").doesNotExist())
                .andExpect(jsonPath("$.orchestration.breaker_state").value("OPEN"))
                .andExpect(jsonPath("$.orchestration.consecutive_failures").value(5))
                .andExpect(jsonPath("$.orchestration.next_probe_at").value("2026-03-01T10:05:00Z"))
                .andExpect(jsonPath("$.orchestration.rate_limits.sandbox_create.count").value(45))
                .andExpect(jsonPath("$.orchestration.rate_limits.sandbox_create.remaining").value(5))
                .andExpect(jsonPath("$.orchestration.queue_depth.PENDING").value(3))
                .andExpect(jsonPath("$.orchestration.oldest_pending_age_seconds").value(90));
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is DOWN")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("database", HealthStatus.Status.UP, "Connected", Map.of()),
                new HealthStatus("sandbox", HealthStatus.Status.DOWN, "Docker daemon not reachable", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.sandbox.detail").value("Docker daemon not reachable"));
    }

    @Test
    @DisplayName("closed breaker reports no probe time")
    void closedBreaker() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of());
        when(healthCheckService.orchestrationHealth()).thenReturn(new OrchestrationHealth(
                CircuitState.CLOSED, 0, null, List.of(), Map.of(), null));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orchestration.breaker_state").value("CLOSED"))
                .andExpect(jsonPath("$.orchestration.next_probe_at").value(nullValue()))
                .andExpect(jsonPath("$.orchestration.oldest_pending_age_seconds").value(nullValue()));
    }
}
