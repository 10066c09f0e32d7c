package com.appforge.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AppForgeMetricsTest {

    private SimpleMeterRegistry registry;
    private AppForgeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AppForgeMetrics(registry);
    }

    @Test
    @DisplayName("recordRunResult counts per final stage")
    void recordRunResult() {
        metrics.recordRunResult("DONE");
        metrics.recordRunResult("DONE");
        metrics.recordRunResult("ERROR");

        assertEquals(2.0, registry.find("appforge.runs.total").tag("stage", "DONE").counter().count());
        assertEquals(1.0, registry.find("appforge.runs.total").tag("stage", "ERROR").counter().count());
    }

    @Test
    @DisplayName("recordStageDuration creates a timer per stage")
    void recordStageDuration() {
        metrics.recordStageDuration("generate_code", 2500);

        var timer = registry.find("appforge.stage.duration").tag("stage", "generate_code").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(2500.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("recordBreakerTransition tags both states")
    void recordBreakerTransition() {
        metrics.recordBreakerTransition("CLOSED", "OPEN");

        assertEquals(1.0, registry.find("appforge.breaker.transitions")
                .tag("from", "CLOSED").tag("to", "OPEN").counter().count());
    }

    @Test
    @DisplayName("recordSweep and recordRepairCount feed distribution summaries")
    void summaries() {
        metrics.recordSweep(3);
        metrics.recordSweep(0);
        metrics.recordRepairCount(2);

        var sweeps = registry.find("appforge.queue.sweep.processed").summary();
        assertEquals(2, sweeps.count());
        assertEquals(3.0, sweeps.totalAmount());
        assertEquals(2.0, registry.find("appforge.repair.count").summary().max());
    }

    @Test
    @DisplayName("recordFailure tolerates a missing stage")
    void recordFailureWithoutStage() {
        metrics.recordFailure("CIRCUIT_OPEN", null);

        assertEquals(1.0, registry.find("appforge.failures.total").tag("stage", "none").counter().count());
    }
}
