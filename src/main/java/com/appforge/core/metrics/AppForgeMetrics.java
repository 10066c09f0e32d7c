package com.appforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for admission control, the queue and agent runs.
 */
@Service
public class AppForgeMetrics {

    private final MeterRegistry registry;

    public AppForgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAdmission(String operationType, boolean allowed) {
        Counter.builder("appforge.admission.total")
                .tag("operation", operationType)
                .tag("result", allowed ? "allowed" : "denied")
                .register(registry)
                .increment();
    }

    public void recordBreakerTransition(String from, String to) {
        Counter.builder("appforge.breaker.transitions")
                .description("Circuit breaker state changes")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordJobOutcome(String status) {
        Counter.builder("appforge.jobs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSweep(int processed) {
        DistributionSummary.builder("appforge.queue.sweep.processed")
                .description("Jobs processed per sweep pass")
                .register(registry)
                .record(processed);
    }

    public void recordRunResult(String stage) {
        Counter.builder("appforge.runs.total")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordRepairCount(int repairs) {
        DistributionSummary.builder("appforge.repair.count")
                .register(registry)
                .record(repairs);
    }

    public void recordCommandDuration(String operationType, long ms) {
        Timer.builder("appforge.sandbox.command.duration")
                .tag("operation", operationType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("appforge.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFailure(String kind, String stage) {
        Counter.builder("appforge.failures.total")
                .tag("kind", kind)
                .tag("stage", stage != null ? stage : "none")
                .register(registry)
                .increment();
    }
}
