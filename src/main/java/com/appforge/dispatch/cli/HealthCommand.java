package com.appforge.dispatch.cli;

import com.appforge.core.health.HealthCheckService;
import com.appforge.core.health.OrchestrationHealth;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: appforge health
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        OrchestrationHealth health = healthCheckService.orchestrationHealth();
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info("Breaker: " + health.breakerState()
                + " (" + health.consecutiveFailures() + " consecutive failures)");
        for (var usage : health.rateLimitUsageByOperation()) {
            ConsoleOutput.info(String.format("Rate limit %s: %d/%d in current window",
                    usage.operationType(), usage.count(), usage.limit()));
        }
        ConsoleOutput.info("Queue: " + health.queueDepthByStatus()
                + (health.oldestPendingAge() != null ? ", oldest pending " + health.oldestPendingAge().toSeconds() + "s" : ""));

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}
