package com.appforge.dispatch.cli;

import com.appforge.core.engine.AgentRunEngine;
import com.appforge.core.model.AgentRun;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: appforge status [run-id]
 * <p>
 * Shows one run in detail, or lists the most recent runs when no id is given.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show run status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Run ID")
    private String runId;

    @Option(names = {"--limit", "-n"}, defaultValue = "10", description = "Runs to list (default: ${DEFAULT-VALUE})")
    private int limit;

    private final AgentRunEngine engine;

    public StatusCommand(AgentRunEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (runId == null) {
            var runs = engine.recentRuns(limit);
            if (runs.isEmpty()) {
                ConsoleOutput.info("No runs recorded.");
                return;
            }
            for (AgentRun run : runs) {
                System.out.printf("%-22s %-10s %-12s %s%n",
                        run.id(), run.stage(), run.projectId(), run.updatedAt());
            }
            return;
        }

        engine.getRunStatus(runId).ifPresentOrElse(
                ConsoleOutput::run,
                () -> ConsoleOutput.error("Run not found: " + runId));
    }
}
