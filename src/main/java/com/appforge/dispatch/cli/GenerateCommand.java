package com.appforge.dispatch.cli;

import com.appforge.core.engine.AgentRunEngine;
import com.appforge.core.model.AgentRun;
import com.appforge.core.model.GenerationRequest;
import com.appforge.core.model.TargetStack;
import com.appforge.core.model.ValidationMode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Locale;

/**
 * CLI command: appforge generate "&lt;request&gt;" --project &lt;id&gt;
 * <p>
 * Drives one run to completion on the calling thread and prints the result.
 */
@Command(name = "generate", mixinStandardHelpOptions = true, description = "Generate an application from a request")
@Component
public class GenerateCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language description of the app")
    private String request;

    @Option(names = {"--project", "-p"}, required = true, description = "Owning project id")
    private String projectId;

    @Option(names = {"--framework", "-f"}, description = "Pin the stack: nextjs, angular, react, vue, svelte")
    private String framework;

    @Option(names = {"--mode", "-m"}, description = "Validation mode: SAFE or FAST")
    private String mode;

    @Option(names = {"--previous-fragment"}, description = "Fragment whose running sandbox to take over")
    private String previousFragmentId;

    private final AgentRunEngine engine;

    public GenerateCommand(AgentRunEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        TargetStack stack = null;
        if (framework != null) {
            stack = TargetStack.fromId(framework).orElse(null);
            if (stack == null) {
                ConsoleOutput.error("Unknown framework: " + framework);
                return;
            }
        }
        ValidationMode validationMode = null;
        if (mode != null) {
            try {
                validationMode = ValidationMode.valueOf(mode.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Invalid mode: " + mode + ". Valid modes: SAFE, FAST");
                return;
            }
        }

        ConsoleOutput.info("Generating...");
        AgentRun run;
        try {
            run = engine.generate(new GenerationRequest(projectId, request, stack, validationMode, previousFragmentId));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        System.out.println();
        ConsoleOutput.run(run);
    }
}
