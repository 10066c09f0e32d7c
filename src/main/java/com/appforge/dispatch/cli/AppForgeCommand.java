package com.appforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 */
@Command(
        name = "appforge",
        mixinStandardHelpOptions = true,
        version = "AppForge 0.1.0",
        description = "Generates, validates and repairs applications in rate-limited sandboxes",
        subcommands = {
                ServeCommand.class,
                GenerateCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                SweepCommand.class,
                BreakerResetCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AppForgeCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // Reuses the subcommand instances the factory already built
        spec.commandLine().usage(System.out);
    }
}
