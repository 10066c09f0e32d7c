package com.appforge.dispatch.cli;

import com.appforge.core.model.AgentRun;
import com.appforge.core.model.GeneratedFile;
import com.appforge.core.model.RunFailure;
import com.appforge.core.model.ValidationReport;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private static final int REPORT_TAIL_CHARS = 2000;

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) APPFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [APPFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void run(AgentRun run) {
        String stage = switch (run.stage()) {
            case DONE -> "@|fg(green),bold DONE|@";
            case ERROR -> "@|fg(red),bold ERROR|@";
            case QUEUED -> "@|fg(yellow),bold QUEUED|@";
            default -> "@|fg(cyan) " + run.stage().name() + "|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold RUN " + run.id() + "|@ " + stage));
        System.out.println("  Project:   " + run.projectId() + " (fragment " + run.fragmentId() + ")");
        System.out.println("  Mode:      " + run.mode());
        if (run.framework() != null) {
            System.out.println("  Framework: " + run.framework().id());
        }
        if (run.sandboxSessionId() != null) {
            System.out.println("  Sandbox:   " + run.sandboxSessionId());
        }
        System.out.println("  Repairs:   " + run.repairCount());
        if (run.plan() != null) {
            System.out.println("  Plan:");
            int i = 1;
            for (String step : run.plan().steps()) {
                System.out.println("    " + i++ + ". " + step);
            }
        }
        if (!run.files().isEmpty()) {
            System.out.println("  Files:");
            for (GeneratedFile file : run.files()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(green) +|@ " + file.path()));
            }
        }
        if (run.lastReport() != null) {
            report(run.lastReport());
        }
        if (run.failure() != null) {
            failure(run.failure());
        }
        if (run.pendingJobId() != null) {
            warn("Waiting on job " + run.pendingJobId());
        }
    }

    public static void report(ValidationReport report) {
        String status = report.passed() ? "@|fg(green) PASS|@"
                : report.timedOut() ? "@|fg(red) TIMEOUT|@" : "@|fg(red) FAIL|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [VALIDATE]|@ " + status + " " + report.command() + " (exit " + report.exitCode() + ")"));
        if (!report.passed()) {
            String output = report.combinedOutput();
            if (output.length() > REPORT_TAIL_CHARS) {
                output = "..." + output.substring(output.length() - REPORT_TAIL_CHARS);
            }
            System.out.println(output.indent(4));
        }
    }

    public static void failure(RunFailure failure) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red),bold [" + failure.kind() + "]|@ at " + failure.stage()
                        + " after " + failure.attempts() + " attempt(s): " + failure.message()));
    }
}
