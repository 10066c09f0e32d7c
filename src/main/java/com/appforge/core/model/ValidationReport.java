package com.appforge.core.model;

import java.io.Serializable;

/**
 * Structured outcome of one sandbox command (or of a whole validation sequence).
 *
 * @param command  the command that produced this report, or a summary for combined reports
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param exitCode process exit code; {@link #TIMEOUT_EXIT_CODE} when the command was killed
 * @param passed   true only when the command exited 0 within its timeout
 * @param timedOut true when the wall-clock timeout killed the command
 */
public record ValidationReport(
    String command,
    String stdout,
    String stderr,
    int exitCode,
    boolean passed,
    boolean timedOut
) implements Serializable {

    public static final int TIMEOUT_EXIT_CODE = 124;

    public static ValidationReport passed(String command, String stdout, String stderr) {
        return new ValidationReport(command, stdout, stderr, 0, true, false);
    }

    /** stdout and stderr joined, the way they are fed back to the coder. */
    public String combinedOutput() {
        var sb = new StringBuilder();
        if (stdout != null && !stdout.isBlank()) {
            sb.append(stdout.strip());
        }
        if (stderr != null && !stderr.isBlank()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(stderr.strip());
        }
        return sb.toString();
    }
}
