package com.appforge.core.validation;

import com.appforge.core.config.AgentProperties;
import com.appforge.core.events.TelemetryEmitter;
import com.appforge.core.model.ValidationReport;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.sandbox.OutputSink;
import com.appforge.sandbox.SandboxLifecycleManager;
import com.appforge.sandbox.SandboxSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Runs the configured validation commands (static check, then build) in order and
 * stops at the first failure. Output is streamed to telemetry as it arrives.
 */
@Service
public class ValidationRunner {

    private static final Logger log = LoggerFactory.getLogger(ValidationRunner.class);

    /** Shell exit code for "command not found". */
    static final int COMMAND_NOT_FOUND = 127;

    private static final Pattern MISSING_SCRIPT = Pattern.compile("Missing script:?\\s*\"?[\\w:-]+", Pattern.CASE_INSENSITIVE);

    private final SandboxLifecycleManager lifecycleManager;
    private final AgentProperties properties;
    private final TelemetryEmitter telemetry;

    public ValidationRunner(SandboxLifecycleManager lifecycleManager, AgentProperties properties,
                            TelemetryEmitter telemetry) {
        this.lifecycleManager = lifecycleManager;
        this.properties = properties;
        this.telemetry = telemetry;
    }

    /**
     * @return the failing command's report, or a combined passing report
     */
    public ValidationReport validate(String runId, SandboxSession session, AdmissionLane lane) {
        OutputSink sink = (channel, chunk) -> {
            log.debug("[{}] {}", channel, chunk);
            telemetry.commandOutput(runId, channel.name().toLowerCase(Locale.ROOT), chunk);
        };

        List<String> ran = new ArrayList<>();
        var stdout = new StringBuilder();
        var stderr = new StringBuilder();
        for (String command : properties.getValidationCommands()) {
            log.info("Validating with '{}'", command);
            ValidationReport report = lifecycleManager.run(runId, session, command, properties.getValidationTimeout(), sink, lane);
            if (!report.passed()) {
                if (isMissingScript(report)) {
                    log.warn("'{}' is not defined for this project; skipping", command);
                    continue;
                }
                log.info("'{}' failed with exit code {}{}", command, report.exitCode(),
                        report.timedOut() ? " (timed out)" : "");
                return report;
            }
            ran.add(command);
            append(stdout, report.stdout());
            append(stderr, report.stderr());
        }
        return ValidationReport.passed(String.join(" && ", ran), stdout.toString(), stderr.toString());
    }

    static boolean isMissingScript(ValidationReport report) {
        if (report.timedOut()) {
            return false;
        }
        return report.exitCode() == COMMAND_NOT_FOUND
                || MISSING_SCRIPT.matcher(report.combinedOutput()).find();
    }

    private static void append(StringBuilder sb, String text) {
        if (text != null && !text.isBlank()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(text.strip());
        }
    }
}
