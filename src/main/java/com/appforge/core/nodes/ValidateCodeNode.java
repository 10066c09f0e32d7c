package com.appforge.core.nodes;

import com.appforge.core.config.AgentProperties;
import com.appforge.core.events.TelemetryEmitter;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.RunFailure;
import com.appforge.core.model.RunStage;
import com.appforge.core.model.ValidationMode;
import com.appforge.core.model.ValidationReport;
import com.appforge.core.state.AgentRunState;
import com.appforge.core.validation.ValidationRunner;
import com.appforge.sandbox.SandboxException;
import com.appforge.sandbox.SandboxLifecycleManager;
import com.appforge.sandbox.SandboxSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs validation and decides the repair loop's next step: DONE on success,
 * REPAIRING while repair budget remains, ERROR once it is spent.
 */
@Component
public class ValidateCodeNode {

    private static final Logger log = LoggerFactory.getLogger(ValidateCodeNode.class);

    static final String STAGE = "validate_code";

    private final ValidationRunner validationRunner;
    private final SandboxLifecycleManager lifecycleManager;
    private final AgentProperties properties;
    private final TelemetryEmitter telemetry;

    public ValidateCodeNode(ValidationRunner validationRunner, SandboxLifecycleManager lifecycleManager,
                            AgentProperties properties, TelemetryEmitter telemetry) {
        this.validationRunner = validationRunner;
        this.lifecycleManager = lifecycleManager;
        this.properties = properties;
        this.telemetry = telemetry;
    }

    public Map<String, Object> apply(AgentRunState state) {
        if (state.mode() == ValidationMode.FAST) {
            log.info("FAST mode: skipping validation");
            return Map.of("stage", RunStage.DONE.name());
        }

        SandboxSession session = lifecycleManager.find(state.sandboxSessionId())
                .orElseThrow(() -> new SandboxException("Run has no sandbox session", false));
        ValidationReport report = validationRunner.validate(state.runId(), session, state.lane());

        if (report.passed()) {
            log.info("Validation passed after {} repair(s)", state.repairCount());
            return Map.of(
                    "lastReport", report,
                    "stage", RunStage.DONE.name());
        }

        if (report.timedOut()) {
            telemetry.failure(state.runId(), STAGE, ErrorKind.SANDBOX_TIMEOUT,
                    "'" + report.command() + "' exceeded " + properties.getValidationTimeout().toSeconds() + "s");
        }

        int repairs = state.repairCount();
        if (repairs < properties.getMaxRepairAttempts()) {
            log.info("Validation failed; starting repair {}/{}", repairs + 1, properties.getMaxRepairAttempts());
            return Map.of(
                    "lastReport", report,
                    "repairCount", repairs + 1,
                    "repairPending", true,
                    "stage", RunStage.REPAIRING.name());
        }

        String message = "Validation still failing after " + repairs + " repair(s): '"
                + report.command() + "' exited with " + report.exitCode();
        return Map.of(
                "lastReport", report,
                "failure", new RunFailure(ErrorKind.REPAIR_BUDGET_EXHAUSTED, message, STAGE, repairs, report),
                "stage", RunStage.ERROR.name());
    }
}
