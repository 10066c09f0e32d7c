package com.appforge.core.nodes;

import com.appforge.core.config.AgentProperties;
import com.appforge.core.events.EventBus;
import com.appforge.core.events.TelemetryEvent;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.RunFailure;
import com.appforge.core.model.ValidationReport;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.state.AgentRunState;
import com.appforge.core.validation.ValidationRunner;
import com.appforge.sandbox.SandboxLifecycleManager;
import com.appforge.sandbox.SandboxSession;
import com.appforge.sandbox.SandboxStatus;
import com.appforge.support.MutableClock;
import com.appforge.support.TestTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ValidateCodeNodeTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final SandboxSession SESSION =
            new SandboxSession("SBX-1", "FRAG-1", "ctr-1", "nextjs", SandboxStatus.RUNNING, NOW, NOW);
    private static final ValidationReport FAILED =
            new ValidationReport("npm run build", "", "Type error", 1, false, false);

    private ValidationRunner runner;
    private SandboxLifecycleManager lifecycle;
    private final List<TelemetryEvent> events = new ArrayList<>();
    private ValidateCodeNode node;

    @BeforeEach
    void setUp() {
        runner = mock(ValidationRunner.class);
        lifecycle = mock(SandboxLifecycleManager.class);
        when(lifecycle.find("SBX-1")).thenReturn(Optional.of(SESSION));
        var bus = new EventBus();
        bus.subscribeAll(events::add);
        node = new ValidateCodeNode(runner, lifecycle, new AgentProperties(),
                TestTelemetry.emitter(bus, MutableClock.startingAt("2026-03-01T10:00:00Z")));
    }

    private static AgentRunState state(int repairCount, String mode) {
        return new AgentRunState(Map.of("runId", "RUN-1", "sandboxSessionId", "SBX-1",
                "repairCount", repairCount, "mode", mode));
    }

    @Test
    @DisplayName("a passing report finishes the run")
    void passed() {
        var report = ValidationReport.passed("npm run lint && npm run build", "ok", "");
        when(runner.validate("RUN-1", SESSION, AdmissionLane.LIVE)).thenReturn(report);

        var result = node.apply(state(0, "SAFE"));

        assertEquals("DONE", result.get("stage"));
        assertEquals(report, result.get("lastReport"));
    }

    @Test
    @DisplayName("a failure with repair budget left asks for a repair")
    void failureStartsRepair() {
        when(runner.validate(anyString(), any(), any())).thenReturn(FAILED);

        var result = node.apply(state(1, "SAFE"));

        assertEquals("REPAIRING", result.get("stage"));
        assertEquals(2, result.get("repairCount"));
        assertEquals(true, result.get("repairPending"));
    }

    @Test
    @DisplayName("a failure with the budget spent ends in REPAIR_BUDGET_EXHAUSTED")
    void budgetExhausted() {
        when(runner.validate(anyString(), any(), any())).thenReturn(FAILED);

        var result = node.apply(state(2, "SAFE"));

        assertEquals("ERROR", result.get("stage"));
        var failure = (RunFailure) result.get("failure");
        assertEquals(ErrorKind.REPAIR_BUDGET_EXHAUSTED, failure.kind());
        assertEquals(2, failure.attempts());
        assertEquals(FAILED, failure.lastReport());
    }

    @Test
    @DisplayName("a timed-out command is reported as SANDBOX_TIMEOUT and still repaired")
    void timeoutReported() {
        when(runner.validate(anyString(), any(), any())).thenReturn(
                new ValidationReport("npm run build", "", "killed", ValidationReport.TIMEOUT_EXIT_CODE, false, true));

        var result = node.apply(state(0, "SAFE"));

        assertEquals("REPAIRING", result.get("stage"));
        assertTrue(events.stream().anyMatch(e -> e.eventType().equals("run.failure")
                && ErrorKind.SANDBOX_TIMEOUT.name().equals(e.payload().get("kind"))));
    }

    @Test
    @DisplayName("FAST mode skips validation entirely")
    void fastModeSkips() {
        var result = node.apply(state(0, "FAST"));

        assertEquals("DONE", result.get("stage"));
        verifyNoInteractions(runner, lifecycle);
    }
}
