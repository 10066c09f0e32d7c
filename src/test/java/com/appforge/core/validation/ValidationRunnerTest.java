package com.appforge.core.validation;

import com.appforge.core.config.AgentProperties;
import com.appforge.core.events.EventBus;
import com.appforge.core.events.TelemetryEvent;
import com.appforge.core.model.ValidationReport;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.sandbox.OutputSink;
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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ValidationRunnerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final SandboxSession SESSION =
            new SandboxSession("SBX-1", "FRAG-1", "ctr-1", "nextjs", SandboxStatus.RUNNING, NOW, NOW);

    private SandboxLifecycleManager lifecycle;
    private final List<TelemetryEvent> events = new ArrayList<>();
    private ValidationRunner runner;

    @BeforeEach
    void setUp() {
        lifecycle = mock(SandboxLifecycleManager.class);
        var bus = new EventBus();
        bus.subscribe("RUN-1", events::add);
        runner = new ValidationRunner(lifecycle, new AgentProperties(),
                TestTelemetry.emitter(bus, MutableClock.startingAt("2026-03-01T10:00:00Z")));
    }

    private void commandReturns(String command, ValidationReport report) {
        when(lifecycle.run(eq("RUN-1"), eq(SESSION), eq(command), any(), any(), any())).thenReturn(report);
    }

    @Test
    @DisplayName("runs lint then build and combines their output")
    void runsAllCommands() {
        commandReturns("npm run lint", ValidationReport.passed("npm run lint", "no lint errors", ""));
        commandReturns("npm run build", ValidationReport.passed("npm run build", "compiled", ""));

        ValidationReport report = runner.validate("RUN-1", SESSION, AdmissionLane.LIVE);

        assertTrue(report.passed());
        assertEquals("npm run lint && npm run build", report.command());
        assertEquals("no lint errors\ncompiled", report.stdout());
    }

    @Test
    @DisplayName("stops at the first failing command")
    void stopsAtFirstFailure() {
        commandReturns("npm run lint", new ValidationReport("npm run lint", "", "unused var", 1, false, false));

        ValidationReport report = runner.validate("RUN-1", SESSION, AdmissionLane.QUEUED);

        assertFalse(report.passed());
        assertEquals("npm run lint", report.command());
        verify(lifecycle, never()).run(any(), any(), eq("npm run build"), any(), any(), any());
    }

    @Test
    @DisplayName("a command the project does not define is skipped")
    void missingScriptSkipped() {
        commandReturns("npm run lint", new ValidationReport("npm run lint", "",
                "npm ERR! Missing script: \"lint\"", 1, false, false));
        commandReturns("npm run build", ValidationReport.passed("npm run build", "compiled", ""));

        ValidationReport report = runner.validate("RUN-1", SESSION, AdmissionLane.LIVE);

        assertTrue(report.passed());
        assertEquals("npm run build", report.command());
    }

    @Test
    @DisplayName("output chunks are published for live followers")
    void streamsOutput() {
        when(lifecycle.run(anyString(), eq(SESSION), anyString(), any(), any(), any())).thenAnswer(invocation -> {
            OutputSink sink = invocation.getArgument(4);
            sink.accept(OutputSink.Channel.STDOUT, "building...");
            return ValidationReport.passed(invocation.getArgument(2), "building...", "");
        });

        runner.validate("RUN-1", SESSION, AdmissionLane.LIVE);

        assertEquals(2, events.size());
        assertEquals("sandbox.output", events.get(0).eventType());
        assertEquals("stdout", events.get(0).payload().get("channel"));
    }

    @Test
    void missingScriptDetection() {
        assertTrue(ValidationRunner.isMissingScript(new ValidationReport("x", "", "sh: eslint: not found",
                ValidationRunner.COMMAND_NOT_FOUND, false, false)));
        assertTrue(ValidationRunner.isMissingScript(new ValidationReport("x", "", "Missing script: build",
                1, false, false)));
        assertFalse(ValidationRunner.isMissingScript(new ValidationReport("x", "", "Type error", 1, false, false)));
        assertFalse(ValidationRunner.isMissingScript(new ValidationReport("x", "", "Missing script: build",
                ValidationReport.TIMEOUT_EXIT_CODE, false, true)));
    }
}
