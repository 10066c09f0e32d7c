package com.appforge.core.graph;

import com.appforge.core.events.TelemetryEvent;
import com.appforge.core.llm.LlmParseException;
import com.appforge.core.model.AgentRun;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.GeneratedCode;
import com.appforge.core.model.RunStage;
import com.appforge.core.model.ValidationMode;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.ratelimit.OperationTypes;
import com.appforge.core.state.AgentRunState;
import com.appforge.sandbox.CommandResult;
import com.appforge.support.Orchestration;
import com.appforge.support.Runs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives the compiled graph end to end against a fake sandbox and mocked agents.
 */
class AgentRunGraphTest {

    private Orchestration orchestration;

    @BeforeEach
    void setUp() {
        orchestration = new Orchestration();
        orchestration.stubAgents();
    }

    private AgentRunState run(AgentRun run) throws Exception {
        orchestration.runStore.save(run);
        return orchestration.graph().execute(run, AdmissionLane.LIVE);
    }

    private AgentRun stored(String id) {
        return orchestration.runStore.findById(id).orElseThrow();
    }

    @Test
    @DisplayName("a clean build goes straight to DONE")
    void happyPath() throws Exception {
        var state = run(Runs.fresh("1", orchestration.clock.instant()));

        assertEquals(RunStage.DONE, state.stage());
        AgentRun run = stored("1");
        assertEquals(RunStage.DONE, run.stage());
        assertEquals(0, run.repairCount());
        assertNotNull(run.sandboxSessionId());
        assertTrue(run.filesWritten());
        assertTrue(run.lastReport().passed());
        assertEquals(List.of("npm run lint", "npm run build"), orchestration.provider.commands);
        assertEquals("export default function Page() { return null; }",
                orchestration.provider.files.get("app/page.tsx"));
    }

    @Test
    @DisplayName("nodes run in order and each is reported as entered and completed")
    void stageEvents() throws Exception {
        run(Runs.fresh("1", orchestration.clock.instant()));

        List<String> entered = orchestration.events.stream()
                .filter(e -> e.eventType().equals("stage.entered"))
                .map(TelemetryEvent::stage)
                .toList();
        assertEquals(List.of("select_framework", "plan_run", "provision_sandbox", "generate_code",
                "write_files", "validate_code"), entered);
        assertEquals(6, orchestration.eventTypes().stream().filter("stage.completed"::equals).count());
    }

    @Test
    @DisplayName("a failed build is repaired once and then passes")
    void failThenPass() throws Exception {
        var builds = new AtomicInteger();
        orchestration.provider.onCommand(cmd -> cmd.equals("npm run build") && builds.incrementAndGet() == 1
                ? new CommandResult("", "Type error: x is not defined", 1, false, 900)
                : new CommandResult("ok", "", 0, false, 100));

        var state = run(Runs.fresh("1", orchestration.clock.instant()));

        assertEquals(RunStage.DONE, state.stage());
        assertEquals(1, stored("1").repairCount());
        assertFalse(stored("1").repairPending());
        verify(orchestration.llm, times(2)).structuredCall(anyString(), anyString(), eq(GeneratedCode.class));
        assertEquals(2, orchestration.provider.writes.get());
    }

    @Test
    @DisplayName("a build that never passes ends in REPAIR_BUDGET_EXHAUSTED")
    void repairBudgetExhausted() throws Exception {
        orchestration.provider.onCommand(cmd -> cmd.equals("npm run build")
                ? new CommandResult("", "Module not found", 1, false, 900)
                : new CommandResult("", "", 0, false, 50));

        var state = run(Runs.fresh("1", orchestration.clock.instant()));

        assertEquals(RunStage.ERROR, state.stage());
        AgentRun run = stored("1");
        assertEquals(ErrorKind.REPAIR_BUDGET_EXHAUSTED, run.failure().kind());
        assertEquals(2, run.repairCount());
        assertEquals("npm run build", run.failure().lastReport().command());
        verify(orchestration.llm, times(3)).structuredCall(anyString(), anyString(), eq(GeneratedCode.class));
    }

    @Test
    @DisplayName("FAST mode writes files without validating")
    void fastMode() throws Exception {
        var state = run(Runs.fresh("1", ValidationMode.FAST, orchestration.clock.instant()));

        assertEquals(RunStage.DONE, state.stage());
        assertTrue(orchestration.provider.commands.isEmpty());
        assertEquals(1, orchestration.provider.writes.get());
    }

    @Test
    @DisplayName("a rate-limited sandbox creation parks the run as QUEUED")
    void rateLimitedCreateQueues() throws Exception {
        orchestration.rateLimits.setLimits(Map.of(OperationTypes.SANDBOX_CREATE, 0));

        var state = run(Runs.fresh("1", orchestration.clock.instant()));

        assertEquals(RunStage.QUEUED, state.stage());
        assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, state.deferralKind().orElseThrow());
        assertEquals(OperationTypes.SANDBOX_CREATE, state.deferralOperation());
        assertTrue(state.retryAfterMs() > 0);
        AgentRun run = stored("1");
        assertEquals(RunStage.QUEUED, run.stage());
        assertNotNull(run.plan());
        assertNull(run.failure());
        assertTrue(orchestration.provider.created.isEmpty());
    }

    @Test
    @DisplayName("unusable agent output ends in MALFORMED_AGENT_OUTPUT")
    void malformedOutput() throws Exception {
        when(orchestration.llm.structuredCall(anyString(), anyString(), eq(GeneratedCode.class)))
                .thenThrow(new LlmParseException("Unexpected character '<'", null));

        var state = run(Runs.fresh("1", orchestration.clock.instant()));

        assertEquals(RunStage.ERROR, state.stage());
        AgentRun run = stored("1");
        assertEquals(ErrorKind.MALFORMED_AGENT_OUTPUT, run.failure().kind());
        assertEquals("generate_code", run.failure().stage());
        assertEquals(3, run.failure().attempts());
        assertTrue(orchestration.provider.files.isEmpty());
    }

    @Test
    @DisplayName("a sandbox that cannot be created ends in SANDBOX_FAILURE")
    void sandboxFailure() throws Exception {
        orchestration.provider.failNextCreate(new RuntimeException("401 unauthorized"));

        var state = run(Runs.fresh("1", orchestration.clock.instant()));

        assertEquals(RunStage.ERROR, state.stage());
        assertEquals(ErrorKind.SANDBOX_FAILURE, stored("1").failure().kind());
        assertTrue(orchestration.eventTypes().contains("run.failure"));
    }
}
