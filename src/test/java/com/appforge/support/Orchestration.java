package com.appforge.support;

import com.appforge.core.admission.AdmissionGate;
import com.appforge.core.breaker.CircuitBreaker;
import com.appforge.core.breaker.CircuitBreakerProperties;
import com.appforge.core.breaker.InMemoryCircuitBreakerStore;
import com.appforge.core.config.AgentProperties;
import com.appforge.core.engine.AgentRunEngine;
import com.appforge.core.engine.ResumeRunJobHandler;
import com.appforge.core.events.EventBus;
import com.appforge.core.events.TelemetryEmitter;
import com.appforge.core.events.TelemetryEvent;
import com.appforge.core.graph.AgentRunGraph;
import com.appforge.core.llm.LlmService;
import com.appforge.core.model.FrameworkChoice;
import com.appforge.core.model.GeneratedCode;
import com.appforge.core.model.GeneratedFile;
import com.appforge.core.model.RunPlan;
import com.appforge.core.nodes.GenerateCodeNode;
import com.appforge.core.nodes.PlanRunNode;
import com.appforge.core.nodes.ProvisionSandboxNode;
import com.appforge.core.nodes.SelectFrameworkNode;
import com.appforge.core.nodes.ValidateCodeNode;
import com.appforge.core.nodes.WriteFilesNode;
import com.appforge.core.queue.InMemoryJobStore;
import com.appforge.core.queue.JobHandler;
import com.appforge.core.queue.JobQueue;
import com.appforge.core.queue.QueueProperties;
import com.appforge.core.ratelimit.InMemoryRateLimitStore;
import com.appforge.core.ratelimit.RateLimitProperties;
import com.appforge.core.ratelimit.RateLimiter;
import com.appforge.core.store.InMemoryAgentRunStore;
import com.appforge.core.validation.ValidationRunner;
import com.appforge.sandbox.FakeSandboxProvider;
import com.appforge.sandbox.InMemorySandboxSessionStore;
import com.appforge.sandbox.ProvisionSandboxJobHandler;
import com.appforge.sandbox.SandboxLifecycleManager;
import com.appforge.sandbox.SandboxProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.TaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The orchestration core wired in memory around a {@link FakeSandboxProvider} and a
 * mocked {@link LlmService}. Properties are mutable until the graph is built.
 */
public final class Orchestration {

    public final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    public final EventBus eventBus = new EventBus();
    public final List<TelemetryEvent> events = new CopyOnWriteArrayList<>();
    public final TelemetryEmitter telemetry = TestTelemetry.emitter(eventBus, clock);
    public final FakeSandboxProvider provider = new FakeSandboxProvider();
    public final LlmService llm = mock(LlmService.class);

    public final RateLimitProperties rateLimits = new RateLimitProperties();
    public final CircuitBreakerProperties breakerProperties = new CircuitBreakerProperties();
    public final SandboxProperties sandboxProperties = new SandboxProperties();
    public final AgentProperties agentProperties = new AgentProperties();

    public final CircuitBreaker breaker;
    public final RateLimiter rateLimiter;
    public final InMemoryJobStore jobStore = new InMemoryJobStore();
    public final JobQueue jobQueue;
    public final SandboxLifecycleManager lifecycle;
    public final InMemoryAgentRunStore runStore = new InMemoryAgentRunStore();

    private final List<JobHandler> handlers = new CopyOnWriteArrayList<>();

    @SuppressWarnings("unchecked")
    public Orchestration() {
        eventBus.subscribeAll(events::add);
        sandboxProperties.setCreateBackoffBase(Duration.ofMillis(1));
        sandboxProperties.setCreateBackoffMax(Duration.ofMillis(5));

        breaker = new CircuitBreaker(new InMemoryCircuitBreakerStore(), breakerProperties, telemetry, clock);
        rateLimiter = new RateLimiter(new InMemoryRateLimitStore(), rateLimits, telemetry, clock);

        ObjectProvider<JobHandler> handlerProvider = mock(ObjectProvider.class);
        when(handlerProvider.orderedStream()).thenAnswer(invocation -> handlers.stream());
        jobQueue = new JobQueue(jobStore, breaker, new QueueProperties(), telemetry, clock, handlerProvider);

        lifecycle = new SandboxLifecycleManager(provider, new InMemorySandboxSessionStore(),
                new AdmissionGate(breaker, rateLimiter), jobQueue, sandboxProperties, telemetry, clock);
        handlers.add(new ProvisionSandboxJobHandler(lifecycle));
    }

    public AgentRunGraph graph() throws Exception {
        return new AgentRunGraph(
                new SelectFrameworkNode(llm, agentProperties),
                new PlanRunNode(llm, agentProperties),
                new ProvisionSandboxNode(lifecycle),
                new GenerateCodeNode(llm, agentProperties),
                new WriteFilesNode(lifecycle),
                new ValidateCodeNode(new ValidationRunner(lifecycle, agentProperties, telemetry), lifecycle,
                        agentProperties, telemetry),
                runStore, telemetry, agentProperties, clock);
    }

    /** Builds the engine and registers its resume handler with the queue. */
    public AgentRunEngine engine(TaskExecutor executor) throws Exception {
        var engine = new AgentRunEngine(graph(), runStore, jobQueue, telemetry, agentProperties, executor, clock);
        handlers.add(new ResumeRunJobHandler(engine));
        return engine;
    }

    /** Stubs the three agents with well-formed answers for a Next.js todo app. */
    public void stubAgents() {
        when(llm.structuredCall(anyString(), anyString(), eq(FrameworkChoice.class)))
                .thenReturn(new FrameworkChoice("nextjs", "general purpose web app"));
        when(llm.structuredCall(anyString(), anyString(), eq(RunPlan.class)))
                .thenReturn(new RunPlan(List.of("Create app/page.tsx with a todo list"),
                        List.of("State is kept client-side"), List.of()));
        when(llm.structuredCall(anyString(), anyString(), eq(GeneratedCode.class)))
                .thenReturn(new GeneratedCode(List.of(
                        new GeneratedFile("app/page.tsx", "export default function Page() { return null; }")),
                        "todo page"));
    }

    public List<String> eventTypes() {
        return events.stream().map(TelemetryEvent::eventType).toList();
    }
}
