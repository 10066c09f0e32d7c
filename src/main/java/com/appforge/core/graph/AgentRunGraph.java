package com.appforge.core.graph;

import com.appforge.core.admission.AdmissionDeniedException;
import com.appforge.core.admission.RateLimitExceededException;
import com.appforge.core.config.AgentProperties;
import com.appforge.core.events.TelemetryEmitter;
import com.appforge.core.logging.MdcContext;
import com.appforge.core.model.AgentRun;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.RunFailure;
import com.appforge.core.model.RunStage;
import com.appforge.core.nodes.GenerateCodeNode;
import com.appforge.core.nodes.MalformedAgentOutputException;
import com.appforge.core.nodes.PlanRunNode;
import com.appforge.core.nodes.ProvisionSandboxNode;
import com.appforge.core.nodes.SelectFrameworkNode;
import com.appforge.core.nodes.ValidateCodeNode;
import com.appforge.core.nodes.WriteFilesNode;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.ratelimit.OperationTypes;
import com.appforge.core.state.AgentRunState;
import com.appforge.core.store.AgentRunStore;
import com.appforge.sandbox.SandboxException;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for one agent run.
 * <pre>
 *   START -> select_framework -> plan_run -> provision_sandbox -> generate_code
 *         -> write_files -> validate_code -> [routeAfterValidate]
 *            -> generate_code  (REPAIRING, while repair budget remains)
 *            -> END            (DONE, ERROR or QUEUED)
 * </pre>
 * Every node leaves the graph early on ERROR or QUEUED.
 * <p>
 * Nodes are wrapped so that exceptions become state: admission denials park the
 * run as QUEUED with the deferral recorded, anything else ends it in ERROR with a
 * {@link RunFailure}. The run record is saved after every node.
 */
@Component
public class AgentRunGraph {

    private static final Logger log = LoggerFactory.getLogger(AgentRunGraph.class);

    static final String SELECT_FRAMEWORK = "select_framework";
    static final String PLAN_RUN = "plan_run";
    static final String PROVISION_SANDBOX = "provision_sandbox";
    static final String GENERATE_CODE = "generate_code";
    static final String WRITE_FILES = "write_files";
    static final String VALIDATE_CODE = "validate_code";

    private static final String CONTINUE = "continue";
    private static final String STOP = "stop";
    private static final String REPAIR = "repair";

    private final CompiledGraph<AgentRunState> compiledGraph;
    private final AgentRunStore runStore;
    private final TelemetryEmitter telemetry;
    private final Clock clock;

    public AgentRunGraph(SelectFrameworkNode selectFrameworkNode,
                         PlanRunNode planRunNode,
                         ProvisionSandboxNode provisionSandboxNode,
                         GenerateCodeNode generateCodeNode,
                         WriteFilesNode writeFilesNode,
                         ValidateCodeNode validateCodeNode,
                         AgentRunStore runStore,
                         TelemetryEmitter telemetry,
                         AgentProperties properties,
                         Clock clock) throws Exception {
        this.runStore = runStore;
        this.telemetry = telemetry;
        this.clock = clock;

        var graph = new StateGraph<>(AgentRunState.SCHEMA, AgentRunState::new)
                .addNode(SELECT_FRAMEWORK, node_async(tracked(SELECT_FRAMEWORK, selectFrameworkNode::apply)))
                .addNode(PLAN_RUN, node_async(tracked(PLAN_RUN, planRunNode::apply)))
                .addNode(PROVISION_SANDBOX, node_async(tracked(PROVISION_SANDBOX, provisionSandboxNode::apply)))
                .addNode(GENERATE_CODE, node_async(tracked(GENERATE_CODE, generateCodeNode::apply)))
                .addNode(WRITE_FILES, node_async(tracked(WRITE_FILES, writeFilesNode::apply)))
                .addNode(VALIDATE_CODE, node_async(tracked(VALIDATE_CODE, validateCodeNode::apply)))
                .addEdge(START, SELECT_FRAMEWORK)
                .addConditionalEdges(SELECT_FRAMEWORK, edge_async(this::routeOnward),
                        Map.of(CONTINUE, PLAN_RUN, STOP, END))
                .addConditionalEdges(PLAN_RUN, edge_async(this::routeOnward),
                        Map.of(CONTINUE, PROVISION_SANDBOX, STOP, END))
                .addConditionalEdges(PROVISION_SANDBOX, edge_async(this::routeOnward),
                        Map.of(CONTINUE, GENERATE_CODE, STOP, END))
                .addConditionalEdges(GENERATE_CODE, edge_async(this::routeOnward),
                        Map.of(CONTINUE, WRITE_FILES, STOP, END))
                .addConditionalEdges(WRITE_FILES, edge_async(this::routeOnward),
                        Map.of(CONTINUE, VALIDATE_CODE, STOP, END))
                .addConditionalEdges(VALIDATE_CODE, edge_async(this::routeAfterValidate),
                        Map.of(REPAIR, GENERATE_CODE, STOP, END));

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        // Six nodes on the first pass, three per repair cycle, plus headroom
        this.compiledGraph.setMaxIterations(6 + 3 * properties.getMaxRepairAttempts() + 5);
        log.info("Agent run graph compiled (max repair attempts {})", properties.getMaxRepairAttempts());
    }

    /**
     * Runs (or resumes) the graph for a persisted run.
     *
     * @return the final graph state; the run record has already been saved
     */
    public AgentRunState execute(AgentRun run, AdmissionLane lane) {
        var config = RunnableConfig.builder()
                .threadId(run.id())
                .build();
        return compiledGraph.invoke(AgentRunState.initialData(run, lane), config)
                .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for run " + run.id()));
    }

    String routeOnward(AgentRunState state) {
        RunStage stage = state.stage();
        return stage == RunStage.ERROR || stage == RunStage.QUEUED ? STOP : CONTINUE;
    }

    String routeAfterValidate(AgentRunState state) {
        return state.stage() == RunStage.REPAIRING ? REPAIR : STOP;
    }

    public CompiledGraph<AgentRunState> getCompiledGraph() {
        return compiledGraph;
    }

    private NodeAction<AgentRunState> tracked(String name, NodeAction<AgentRunState> node) {
        return state -> {
            String runId = state.runId();
            MdcContext.setStage(runId, name);
            telemetry.stageEntered(runId, name);
            long start = System.currentTimeMillis();
            Map<String, Object> update;
            try {
                update = node.apply(state);
            } catch (AdmissionDeniedException e) {
                update = deferred(runId, name, e);
            } catch (MalformedAgentOutputException e) {
                update = failed(name, ErrorKind.MALFORMED_AGENT_OUTPUT, e.getMessage(), e.getAttempts());
            } catch (SandboxException e) {
                update = failed(name, ErrorKind.SANDBOX_FAILURE, e.getMessage(), 1);
            } catch (Exception e) {
                log.error("Unexpected error in {}", name, e);
                update = failed(name, ErrorKind.INTERNAL, e.getMessage(), 1);
            } finally {
                MdcContext.clearStage();
            }

            var merged = new HashMap<String, Object>(state.data());
            merged.putAll(update);
            var next = new AgentRunState(merged);
            if (next.stage() == RunStage.ERROR && update.containsKey("failure")) {
                next.failure().ifPresent(f -> telemetry.failure(runId, name, f.kind(), f.message()));
            }
            persist(next);
            telemetry.stageCompleted(runId, name, next.stage().name(), System.currentTimeMillis() - start);
            return update;
        };
    }

    private Map<String, Object> deferred(String runId, String node, AdmissionDeniedException e) {
        telemetry.failure(runId, node, e.kind(), e.getMessage());
        var update = new HashMap<String, Object>();
        update.put("stage", RunStage.QUEUED.name());
        update.put("deferralKind", e.kind().name());
        update.put("retryAfterMs", e.getRetryAfter().toMillis());
        update.put("deferralOperation", e instanceof RateLimitExceededException rle
                ? rle.getOperationType()
                : PROVISION_SANDBOX.equals(node) ? OperationTypes.SANDBOX_CREATE : OperationTypes.SANDBOX_COMMAND);
        return update;
    }

    private Map<String, Object> failed(String node, ErrorKind kind, String message, int attempts) {
        return Map.of(
                "stage", RunStage.ERROR.name(),
                "failure", new RunFailure(kind, message != null ? message : kind.name(), node, attempts, null));
    }

    private void persist(AgentRunState state) {
        AgentRun base = runStore.findById(state.runId())
                .orElseThrow(() -> new IllegalStateException("Run " + state.runId() + " is not persisted"));
        runStore.save(state.toRun(base, clock.instant().truncatedTo(ChronoUnit.MILLIS)));
    }
}
