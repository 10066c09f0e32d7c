package com.appforge.core.state;

import com.appforge.core.model.AgentRun;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.GeneratedFile;
import com.appforge.core.model.RunFailure;
import com.appforge.core.model.RunPlan;
import com.appforge.core.model.RunStage;
import com.appforge.core.model.TargetStack;
import com.appforge.core.model.ValidationMode;
import com.appforge.core.model.ValidationReport;
import com.appforge.core.ratelimit.AdmissionLane;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one agent run.
 * <p>
 * Every channel has last-write-wins semantics: nodes return only the keys they
 * change. The state converts to and from {@link AgentRun} so a run can be
 * persisted after each node and rebuilt when a queued run resumes.
 */
public class AgentRunState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("runId",              Channels.base(() -> "")),
        Map.entry("projectId",          Channels.base(() -> "")),
        Map.entry("fragmentId",         Channels.base(() -> "")),
        Map.entry("request",            Channels.base(() -> "")),
        Map.entry("mode",               Channels.base(() -> ValidationMode.SAFE.name())),
        Map.entry("stage",              Channels.base(() -> RunStage.PLANNING.name())),
        Map.entry("lane",               Channels.base(() -> AdmissionLane.LIVE.name())),
        Map.entry("framework",          Channels.base(() -> "")),
        Map.entry("plan",               Channels.base((Reducer<RunPlan>) null)),
        Map.entry("files",              Channels.base((Supplier<List<GeneratedFile>>) List::of)),
        Map.entry("filesWritten",       Channels.base(() -> false)),
        Map.entry("sandboxSessionId",   Channels.base(() -> "")),
        Map.entry("previousFragmentId", Channels.base(() -> "")),
        Map.entry("lastReport",         Channels.base((Reducer<ValidationReport>) null)),
        Map.entry("repairCount",        Channels.base(() -> 0)),
        Map.entry("repairPending",      Channels.base(() -> false)),
        Map.entry("failure",            Channels.base((Reducer<RunFailure>) null)),

        // Set when admission control deferred the run
        Map.entry("deferralKind",       Channels.base(() -> "")),
        Map.entry("deferralOperation",  Channels.base(() -> "")),
        Map.entry("retryAfterMs",       Channels.base(() -> 0L))
    );

    public AgentRunState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String projectId() {
        return this.<String>value("projectId").orElse("");
    }

    public String fragmentId() {
        return this.<String>value("fragmentId").orElse("");
    }

    public String request() {
        return this.<String>value("request").orElse("");
    }

    public ValidationMode mode() {
        return ValidationMode.valueOf(this.<String>value("mode").orElse(ValidationMode.SAFE.name()));
    }

    public RunStage stage() {
        return RunStage.valueOf(this.<String>value("stage").orElse(RunStage.PLANNING.name()));
    }

    public AdmissionLane lane() {
        return AdmissionLane.valueOf(this.<String>value("lane").orElse(AdmissionLane.LIVE.name()));
    }

    public Optional<TargetStack> framework() {
        String raw = this.<String>value("framework").orElse("");
        return raw.isEmpty() ? Optional.empty() : Optional.of(TargetStack.valueOf(raw));
    }

    public Optional<RunPlan> plan() {
        return value("plan");
    }

    public List<GeneratedFile> files() {
        return this.<List<GeneratedFile>>value("files").orElse(List.of());
    }

    public boolean filesWritten() {
        return this.<Boolean>value("filesWritten").orElse(false);
    }

    public String sandboxSessionId() {
        return this.<String>value("sandboxSessionId").orElse("");
    }

    public String previousFragmentId() {
        return this.<String>value("previousFragmentId").orElse("");
    }

    public Optional<ValidationReport> lastReport() {
        return value("lastReport");
    }

    public int repairCount() {
        return this.<Integer>value("repairCount").orElse(0);
    }

    public boolean repairPending() {
        return this.<Boolean>value("repairPending").orElse(false);
    }

    public Optional<RunFailure> failure() {
        return value("failure");
    }

    public Optional<ErrorKind> deferralKind() {
        String raw = this.<String>value("deferralKind").orElse("");
        return raw.isEmpty() ? Optional.empty() : Optional.of(ErrorKind.valueOf(raw));
    }

    public String deferralOperation() {
        return this.<String>value("deferralOperation").orElse("");
    }

    public long retryAfterMs() {
        return this.<Number>value("retryAfterMs").map(Number::longValue).orElse(0L);
    }

    /** Initial graph input for a run, resuming from whatever the record already holds. */
    public static Map<String, Object> initialData(AgentRun run, AdmissionLane lane) {
        var data = new HashMap<String, Object>();
        data.put("runId", run.id());
        data.put("projectId", run.projectId());
        data.put("fragmentId", run.fragmentId());
        data.put("request", run.request());
        data.put("mode", run.mode().name());
        // A resumed run re-enters the graph from the top; nodes skip finished work
        data.put("stage", (run.stage() == RunStage.QUEUED ? RunStage.PLANNING : run.stage()).name());
        data.put("lane", lane.name());
        data.put("files", run.files());
        data.put("filesWritten", run.filesWritten());
        data.put("repairCount", run.repairCount());
        data.put("repairPending", run.repairPending());
        if (run.framework() != null) {
            data.put("framework", run.framework().name());
        }
        if (run.plan() != null) {
            data.put("plan", run.plan());
        }
        if (run.sandboxSessionId() != null) {
            data.put("sandboxSessionId", run.sandboxSessionId());
        }
        if (run.previousFragmentId() != null) {
            data.put("previousFragmentId", run.previousFragmentId());
        }
        if (run.lastReport() != null) {
            data.put("lastReport", run.lastReport());
        }
        return data;
    }

    /**
     * Copies the graph's view of the run onto {@code base}, keeping the fields the
     * graph does not own (ids, timestamps, pending job).
     */
    public AgentRun toRun(AgentRun base, Instant now) {
        return new AgentRun(
                base.id(),
                base.projectId(),
                base.fragmentId(),
                base.request(),
                base.mode(),
                stage(),
                framework().orElse(null),
                plan().orElse(null),
                files(),
                filesWritten(),
                sandboxSessionId().isEmpty() ? null : sandboxSessionId(),
                lastReport().orElse(null),
                repairCount(),
                repairPending(),
                failure().orElse(null),
                stage() == RunStage.QUEUED ? base.pendingJobId() : null,
                base.previousFragmentId(),
                base.createdAt(),
                now);
    }
}
