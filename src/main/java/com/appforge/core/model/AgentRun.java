package com.appforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One end-to-end generation and bounded repair cycle for a single request.
 * <p>
 * This record is the durable view of a run: the graph state is rebuilt from it
 * when a queued run is resumed, so every field a node needs to skip finished
 * work lives here.
 *
 * @param id               run identifier (e.g. "RUN-2026-3f9c1a2b")
 * @param projectId        owning project
 * @param fragmentId       fragment that owns the sandbox session for this run
 * @param request          the user's request text
 * @param mode             SAFE or FAST validation
 * @param stage            current lifecycle stage
 * @param framework        selected stack, null until selection ran
 * @param plan             planner output, null until planning ran
 * @param files            latest coder output
 * @param filesWritten     true once {@code files} are materialized in the sandbox
 * @param sandboxSessionId session the files are written to
 * @param lastReport       most recent validation report
 * @param repairCount      repair cycles consumed, never above the configured maximum
 * @param repairPending    true when the next coding pass must repair {@code lastReport}
 * @param failure          structured error when {@code stage} is ERROR
 * @param pendingJobId     queue job that will resume the run when {@code stage} is QUEUED
 * @param previousFragmentId fragment whose sandbox this run should take over, if any
 */
public record AgentRun(
    String id,
    String projectId,
    String fragmentId,
    String request,
    ValidationMode mode,
    RunStage stage,
    TargetStack framework,
    RunPlan plan,
    List<GeneratedFile> files,
    boolean filesWritten,
    String sandboxSessionId,
    ValidationReport lastReport,
    int repairCount,
    boolean repairPending,
    RunFailure failure,
    String pendingJobId,
    String previousFragmentId,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public AgentRun {
        files = files != null ? List.copyOf(files) : List.of();
    }

    public AgentRun withStage(RunStage newStage, Instant now) {
        return new AgentRun(id, projectId, fragmentId, request, mode, newStage, framework, plan, files,
                filesWritten, sandboxSessionId, lastReport, repairCount, repairPending, failure,
                pendingJobId, previousFragmentId, createdAt, now);
    }

    public AgentRun withPendingJob(String jobId, Instant now) {
        return new AgentRun(id, projectId, fragmentId, request, mode, RunStage.QUEUED, framework, plan, files,
                filesWritten, sandboxSessionId, lastReport, repairCount, repairPending, failure,
                jobId, previousFragmentId, createdAt, now);
    }

    public AgentRun withFailure(RunFailure newFailure, Instant now) {
        return new AgentRun(id, projectId, fragmentId, request, mode, RunStage.ERROR, framework, plan, files,
                filesWritten, sandboxSessionId, lastReport, repairCount, repairPending, newFailure,
                pendingJobId, previousFragmentId, createdAt, now);
    }
}
