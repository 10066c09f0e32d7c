package com.appforge.dispatch.api;

import com.appforge.core.model.AgentRun;
import com.appforge.core.model.GeneratedFile;
import com.appforge.core.model.RunFailure;
import com.appforge.core.model.RunPlan;
import com.appforge.core.model.ValidationReport;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for run endpoints.
 */
public record RunResponse(
    @JsonProperty("run_id") String runId,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("fragment_id") String fragmentId,
    String stage,
    String mode,
    String framework,
    RunPlan plan,
    @JsonProperty("file_paths") List<String> filePaths,
    @JsonProperty("sandbox_session_id") String sandboxSessionId,
    @JsonProperty("repair_count") int repairCount,
    @JsonProperty("last_report") ReportResponse lastReport,
    FailureResponse failure,
    @JsonProperty("pending_job_id") String pendingJobId,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public record ReportResponse(
        String command,
        @JsonProperty("exit_code") int exitCode,
        boolean passed,
        @JsonProperty("timed_out") boolean timedOut,
        String stdout,
        String stderr
    ) {}

    public record FailureResponse(
        String kind,
        String message,
        String stage,
        int attempts
    ) {}

    static RunResponse from(AgentRun run) {
        return new RunResponse(
                run.id(),
                run.projectId(),
                run.fragmentId(),
                run.stage().name(),
                run.mode() != null ? run.mode().name() : null,
                run.framework() != null ? run.framework().id() : null,
                run.plan(),
                run.files().stream().map(GeneratedFile::path).toList(),
                run.sandboxSessionId(),
                run.repairCount(),
                toReport(run.lastReport()),
                toFailure(run.failure()),
                run.pendingJobId(),
                run.createdAt(),
                run.updatedAt());
    }

    private static ReportResponse toReport(ValidationReport report) {
        if (report == null) return null;
        return new ReportResponse(report.command(), report.exitCode(), report.passed(), report.timedOut(),
                report.stdout(), report.stderr());
    }

    private static FailureResponse toFailure(RunFailure failure) {
        if (failure == null) return null;
        return new FailureResponse(failure.kind().name(), failure.message(), failure.stage(), failure.attempts());
    }
}
