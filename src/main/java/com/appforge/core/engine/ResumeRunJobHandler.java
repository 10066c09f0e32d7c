package com.appforge.core.engine;

import com.appforge.core.queue.JobHandler;
import com.appforge.core.queue.PendingJob;
import com.appforge.core.ratelimit.AdmissionLane;
import org.springframework.stereotype.Component;

/**
 * Re-enters the agent graph for a run that admission control parked.
 */
@Component
public class ResumeRunJobHandler implements JobHandler {

    private final AgentRunEngine engine;

    public ResumeRunJobHandler(AgentRunEngine engine) {
        this.engine = engine;
    }

    @Override
    public String action() {
        return AgentRunEngine.RESUME_ACTION;
    }

    @Override
    public void handle(PendingJob job) {
        String runId = job.payloadString("runId");
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("resume_run job " + job.id() + " has no runId");
        }
        engine.executeRun(runId, AdmissionLane.QUEUED);
    }
}
