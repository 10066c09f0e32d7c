package com.appforge.sandbox;

import com.appforge.core.queue.JobHandler;
import com.appforge.core.queue.PendingJob;
import com.appforge.core.ratelimit.AdmissionLane;
import org.springframework.stereotype.Component;

/**
 * Creates a sandbox that was deferred by admission control.
 */
@Component
public class ProvisionSandboxJobHandler implements JobHandler {

    private final SandboxLifecycleManager lifecycleManager;

    public ProvisionSandboxJobHandler(SandboxLifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    @Override
    public String action() {
        return SandboxLifecycleManager.PROVISION_ACTION;
    }

    @Override
    public void handle(PendingJob job) {
        String owner = job.payloadString("ownerEntityId");
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("provision_sandbox job " + job.id() + " has no ownerEntityId");
        }
        lifecycleManager.getOrCreate(owner, job.payloadString("imageTag"), AdmissionLane.QUEUED);
    }
}
