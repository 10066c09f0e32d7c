package com.appforge.sandbox;

import com.appforge.core.queue.JobPriority;
import com.appforge.core.queue.JobStatus;
import com.appforge.core.queue.PendingJob;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.ratelimit.OperationTypes;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProvisionSandboxJobHandlerTest {

    private final SandboxLifecycleManager lifecycle = mock(SandboxLifecycleManager.class);
    private final ProvisionSandboxJobHandler handler = new ProvisionSandboxJobHandler(lifecycle);

    private static PendingJob job(Map<String, Object> payload) {
        return new PendingJob("JOB-1", OperationTypes.SANDBOX_CREATE, SandboxLifecycleManager.PROVISION_ACTION,
                payload, JobPriority.NORMAL, Instant.parse("2026-03-01T10:00:00Z"), 0, 3,
                JobStatus.PROCESSING, null, null, null);
    }

    @Test
    void handlesProvisionAction() {
        assertEquals("provision_sandbox", handler.action());
    }

    @Test
    void createsSandboxOnTheQueuedLane() {
        handler.handle(job(Map.of("ownerEntityId", "FRAG-1", "imageTag", "nextjs")));

        verify(lifecycle).getOrCreate("FRAG-1", "nextjs", AdmissionLane.QUEUED);
    }

    @Test
    void rejectsJobWithoutOwner() {
        assertThrows(IllegalArgumentException.class, () -> handler.handle(job(Map.of("imageTag", "nextjs"))));
        verifyNoInteractions(lifecycle);
    }
}
