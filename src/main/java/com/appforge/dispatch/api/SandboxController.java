package com.appforge.dispatch.api;

import com.appforge.core.model.TargetStack;
import com.appforge.sandbox.SandboxLifecycleManager;
import com.appforge.sandbox.SandboxLifecycleManager.SandboxAcquisition;
import com.appforge.sandbox.SandboxSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for sandbox sessions.
 */
@RestController
@RequestMapping("/api/v1/sandboxes")
public class SandboxController {

    private static final Logger log = LoggerFactory.getLogger(SandboxController.class);

    private final SandboxLifecycleManager lifecycle;

    public SandboxController(SandboxLifecycleManager lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * POST /api/v1/sandboxes: Returns the owner's running session or provisions one.
     * Answers 202 with a job id when provisioning was deferred by admission control.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> acquire(@RequestBody SandboxRequest request) {
        if (request.ownerEntityId() == null || request.ownerEntityId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "owner_entity_id is required"));
        }
        TargetStack stack = TargetStack.DEFAULT;
        if (request.framework() != null && !request.framework().isBlank()) {
            stack = TargetStack.fromId(request.framework()).orElse(null);
            if (stack == null) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown framework: " + request.framework()));
            }
        }

        SandboxAcquisition acquisition = lifecycle.acquire(request.ownerEntityId(), stack.imageTag());
        if (acquisition.isReady()) {
            return ResponseEntity.ok(toBody(acquisition.session()));
        }
        log.info("Sandbox for {} deferred as job {}", request.ownerEntityId(), acquisition.jobId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", acquisition.jobId());
        body.put("retry_after_seconds", acquisition.retryAfter().toSeconds());
        return ResponseEntity.accepted().body(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getSession(@PathVariable String id) {
        return lifecycle.find(id)
                .map(session -> ResponseEntity.ok(toBody(session)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/sandboxes/{id}/transfer: Hands a running session to a new owner.
     */
    @PostMapping("/{id}/transfer")
    public ResponseEntity<Map<String, Object>> transfer(@PathVariable String id, @RequestBody TransferRequest request) {
        if (request.newOwnerEntityId() == null || request.newOwnerEntityId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "new_owner_entity_id is required"));
        }
        if (lifecycle.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toBody(lifecycle.transfer(id, request.newOwnerEntityId())));
    }

    /**
     * DELETE /api/v1/sandboxes/{id}: Stops a session. Stopping twice is a no-op.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> stop(@PathVariable String id) {
        if (lifecycle.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        lifecycle.stop(id);
        return ResponseEntity.noContent().build();
    }

    private static Map<String, Object> toBody(SandboxSession session) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", session.id());
        body.put("owner_entity_id", session.ownerEntityId());
        body.put("image_tag", session.imageTag());
        body.put("status", session.status().name());
        body.put("created_at", session.createdAt().toString());
        body.put("last_used_at", session.lastUsedAt().toString());
        return body;
    }
}
