package com.appforge.core.nodes;

import com.appforge.core.model.RunStage;
import com.appforge.core.model.TargetStack;
import com.appforge.core.state.AgentRunState;
import com.appforge.sandbox.SandboxLifecycleManager;
import com.appforge.sandbox.SandboxSession;
import com.appforge.sandbox.SandboxStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Gives the run's fragment a running sandbox: the one it already has, the one a
 * previous fragment hands over, or a new one. Admission denials propagate so the
 * graph can queue the run.
 */
@Component
public class ProvisionSandboxNode {

    private static final Logger log = LoggerFactory.getLogger(ProvisionSandboxNode.class);

    private final SandboxLifecycleManager lifecycleManager;

    public ProvisionSandboxNode(SandboxLifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    public Map<String, Object> apply(AgentRunState state) {
        String currentId = state.sandboxSessionId();
        if (!currentId.isEmpty()
                && lifecycleManager.find(currentId).filter(s -> s.status() == SandboxStatus.RUNNING).isPresent()) {
            return Map.of("stage", RunStage.CODING.name());
        }

        SandboxSession session = takeOverPrevious(state)
                .orElseGet(() -> lifecycleManager.getOrCreate(state.fragmentId(),
                        state.framework().orElse(TargetStack.DEFAULT).imageTag(), state.lane()));

        boolean sameSandbox = session.id().equals(currentId);
        if (!currentId.isEmpty() && !sameSandbox) {
            log.warn("Sandbox {} is gone; files will be rewritten to {}", currentId, session.id());
        }
        return Map.of(
                "sandboxSessionId", session.id(),
                "filesWritten", sameSandbox && state.filesWritten(),
                "stage", RunStage.CODING.name());
    }

    private Optional<SandboxSession> takeOverPrevious(AgentRunState state) {
        String previous = state.previousFragmentId();
        if (previous.isEmpty() || lifecycleManager.findActive(state.fragmentId()).isPresent()) {
            return Optional.empty();
        }
        return lifecycleManager.findActive(previous)
                .filter(s -> s.status() == SandboxStatus.RUNNING)
                .map(s -> {
                    log.info("Taking over sandbox {} from fragment {}", s.id(), previous);
                    return lifecycleManager.transfer(s.id(), state.fragmentId());
                });
    }
}
