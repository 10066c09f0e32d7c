package com.appforge.core.nodes;

import com.appforge.core.model.RunStage;
import com.appforge.core.state.AgentRunState;
import com.appforge.sandbox.SandboxException;
import com.appforge.sandbox.SandboxLifecycleManager;
import com.appforge.sandbox.SandboxSession;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Materializes the generated files in the run's sandbox.
 */
@Component
public class WriteFilesNode {

    private final SandboxLifecycleManager lifecycleManager;

    public WriteFilesNode(SandboxLifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    public Map<String, Object> apply(AgentRunState state) {
        if (state.filesWritten()) {
            return Map.of("stage", RunStage.VALIDATING.name());
        }
        SandboxSession session = lifecycleManager.find(state.sandboxSessionId())
                .orElseThrow(() -> new SandboxException("Run has no sandbox session", false));
        lifecycleManager.writeFiles(state.runId(), session, state.files(), state.lane());
        return Map.of(
                "filesWritten", true,
                "stage", RunStage.VALIDATING.name());
    }
}
