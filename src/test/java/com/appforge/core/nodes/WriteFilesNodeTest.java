package com.appforge.core.nodes;

import com.appforge.core.model.GeneratedFile;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.state.AgentRunState;
import com.appforge.sandbox.SandboxException;
import com.appforge.sandbox.SandboxLifecycleManager;
import com.appforge.sandbox.SandboxSession;
import com.appforge.sandbox.SandboxStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WriteFilesNodeTest {

    private final SandboxLifecycleManager lifecycle = mock(SandboxLifecycleManager.class);
    private final WriteFilesNode node = new WriteFilesNode(lifecycle);

    private static final List<GeneratedFile> FILES = List.of(new GeneratedFile("app/page.tsx", "export {}"));

    @Test
    void writesFilesToTheRunsSandbox() {
        var now = Instant.parse("2026-03-01T10:00:00Z");
        var session = new SandboxSession("SBX-1", "FRAG-1", "ctr-1", "nextjs", SandboxStatus.RUNNING, now, now);
        when(lifecycle.find("SBX-1")).thenReturn(Optional.of(session));

        var result = node.apply(new AgentRunState(Map.of("runId", "RUN-1", "sandboxSessionId", "SBX-1", "files", FILES)));

        verify(lifecycle).writeFiles("RUN-1", session, FILES, AdmissionLane.LIVE);
        assertEquals(true, result.get("filesWritten"));
        assertEquals("VALIDATING", result.get("stage"));
    }

    @Test
    void skipsWhenAlreadyWritten() {
        var result = node.apply(new AgentRunState(Map.of("sandboxSessionId", "SBX-1", "filesWritten", true)));

        assertEquals("VALIDATING", result.get("stage"));
        verify(lifecycle, never()).writeFiles(any(), any(), anyList(), any());
    }

    @Test
    void failsWithoutSandbox() {
        when(lifecycle.find(anyString())).thenReturn(Optional.empty());

        assertThrows(SandboxException.class, () -> node.apply(new AgentRunState(Map.of("files", FILES))));
    }
}
