package com.appforge.core.nodes;

import com.appforge.core.config.AgentProperties;
import com.appforge.core.llm.LlmService;
import com.appforge.core.model.RunPlan;
import com.appforge.core.state.AgentRunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PlanRunNodeTest {

    private final LlmService llm = mock(LlmService.class);
    private final PlanRunNode node = new PlanRunNode(llm, new AgentProperties());

    @Test
    @DisplayName("cleans blank entries out of the plan")
    void cleansPlan() {
        when(llm.structuredCall(anyString(), anyString(), eq(RunPlan.class))).thenReturn(new RunPlan(
                Arrays.asList(" Create app/page.tsx ", "", null, "Add task list component"),
                List.of("Tasks live in local state"),
                null));

        var result = node.apply(new AgentRunState(Map.of("request", "Todo app", "framework", "NEXTJS")));

        var plan = (RunPlan) result.get("plan");
        assertEquals(List.of("Create app/page.tsx", "Add task list component"), plan.steps());
        assertEquals(List.of("Tasks live in local state"), plan.assumptions());
        assertEquals(List.of(), plan.risks());
    }

    @Test
    @DisplayName("sends stack conventions with the request")
    void promptIncludesStack() {
        when(llm.structuredCall(anyString(), anyString(), eq(RunPlan.class)))
                .thenReturn(new RunPlan(List.of("step"), List.of(), List.of()));

        node.apply(new AgentRunState(Map.of("request", "Photo gallery", "framework", "SVELTE")));

        var prompt = ArgumentCaptor.forClass(String.class);
        verify(llm).structuredCall(anyString(), prompt.capture(), eq(RunPlan.class));
        assertTrue(prompt.getValue().contains("Target stack: svelte"));
        assertTrue(prompt.getValue().contains("Photo gallery"));
    }

    @Test
    @DisplayName("a plan without steps is rejected and asked again")
    void emptyPlanRetried() {
        when(llm.structuredCall(anyString(), anyString(), eq(RunPlan.class)))
                .thenReturn(new RunPlan(List.of("  "), List.of(), List.of()))
                .thenReturn(new RunPlan(List.of("Scaffold layout"), List.of(), List.of()));

        var result = node.apply(new AgentRunState(Map.of("request", "Blog")));

        assertEquals(List.of("Scaffold layout"), ((RunPlan) result.get("plan")).steps());
    }

    @Test
    @DisplayName("an existing plan is kept on resume")
    void existingPlanKept() {
        var existing = new RunPlan(List.of("done already"), List.of(), List.of());

        var result = node.apply(new AgentRunState(Map.of("request", "Blog", "plan", existing)));

        assertFalse(result.containsKey("plan"));
        verifyNoInteractions(llm);
    }
}
