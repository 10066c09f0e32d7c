package com.appforge.core.nodes;

import com.appforge.core.config.AgentProperties;
import com.appforge.core.llm.LlmService;
import com.appforge.core.model.RunPlan;
import com.appforge.core.model.RunStage;
import com.appforge.core.model.TargetStack;
import com.appforge.core.state.AgentRunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Breaks the request into ordered implementation steps with explicit assumptions
 * and risks. Produces no code.
 */
@Component
public class PlanRunNode {

    private static final Logger log = LoggerFactory.getLogger(PlanRunNode.class);

    static final String STAGE = "plan_run";

    private static final String SYSTEM_PROMPT = """
            You are the planner for a web application generator.
            Decompose the user's request into an ordered list of concrete implementation
            steps for the given stack. Each step is one focused change, for example
            "Create app/page.tsx with a hero section and a task list".

            Also list:
            - assumptions: anything you decided that the request left open
            - risks: things likely to break the build or surprise the user

            DO NOT write code. Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final AgentProperties properties;

    public PlanRunNode(LlmService llmService, AgentProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    public Map<String, Object> apply(AgentRunState state) {
        if (state.plan().isPresent()) {
            return Map.of("stage", RunStage.PLANNING.name());
        }

        TargetStack stack = state.framework().orElse(TargetStack.DEFAULT);
        String userPrompt = """
                Target stack: %s
                Stack conventions: %s

                Request:
                %s
                """.formatted(stack.id(), stack.conventions(), state.request());

        RunPlan raw = AgentOutputRetry.call(STAGE, properties.getMaxOutputAttempts(),
                () -> llmService.structuredCall(SYSTEM_PROMPT, userPrompt, RunPlan.class),
                p -> clean(p.steps()).isEmpty() ? "plan has no steps" : null);
        RunPlan plan = new RunPlan(clean(raw.steps()), clean(raw.assumptions()), clean(raw.risks()));

        log.info("Plan ready: {} steps, {} assumptions, {} risks",
                plan.steps().size(), plan.assumptions().size(), plan.risks().size());
        return Map.of(
                "plan", plan,
                "stage", RunStage.PLANNING.name());
    }

    private static List<String> clean(List<String> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
