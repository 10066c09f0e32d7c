package com.appforge.core.nodes;

import com.appforge.core.config.AgentProperties;
import com.appforge.core.llm.LlmService;
import com.appforge.core.model.FrameworkChoice;
import com.appforge.core.model.RunStage;
import com.appforge.core.model.TargetStack;
import com.appforge.core.state.AgentRunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps the request to exactly one {@link TargetStack}.
 * <p>
 * A pinned stack or a request naming exactly one stack is used as-is. Otherwise
 * the model chooses, and any answer outside the closed set of identifiers is
 * rejected and asked again. When every attempt is unusable the request is treated
 * as ambiguous and gets the configured default stack.
 */
@Component
public class SelectFrameworkNode {

    private static final Logger log = LoggerFactory.getLogger(SelectFrameworkNode.class);

    static final String STAGE = "select_framework";

    private static final String SYSTEM_PROMPT_TEMPLATE = """
            You are a framework selector for a web application generator.
            Pick the single best target stack for the user's request.

            Allowed identifiers: %s

            Rules:
            1. If the request names a framework, choose it.
            2. Choose angular for large enterprise apps with complex forms.
            3. Choose svelte for small, performance-critical apps.
            4. If the request is ambiguous, choose %s.
            5. The "framework" field must be exactly one allowed identifier, lowercase.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final AgentProperties properties;
    private final String systemPrompt;

    public SelectFrameworkNode(LlmService llmService, AgentProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
        this.systemPrompt = SYSTEM_PROMPT_TEMPLATE.formatted(
                Arrays.stream(TargetStack.values()).map(TargetStack::id).collect(Collectors.joining(", ")),
                properties.getDefaultFramework().id());
    }

    public Map<String, Object> apply(AgentRunState state) {
        if (state.framework().isPresent()) {
            return Map.of("stage", RunStage.PLANNING.name());
        }

        Optional<TargetStack> explicit = TargetStack.detectExplicit(state.request());
        if (explicit.isPresent()) {
            log.info("Request names {} explicitly; skipping selector", explicit.get().id());
            return selected(explicit.get());
        }

        FrameworkChoice choice;
        try {
            choice = AgentOutputRetry.call(STAGE, properties.getMaxOutputAttempts(),
                    () -> llmService.structuredCall(systemPrompt, state.request(), FrameworkChoice.class),
                    c -> TargetStack.fromId(c.framework()).isPresent()
                            ? null : "unrecognized framework '" + c.framework() + "'");
        } catch (MalformedAgentOutputException e) {
            TargetStack fallback = properties.getDefaultFramework();
            log.warn("No usable framework after {} attempts ({}); falling back to {}",
                    e.getAttempts(), e.getMessage(), fallback.id());
            return selected(fallback);
        }
        TargetStack stack = TargetStack.fromId(choice.framework()).orElseThrow();
        log.info("Selected {} ({})", stack.id(), choice.reason());
        return selected(stack);
    }

    private Map<String, Object> selected(TargetStack stack) {
        return Map.of(
                "framework", stack.name(),
                "stage", RunStage.PLANNING.name());
    }
}
