package com.appforge.core.nodes;

import com.appforge.core.llm.LlmEmptyResponseException;
import com.appforge.core.llm.LlmParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Bounded retry for agent calls whose output may be unusable. Only malformed
 * output is retried; any other exception propagates on the first attempt.
 */
final class AgentOutputRetry {

    private static final Logger log = LoggerFactory.getLogger(AgentOutputRetry.class);

    private AgentOutputRetry() {}

    /**
     * @param check returns null when the output is acceptable, otherwise the rejection reason
     */
    static <T> T call(String stage, int maxAttempts, Supplier<T> attempt, Function<T, String> check) {
        int budget = Math.max(maxAttempts, 1);
        String lastError = "no output";
        for (int i = 1; i <= budget; i++) {
            try {
                T output = attempt.get();
                String rejection = output == null ? "null output" : check.apply(output);
                if (rejection == null) {
                    return output;
                }
                lastError = rejection;
            } catch (LlmParseException | LlmEmptyResponseException e) {
                lastError = e.getMessage();
            }
            log.warn("{} output rejected (attempt {}/{}): {}", stage, i, budget, lastError);
        }
        throw new MalformedAgentOutputException(stage, budget, lastError);
    }
}
