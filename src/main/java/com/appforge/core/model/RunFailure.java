package com.appforge.core.model;

import java.io.Serializable;

/**
 * Structured error attached to an {@link AgentRun} that ended in {@link RunStage#ERROR}.
 *
 * @param kind       taxonomy entry
 * @param message    human-readable description of the last error
 * @param stage      graph node that failed
 * @param attempts   attempts spent before giving up (LLM retries or repair cycles)
 * @param lastReport last validation report, when the failure came out of the repair loop
 */
public record RunFailure(
    ErrorKind kind,
    String message,
    String stage,
    int attempts,
    ValidationReport lastReport
) implements Serializable {}
