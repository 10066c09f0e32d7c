package com.appforge.core.model;

/**
 * Failure taxonomy shared by the orchestration core, the REST layer and telemetry.
 */
public enum ErrorKind {
    RATE_LIMIT_EXCEEDED(true),
    CIRCUIT_OPEN(true),
    SANDBOX_TIMEOUT(false),
    MALFORMED_AGENT_OUTPUT(false),
    REPAIR_BUDGET_EXHAUSTED(false),
    SANDBOX_FAILURE(false),
    INTERNAL(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /** Transient failures are queued and retried; everything else is surfaced to the caller. */
    public boolean isTransient() {
        return transientFailure;
    }
}
