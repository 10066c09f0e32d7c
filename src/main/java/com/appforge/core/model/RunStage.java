package com.appforge.core.model;

/**
 * Lifecycle stage of an {@link AgentRun}.
 * <p>
 * QUEUED means the run is parked behind a deferred sandbox operation and will be
 * resumed by the job queue.
 */
public enum RunStage {
    QUEUED,
    PLANNING,
    CODING,
    VALIDATING,
    REPAIRING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
