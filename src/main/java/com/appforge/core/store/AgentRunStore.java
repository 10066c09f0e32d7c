package com.appforge.core.store;

import com.appforge.core.model.AgentRun;

import java.util.List;
import java.util.Optional;

/**
 * Durable run records. A run is saved after every graph node so a queued run can
 * resume from its last completed step.
 */
public interface AgentRunStore {

    /** Inserts or replaces the run. */
    void save(AgentRun run);

    Optional<AgentRun> findById(String runId);

    /** Most recently updated runs first. */
    List<AgentRun> findRecent(int limit);
}
