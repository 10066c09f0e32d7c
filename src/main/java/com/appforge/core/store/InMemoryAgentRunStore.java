package com.appforge.core.store;

import com.appforge.core.model.AgentRun;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAgentRunStore implements AgentRunStore {

    private final ConcurrentHashMap<String, AgentRun> runs = new ConcurrentHashMap<>();

    @Override
    public void save(AgentRun run) {
        runs.put(run.id(), run);
    }

    @Override
    public Optional<AgentRun> findById(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<AgentRun> findRecent(int limit) {
        return runs.values().stream()
                .sorted(Comparator.comparing(AgentRun::updatedAt).reversed())
                .limit(limit)
                .toList();
    }
}
