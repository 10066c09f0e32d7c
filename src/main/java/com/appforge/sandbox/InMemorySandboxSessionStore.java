package com.appforge.sandbox;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySandboxSessionStore implements SandboxSessionStore {

    private final ConcurrentHashMap<String, SandboxSession> sessions = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean insert(SandboxSession session) {
        if (findActiveByOwner(session.ownerEntityId()).isPresent()) {
            return false;
        }
        sessions.put(session.id(), session);
        return true;
    }

    @Override
    public Optional<SandboxSession> findById(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    @Override
    public Optional<SandboxSession> findActiveByOwner(String ownerEntityId) {
        return sessions.values().stream()
                .filter(s -> s.ownerEntityId().equals(ownerEntityId) && s.status().isActive())
                .findFirst();
    }

    @Override
    public List<SandboxSession> findActive() {
        return sessions.values().stream().filter(s -> s.status().isActive()).toList();
    }

    @Override
    public synchronized boolean updateStatus(String id, SandboxStatus expected, SandboxStatus next,
                                             String handle, Instant now) {
        SandboxSession s = sessions.get(id);
        if (s == null || s.status() != expected) {
            return false;
        }
        sessions.put(id, new SandboxSession(s.id(), s.ownerEntityId(), handle != null ? handle : s.handle(),
                s.imageTag(), next, s.createdAt(), now));
        return true;
    }

    @Override
    public synchronized boolean transfer(String id, String newOwnerEntityId, Instant now) {
        SandboxSession s = sessions.get(id);
        if (s == null || !s.status().isActive()) {
            return false;
        }
        Optional<SandboxSession> occupant = findActiveByOwner(newOwnerEntityId);
        if (occupant.isPresent() && !occupant.get().id().equals(id)) {
            return false;
        }
        sessions.put(id, new SandboxSession(s.id(), newOwnerEntityId, s.handle(), s.imageTag(),
                s.status(), s.createdAt(), now));
        return true;
    }

    @Override
    public void touch(String id, Instant now) {
        sessions.computeIfPresent(id, (k, s) -> new SandboxSession(s.id(), s.ownerEntityId(), s.handle(),
                s.imageTag(), s.status(), s.createdAt(), now));
    }
}
