package com.appforge.sandbox;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable sandbox ownership. At most one active (PROVISIONING or RUNNING) session
 * exists per owner; the store enforces it on insert and transfer.
 */
public interface SandboxSessionStore {

    /**
     * @return false when the owner already has an active session
     */
    boolean insert(SandboxSession session);

    Optional<SandboxSession> findById(String id);

    Optional<SandboxSession> findActiveByOwner(String ownerEntityId);

    List<SandboxSession> findActive();

    /**
     * Moves {@code expected} to {@code next}, setting the handle when non-null.
     *
     * @return false when the session is no longer in {@code expected}
     */
    boolean updateStatus(String id, SandboxStatus expected, SandboxStatus next, String handle, Instant now);

    /**
     * Reassigns an active session.
     *
     * @return false when {@code newOwnerEntityId} already owns an active session
     */
    boolean transfer(String id, String newOwnerEntityId, Instant now);

    void touch(String id, Instant now);
}
