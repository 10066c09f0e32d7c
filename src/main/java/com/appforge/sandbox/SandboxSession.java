package com.appforge.sandbox;

import java.time.Instant;

/**
 * A sandbox owned by one project or fragment.
 *
 * @param id            session identifier
 * @param ownerEntityId fragment (or project) that owns the session
 * @param handle        provider handle, null while PROVISIONING
 * @param imageTag      sandbox template the session was created from
 * @param status        forward-only lifecycle status
 * @param createdAt     creation time
 * @param lastUsedAt    last command or write
 */
public record SandboxSession(
    String id,
    String ownerEntityId,
    String handle,
    String imageTag,
    SandboxStatus status,
    Instant createdAt,
    Instant lastUsedAt
) {}
