package com.appforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sandboxes.
 *
 * @param ownerEntityId fragment or other entity that will own the session
 * @param framework     stack id whose image the sandbox starts from; nullable, defaults to nextjs
 */
public record SandboxRequest(
    @JsonProperty("owner_entity_id") String ownerEntityId,
    String framework
) {}
