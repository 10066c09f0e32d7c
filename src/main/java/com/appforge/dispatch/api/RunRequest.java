package com.appforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/runs.
 *
 * @param projectId          owning project
 * @param request            natural-language description of the app
 * @param framework          optional stack id (nextjs, angular, react, vue, svelte)
 * @param mode               SAFE or FAST; nullable, defaults to the configured mode
 * @param previousFragmentId fragment whose running sandbox should be taken over
 */
public record RunRequest(
    @JsonProperty("project_id") String projectId,
    String request,
    String framework,
    String mode,
    @JsonProperty("previous_fragment_id") String previousFragmentId
) {}
