package com.appforge.core.model;

/**
 * Caller input for a new generation run.
 *
 * @param projectId          project the generated code belongs to
 * @param request            natural-language description of the app
 * @param framework          optional stack pin; skips the framework selector when set
 * @param mode               validation mode; nullable, defaults to the configured mode
 * @param previousFragmentId optional fragment whose running sandbox should be reused
 */
public record GenerationRequest(
    String projectId,
    String request,
    TargetStack framework,
    ValidationMode mode,
    String previousFragmentId
) {

    public static GenerationRequest of(String projectId, String request) {
        return new GenerationRequest(projectId, request, null, null, null);
    }
}
