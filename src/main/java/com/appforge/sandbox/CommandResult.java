package com.appforge.sandbox;

/**
 * Raw result of one sandbox command.
 */
public record CommandResult(
    String stdout,
    String stderr,
    int exitCode,
    boolean timedOut,
    long durationMs
) {}
