package com.appforge.core.model;

import java.io.Serializable;

/**
 * One file emitted by the coder, with a path relative to the sandbox workspace.
 */
public record GeneratedFile(
    String path,
    String content
) implements Serializable {}
