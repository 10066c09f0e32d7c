package com.appforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Coder output: the complete file set for the project plus a short summary.
 */
public record GeneratedCode(
    List<GeneratedFile> files,
    String summary
) implements Serializable {}
