package com.appforge.core.model;

/**
 * SAFE runs the lint/build sequence after every code generation; FAST writes the files and stops.
 */
public enum ValidationMode {
    SAFE,
    FAST
}
