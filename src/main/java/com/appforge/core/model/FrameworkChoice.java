package com.appforge.core.model;

import java.io.Serializable;

/**
 * Raw framework selector output before it is checked against {@link TargetStack}.
 */
public record FrameworkChoice(
    String framework,
    String reason
) implements Serializable {}
