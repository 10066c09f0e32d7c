package com.appforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Planner output: ordered implementation steps plus the assumptions and risks behind them.
 */
public record RunPlan(
    List<String> steps,
    List<String> assumptions,
    List<String> risks
) implements Serializable {}
