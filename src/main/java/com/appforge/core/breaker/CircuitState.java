package com.appforge.core.breaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
