package com.appforge.core.admission;

import com.appforge.core.model.ErrorKind;

import java.time.Duration;

public class CircuitOpenException extends AdmissionDeniedException {

    public CircuitOpenException(String breakerName, Duration retryAfter) {
        super("Circuit '" + breakerName + "' is open, retry after " + retryAfter.toSeconds() + "s", retryAfter);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CIRCUIT_OPEN;
    }
}
