package com.appforge.core.admission;

import com.appforge.core.model.ErrorKind;

import java.time.Duration;

/**
 * A sandbox operation was refused before reaching the upstream. Always transient:
 * callers queue the operation instead of failing.
 */
public abstract class AdmissionDeniedException extends RuntimeException {

    private final Duration retryAfter;

    protected AdmissionDeniedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter != null ? retryAfter : Duration.ZERO;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public abstract ErrorKind kind();
}
