package com.appforge.core.admission;

import com.appforge.core.model.ErrorKind;

import java.time.Duration;

public class RateLimitExceededException extends AdmissionDeniedException {

    private final String operationType;

    public RateLimitExceededException(String operationType, Duration retryAfter) {
        super("Rate limit exceeded for " + operationType + ", retry after " + retryAfter.toSeconds() + "s",
                retryAfter);
        this.operationType = operationType;
    }

    public String getOperationType() {
        return operationType;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RATE_LIMIT_EXCEEDED;
    }
}
