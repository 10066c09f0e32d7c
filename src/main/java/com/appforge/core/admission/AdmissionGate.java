package com.appforge.core.admission;

import com.appforge.core.breaker.CircuitBreaker;
import com.appforge.core.ratelimit.AdmissionDecision;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.ratelimit.RateLimiter;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Admission path every sandbox call goes through: circuit breaker first, so an
 * open circuit costs no rate-limit budget, then the rate limiter, then the call.
 * <p>
 * Upstream exceptions count as breaker failures and are rethrown unchanged.
 */
@Service
public class AdmissionGate {

    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;

    public AdmissionGate(CircuitBreaker circuitBreaker, RateLimiter rateLimiter) {
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
    }

    /**
     * @throws CircuitOpenException       when the breaker short-circuits the call
     * @throws RateLimitExceededException when the operation's window is exhausted for this lane
     */
    public <T> T call(String operationType, AdmissionLane lane, Supplier<T> upstreamCall) {
        CircuitBreaker.Permit permit = circuitBreaker.acquire();

        AdmissionDecision decision;
        try {
            decision = rateLimiter.admit(operationType, lane);
        } catch (RuntimeException e) {
            circuitBreaker.release(permit);
            throw e;
        }
        if (!decision.allowed()) {
            circuitBreaker.release(permit);
            throw new RateLimitExceededException(operationType, decision.retryAfter());
        }

        T result;
        try {
            result = upstreamCall.get();
        } catch (RuntimeException e) {
            circuitBreaker.onFailure(permit, e);
            throw e;
        }
        circuitBreaker.onSuccess(permit);
        return result;
    }

    public void run(String operationType, AdmissionLane lane, Runnable upstreamCall) {
        call(operationType, lane, () -> {
            upstreamCall.run();
            return null;
        });
    }
}
