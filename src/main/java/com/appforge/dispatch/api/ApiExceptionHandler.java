package com.appforge.dispatch.api;

import com.appforge.core.admission.AdmissionDeniedException;
import com.appforge.core.admission.CircuitOpenException;
import com.appforge.sandbox.SandboxException;
import com.appforge.sandbox.SandboxOwnershipConflictException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps orchestration exceptions to HTTP responses.
 * <p>
 * Admission denials carry a Retry-After header in whole seconds: 429 when a rate
 * limit window is full, 503 while the circuit is open.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAdmissionDenied(AdmissionDeniedException ex,
                                                                     HttpServletRequest request) {
        HttpStatus status = ex instanceof CircuitOpenException
                ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.TOO_MANY_REQUESTS;
        long retryAfterSeconds = Math.max(1, (ex.getRetryAfter().toMillis() + 999) / 1000);
        log.warn("HTTP {} {} denied: {} (retry after {}s)", request.getMethod(), request.getRequestURI(),
                ex.kind(), retryAfterSeconds);
        return ResponseEntity.status(status)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(body(ex.kind().name(), ex.getMessage()));
    }

    @ExceptionHandler(SandboxOwnershipConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(SandboxOwnershipConflictException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body("OWNERSHIP_CONFLICT", ex.getMessage()));
    }

    @ExceptionHandler(SandboxException.class)
    public ResponseEntity<Map<String, Object>> handleSandbox(SandboxException ex, HttpServletRequest request) {
        log.error("HTTP {} {} failed in sandbox: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body("SANDBOX_FAILURE", ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(body("BAD_REQUEST", ex.getMessage()));
    }

    private static Map<String, Object> body(String kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", kind);
        body.put("message", message);
        return body;
    }
}
