package com.appforge.dispatch.api;

import com.appforge.core.breaker.CircuitBreaker;
import com.appforge.core.queue.JobQueue;
import com.appforge.core.queue.PendingJob;
import com.appforge.core.queue.QueueStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoints for the breaker and the job queue.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final CircuitBreaker circuitBreaker;
    private final JobQueue jobQueue;

    public AdminController(CircuitBreaker circuitBreaker, JobQueue jobQueue) {
        this.circuitBreaker = circuitBreaker;
        this.jobQueue = jobQueue;
    }

    @PostMapping("/circuit-breaker/reset")
    public Map<String, String> resetBreaker() {
        log.warn("Circuit breaker {} reset by operator", circuitBreaker.getName());
        circuitBreaker.reset();
        return Map.of("state", circuitBreaker.state().state().name());
    }

    @PostMapping("/queue/sweep")
    public Map<String, Integer> sweep() {
        return Map.of("processed", jobQueue.sweep());
    }

    @GetMapping("/queue/stats")
    public QueueStats queueStats() {
        return jobQueue.stats();
    }

    @GetMapping("/queue/jobs/{id}")
    public ResponseEntity<PendingJob> getJob(@PathVariable String id) {
        return jobQueue.find(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
