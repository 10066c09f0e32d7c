package com.appforge.core.queue;

import com.appforge.core.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Timer that drives the queue: sweeps every two minutes by default, cleans up
 * finished jobs and purges stale rate-limit windows hourly.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "appforge.queue.scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class JobSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobSweepScheduler.class);

    private final JobQueue jobQueue;
    private final RateLimiter rateLimiter;

    public JobSweepScheduler(JobQueue jobQueue, RateLimiter rateLimiter) {
        this.jobQueue = jobQueue;
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${appforge.queue.sweep-interval:PT2M}",
            initialDelayString = "${appforge.queue.sweep-interval:PT2M}")
    public void sweep() {
        try {
            jobQueue.sweep();
        } catch (RuntimeException e) {
            log.error("Queue sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "PT1H", initialDelayString = "PT5M")
    public void housekeeping() {
        try {
            jobQueue.cleanup();
            rateLimiter.purgeExpired();
        } catch (RuntimeException e) {
            log.error("Queue housekeeping failed: {}", e.getMessage(), e);
        }
    }
}
