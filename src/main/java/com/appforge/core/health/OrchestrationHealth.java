package com.appforge.core.health;

import com.appforge.core.breaker.CircuitState;
import com.appforge.core.queue.JobStatus;
import com.appforge.core.ratelimit.RateLimitUsage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operational snapshot of the admission layer and the backlog.
 *
 * @param breakerState              current circuit state
 * @param consecutiveFailures       failures since the last success
 * @param nextProbeAt               earliest probe time while OPEN, else null
 * @param rateLimitUsageByOperation current window usage per operation type
 * @param queueDepthByStatus        job counts per status
 * @param oldestPendingAge          age of the oldest pending job, null when none
 */
public record OrchestrationHealth(
    CircuitState breakerState,
    int consecutiveFailures,
    Instant nextProbeAt,
    List<RateLimitUsage> rateLimitUsageByOperation,
    Map<JobStatus, Long> queueDepthByStatus,
    Duration oldestPendingAge
) {}
