package com.appforge.core.queue;

import java.time.Duration;
import java.util.Map;

/**
 * @param depthByStatus    job count for every {@link JobStatus}
 * @param oldestPendingAge age of the oldest PENDING job, null when none is pending
 */
public record QueueStats(
    Map<JobStatus, Long> depthByStatus,
    Duration oldestPendingAge
) {}
