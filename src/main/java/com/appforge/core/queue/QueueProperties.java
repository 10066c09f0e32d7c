package com.appforge.core.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "appforge.queue")
public class QueueProperties {

    private int maxAttempts = 3;
    private Duration sweepInterval = Duration.ofMinutes(2);

    /** PROCESSING claims older than this belong to a dead sweeper and are requeued. */
    private Duration processingLease = Duration.ofMinutes(10);

    private Duration retention = Duration.ofDays(7);
    private int cleanupBatchSize = 100;
    private boolean schedulingEnabled = true;

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public Duration getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    public Duration getProcessingLease() { return processingLease; }
    public void setProcessingLease(Duration processingLease) { this.processingLease = processingLease; }
    public Duration getRetention() { return retention; }
    public void setRetention(Duration retention) { this.retention = retention; }
    public int getCleanupBatchSize() { return cleanupBatchSize; }
    public void setCleanupBatchSize(int cleanupBatchSize) { this.cleanupBatchSize = cleanupBatchSize; }
    public boolean isSchedulingEnabled() { return schedulingEnabled; }
    public void setSchedulingEnabled(boolean schedulingEnabled) { this.schedulingEnabled = schedulingEnabled; }
}
