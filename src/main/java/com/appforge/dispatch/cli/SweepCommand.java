package com.appforge.dispatch.cli;

import com.appforge.core.queue.JobQueue;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: appforge sweep
 * <p>
 * Runs one queue sweep, for deployments that drive sweeps from an external scheduler.
 */
@Command(name = "sweep", mixinStandardHelpOptions = true, description = "Process due pending jobs once")
@Component
public class SweepCommand implements Runnable {

    private final JobQueue jobQueue;

    public SweepCommand(JobQueue jobQueue) {
        this.jobQueue = jobQueue;
    }

    @Override
    public void run() {
        int processed = jobQueue.sweep();
        int cleaned = jobQueue.cleanup();
        ConsoleOutput.info("Processed " + processed + " job(s), removed " + cleaned + " finished job(s)");
        ConsoleOutput.info("Queue: " + jobQueue.stats().depthByStatus());
    }
}
