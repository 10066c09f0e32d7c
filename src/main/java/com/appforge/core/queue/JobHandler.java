package com.appforge.core.queue;

/**
 * Executes one kind of deferred job during a sweep.
 * <p>
 * Implementations request admission with the QUEUED lane. Throwing an
 * {@link com.appforge.core.admission.AdmissionDeniedException} returns the job to
 * PENDING without spending an attempt; any other exception counts as a failed attempt.
 */
public interface JobHandler {

    /** Matches {@link PendingJob#action()}. */
    String action();

    void handle(PendingJob job);
}
