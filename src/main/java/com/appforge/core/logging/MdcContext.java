package com.appforge.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys used by the logback pattern to tag log lines with run, stage and job.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String STAGE = "stage";
    public static final String JOB_ID = "jobId";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setStage(String runId, String stage) {
        MDC.put(RUN_ID, runId);
        MDC.put(STAGE, stage);
    }

    public static void setJob(String jobId) {
        MDC.put(JOB_ID, jobId);
    }

    public static void clearStage() {
        MDC.remove(STAGE);
    }

    public static void clearJob() {
        MDC.remove(JOB_ID);
    }

    /** Removes the run and stage keys, leaving any job key in place. */
    public static void clearRun() {
        MDC.remove(RUN_ID);
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(STAGE);
        MDC.remove(JOB_ID);
    }
}
