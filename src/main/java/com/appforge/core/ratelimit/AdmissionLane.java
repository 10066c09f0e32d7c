package com.appforge.core.ratelimit;

/**
 * Who is asking for admission. LIVE callers stop short of the queue reserve;
 * QUEUED callers (the sweep) may use the full window.
 */
public enum AdmissionLane {
    LIVE,
    QUEUED
}
