package com.appforge.sandbox;

/**
 * Session status. Transitions only move forward:
 * PROVISIONING to RUNNING or FAILED, RUNNING to STOPPED or FAILED.
 */
public enum SandboxStatus {
    PROVISIONING,
    RUNNING,
    STOPPED,
    FAILED;

    public boolean isActive() {
        return this == PROVISIONING || this == RUNNING;
    }

    public boolean canTransitionTo(SandboxStatus next) {
        return switch (this) {
            case PROVISIONING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == STOPPED || next == FAILED;
            case STOPPED, FAILED -> false;
        };
    }
}
