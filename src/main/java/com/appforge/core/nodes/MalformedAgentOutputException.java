package com.appforge.core.nodes;

/**
 * Thrown when an agent stage keeps producing output that cannot be used, after
 * its attempt budget is spent.
 */
public class MalformedAgentOutputException extends RuntimeException {

    private final String stage;
    private final int attempts;

    public MalformedAgentOutputException(String stage, int attempts, String lastError) {
        super(stage + " produced no usable output after " + attempts + " attempt(s): " + lastError);
        this.stage = stage;
        this.attempts = attempts;
    }

    public String getStage() {
        return stage;
    }

    public int getAttempts() {
        return attempts;
    }
}
