package com.appforge.sandbox;

/**
 * Upstream sandbox failure. {@code permanent} errors (auth, quota, unknown image)
 * are not worth retrying; everything else may succeed on a later attempt.
 */
public class SandboxException extends RuntimeException {

    private final boolean permanent;

    public SandboxException(String message, boolean permanent) {
        super(message);
        this.permanent = permanent;
    }

    public SandboxException(String message, Throwable cause, boolean permanent) {
        super(message, cause);
        this.permanent = permanent;
    }

    public boolean isPermanent() {
        return permanent;
    }
}
