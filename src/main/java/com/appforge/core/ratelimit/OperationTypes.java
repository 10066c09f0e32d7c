package com.appforge.core.ratelimit;

/**
 * Operation types with independent rate-limit windows.
 */
public final class OperationTypes {

    /** Creating a sandbox; scarce upstream. */
    public static final String SANDBOX_CREATE = "sandbox_create";

    /** Any command or file write inside an existing sandbox. */
    public static final String SANDBOX_COMMAND = "sandbox_command";

    private OperationTypes() {}
}
