package com.appforge.sandbox;

public class SandboxOwnershipConflictException extends RuntimeException {

    public SandboxOwnershipConflictException(String message) {
        super(message);
    }
}
