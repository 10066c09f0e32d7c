package com.appforge.core.store;

/**
 * Unchecked wrapper for database errors raised by the JDBC stores.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
