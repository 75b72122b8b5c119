package com.novemberain.quartz.store.db;

/**
 * Thrown when a row lock could not be obtained, either in time or because
 * another transaction holds it.
 */
public class LockTimeoutException extends StoreException {

    public LockTimeoutException(String message) {
        super(message, null, true);
    }

    public LockTimeoutException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
