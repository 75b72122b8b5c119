package com.novemberain.quartz.store.db;

/**
 * Failure reported by a {@link Database}. Transient failures (timeouts, lock waits,
 * dropped connections) may succeed when the whole transaction is retried.
 */
public class StoreException extends RuntimeException {

    private final boolean transientFailure;

    public StoreException(String message) {
        this(message, null, false);
    }

    public StoreException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public StoreException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
