package com.novemberain.quartz.store.db;

/**
 * Thrown when a write would violate a unique index.
 */
public class DuplicateKeyException extends StoreException {

    public DuplicateKeyException(String message) {
        super(message);
    }
}
