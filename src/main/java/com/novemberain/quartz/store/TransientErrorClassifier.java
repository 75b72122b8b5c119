package com.novemberain.quartz.store;

/**
 * Decides whether a failure is worth retrying later rather than reporting.
 */
public interface TransientErrorClassifier {

    boolean isTransient(Throwable error);
}
