package com.novemberain.quartz.store;

import com.novemberain.quartz.store.db.LockTimeoutException;
import com.novemberain.quartz.store.db.StoreException;
import org.quartz.impl.jdbcjobstore.LockException;

import java.util.concurrent.TimeoutException;

/**
 * Treats transient store failures, lock timeouts and lock failures found
 * anywhere in the cause chain as transient.
 */
public class DefaultTransientErrorClassifier implements TransientErrorClassifier {

    @Override
    public boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof StoreException && ((StoreException) t).isTransient()) {
                return true;
            }
            if (t instanceof LockTimeoutException || t instanceof LockException
                    || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }
}
