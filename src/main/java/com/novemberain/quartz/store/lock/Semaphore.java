package com.novemberain.quartz.store.lock;

import com.novemberain.quartz.store.db.Session;
import org.quartz.impl.jdbcjobstore.LockException;

/**
 * Named locks serializing store operations across threads, and across
 * scheduler instances for implementations that lock in the database.
 */
public interface Semaphore {

    /**
     * Grants the named lock to the calling thread, blocking until it is available.
     *
     * @param session transaction the lock is bound to, may be null when
     *                {@link #requiresSession()} is false
     * @return false if the thread already owned the lock, true otherwise
     * @throws LockException when the lock could not be obtained
     */
    boolean obtainLock(Session session, String lockName) throws LockException;

    /**
     * Releases the named lock. Releasing a lock the thread does not own is a no-op.
     */
    void releaseLock(String lockName);

    /**
     * @return if locks are bound to a transaction that has to be open while they are held
     */
    boolean requiresSession();
}
