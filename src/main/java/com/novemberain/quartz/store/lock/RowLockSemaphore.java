package com.novemberain.quartz.store.lock;

import com.novemberain.quartz.store.dao.LocksDao;
import com.novemberain.quartz.store.db.DuplicateKeyException;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.db.StoreException;
import org.quartz.impl.jdbcjobstore.LockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Semaphore locking one row per lock name, so that it is shared by every
 * scheduler instance using the database. The row lock, and with it the
 * named lock, lasts until the session's transaction commits or rolls back.
 */
public class RowLockSemaphore implements Semaphore {

    private static final Logger log = LoggerFactory.getLogger(RowLockSemaphore.class);

    private final ThreadLocal<Set<String>> lockOwners = ThreadLocal.withInitial(HashSet::new);
    private final LocksDao locksDao;
    private final int maxRetry;
    private final long retryPeriodMillis;

    public RowLockSemaphore(LocksDao locksDao, int maxRetry, long retryPeriodMillis) {
        this.locksDao = locksDao;
        this.maxRetry = maxRetry;
        this.retryPeriodMillis = retryPeriodMillis;
    }

    @Override
    public boolean obtainLock(Session session, String lockName) throws LockException {
        if (session == null) {
            throw new LockException("Lock '" + lockName + "' needs a session");
        }
        if (lockOwners.get().contains(lockName)) {
            log.debug("Lock '{}' already owned by {}", lockName, Thread.currentThread().getName());
            return false;
        }
        log.debug("Lock '{}' is being obtained: {}", lockName, Thread.currentThread().getName());
        executeLockRow(session, lockName);
        log.debug("Lock '{}' given to {}", lockName, Thread.currentThread().getName());
        lockOwners.get().add(lockName);
        return true;
    }

    private void executeLockRow(Session session, String lockName) throws LockException {
        StoreException lastFailure = null;
        for (int attempt = 0; attempt < maxRetry; attempt++) {
            try {
                if (locksDao.selectForUpdate(session, lockName)) {
                    return;
                }
                log.debug("Inserting new lock row for lock '{}'", lockName);
                locksDao.insertLock(session, lockName);
                return;
            } catch (DuplicateKeyException e) {
                log.debug("Lock row for '{}' was inserted concurrently, retrying", lockName);
                lastFailure = e;
            } catch (StoreException e) {
                lastFailure = e;
                log.debug("Lock '{}' was not obtained by {}, attempt {}: {}", lockName,
                        Thread.currentThread().getName(), attempt + 1, e.getMessage());
                pauseBeforeRetry(lockName);
            }
        }
        throw new LockException("Failure obtaining db row lock '" + lockName + "': "
                + (lastFailure == null ? "retries exhausted" : lastFailure.getMessage()), lastFailure);
    }

    private void pauseBeforeRetry(String lockName) throws LockException {
        try {
            Thread.sleep(retryPeriodMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockException("Interrupted while retrying lock '" + lockName + "'", e);
        }
    }

    /**
     * Forgets the named lock. The row itself is released when the transaction ends.
     */
    @Override
    public void releaseLock(String lockName) {
        if (!lockOwners.get().remove(lockName)) {
            log.warn("Lock '{}' attempt to return by {} who is not owner", lockName,
                    Thread.currentThread().getName());
            return;
        }
        log.debug("Lock '{}' returned by {}", lockName, Thread.currentThread().getName());
    }

    @Override
    public boolean requiresSession() {
        return true;
    }
}
