package com.novemberain.quartz.store.lock;

import com.novemberain.quartz.store.db.Session;
import org.quartz.impl.jdbcjobstore.LockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * In-process semaphore for stores that are not clustered.
 */
public class SimpleSemaphore implements Semaphore {

    private static final Logger log = LoggerFactory.getLogger(SimpleSemaphore.class);

    private final ThreadLocal<Set<String>> lockOwners = ThreadLocal.withInitial(HashSet::new);
    private final Set<String> locks = new HashSet<>();

    @Override
    public synchronized boolean obtainLock(Session session, String lockName) throws LockException {
        if (isLockOwner(lockName)) {
            log.debug("Lock '{}' already owned by {}", lockName, Thread.currentThread().getName());
            return false;
        }
        log.debug("Lock '{}' is desired by {}", lockName, Thread.currentThread().getName());
        try {
            while (locks.contains(lockName)) {
                wait();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockException("Interrupted while waiting for lock '" + lockName + "'", e);
        }
        log.debug("Lock '{}' given to {}", lockName, Thread.currentThread().getName());
        lockOwners.get().add(lockName);
        locks.add(lockName);
        return true;
    }

    @Override
    public synchronized void releaseLock(String lockName) {
        if (!isLockOwner(lockName)) {
            log.warn("Lock '{}' attempt to return by {} who is not owner", lockName,
                    Thread.currentThread().getName());
            return;
        }
        log.debug("Lock '{}' returned by {}", lockName, Thread.currentThread().getName());
        lockOwners.get().remove(lockName);
        locks.remove(lockName);
        notifyAll();
    }

    @Override
    public boolean requiresSession() {
        return false;
    }

    private boolean isLockOwner(String lockName) {
        return lockOwners.get().contains(lockName);
    }
}
