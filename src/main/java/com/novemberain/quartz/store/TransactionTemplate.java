package com.novemberain.quartz.store;

import com.novemberain.quartz.store.db.Database;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.db.StoreException;
import com.novemberain.quartz.store.lock.Semaphore;
import org.quartz.JobPersistenceException;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs store work in a transaction: obtain the lock, do the work, commit, and
 * always release the lock and close the session. Failures roll back.
 */
public class TransactionTemplate {

    private static final Logger log = LoggerFactory.getLogger(TransactionTemplate.class);

    /**
     * Work done inside a transaction.
     */
    public interface TransactionCallback<T> {
        T execute(Session session) throws JobPersistenceException;
    }

    /**
     * Decides, after a failed commit, whether the work was durable anyway.
     */
    public interface TransactionValidator<T> {
        Boolean validate(Session session, T result) throws JobPersistenceException;
    }

    private final Database database;
    private final Semaphore lockHandler;
    private final TransientErrorClassifier errorClassifier;
    private final SchedulerSignaler signaler;
    private final long dbRetryIntervalMillis;
    private final int retryableActionErrorLogThreshold;
    private final ThreadLocal<Long> sigChangeForTxCompletion = new ThreadLocal<>();
    private volatile boolean shutdown;

    public TransactionTemplate(Database database, Semaphore lockHandler,
                               TransientErrorClassifier errorClassifier, SchedulerSignaler signaler,
                               long dbRetryIntervalMillis, int retryableActionErrorLogThreshold) {
        this.database = database;
        this.lockHandler = lockHandler;
        this.errorClassifier = errorClassifier;
        this.signaler = signaler;
        this.dbRetryIntervalMillis = dbRetryIntervalMillis;
        this.retryableActionErrorLogThreshold = retryableActionErrorLogThreshold;
    }

    public <T> T executeWithoutLock(TransactionCallback<T> txCallback) throws JobPersistenceException {
        return executeInLock(null, txCallback, null);
    }

    public <T> T executeInLock(String lockName, TransactionCallback<T> txCallback)
            throws JobPersistenceException {
        return executeInLock(lockName, txCallback, null);
    }

    /**
     * @param lockName    lock to hold while the work runs, or null for none
     * @param txValidator consulted when commit fails, may be null
     */
    public <T> T executeInLock(String lockName, TransactionCallback<T> txCallback,
                               final TransactionValidator<T> txValidator) throws JobPersistenceException {
        boolean transOwner = false;
        Session session = null;
        try {
            session = openSession();
            if (lockName != null) {
                transOwner = lockHandler.obtainLock(lockHandler.requiresSession() ? session : null, lockName);
            }

            final T result = txCallback.execute(session);
            try {
                commit(session);
            } catch (JobPersistenceException e) {
                rollback(session, e);
                // The rollback released row locks, the semaphore has to follow.
                releaseLock(lockName, transOwner);
                transOwner = false;
                if (txValidator == null || !retryExecuteInLock(lockName, new TransactionCallback<Boolean>() {
                    @Override
                    public Boolean execute(Session validationSession) throws JobPersistenceException {
                        return txValidator.validate(validationSession, result);
                    }
                })) {
                    throw e;
                }
            }

            Long sigTime = sigChangeForTxCompletion.get();
            sigChangeForTxCompletion.remove();
            if (sigTime != null && sigTime >= 0) {
                signaler.signalSchedulingChange(sigTime);
            }
            return result;
        } catch (JobPersistenceException e) {
            sigChangeForTxCompletion.remove();
            rollback(session, e);
            throw e;
        } catch (RuntimeException e) {
            sigChangeForTxCompletion.remove();
            rollback(session, e);
            throw new JobPersistenceException("Unexpected runtime exception: " + e.getMessage(), e);
        } finally {
            try {
                releaseLock(lockName, transOwner);
            } finally {
                closeSession(session);
            }
        }
    }

    /**
     * Repeats the work until it succeeds or the store shuts down.
     *
     * @throws IllegalStateException when the store shut down before the work succeeded
     */
    public <T> T retryExecuteInLock(String lockName, TransactionCallback<T> txCallback) {
        for (int retry = 1; !shutdown; retry++) {
            try {
                return executeInLock(lockName, txCallback, null);
            } catch (JobPersistenceException jpe) {
                if (retry % retryableActionErrorLogThreshold == 0) {
                    signaler.notifySchedulerListenersError("An error occurred while " + txCallback, jpe);
                }
            } catch (RuntimeException e) {
                log.error("retryExecuteInLock: RuntimeException " + e.getMessage(), e);
            }
            try {
                Thread.sleep(dbRetryIntervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Received interrupted exception", e);
            }
        }
        throw new IllegalStateException("JobStore is shutdown - aborting retry");
    }

    /**
     * Signals a scheduling change once the current transaction commits.
     * Keeps the earliest of the requested times.
     *
     * @param candidateNewNextFireTime new next fire time, or 0 when unknown
     */
    public void signalSchedulingChangeOnTxCompletion(long candidateNewNextFireTime) {
        Long sigTime = sigChangeForTxCompletion.get();
        if (sigTime == null && candidateNewNextFireTime >= 0L) {
            sigChangeForTxCompletion.set(candidateNewNextFireTime);
        } else if (sigTime == null || candidateNewNextFireTime < sigTime) {
            sigChangeForTxCompletion.set(candidateNewNextFireTime);
        }
    }

    public void shutdown() {
        shutdown = true;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private Session openSession() throws JobPersistenceException {
        try {
            return database.openSession();
        } catch (StoreException e) {
            throw new JobPersistenceException("Failed to obtain session: " + e.getMessage(), e);
        }
    }

    private void commit(Session session) throws JobPersistenceException {
        try {
            session.commit();
        } catch (StoreException e) {
            throw new JobPersistenceException("Couldn't commit transaction: " + e.getMessage(), e);
        }
    }

    private void rollback(Session session, Exception cause) {
        if (session == null) {
            return;
        }
        try {
            session.rollback();
        } catch (StoreException e) {
            if (errorClassifier.isTransient(cause)) {
                log.debug("Couldn't rollback transaction after transient failure", e);
            } else {
                log.error("Couldn't rollback transaction", e);
            }
        }
    }

    private void releaseLock(String lockName, boolean doIt) {
        if (doIt && lockName != null) {
            try {
                lockHandler.releaseLock(lockName);
            } catch (RuntimeException e) {
                log.error("Error returning lock: " + e.getMessage(), e);
            }
        }
    }

    private void closeSession(Session session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (StoreException e) {
            log.error("Failed to close session", e);
        }
    }
}
