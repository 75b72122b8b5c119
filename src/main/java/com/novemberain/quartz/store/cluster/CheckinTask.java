package com.novemberain.quartz.store.cluster;

import com.novemberain.quartz.store.dao.SchedulerDao;
import com.novemberain.quartz.store.db.Database;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.db.StoreException;
import com.novemberain.quartz.store.lock.Semaphore;
import com.novemberain.quartz.store.util.Clock;
import org.quartz.JobPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.novemberain.quartz.store.Constants.LOCK_STATE_ACCESS;
import static com.novemberain.quartz.store.Constants.LOCK_TRIGGER_ACCESS;

/**
 * The responsibility of this class is to check-in inside Scheduler Cluster,
 * and to recover the instances that stopped checking in.
 */
public class CheckinTask {

    private static final Logger log = LoggerFactory.getLogger(CheckinTask.class);

    private final Database database;
    private final Semaphore lockHandler;
    private final SchedulerDao schedulerDao;
    private final Recoverer recoverer;
    private final TriggerRecoverer triggerRecoverer;
    private final Clock clock;

    private volatile boolean firstCheckIn = true;
    private volatile long lastCheckin;

    public CheckinTask(Database database, Semaphore lockHandler, SchedulerDao schedulerDao,
                       Recoverer recoverer, TriggerRecoverer triggerRecoverer, Clock clock) {
        this.database = database;
        this.lockHandler = lockHandler;
        this.schedulerDao = schedulerDao;
        this.recoverer = recoverer;
        this.triggerRecoverer = triggerRecoverer;
        this.clock = clock;
        this.lastCheckin = clock.millis();
    }

    /**
     * @return time of the last successful check-in
     */
    public long getLastCheckin() {
        return lastCheckin;
    }

    public boolean isFirstCheckIn() {
        return firstCheckIn;
    }

    /**
     * Checks in and recovers failed instances.
     *
     * @return if any instance was recovered
     */
    public boolean doCheckin() throws JobPersistenceException {
        log.debug("Node {}:{} checks-in.", schedulerDao.schedulerName, schedulerDao.instanceId);
        boolean transOwner = false;
        boolean transStateOwner = false;
        boolean recovered = false;

        Session session = openSession();
        try {
            List<Scheduler> failedRecords = null;
            if (!firstCheckIn) {
                failedRecords = clusterCheckIn(session);
                session.commit();
            }

            if (firstCheckIn || !failedRecords.isEmpty()) {
                transStateOwner = lockHandler.obtainLock(sessionFor(session), LOCK_STATE_ACCESS);

                // Now that we own the lock, make sure we still have work to do.
                failedRecords = firstCheckIn ? firstClusterCheckIn(session) : findFailedInstances(session);

                if (!failedRecords.isEmpty()) {
                    transOwner = lockHandler.obtainLock(sessionFor(session), LOCK_TRIGGER_ACCESS);
                    recovered = clusterRecover(session, failedRecords);
                }
            }
            session.commit();
        } catch (JobPersistenceException e) {
            rollback(session);
            throw e;
        } catch (StoreException e) {
            rollback(session);
            throw new JobPersistenceException("Failure checking in: " + e.getMessage(), e);
        } finally {
            try {
                releaseLock(LOCK_TRIGGER_ACCESS, transOwner);
            } finally {
                try {
                    releaseLock(LOCK_STATE_ACCESS, transStateOwner);
                } finally {
                    session.close();
                }
            }
        }

        firstCheckIn = false;
        return recovered;
    }

    private List<Scheduler> clusterCheckIn(Session session) {
        List<Scheduler> failedInstances = findFailedInstances(session);
        long now = clock.millis();
        if (schedulerDao.checkIn(session, now) == 0) {
            log.warn("Check-in record of {} is missing, inserting it again", schedulerDao.instanceId);
            schedulerDao.insertSelf(session, now);
        }
        lastCheckin = now;
        return failedInstances;
    }

    /**
     * Replaces the record left by a previous run of this instance, reporting
     * that run as failed so its fired triggers get recovered.
     */
    private List<Scheduler> firstClusterCheckIn(Session session) {
        List<Scheduler> failedInstances = findFailedInstances(session);
        long now = clock.millis();
        schedulerDao.remove(session, schedulerDao.instanceId);
        schedulerDao.insertSelf(session, now);
        lastCheckin = now;
        return failedInstances;
    }

    private List<Scheduler> findFailedInstances(Session session) {
        return recoverer.findFailedInstances(session, clock.millis(), lastCheckin, firstCheckIn);
    }

    private boolean clusterRecover(Session session, List<Scheduler> failedInstances)
            throws JobPersistenceException {
        log.info("ClusterManager: detected {} failed or restarted instances.", failedInstances.size());
        boolean recovered = false;
        for (Scheduler failed : failedInstances) {
            recovered |= triggerRecoverer.recoverInstance(session, failed);
        }
        return recovered;
    }

    private Session openSession() throws JobPersistenceException {
        try {
            return database.openSession();
        } catch (StoreException e) {
            throw new JobPersistenceException("Failed to obtain session: " + e.getMessage(), e);
        }
    }

    private Session sessionFor(Session session) {
        return lockHandler.requiresSession() ? session : null;
    }

    private void rollback(Session session) {
        try {
            session.rollback();
        } catch (StoreException e) {
            log.error("Couldn't rollback check-in transaction", e);
        }
    }

    private void releaseLock(String lockName, boolean doIt) {
        if (doIt) {
            try {
                lockHandler.releaseLock(lockName);
            } catch (RuntimeException e) {
                log.error("Error returning lock: " + e.getMessage(), e);
            }
        }
    }
}
