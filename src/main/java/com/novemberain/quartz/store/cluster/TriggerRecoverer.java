package com.novemberain.quartz.store.cluster;

import com.novemberain.quartz.store.JobDataConverter;
import com.novemberain.quartz.store.TriggerAndJobPersister;
import com.novemberain.quartz.store.dao.FiredTriggerDao;
import com.novemberain.quartz.store.dao.JobDao;
import com.novemberain.quartz.store.dao.SchedulerDao;
import com.novemberain.quartz.store.dao.TriggerDao;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.trigger.FiredTriggerRecord;
import com.novemberain.quartz.store.trigger.MisfireHandler;
import org.bson.Document;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.novemberain.quartz.store.Constants.*;

/**
 * Brings triggers left behind by a stopped scheduler back into a consistent state:
 * releases acquired and blocked triggers, schedules recovery of interrupted jobs
 * that request it and drops completed triggers nobody executes anymore.
 */
public class TriggerRecoverer {

    private static final Logger log = LoggerFactory.getLogger(TriggerRecoverer.class);

    private final TriggerAndJobPersister persister;
    private final TriggerDao triggerDao;
    private final JobDao jobDao;
    private final FiredTriggerDao firedTriggerDao;
    private final SchedulerDao schedulerDao;
    private final MisfireHandler misfireHandler;
    private final JobDataConverter jobDataConverter;
    private final RecoveryTriggerFactory recoveryTriggerFactory;

    public TriggerRecoverer(TriggerAndJobPersister persister, TriggerDao triggerDao, JobDao jobDao,
                            FiredTriggerDao firedTriggerDao, SchedulerDao schedulerDao,
                            MisfireHandler misfireHandler, JobDataConverter jobDataConverter,
                            RecoveryTriggerFactory recoveryTriggerFactory) {
        this.persister = persister;
        this.triggerDao = triggerDao;
        this.jobDao = jobDao;
        this.firedTriggerDao = firedTriggerDao;
        this.schedulerDao = schedulerDao;
        this.misfireHandler = misfireHandler;
        this.jobDataConverter = jobDataConverter;
        this.recoveryTriggerFactory = recoveryTriggerFactory;
    }

    /**
     * Recovers the work of a failed cluster member.
     *
     * @return false when another instance is already recovering it
     */
    public boolean recoverInstance(Session session, Scheduler failed) throws JobPersistenceException {
        String failedId = failed.getInstanceId();
        boolean claimable = schedulerDao.isNotSelf(failed) && schedulerDao.findInstance(session, failedId) != null;
        if (claimable && !schedulerDao.claim(session, failedId)) {
            log.info("Scheduler {} is already being recovered by another instance", failedId);
            return false;
        }

        log.info("ClusterManager: Scanning for instance \"{}\"'s failed in-progress jobs.", failedId);

        int acquiredCount = 0;
        int recoveredCount = 0;
        int otherCount = 0;
        Set<TriggerKey> triggerKeys = new HashSet<>();

        for (FiredTriggerRecord ftRec : firedTriggerDao.findByInstance(session, failedId)) {
            TriggerKey tKey = ftRec.getTriggerKey();
            JobKey jKey = ftRec.getJobKey();
            triggerKeys.add(tKey);

            if (STATE_BLOCKED.equals(ftRec.getState()) && jKey != null) {
                triggerDao.transferStateForJob(session, jKey, STATE_WAITING, STATE_BLOCKED);
            } else if (STATE_PAUSED_BLOCKED.equals(ftRec.getState()) && jKey != null) {
                triggerDao.transferStateForJob(session, jKey, STATE_PAUSED, STATE_PAUSED_BLOCKED);
            }

            if (STATE_ACQUIRED.equals(ftRec.getState())) {
                triggerDao.transferState(session, tKey, STATE_WAITING, STATE_ACQUIRED);
                acquiredCount++;
            } else if (ftRec.isJobRequestsRecovery()) {
                if (jKey != null && jobDao.exists(session, jKey)) {
                    storeRecoveryTrigger(session,
                            recoveryTriggerFactory.from(ftRec, originalDataOf(session, ftRec)));
                    recoveredCount++;
                } else {
                    log.warn("ClusterManager: failed job '{}' no longer exists, cannot schedule recovery.", jKey);
                    otherCount++;
                }
            } else {
                otherCount++;
            }

            if (ftRec.isJobDisallowsConcurrentExecution() && jKey != null) {
                triggerDao.transferStateForJob(session, jKey, STATE_WAITING, STATE_BLOCKED);
                triggerDao.transferStateForJob(session, jKey, STATE_PAUSED, STATE_PAUSED_BLOCKED);
            }
        }

        firedTriggerDao.removeByInstance(session, failedId);

        // Fired records just deleted may have been the last ones of a COMPLETE trigger.
        int completeCount = 0;
        for (TriggerKey triggerKey : triggerKeys) {
            if (STATE_COMPLETE.equals(triggerDao.getState(session, triggerKey))
                    && !firedTriggerDao.existsForTrigger(session, triggerKey)
                    && persister.removeTrigger(session, triggerKey)) {
                completeCount++;
            }
        }

        logWarnIfNonZero(acquiredCount, "ClusterManager: ......Freed " + acquiredCount + " acquired trigger(s).");
        logWarnIfNonZero(completeCount, "ClusterManager: ......Deleted " + completeCount + " complete triggers(s).");
        logWarnIfNonZero(recoveredCount, "ClusterManager: ......Scheduled " + recoveredCount
                + " recoverable job(s) for recovery.");
        logWarnIfNonZero(otherCount, "ClusterManager: ......Cleaned-up " + otherCount + " other failed job(s).");

        if (schedulerDao.isNotSelf(failed)) {
            schedulerDao.remove(session, failedId);
        }
        return true;
    }

    /**
     * Recovers the state left by this scheduler's previous run when it does not
     * share the store with other instances.
     */
    public void recoverJobs(Session session) throws JobPersistenceException {
        // update inconsistent job states
        long rows = triggerDao.transferStateInAll(session, STATE_WAITING, STATE_ACQUIRED, STATE_BLOCKED);
        rows += triggerDao.transferStateInAll(session, STATE_PAUSED, STATE_PAUSED_BLOCKED);
        log.info("Freed {} triggers from 'acquired' / 'blocked' state.", rows);

        misfireHandler.recoverMisfiredJobs(session, true);

        List<FiredTriggerRecord> firedRecords = firedTriggerDao.findAll(session);
        int recovering = 0;
        for (FiredTriggerRecord ftRec : firedRecords) {
            if (ftRec.isJobRequestsRecovery() && STATE_EXECUTING.equals(ftRec.getState())
                    && ftRec.getJobKey() != null && jobDao.exists(session, ftRec.getJobKey())) {
                storeRecoveryTrigger(session,
                        recoveryTriggerFactory.fromPreviousRun(ftRec, originalDataOf(session, ftRec)));
                recovering++;
            }
        }
        log.info("Recovering {} jobs that were in-progress at the time of the last shut-down.", recovering);
        log.info("Recovery complete.");

        List<TriggerKey> completeTriggers = triggerDao.getTriggerKeysInState(session, STATE_COMPLETE);
        for (TriggerKey completeTrigger : completeTriggers) {
            persister.removeTrigger(session, completeTrigger);
        }
        log.info("Removed {} 'complete' triggers.", completeTriggers.size());

        long n = firedTriggerDao.removeAll(session);
        log.info("Removed {} stale fired job entries.", n);
    }

    private JobDataMap originalDataOf(Session session, FiredTriggerRecord ftRec) throws JobPersistenceException {
        JobDataMap originalData = new JobDataMap();
        Document original = triggerDao.findTrigger(session, ftRec.getTriggerKey());
        if (original != null) {
            jobDataConverter.toJobData(original, originalData);
        }
        return originalData;
    }

    private void storeRecoveryTrigger(Session session, OperableTrigger recoveryTrigger)
            throws JobPersistenceException {
        log.info("Scheduling recovery of job {} with trigger {}", recoveryTrigger.getJobKey(), recoveryTrigger.getKey());
        persister.storeTrigger(session, recoveryTrigger, null, false, STATE_WAITING, false, true);
    }

    private void logWarnIfNonZero(int val, String warning) {
        if (val > 0) {
            log.info(warning);
        } else {
            log.debug(warning);
        }
    }
}
