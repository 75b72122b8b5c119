package com.novemberain.quartz.store;

import com.novemberain.quartz.store.dao.FiredTriggerDao;
import com.novemberain.quartz.store.dao.JobDao;
import com.novemberain.quartz.store.dao.TriggerDao;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.db.StoreException;
import com.novemberain.quartz.store.trigger.FiredTriggerRecord;
import com.novemberain.quartz.store.trigger.MisfireHandler;
import com.novemberain.quartz.store.util.Clock;
import com.novemberain.quartz.store.util.Keys;
import org.bson.Document;
import org.quartz.Calendar;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.Scheduler;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.TriggerFiredBundle;
import org.quartz.spi.TriggerFiredResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static com.novemberain.quartz.store.Constants.*;

/**
 * Acquires triggers for firing, fires them and releases the ones that could not fire.
 */
public class TriggerRunner {

    private static final Logger log = LoggerFactory.getLogger(TriggerRunner.class);

    private static final int MAX_DO_LOOP_RETRY = 3;

    private final TriggerAndJobPersister persister;
    private final TriggerDao triggerDao;
    private final JobDao jobDao;
    private final FiredTriggerDao firedTriggerDao;
    private final CalendarManager calendarManager;
    private final MisfireHandler misfireHandler;
    private final Clock clock;
    private final String instanceId;
    private final AtomicLong firedTriggerCounter;

    public TriggerRunner(TriggerAndJobPersister persister, TriggerDao triggerDao, JobDao jobDao,
                         FiredTriggerDao firedTriggerDao, CalendarManager calendarManager,
                         MisfireHandler misfireHandler, Clock clock, String instanceId) {
        this.persister = persister;
        this.triggerDao = triggerDao;
        this.jobDao = jobDao;
        this.firedTriggerDao = firedTriggerDao;
        this.calendarManager = calendarManager;
        this.misfireHandler = misfireHandler;
        this.clock = clock;
        this.instanceId = instanceId;
        this.firedTriggerCounter = new AtomicLong(clock.millis());
    }

    /**
     * Moves up to {@code maxCount} due waiting triggers to the acquired state and
     * records their firing. Overdue triggers are classified as misfired first, and
     * left to the misfire handling.
     */
    public List<OperableTrigger> acquireNextTriggers(Session session, long noLaterThan, int maxCount,
                                                     long timeWindow) throws JobPersistenceException {
        if (timeWindow < 0) {
            throw new IllegalArgumentException("timeWindow must not be negative: " + timeWindow);
        }

        List<OperableTrigger> acquiredTriggers = new ArrayList<>();
        Set<JobKey> acquiredJobKeysForNoConcurrentExec = new HashSet<>();
        int currentLoopCount = 0;
        try {
            do {
                currentLoopCount++;
                misfireHandler.reclassifyMisfired(session);

                List<Document> candidates =
                        triggerDao.findEligibleToRun(session, new Date(noLaterThan + timeWindow), maxCount);
                if (candidates.isEmpty()) {
                    return acquiredTriggers;
                }

                long batchEnd = noLaterThan;
                for (Document candidate : candidates) {
                    TriggerKey triggerKey = Keys.toTriggerKey(candidate);
                    OperableTrigger nextTrigger;
                    try {
                        nextTrigger = triggerDao.toTrigger(candidate);
                    } catch (JobPersistenceException e) {
                        log.error("Error retrieving trigger " + triggerKey + ", setting trigger state to ERROR.", e);
                        triggerDao.setState(session, triggerKey, STATE_ERROR);
                        continue;
                    }

                    JobKey jobKey = nextTrigger.getJobKey();
                    JobDetail job;
                    try {
                        job = jobDao.retrieveJob(session, jobKey);
                    } catch (JobPersistenceException e) {
                        log.error("Error retrieving job " + jobKey + ", setting trigger state to ERROR.", e);
                        triggerDao.setState(session, triggerKey, STATE_ERROR);
                        continue;
                    }
                    if (job == null) {
                        log.error("Job {} of trigger {} does not exist, setting trigger state to ERROR.",
                                jobKey, triggerKey);
                        triggerDao.setState(session, triggerKey, STATE_ERROR);
                        continue;
                    }

                    if (job.isConcurrentExectionDisallowed()) {
                        if (!acquiredJobKeysForNoConcurrentExec.add(jobKey)) {
                            continue;
                        }
                    }

                    Date nextFireTime = nextTrigger.getNextFireTime();
                    if (nextFireTime == null) {
                        log.warn("Trigger {} returned null on nextFireTime and yet still exists in the store!",
                                triggerKey);
                        continue;
                    }
                    if (nextFireTime.getTime() > batchEnd) {
                        break;
                    }

                    // Another instance or thread may have acquired it in the meantime.
                    if (!triggerDao.transferState(session, triggerKey, STATE_ACQUIRED, STATE_WAITING)) {
                        continue;
                    }
                    nextTrigger.setFireInstanceId(nextFiredTriggerRecordId());
                    firedTriggerDao.insert(session, instanceId, nextTrigger, STATE_ACQUIRED, job, clock.now());

                    if (acquiredTriggers.isEmpty()) {
                        batchEnd = Math.max(nextFireTime.getTime(), clock.millis()) + timeWindow;
                    }
                    log.debug("Acquired trigger {}", triggerKey);
                    acquiredTriggers.add(nextTrigger);
                }
            } while (acquiredTriggers.isEmpty() && currentLoopCount < MAX_DO_LOOP_RETRY);
        } catch (StoreException e) {
            throw new JobPersistenceException("Couldn't acquire next trigger: " + e.getMessage(), e);
        }
        return acquiredTriggers;
    }

    /**
     * Checks whether any of the acquired triggers is recorded for this instance.
     * Used after a failed commit to learn whether the acquisition went through.
     */
    public boolean isAnyRecorded(Session session, List<OperableTrigger> acquired) {
        Set<String> fireInstanceIds = new HashSet<>();
        for (FiredTriggerRecord ft : firedTriggerDao.findByInstance(session, instanceId)) {
            fireInstanceIds.add(ft.getFireInstanceId());
        }
        for (OperableTrigger tr : acquired) {
            if (fireInstanceIds.contains(tr.getFireInstanceId())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fires every trigger, collecting a result or a failure for each.
     */
    public List<TriggerFiredResult> triggersFired(Session session, List<OperableTrigger> triggers) {
        List<TriggerFiredResult> results = new ArrayList<>(triggers.size());
        for (OperableTrigger trigger : triggers) {
            TriggerFiredResult result;
            try {
                result = new TriggerFiredResult(triggerFired(session, trigger));
            } catch (JobPersistenceException jpe) {
                result = new TriggerFiredResult(jpe);
            } catch (RuntimeException re) {
                result = new TriggerFiredResult(re);
            }
            results.add(result);
        }
        return results;
    }

    /**
     * Checks that every fired bundle is recorded as executing by this instance.
     * Used after a failed commit to learn whether firing went through.
     */
    public boolean areAllExecuting(Session session, List<TriggerFiredResult> results) {
        Set<String> executingTriggers = new HashSet<>();
        for (FiredTriggerRecord ft : firedTriggerDao.findByInstance(session, instanceId)) {
            if (STATE_EXECUTING.equals(ft.getState())) {
                executingTriggers.add(ft.getFireInstanceId());
            }
        }
        for (TriggerFiredResult tr : results) {
            if (tr.getTriggerFiredBundle() != null) {
                String ftId = tr.getTriggerFiredBundle().getTrigger().getFireInstanceId();
                if (!executingTriggers.contains(ftId)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return bundle to execute, or null when the trigger cannot fire
     */
    private TriggerFiredBundle triggerFired(Session session, OperableTrigger trigger)
            throws JobPersistenceException {
        String storedState = triggerDao.getState(session, trigger.getKey());
        if (!STATE_ACQUIRED.equals(storedState)) {
            log.debug("Trigger {} is no longer acquired, state: {}", trigger.getKey(), storedState);
            return null;
        }

        JobDetail job;
        try {
            job = jobDao.retrieveJob(session, trigger.getJobKey());
            if (job == null) {
                return null;
            }
        } catch (JobPersistenceException jpe) {
            log.error("Error retrieving job, setting trigger state to ERROR.", jpe);
            triggerDao.setState(session, trigger.getKey(), STATE_ERROR);
            throw jpe;
        }

        Calendar cal = null;
        if (trigger.getCalendarName() != null) {
            cal = calendarManager.retrieveCalendar(session, trigger.getCalendarName());
            if (cal == null) {
                log.warn("Calendar '{}' of trigger {} not found", trigger.getCalendarName(), trigger.getKey());
                return null;
            }
        }

        Date firedTime = clock.now();
        firedTriggerDao.updateFiredTrigger(session, trigger, STATE_EXECUTING, job, firedTime);

        Date prevFireTime = trigger.getPreviousFireTime();
        Date scheduledFireTime = trigger.getNextFireTime();

        // call triggered - to update the trigger's next-fire-time state...
        trigger.triggered(cal);

        String state = STATE_WAITING;
        boolean force = true;

        if (job.isConcurrentExectionDisallowed()) {
            state = STATE_BLOCKED;
            force = false;
            triggerDao.transferStateForJob(session, job.getKey(), STATE_BLOCKED, STATE_WAITING, STATE_ACQUIRED);
            triggerDao.transferStateForJob(session, job.getKey(), STATE_PAUSED_BLOCKED, STATE_PAUSED);
        }

        if (trigger.getNextFireTime() == null) {
            state = STATE_COMPLETE;
            force = true;
        }

        persister.storeTrigger(session, trigger, job, true, state, force, false);

        job.getJobDataMap().clearDirtyFlag();

        log.debug("Fired trigger {}", trigger.getKey());
        return new TriggerFiredBundle(job, trigger, cal,
                trigger.getKey().getGroup().equals(Scheduler.DEFAULT_RECOVERY_GROUP), firedTime,
                scheduledFireTime, prevFireTime, trigger.getNextFireTime());
    }

    /**
     * Returns an acquired trigger to the waiting state, or to the blocked state
     * while another trigger of its non-concurrent job is executing.
     */
    public void releaseAcquiredTrigger(Session session, OperableTrigger trigger) {
        firedTriggerDao.remove(session, trigger.getFireInstanceId());
        String newState = persister.checkBlockedState(session, trigger.getJobKey(), STATE_WAITING);
        triggerDao.transferState(session, trigger.getKey(), newState, STATE_ACQUIRED, STATE_BLOCKED);
    }

    private String nextFiredTriggerRecordId() {
        return instanceId + firedTriggerCounter.incrementAndGet();
    }
}
