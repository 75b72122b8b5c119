package com.novemberain.quartz.store.trigger;

import com.novemberain.quartz.store.CalendarManager;
import com.novemberain.quartz.store.Constants;
import com.novemberain.quartz.store.TriggerAndJobPersister;
import com.novemberain.quartz.store.dao.TriggerDao;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.util.Clock;
import com.novemberain.quartz.store.util.Keys;
import org.bson.Document;
import org.quartz.Calendar;
import org.quartz.JobPersistenceException;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;
import java.util.List;

/**
 * Applies misfire instructions of triggers whose fire time passed by more
 * than the misfire threshold.
 */
public class MisfireHandler {

    private static final Logger log = LoggerFactory.getLogger(MisfireHandler.class);

    /**
     * Outcome of one batch of misfire handling.
     */
    public static class RecoverMisfiredJobsResult {

        public static final RecoverMisfiredJobsResult NO_OP = new RecoverMisfiredJobsResult(false, 0, Long.MAX_VALUE);

        private final boolean hasMoreMisfiredTriggers;
        private final int processedMisfiredTriggerCount;
        private final long earliestNewTime;

        public RecoverMisfiredJobsResult(boolean hasMoreMisfiredTriggers, int processedMisfiredTriggerCount,
                                         long earliestNewTime) {
            this.hasMoreMisfiredTriggers = hasMoreMisfiredTriggers;
            this.processedMisfiredTriggerCount = processedMisfiredTriggerCount;
            this.earliestNewTime = earliestNewTime;
        }

        public boolean hasMoreMisfiredTriggers() {
            return hasMoreMisfiredTriggers;
        }

        public int getProcessedMisfiredTriggerCount() {
            return processedMisfiredTriggerCount;
        }

        /**
         * @return earliest next fire time among handled triggers, {@link Long#MAX_VALUE} if none
         */
        public long getEarliestNewTime() {
            return earliestNewTime;
        }
    }

    private final TriggerDao triggerDao;
    private final TriggerAndJobPersister persister;
    private final CalendarManager calendarManager;
    private final SchedulerSignaler signaler;
    private final Clock clock;
    private final long misfireThreshold;
    private final int maxMisfiresToHandleAtATime;

    public MisfireHandler(TriggerDao triggerDao, TriggerAndJobPersister persister, CalendarManager calendarManager,
                          SchedulerSignaler signaler, Clock clock, long misfireThreshold,
                          int maxMisfiresToHandleAtATime) {
        this.triggerDao = triggerDao;
        this.persister = persister;
        this.calendarManager = calendarManager;
        this.signaler = signaler;
        this.clock = clock;
        this.misfireThreshold = misfireThreshold;
        this.maxMisfiresToHandleAtATime = maxMisfiresToHandleAtATime;
    }

    /**
     * Triggers due before this time have misfired.
     */
    public long getMisfireTime() {
        long misfireTime = clock.millis();
        if (misfireThreshold > 0) {
            misfireTime -= misfireThreshold;
        }
        return misfireTime;
    }

    /**
     * Moves waiting triggers due before the misfire time to the misfired state.
     */
    public long reclassifyMisfired(Session session) {
        long count = triggerDao.reclassifyMisfired(session, new Date(getMisfireTime()));
        if (count > 0) {
            log.debug("Found {} misfired triggers", count);
        }
        return count;
    }

    /**
     * Counts overdue and misfired triggers without taking locks.
     */
    public boolean hasMisfires(Session session) {
        return triggerDao.countMisfired(session, new Date(getMisfireTime())) > 0;
    }

    /**
     * Handles a batch of misfired triggers.
     *
     * @param recovering handle all of them at once, as on startup
     */
    public RecoverMisfiredJobsResult recoverMisfiredJobs(Session session, boolean recovering)
            throws JobPersistenceException {
        reclassifyMisfired(session);

        int limit = recovering ? -1 : maxMisfiresToHandleAtATime + 1;
        List<Document> misfired = triggerDao.findMisfired(session, limit);
        boolean hasMore = false;
        if (!recovering && misfired.size() > maxMisfiresToHandleAtATime) {
            hasMore = true;
            misfired = misfired.subList(0, maxMisfiresToHandleAtATime);
        }
        if (misfired.isEmpty()) {
            return RecoverMisfiredJobsResult.NO_OP;
        }
        if (recovering || hasMore) {
            log.info("Handling {} trigger(s) that missed their scheduled fire-time.", misfired.size());
        } else {
            log.debug("Handling {} trigger(s) that missed their scheduled fire-time.", misfired.size());
        }

        long earliestNewTime = Long.MAX_VALUE;
        int processed = 0;
        for (Document doc : misfired) {
            TriggerKey key = Keys.toTriggerKey(doc);
            OperableTrigger trigger;
            try {
                trigger = triggerDao.toTrigger(doc);
            } catch (JobPersistenceException e) {
                log.error("Error retrieving misfired trigger " + key + ", setting trigger state to ERROR.", e);
                triggerDao.setState(session, key, Constants.STATE_ERROR);
                continue;
            }
            doUpdateOfMisfiredTrigger(session, trigger, false, Constants.STATE_WAITING, recovering);
            processed++;
            if (trigger.getNextFireTime() != null && trigger.getNextFireTime().getTime() < earliestNewTime) {
                earliestNewTime = trigger.getNextFireTime().getTime();
            }
        }
        return new RecoverMisfiredJobsResult(hasMore, processed, earliestNewTime);
    }

    /**
     * Applies the misfire instruction if the trigger is due before the misfire time.
     *
     * @return if the trigger had misfired
     */
    public boolean updateMisfiredTrigger(Session session, TriggerKey triggerKey, String newStateIfNotComplete,
                                         boolean forceState) throws JobPersistenceException {
        OperableTrigger trigger = triggerDao.getTrigger(session, triggerKey);
        if (trigger == null || trigger.getNextFireTime() == null
                || trigger.getNextFireTime().getTime() > getMisfireTime()) {
            return false;
        }
        doUpdateOfMisfiredTrigger(session, trigger, forceState, newStateIfNotComplete, false);
        return true;
    }

    private void doUpdateOfMisfiredTrigger(Session session, OperableTrigger trigger, boolean forceState,
                                           String newStateIfNotComplete, boolean recovering)
            throws JobPersistenceException {
        Calendar cal = calendarManager.retrieveCalendar(session, trigger.getCalendarName());

        signaler.notifyTriggerListenersMisfired(trigger);

        trigger.updateAfterMisfire(cal);

        if (trigger.getNextFireTime() == null) {
            log.debug("Trigger {} completed after misfire", trigger.getKey());
            persister.storeTrigger(session, trigger, null, true, Constants.STATE_COMPLETE, forceState, recovering);
            signaler.notifySchedulerListenersFinalized(trigger);
        } else {
            log.debug("Trigger {} rescheduled after misfire to {}", trigger.getKey(), trigger.getNextFireTime());
            persister.storeTrigger(session, trigger, null, true, newStateIfNotComplete, forceState, false);
        }
    }
}
