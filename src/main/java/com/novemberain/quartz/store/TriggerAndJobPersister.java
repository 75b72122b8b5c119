package com.novemberain.quartz.store;

import com.novemberain.quartz.store.dao.CalendarDao;
import com.novemberain.quartz.store.dao.FiredTriggerDao;
import com.novemberain.quartz.store.dao.JobDao;
import com.novemberain.quartz.store.dao.PausedTriggerGroupsDao;
import com.novemberain.quartz.store.dao.TriggerDao;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.trigger.FiredTriggerRecord;
import com.novemberain.quartz.store.util.Keys;
import org.bson.Document;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.novemberain.quartz.store.Constants.*;

/**
 * Stores and removes jobs and triggers. Stored triggers get their state
 * re-checked against paused groups and running non-concurrent jobs.
 */
public class TriggerAndJobPersister {

    private static final Logger log = LoggerFactory.getLogger(TriggerAndJobPersister.class);

    private final JobDao jobDao;
    private final TriggerDao triggerDao;
    private final FiredTriggerDao firedTriggerDao;
    private final PausedTriggerGroupsDao pausedTriggerGroupsDao;
    private final CalendarDao calendarDao;
    private final SchedulerSignaler signaler;

    public TriggerAndJobPersister(JobDao jobDao, TriggerDao triggerDao, FiredTriggerDao firedTriggerDao,
                                  PausedTriggerGroupsDao pausedTriggerGroupsDao, CalendarDao calendarDao,
                                  SchedulerSignaler signaler) {
        this.jobDao = jobDao;
        this.triggerDao = triggerDao;
        this.firedTriggerDao = firedTriggerDao;
        this.pausedTriggerGroupsDao = pausedTriggerGroupsDao;
        this.calendarDao = calendarDao;
        this.signaler = signaler;
    }

    public List<OperableTrigger> getTriggersForJob(Session session, JobKey jobKey) throws JobPersistenceException {
        return triggerDao.getTriggersForJob(session, jobKey);
    }

    public boolean removeJob(Session session, JobKey jobKey) {
        for (TriggerKey triggerKey : triggerDao.getTriggerKeysForJob(session, jobKey)) {
            triggerDao.remove(session, triggerKey);
        }
        return jobDao.remove(session, jobKey);
    }

    public boolean removeJobs(Session session, List<JobKey> jobKeys) {
        boolean allFound = true;
        for (JobKey key : jobKeys) {
            allFound = removeJob(session, key) && allFound;
        }
        return allFound;
    }

    /**
     * Removes the trigger. A non-durable job left without triggers is removed too.
     */
    public boolean removeTrigger(Session session, TriggerKey key) {
        Document trigger = triggerDao.findTrigger(session, key);
        if (trigger == null) {
            return false;
        }
        JobKey jobKey = Keys.toJobKeyOfTrigger(trigger);
        boolean removed = triggerDao.remove(session, key);

        Document job = jobDao.getJob(session, jobKey);
        if (job != null && !JobConverter.isDurable(job) && triggerDao.countForJob(session, jobKey) == 0) {
            log.debug("Removing job {} left without triggers", jobKey);
            jobDao.remove(session, jobKey);
            signaler.notifySchedulerListenersJobDeleted(jobKey);
        }
        return removed;
    }

    public boolean removeTriggers(Session session, List<TriggerKey> triggerKeys) {
        boolean allFound = true;
        for (TriggerKey key : triggerKeys) {
            allFound = removeTrigger(session, key) && allFound;
        }
        return allFound;
    }

    /**
     * Replaces the trigger with one pointing at the same job. The job stays,
     * even when it is not durable.
     *
     * @return false when there was no trigger to replace
     */
    public boolean replaceTrigger(Session session, TriggerKey triggerKey, OperableTrigger newTrigger)
            throws JobPersistenceException {
        Document oldTrigger = triggerDao.findTrigger(session, triggerKey);
        if (oldTrigger == null) {
            return false;
        }
        JobKey jobKey = Keys.toJobKeyOfTrigger(oldTrigger);
        if (!jobKey.equals(newTrigger.getJobKey())) {
            throw new JobPersistenceException("New trigger is not related to the same job as the old trigger.");
        }
        boolean removed = triggerDao.remove(session, triggerKey);
        storeTrigger(session, newTrigger, null, false, STATE_WAITING, false, false);
        return removed;
    }

    public JobDetail retrieveJob(Session session, JobKey jobKey) throws JobPersistenceException {
        return jobDao.retrieveJob(session, jobKey);
    }

    public OperableTrigger retrieveTrigger(Session session, TriggerKey triggerKey) throws JobPersistenceException {
        return triggerDao.getTrigger(session, triggerKey);
    }

    public boolean checkExists(Session session, JobKey jobKey) {
        return jobDao.exists(session, jobKey);
    }

    public boolean checkExists(Session session, TriggerKey triggerKey) {
        return triggerDao.exists(session, triggerKey);
    }

    public int getNumberOfJobs(Session session) {
        return jobDao.getCount(session);
    }

    public int getNumberOfTriggers(Session session) {
        return triggerDao.getCount(session);
    }

    public Set<JobKey> getJobKeys(Session session, GroupMatcher<JobKey> matcher) {
        return jobDao.getJobKeys(session, matcher);
    }

    public Set<TriggerKey> getTriggerKeys(Session session, GroupMatcher<TriggerKey> matcher) {
        return triggerDao.getTriggerKeys(session, matcher);
    }

    public List<String> getJobGroupNames(Session session) {
        return jobDao.getGroupNames(session);
    }

    public List<String> getTriggerGroupNames(Session session) {
        return triggerDao.getGroupNames(session);
    }

    public void storeJob(Session session, JobDetail newJob, boolean replaceExisting)
            throws JobPersistenceException {
        boolean existingJob = jobDao.exists(session, newJob.getKey());
        if (existingJob && !replaceExisting) {
            throw new ObjectAlreadyExistsException(newJob);
        }
        if (existingJob) {
            jobDao.replace(session, newJob);
        } else {
            jobDao.insert(session, newJob);
        }
    }

    public void storeJobAndTrigger(Session session, JobDetail newJob, OperableTrigger newTrigger)
            throws JobPersistenceException {
        storeJob(session, newJob, false);
        storeTrigger(session, newTrigger, newJob, false, STATE_WAITING, false, false);
    }

    public void storeJobsAndTriggers(Session session, Map<JobDetail, Set<? extends Trigger>> triggersAndJobs,
                                     boolean replace) throws JobPersistenceException {
        for (Map.Entry<JobDetail, Set<? extends Trigger>> e : triggersAndJobs.entrySet()) {
            storeJob(session, e.getKey(), replace);
            for (Trigger trigger : e.getValue()) {
                storeTrigger(session, (OperableTrigger) trigger, e.getKey(), replace, STATE_WAITING, false, false);
            }
        }
    }

    public void storeTrigger(Session session, OperableTrigger newTrigger, boolean replaceExisting)
            throws JobPersistenceException {
        storeTrigger(session, newTrigger, null, replaceExisting, STATE_WAITING, false, false);
    }

    /**
     * Inserts or replaces the trigger.
     *
     * @param job        the trigger's job if already at hand, or null
     * @param state      state to store the trigger in
     * @param forceState store the state as given, skipping the paused group and blocked job checks
     * @param recovering the trigger is a recovery trigger, skip the blocked job check
     */
    public void storeTrigger(Session session, OperableTrigger newTrigger, JobDetail job, boolean replaceExisting,
                             String state, boolean forceState, boolean recovering)
            throws JobPersistenceException {
        boolean existingTrigger = triggerDao.exists(session, newTrigger.getKey());
        if (existingTrigger && !replaceExisting) {
            throw new ObjectAlreadyExistsException(newTrigger);
        }

        if (!forceState) {
            String group = newTrigger.getKey().getGroup();
            boolean shouldBePaused = pausedTriggerGroupsDao.isPaused(session, group);
            if (!shouldBePaused) {
                shouldBePaused = pausedTriggerGroupsDao.isPaused(session, ALL_GROUPS_PAUSED);
                if (shouldBePaused) {
                    pausedTriggerGroupsDao.pauseGroup(session, group);
                }
            }
            if (shouldBePaused && (STATE_WAITING.equals(state) || STATE_ACQUIRED.equals(state))) {
                state = STATE_PAUSED;
            }
        }

        boolean concurrentExecutionDisallowed;
        if (job != null) {
            concurrentExecutionDisallowed = job.isConcurrentExectionDisallowed();
        } else {
            Document jobDoc = jobDao.getJob(session, newTrigger.getJobKey());
            if (jobDoc == null) {
                throw new JobPersistenceException("The job (" + newTrigger.getJobKey()
                        + ") referenced by the trigger does not exist.");
            }
            concurrentExecutionDisallowed = JobConverter.isConcurrentExecutionDisallowed(jobDoc);
        }
        if (concurrentExecutionDisallowed && !recovering) {
            state = checkBlockedState(session, newTrigger.getJobKey(), state);
        }

        if (existingTrigger) {
            triggerDao.replace(session, newTrigger, state);
        } else {
            triggerDao.insert(session, newTrigger, state);
        }
    }

    /**
     * Determines if a trigger for the given job should be blocked,
     * because the job is executing and disallows concurrent execution.
     *
     * @return the blocked counterpart of the state, or the state unchanged
     */
    public String checkBlockedState(Session session, JobKey jobKey, String currentState) {
        // State can only transition to BLOCKED from PAUSED or WAITING.
        if (!STATE_WAITING.equals(currentState) && !STATE_PAUSED.equals(currentState)) {
            return currentState;
        }
        // Acquired records do not block: their trigger may still be released.
        for (FiredTriggerRecord record : firedTriggerDao.findByJob(session, jobKey)) {
            if (STATE_EXECUTING.equals(record.getState()) && record.isJobDisallowsConcurrentExecution()) {
                return STATE_PAUSED.equals(currentState) ? STATE_PAUSED_BLOCKED : STATE_BLOCKED;
            }
        }
        return currentState;
    }

    public void clearAllSchedulingData(Session session) {
        long triggers = triggerDao.clear(session);
        long jobs = jobDao.clear(session);
        long calendars = calendarDao.clear(session);
        firedTriggerDao.removeAll(session);
        pausedTriggerGroupsDao.remove(session);
        log.info("Removed {} jobs, {} triggers and {} calendars", jobs, triggers, calendars);
    }
}
