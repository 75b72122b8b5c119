package com.novemberain.quartz.store;

import com.novemberain.quartz.store.dao.JobDao;
import com.novemberain.quartz.store.dao.PausedTriggerGroupsDao;
import com.novemberain.quartz.store.dao.TriggerDao;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.trigger.MisfireHandler;
import com.novemberain.quartz.store.trigger.TriggerStatus;
import com.novemberain.quartz.store.util.Clock;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.impl.matchers.StringMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.novemberain.quartz.store.Constants.*;

public class TriggerStateManager {

    private static final Logger log = LoggerFactory.getLogger(TriggerStateManager.class);

    private final TriggerDao triggerDao;
    private final JobDao jobDao;
    private final PausedTriggerGroupsDao pausedTriggerGroupsDao;
    private final TriggerAndJobPersister persister;
    private final MisfireHandler misfireHandler;
    private final Clock clock;
    private volatile boolean schedulerRunning;

    public TriggerStateManager(TriggerDao triggerDao, JobDao jobDao, PausedTriggerGroupsDao pausedTriggerGroupsDao,
                               TriggerAndJobPersister persister, MisfireHandler misfireHandler, Clock clock) {
        this.triggerDao = triggerDao;
        this.jobDao = jobDao;
        this.pausedTriggerGroupsDao = pausedTriggerGroupsDao;
        this.persister = persister;
        this.misfireHandler = misfireHandler;
        this.clock = clock;
    }

    /**
     * While running, resumed triggers that are overdue get their misfire instruction applied.
     */
    public void setSchedulerRunning(boolean schedulerRunning) {
        this.schedulerRunning = schedulerRunning;
    }

    public Set<String> getPausedTriggerGroups(Session session) {
        Set<String> groups = pausedTriggerGroupsDao.getPausedGroups(session);
        groups.remove(ALL_GROUPS_PAUSED);
        return groups;
    }

    public TriggerState getState(Session session, TriggerKey triggerKey) {
        return triggerStateForValue(triggerDao.getState(session, triggerKey));
    }

    public void pause(Session session, TriggerKey triggerKey) {
        triggerDao.transferState(session, triggerKey, STATE_PAUSED, STATE_WAITING, STATE_ACQUIRED, STATE_MISFIRED);
        triggerDao.transferState(session, triggerKey, STATE_PAUSED_BLOCKED, STATE_BLOCKED);
    }

    /**
     * Pauses the triggers of matching groups, and marks the groups paused so that
     * triggers added to them later start paused.
     *
     * @return the paused groups
     */
    public Collection<String> pause(Session session, GroupMatcher<TriggerKey> matcher) {
        triggerDao.transferStateInMatching(session, matcher, STATE_PAUSED, STATE_WAITING, STATE_ACQUIRED, STATE_MISFIRED);
        triggerDao.transferStateInMatching(session, matcher, STATE_PAUSED_BLOCKED, STATE_BLOCKED);

        Set<String> groups = new HashSet<>(triggerDao.getGroupNames(session, matcher));
        // An exact group may not have any triggers yet.
        if (matcher.getCompareWithOperator().equals(StringMatcher.StringOperatorName.EQUALS)) {
            groups.add(matcher.getCompareToValue());
        }
        for (String group : groups) {
            pausedTriggerGroupsDao.pauseGroup(session, group);
        }
        return groups;
    }

    public void pauseJob(Session session, JobKey jobKey) {
        for (TriggerKey key : triggerDao.getTriggerKeysForJob(session, jobKey)) {
            pause(session, key);
        }
    }

    /**
     * @return the groups of the paused jobs
     */
    public Collection<String> pauseJobs(Session session, GroupMatcher<JobKey> groupMatcher) {
        Set<String> groups = new HashSet<>();
        for (JobKey jobKey : jobDao.getJobKeys(session, groupMatcher)) {
            pauseJob(session, jobKey);
            groups.add(jobKey.getGroup());
        }
        return groups;
    }

    public void pauseAll(Session session) {
        for (String group : triggerDao.getGroupNames(session)) {
            pause(session, GroupMatcher.triggerGroupEquals(group));
        }
        pausedTriggerGroupsDao.pauseGroup(session, ALL_GROUPS_PAUSED);
    }

    /**
     * Resumes a paused trigger. It becomes blocked when its job is executing and
     * disallows concurrent execution, and gets its misfire instruction applied
     * when it missed its fire time while paused.
     */
    public void resume(Session session, TriggerKey triggerKey) throws JobPersistenceException {
        TriggerStatus status = triggerDao.getStatus(session, triggerKey);
        if (status == null || status.getNextFireTime() == null) {
            return;
        }
        boolean blocked = STATE_PAUSED_BLOCKED.equals(status.getState());
        if (!blocked && !STATE_PAUSED.equals(status.getState())) {
            return;
        }

        String newState = persister.checkBlockedState(session, status.getJobKey(), STATE_WAITING);

        boolean misfired = false;
        if (schedulerRunning && status.getNextFireTime().before(clock.now())) {
            misfired = misfireHandler.updateMisfiredTrigger(session, triggerKey, newState, true);
        }

        if (!misfired) {
            triggerDao.transferState(session, triggerKey, newState, blocked ? STATE_PAUSED_BLOCKED : STATE_PAUSED);
        }
    }

    /**
     * Removes the paused marks of matching groups and resumes their triggers.
     *
     * @return the resumed groups
     */
    public Collection<String> resume(Session session, GroupMatcher<TriggerKey> matcher)
            throws JobPersistenceException {
        Set<String> groups = new LinkedHashSet<>(pausedTriggerGroupsDao.unpauseGroups(session, matcher));
        groups.remove(ALL_GROUPS_PAUSED);
        for (TriggerKey key : triggerDao.getTriggerKeys(session, matcher)) {
            resume(session, key);
            groups.add(key.getGroup());
        }
        return groups;
    }

    public void resumeJob(Session session, JobKey jobKey) throws JobPersistenceException {
        for (TriggerKey key : triggerDao.getTriggerKeysForJob(session, jobKey)) {
            resume(session, key);
        }
    }

    /**
     * @return the groups of the resumed jobs
     */
    public Collection<String> resumeJobs(Session session, GroupMatcher<JobKey> groupMatcher)
            throws JobPersistenceException {
        Set<String> groups = new HashSet<>();
        for (JobKey jobKey : jobDao.getJobKeys(session, groupMatcher)) {
            resumeJob(session, jobKey);
            groups.add(jobKey.getGroup());
        }
        return groups;
    }

    public void resumeAll(Session session) throws JobPersistenceException {
        Set<String> groups = new HashSet<>(triggerDao.getGroupNames(session));
        groups.addAll(pausedTriggerGroupsDao.getPausedGroups(session));
        groups.remove(ALL_GROUPS_PAUSED);
        for (String group : groups) {
            resume(session, GroupMatcher.triggerGroupEquals(group));
        }
        pausedTriggerGroupsDao.unpauseGroup(session, ALL_GROUPS_PAUSED);
    }

    /**
     * Moves a trigger out of the error state, to paused if its group is paused.
     */
    public void resetTriggerFromErrorState(Session session, TriggerKey triggerKey) {
        String newState = STATE_WAITING;
        if (pausedTriggerGroupsDao.isPaused(session, triggerKey.getGroup())
                || pausedTriggerGroupsDao.isPaused(session, ALL_GROUPS_PAUSED)) {
            newState = STATE_PAUSED;
        }
        if (triggerDao.transferState(session, triggerKey, newState, STATE_ERROR)) {
            log.info("Trigger {} reset from error state to {}", triggerKey, newState);
        }
    }

    private TriggerState triggerStateForValue(String ts) {
        if (ts == null || STATE_DELETED.equals(ts)) {
            return TriggerState.NONE;
        }
        if (STATE_COMPLETE.equals(ts)) {
            return TriggerState.COMPLETE;
        }
        if (STATE_PAUSED.equals(ts) || STATE_PAUSED_BLOCKED.equals(ts)) {
            return TriggerState.PAUSED;
        }
        if (STATE_ERROR.equals(ts)) {
            return TriggerState.ERROR;
        }
        if (STATE_BLOCKED.equals(ts)) {
            return TriggerState.BLOCKED;
        }
        return TriggerState.NORMAL;
    }
}
