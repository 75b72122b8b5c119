package com.novemberain.quartz.store.trigger;

import org.quartz.JobKey;
import org.quartz.TriggerKey;

import java.util.Date;

/**
 * A trigger that was acquired or is executing on some scheduler instance.
 */
public class FiredTriggerRecord {

    private final String fireInstanceId;
    private final String instanceId;
    private final TriggerKey triggerKey;
    private final JobKey jobKey;
    private final Date firedTime;
    private final Date scheduledTime;
    private final int priority;
    private final String state;
    private final boolean jobDisallowsConcurrentExecution;
    private final boolean jobRequestsRecovery;

    public FiredTriggerRecord(String fireInstanceId, String instanceId, TriggerKey triggerKey,
                              JobKey jobKey, Date firedTime, Date scheduledTime, int priority,
                              String state, boolean jobDisallowsConcurrentExecution,
                              boolean jobRequestsRecovery) {
        this.fireInstanceId = fireInstanceId;
        this.instanceId = instanceId;
        this.triggerKey = triggerKey;
        this.jobKey = jobKey;
        this.firedTime = firedTime;
        this.scheduledTime = scheduledTime;
        this.priority = priority;
        this.state = state;
        this.jobDisallowsConcurrentExecution = jobDisallowsConcurrentExecution;
        this.jobRequestsRecovery = jobRequestsRecovery;
    }

    public String getFireInstanceId() {
        return fireInstanceId;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public TriggerKey getTriggerKey() {
        return triggerKey;
    }

    /**
     * Null while the trigger is only acquired.
     */
    public JobKey getJobKey() {
        return jobKey;
    }

    public Date getFiredTime() {
        return firedTime;
    }

    public Date getScheduledTime() {
        return scheduledTime;
    }

    public int getPriority() {
        return priority;
    }

    public String getState() {
        return state;
    }

    public boolean isJobDisallowsConcurrentExecution() {
        return jobDisallowsConcurrentExecution;
    }

    public boolean isJobRequestsRecovery() {
        return jobRequestsRecovery;
    }

    @Override
    public String toString() {
        return "FiredTriggerRecord{" + fireInstanceId + ", instance=" + instanceId
                + ", trigger=" + triggerKey + ", state=" + state + '}';
    }
}
