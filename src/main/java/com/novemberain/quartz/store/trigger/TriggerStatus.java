package com.novemberain.quartz.store.trigger;

import org.quartz.JobKey;
import org.quartz.TriggerKey;

import java.util.Date;

/**
 * Stored state of a trigger, read without converting the whole trigger.
 */
public class TriggerStatus {

    private final TriggerKey key;
    private final JobKey jobKey;
    private final String state;
    private final Date nextFireTime;

    public TriggerStatus(TriggerKey key, JobKey jobKey, String state, Date nextFireTime) {
        this.key = key;
        this.jobKey = jobKey;
        this.state = state;
        this.nextFireTime = nextFireTime;
    }

    public TriggerKey getKey() {
        return key;
    }

    public JobKey getJobKey() {
        return jobKey;
    }

    public String getState() {
        return state;
    }

    public Date getNextFireTime() {
        return nextFireTime;
    }
}
