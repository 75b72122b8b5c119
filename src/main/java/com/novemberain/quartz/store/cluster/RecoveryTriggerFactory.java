package com.novemberain.quartz.store.cluster;

import com.novemberain.quartz.store.trigger.FiredTriggerRecord;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SimpleTrigger;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.impl.triggers.SimpleTriggerImpl;
import org.quartz.spi.OperableTrigger;

import java.util.Date;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates one-shot triggers re-running jobs whose execution was cut short
 * by a failed scheduler instance.
 */
public class RecoveryTriggerFactory {

    private final AtomicLong recoverIds;

    public RecoveryTriggerFactory(long firstRecoverId) {
        this.recoverIds = new AtomicLong(firstRecoverId);
    }

    /**
     * Recovery of an execution interrupted by a failed cluster member: starts
     * at the time the job was fired and fires right away when misfired.
     *
     * @param ftRec        fired record of the interrupted execution
     * @param originalData job data of the interrupted trigger
     */
    public OperableTrigger from(FiredTriggerRecord ftRec, JobDataMap originalData) {
        long fireTimestamp = fireTimestampOf(ftRec);
        return build(ftRec, originalData, fireTimestamp, SimpleTrigger.MISFIRE_INSTRUCTION_FIRE_NOW);
    }

    /**
     * Recovery of an execution interrupted by the previous run of a
     * non-clustered scheduler: starts at the originally scheduled time and
     * ignores the misfire policy.
     */
    public OperableTrigger fromPreviousRun(FiredTriggerRecord ftRec, JobDataMap originalData) {
        return build(ftRec, originalData, scheduledTimestampOf(ftRec),
                Trigger.MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY);
    }

    private OperableTrigger build(FiredTriggerRecord ftRec, JobDataMap originalData,
                                  long startTimestamp, int misfireInstruction) {
        TriggerKey tKey = ftRec.getTriggerKey();
        JobKey jKey = ftRec.getJobKey();

        SimpleTriggerImpl rcvryTrig = new SimpleTriggerImpl();
        rcvryTrig.setName("recover_" + ftRec.getInstanceId() + "_" + recoverIds.getAndIncrement());
        rcvryTrig.setGroup(Scheduler.DEFAULT_RECOVERY_GROUP);
        rcvryTrig.setStartTime(new Date(startTimestamp));
        rcvryTrig.setJobName(jKey.getName());
        rcvryTrig.setJobGroup(jKey.getGroup());
        rcvryTrig.setMisfireInstruction(misfireInstruction);
        rcvryTrig.setPriority(ftRec.getPriority());

        // Cannot reuse JobDataMap, because the original trigger
        // may be persisted after applying misfire.
        JobDataMap jd = new JobDataMap(originalData);
        jd.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_NAME, tKey.getName());
        jd.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_GROUP, tKey.getGroup());
        jd.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_FIRETIME_IN_MILLISECONDS,
                String.valueOf(fireTimestampOf(ftRec)));
        jd.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_SCHEDULED_FIRETIME_IN_MILLISECONDS,
                String.valueOf(scheduledTimestampOf(ftRec)));
        rcvryTrig.setJobDataMap(jd);

        rcvryTrig.computeFirstFireTime(null);
        return rcvryTrig;
    }

    private static long fireTimestampOf(FiredTriggerRecord ftRec) {
        return ftRec.getFiredTime() != null ? ftRec.getFiredTime().getTime() : 0L;
    }

    private static long scheduledTimestampOf(FiredTriggerRecord ftRec) {
        return ftRec.getScheduledTime() != null ? ftRec.getScheduledTime().getTime() : fireTimestampOf(ftRec);
    }
}
