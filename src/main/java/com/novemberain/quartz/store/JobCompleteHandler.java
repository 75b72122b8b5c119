package com.novemberain.quartz.store;

import com.novemberain.quartz.store.dao.FiredTriggerDao;
import com.novemberain.quartz.store.dao.JobDao;
import com.novemberain.quartz.store.dao.TriggerDao;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.trigger.TriggerStatus;
import org.quartz.JobDetail;
import org.quartz.JobPersistenceException;
import org.quartz.Trigger.CompletedExecutionInstruction;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.novemberain.quartz.store.Constants.*;

/**
 * Applies the instruction a finished job returned for its trigger,
 * unblocks the job's other triggers and forgets the firing.
 */
public class JobCompleteHandler {

    private static final Logger log = LoggerFactory.getLogger(JobCompleteHandler.class);

    private final TriggerAndJobPersister persister;
    private final TriggerDao triggerDao;
    private final JobDao jobDao;
    private final FiredTriggerDao firedTriggerDao;
    private final TransactionTemplate transactionTemplate;

    public JobCompleteHandler(TriggerAndJobPersister persister, TriggerDao triggerDao, JobDao jobDao,
                              FiredTriggerDao firedTriggerDao, TransactionTemplate transactionTemplate) {
        this.persister = persister;
        this.triggerDao = triggerDao;
        this.jobDao = jobDao;
        this.firedTriggerDao = firedTriggerDao;
        this.transactionTemplate = transactionTemplate;
    }

    public void jobComplete(Session session, OperableTrigger trigger, JobDetail jobDetail,
                            CompletedExecutionInstruction triggerInstCode) throws JobPersistenceException {
        log.debug("Trigger completed {} with instruction {}", trigger.getKey(), triggerInstCode);

        process(session, trigger, triggerInstCode);

        if (jobDetail.isConcurrentExectionDisallowed()) {
            triggerDao.transferStateForJob(session, jobDetail.getKey(), STATE_WAITING, STATE_BLOCKED);
            triggerDao.transferStateForJob(session, jobDetail.getKey(), STATE_PAUSED, STATE_PAUSED_BLOCKED);
            transactionTemplate.signalSchedulingChangeOnTxCompletion(0L);
        }

        if (jobDetail.isPersistJobDataAfterExecution() && jobDetail.getJobDataMap().isDirty()) {
            log.debug("Job data map dirty, will store {}", jobDetail.getKey());
            jobDao.updateJobData(session, jobDetail.getKey(), jobDetail.getJobDataMap());
        }

        firedTriggerDao.remove(session, trigger.getFireInstanceId());
    }

    private void process(Session session, OperableTrigger trigger, CompletedExecutionInstruction triggerInstCode) {
        switch (triggerInstCode) {
            case DELETE_TRIGGER:
                if (trigger.getNextFireTime() == null) {
                    // double check for possible reschedule within job
                    // execution, which would cancel the need to delete...
                    TriggerStatus stat = triggerDao.getStatus(session, trigger.getKey());
                    if (stat != null && stat.getNextFireTime() == null) {
                        persister.removeTrigger(session, trigger.getKey());
                    }
                } else {
                    persister.removeTrigger(session, trigger.getKey());
                    transactionTemplate.signalSchedulingChangeOnTxCompletion(0L);
                }
                break;
            case SET_TRIGGER_COMPLETE:
                triggerDao.setState(session, trigger.getKey(), STATE_COMPLETE);
                transactionTemplate.signalSchedulingChangeOnTxCompletion(0L);
                break;
            case SET_TRIGGER_ERROR:
                log.info("Trigger {} set to ERROR state.", trigger.getKey());
                triggerDao.setState(session, trigger.getKey(), STATE_ERROR);
                transactionTemplate.signalSchedulingChangeOnTxCompletion(0L);
                break;
            case SET_ALL_JOB_TRIGGERS_COMPLETE:
                triggerDao.setStateForJob(session, trigger.getJobKey(), STATE_COMPLETE);
                transactionTemplate.signalSchedulingChangeOnTxCompletion(0L);
                break;
            case SET_ALL_JOB_TRIGGERS_ERROR:
                log.info("All triggers of Job {} set to ERROR state.", trigger.getJobKey());
                triggerDao.setStateForJob(session, trigger.getJobKey(), STATE_ERROR);
                transactionTemplate.signalSchedulingChangeOnTxCompletion(0L);
                break;
            default:
                break;
        }
    }
}
