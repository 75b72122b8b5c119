package com.novemberain.quartz.store.trigger;

import com.novemberain.quartz.store.TransactionTemplate;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.trigger.MisfireHandler.RecoverMisfiredJobsResult;
import com.novemberain.quartz.store.util.Clock;
import com.novemberain.quartz.store.util.SupervisedLoop;
import org.quartz.JobPersistenceException;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.novemberain.quartz.store.Constants.LOCK_TRIGGER_ACCESS;

/**
 * Background loop handing misfired triggers to the {@link MisfireHandler}
 * about once per misfire threshold.
 */
public class MisfireScanner extends SupervisedLoop {

    private static final Logger log = LoggerFactory.getLogger(MisfireScanner.class);

    private static final long MIN_PAUSE = 50L;

    private final MisfireHandler misfireHandler;
    private final TransactionTemplate transactionTemplate;
    private final SchedulerSignaler signaler;
    private final Clock clock;
    private final long misfireThreshold;
    private final long dbRetryInterval;
    private final boolean doubleCheckLockMisfireHandler;
    private final int retryableActionErrorLogThreshold;
    private int numFails;

    public MisfireScanner(String schedulerName, MisfireHandler misfireHandler, TransactionTemplate transactionTemplate,
                          SchedulerSignaler signaler, Clock clock, long misfireThreshold, long dbRetryInterval,
                          boolean doubleCheckLockMisfireHandler, int retryableActionErrorLogThreshold) {
        super("QuartzScheduler_" + schedulerName + "-MisfireHandler", dbRetryInterval);
        this.misfireHandler = misfireHandler;
        this.transactionTemplate = transactionTemplate;
        this.signaler = signaler;
        this.clock = clock;
        this.misfireThreshold = misfireThreshold;
        this.dbRetryInterval = dbRetryInterval;
        this.doubleCheckLockMisfireHandler = doubleCheckLockMisfireHandler;
        this.retryableActionErrorLogThreshold = retryableActionErrorLogThreshold;
    }

    @Override
    protected long runCycle() {
        long sTime = clock.millis();
        RecoverMisfiredJobsResult result = manage();

        if (result.getProcessedMisfiredTriggerCount() > 0) {
            signaler.signalSchedulingChange(result.getEarliestNewTime());
        }

        if (result.hasMoreMisfiredTriggers()) {
            return MIN_PAUSE;
        }
        long timeToSleep = misfireThreshold - clock.elapsedSince(sTime);
        if (timeToSleep <= 0) {
            timeToSleep = MIN_PAUSE;
        }
        if (numFails > 0) {
            timeToSleep = Math.max(dbRetryInterval, timeToSleep);
        }
        return timeToSleep;
    }

    RecoverMisfiredJobsResult manage() {
        try {
            log.debug("MisfireHandler: scanning for misfires...");
            RecoverMisfiredJobsResult res = doRecoverMisfires();
            numFails = 0;
            return res;
        } catch (JobPersistenceException e) {
            if (numFails % retryableActionErrorLogThreshold == 0) {
                log.error("MisfireHandler: Error handling misfires: " + e.getMessage(), e);
            }
            numFails++;
        }
        return RecoverMisfiredJobsResult.NO_OP;
    }

    private RecoverMisfiredJobsResult doRecoverMisfires() throws JobPersistenceException {
        if (doubleCheckLockMisfireHandler) {
            // Peek before taking the lock.
            boolean hasMisfires = transactionTemplate.executeWithoutLock(
                    new TransactionTemplate.TransactionCallback<Boolean>() {
                        @Override
                        public Boolean execute(Session session) {
                            return misfireHandler.hasMisfires(session);
                        }
                    });
            if (!hasMisfires) {
                log.debug("Found 0 triggers that missed their scheduled fire-time.");
                return RecoverMisfiredJobsResult.NO_OP;
            }
        }
        return transactionTemplate.executeInLock(LOCK_TRIGGER_ACCESS,
                new TransactionTemplate.TransactionCallback<RecoverMisfiredJobsResult>() {
                    @Override
                    public RecoverMisfiredJobsResult execute(Session session) throws JobPersistenceException {
                        return misfireHandler.recoverMisfiredJobs(session, false);
                    }
                });
    }
}
