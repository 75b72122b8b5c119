package com.novemberain.quartz.store.cluster;

import com.novemberain.quartz.store.util.Clock;
import com.novemberain.quartz.store.util.SupervisedLoop;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically checks this instance in and recovers failed cluster members.
 */
public class ClusterManager extends SupervisedLoop {

    private static final Logger log = LoggerFactory.getLogger(ClusterManager.class);

    private final CheckinTask checkinTask;
    private final SchedulerSignaler signaler;
    private final Clock clock;
    private final long clusterCheckinInterval;
    private final long dbRetryInterval;
    private final int retryableActionErrorLogThreshold;
    private int numFails;

    public ClusterManager(String schedulerName, CheckinTask checkinTask, SchedulerSignaler signaler, Clock clock,
                          long clusterCheckinInterval, long dbRetryInterval, int retryableActionErrorLogThreshold) {
        super("QuartzScheduler_" + schedulerName + "-ClusterManager", dbRetryInterval);
        this.checkinTask = checkinTask;
        this.signaler = signaler;
        this.clock = clock;
        this.clusterCheckinInterval = clusterCheckinInterval;
        this.dbRetryInterval = dbRetryInterval;
        this.retryableActionErrorLogThreshold = retryableActionErrorLogThreshold;
    }

    /**
     * Runs the first check-in in the calling thread, then keeps checking in
     * from the background.
     */
    public void initialize() {
        manage();
        start(timeToSleep());
    }

    @Override
    protected long runCycle() {
        if (!isShutdown() && manage()) {
            signaler.signalSchedulingChange(0L);
        }
        return timeToSleep();
    }

    /**
     * @return if any failed instance was recovered
     */
    synchronized boolean manage() {
        boolean res = false;
        try {
            res = checkinTask.doCheckin();
            numFails = 0;
            log.debug("ClusterManager: Check-in complete.");
        } catch (Exception e) {
            if (numFails % retryableActionErrorLogThreshold == 0) {
                log.error("ClusterManager: Error managing cluster: " + e.getMessage(), e);
            }
            numFails++;
        }
        return res;
    }

    private synchronized long timeToSleep() {
        long timeToSleep = clusterCheckinInterval - clock.elapsedSince(checkinTask.getLastCheckin());
        if (timeToSleep <= 0) {
            timeToSleep = 100L;
        }
        if (numFails > 0) {
            timeToSleep = Math.max(dbRetryInterval, timeToSleep);
        }
        return timeToSleep;
    }
}
