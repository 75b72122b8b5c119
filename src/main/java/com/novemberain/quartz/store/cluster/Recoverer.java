package com.novemberain.quartz.store.cluster;

import com.novemberain.quartz.store.dao.FiredTriggerDao;
import com.novemberain.quartz.store.dao.SchedulerDao;
import com.novemberain.quartz.store.db.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
 * The responsibility of this class is to find failed scheduler instances.
 *
 * Failed schedulers are those that haven't checked in within their
 * check-in interval and are not being recovered by another instance yet.
 */
public class Recoverer {

    private static final Logger log = LoggerFactory.getLogger(Recoverer.class);

    private final SchedulerDao schedulerDao;
    private final FiredTriggerDao firedTriggerDao;

    public Recoverer(SchedulerDao schedulerDao, FiredTriggerDao firedTriggerDao) {
        this.schedulerDao = schedulerDao;
        this.firedTriggerDao = firedTriggerDao;
    }

    /**
     * @param now             time to compare check-ins with
     * @param ownLastCheckin  this instance's last check-in time
     * @param firstCheckIn    also report this instance's own previous record and
     *                        instances owning fired records without a state record
     */
    public List<Scheduler> findFailedInstances(Session session, long now, long ownLastCheckin,
                                               boolean firstCheckIn) {
        // Compare all schedulers using the same moment:
        List<Scheduler> failedInstances = new LinkedList<>();
        boolean foundThisScheduler = false;

        List<Scheduler> states = schedulerDao.getAllByCheckinTime(session);
        for (Scheduler scheduler : states) {
            if (!schedulerDao.isNotSelf(scheduler)) {
                foundThisScheduler = true;
                if (firstCheckIn) {
                    failedInstances.add(scheduler);
                }
            } else if (scheduler.getRecoverer() == null && scheduler.isDefunct(now, ownLastCheckin)) {
                log.info("Found defunct scheduler: {}", scheduler);
                failedInstances.add(scheduler);
            }
        }

        if (firstCheckIn) {
            failedInstances.addAll(findOrphanedFailedInstances(session, states));
        }

        // If not the first time but we didn't find our own instance, then
        // someone must have recovered us.
        if (!foundThisScheduler && !firstCheckIn) {
            log.warn("This scheduler instance ({}) is still active but was recovered by another "
                    + "instance in the cluster.  This may cause inconsistent behavior.", schedulerDao.instanceId);
        }
        return failedInstances;
    }

    /**
     * Instances owning fired records but having no state record, for example
     * because they were recovered while still running.
     */
    private List<Scheduler> findOrphanedFailedInstances(Session session, List<Scheduler> states) {
        Set<String> allFiredTriggerInstanceNames = new HashSet<>(firedTriggerDao.findInstanceNames(session));
        for (Scheduler state : states) {
            allFiredTriggerInstanceNames.remove(state.getInstanceId());
        }
        List<Scheduler> orphaned = new LinkedList<>();
        for (String instanceId : allFiredTriggerInstanceNames) {
            log.warn("Found orphaned fired triggers for instance: {}", instanceId);
            orphaned.add(new Scheduler(schedulerDao.schedulerName, instanceId, 0L, 0L, null));
        }
        return orphaned;
    }
}
