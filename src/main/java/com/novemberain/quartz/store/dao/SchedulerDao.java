package com.novemberain.quartz.store.dao;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import com.novemberain.quartz.store.cluster.Scheduler;
import com.novemberain.quartz.store.db.DocumentCollection;
import com.novemberain.quartz.store.db.Session;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedList;
import java.util.List;

public class SchedulerDao {

    private static final Logger log = LoggerFactory.getLogger(SchedulerDao.class);

    public static final String SCHEDULER_NAME_FIELD = "schedulerName";
    public static final String INSTANCE_ID_FIELD = "instanceId";
    public static final String LAST_CHECKIN_TIME_FIELD = "lastCheckinTime";
    public static final String CHECKIN_INTERVAL_FIELD = "checkinInterval";
    public static final String RECOVERER_FIELD = "recoverer";

    private final DocumentCollection schedulerCollection;

    public final String schedulerName;
    public final String instanceId;
    public final long clusterCheckinIntervalMillis;

    public SchedulerDao(DocumentCollection schedulerCollection, String schedulerName,
                        String instanceId, long clusterCheckinIntervalMillis) {
        this.schedulerCollection = schedulerCollection;
        this.schedulerName = schedulerName;
        this.instanceId = instanceId;
        this.clusterCheckinIntervalMillis = clusterCheckinIntervalMillis;
    }

    public void createIndex() {
        schedulerCollection.createUniqueIndex(SCHEDULER_NAME_FIELD, INSTANCE_ID_FIELD);
    }

    /**
     * Inserts the check-in record of this instance.
     */
    public void insertSelf(Session session, long checkinTime) {
        log.debug("Inserting node data: name='{}', id='{}', checkin time={}, interval={}",
                schedulerName, instanceId, checkinTime, clusterCheckinIntervalMillis);
        schedulerCollection.insertOne(session, new Document(SCHEDULER_NAME_FIELD, schedulerName)
                .append(INSTANCE_ID_FIELD, instanceId)
                .append(LAST_CHECKIN_TIME_FIELD, checkinTime)
                .append(CHECKIN_INTERVAL_FIELD, clusterCheckinIntervalMillis)
                .append(RECOVERER_FIELD, null));
    }

    /**
     * Checks-in in cluster to inform other nodes that its alive.
     *
     * @return number of updated records, zero when this instance has none
     */
    public long checkIn(Session session, long checkinTime) {
        log.debug("Saving node data: name='{}', id='{}', checkin time={}, interval={}",
                schedulerName, instanceId, checkinTime, clusterCheckinIntervalMillis);
        return schedulerCollection.updateMany(session, createSchedulerFilter(instanceId),
                new Document(LAST_CHECKIN_TIME_FIELD, checkinTime)
                        .append(CHECKIN_INTERVAL_FIELD, clusterCheckinIntervalMillis));
    }

    /**
     * @return Scheduler or null when not found
     */
    public Scheduler findInstance(Session session, String instanceId) {
        Document doc = schedulerCollection.first(session, createSchedulerFilter(instanceId));
        if (doc == null) {
            log.debug("Scheduler instance '{}' not found.", instanceId);
            return null;
        }
        return toScheduler(doc);
    }

    public boolean isNotSelf(Scheduler scheduler) {
        return !instanceId.equals(scheduler.getInstanceId());
    }

    /**
     * Return all scheduler instances in ascending order by last check-in time.
     */
    public List<Scheduler> getAllByCheckinTime(Session session) {
        final List<Scheduler> schedulers = new LinkedList<>();
        for (Document doc : schedulerCollection.find(session,
                Filters.eq(SCHEDULER_NAME_FIELD, schedulerName),
                Sorts.ascending(LAST_CHECKIN_TIME_FIELD), 0)) {
            schedulers.add(toScheduler(doc));
        }
        return schedulers;
    }

    /**
     * Marks this instance as the recoverer of the failed one, unless another
     * instance claimed it first.
     *
     * @return if the claim succeeded
     */
    public boolean claim(Session session, String failedInstanceId) {
        return schedulerCollection.updateMany(session,
                Filters.and(createSchedulerFilter(failedInstanceId),
                        Filters.or(Filters.eq(RECOVERER_FIELD, null), Filters.eq(RECOVERER_FIELD, instanceId))),
                new Document(RECOVERER_FIELD, instanceId)) > 0;
    }

    /**
     * Remove selected scheduler instance entry from database.
     *
     * @return when removed successfully
     */
    public boolean remove(Session session, String instanceId) {
        log.info("Removing scheduler: {},{}", schedulerName, instanceId);
        return schedulerCollection.deleteMany(session, createSchedulerFilter(instanceId)) > 0;
    }

    private Bson createSchedulerFilter(String instanceId) {
        return Filters.and(
                Filters.eq(SCHEDULER_NAME_FIELD, schedulerName),
                Filters.eq(INSTANCE_ID_FIELD, instanceId));
    }

    private Scheduler toScheduler(Document document) {
        return new Scheduler(
                document.getString(SCHEDULER_NAME_FIELD),
                document.getString(INSTANCE_ID_FIELD),
                document.getLong(LAST_CHECKIN_TIME_FIELD),
                document.getLong(CHECKIN_INTERVAL_FIELD),
                document.getString(RECOVERER_FIELD));
    }
}
