package com.novemberain.quartz.store.dao;

import com.mongodb.client.model.Filters;
import com.novemberain.quartz.store.db.DocumentCollection;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.trigger.FiredTriggerRecord;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Records of triggers acquired or executing, one per firing. Job fields
 * are filled once the trigger fires.
 */
public class FiredTriggerDao {

    static final String FIRE_INSTANCE_ID = "fireInstanceId";
    static final String INSTANCE_ID = "instanceId";
    static final String TRIGGER_NAME = "triggerName";
    static final String TRIGGER_GROUP = "triggerGroup";
    static final String JOB_NAME = "jobName";
    static final String JOB_GROUP = "jobGroup";
    static final String FIRED_TIME = "firedTime";
    static final String SCHEDULED_TIME = "scheduledTime";
    static final String PRIORITY = "priority";
    static final String STATE = "state";
    static final String CONCURRENT_EXECUTION_DISALLOWED = "concurrentExecutionDisallowed";
    static final String REQUESTS_RECOVERY = "requestsRecovery";

    private final DocumentCollection firedTriggerCollection;

    public FiredTriggerDao(DocumentCollection firedTriggerCollection) {
        this.firedTriggerCollection = firedTriggerCollection;
    }

    public void createIndex() {
        firedTriggerCollection.createUniqueIndex(FIRE_INSTANCE_ID);
    }

    /**
     * Records a firing of the trigger.
     *
     * @param job job of the trigger, may be null
     */
    public void insert(Session session, String instanceId, OperableTrigger trigger,
                       String state, JobDetail job, Date firedTime) {
        Document doc = new Document(FIRE_INSTANCE_ID, trigger.getFireInstanceId())
                .append(INSTANCE_ID, instanceId)
                .append(TRIGGER_NAME, trigger.getKey().getName())
                .append(TRIGGER_GROUP, trigger.getKey().getGroup())
                .append(FIRED_TIME, firedTime)
                .append(SCHEDULED_TIME, trigger.getNextFireTime())
                .append(PRIORITY, trigger.getPriority())
                .append(STATE, state);
        appendJob(doc, job);
        firedTriggerCollection.insertOne(session, doc);
    }

    public long updateFiredTrigger(Session session, OperableTrigger trigger, String state,
                                   JobDetail job, Date firedTime) {
        Document fields = new Document(STATE, state)
                .append(FIRED_TIME, firedTime)
                .append(PRIORITY, trigger.getPriority());
        appendJob(fields, job);
        return firedTriggerCollection.updateMany(session,
                Filters.eq(FIRE_INSTANCE_ID, trigger.getFireInstanceId()), fields);
    }

    private void appendJob(Document doc, JobDetail job) {
        if (job == null) {
            return;
        }
        doc.append(JOB_NAME, job.getKey().getName())
                .append(JOB_GROUP, job.getKey().getGroup())
                .append(CONCURRENT_EXECUTION_DISALLOWED, job.isConcurrentExectionDisallowed())
                .append(REQUESTS_RECOVERY, job.requestsRecovery());
    }

    public boolean remove(Session session, String fireInstanceId) {
        return firedTriggerCollection.deleteMany(session, Filters.eq(FIRE_INSTANCE_ID, fireInstanceId)) > 0;
    }

    public long removeAll(Session session) {
        return firedTriggerCollection.deleteMany(session, Filters.empty());
    }

    public long removeByInstance(Session session, String instanceId) {
        return firedTriggerCollection.deleteMany(session, Filters.eq(INSTANCE_ID, instanceId));
    }

    public List<FiredTriggerRecord> findByTrigger(Session session, TriggerKey key) {
        return toRecords(firedTriggerCollection.find(session, Filters.and(
                Filters.eq(TRIGGER_GROUP, key.getGroup()),
                Filters.eq(TRIGGER_NAME, key.getName()))));
    }

    public boolean existsForTrigger(Session session, TriggerKey key) {
        return firedTriggerCollection.count(session, Filters.and(
                Filters.eq(TRIGGER_GROUP, key.getGroup()),
                Filters.eq(TRIGGER_NAME, key.getName()))) > 0;
    }

    public List<FiredTriggerRecord> findByJob(Session session, JobKey jobKey) {
        return toRecords(firedTriggerCollection.find(session, byJob(jobKey)));
    }

    public List<FiredTriggerRecord> findByInstance(Session session, String instanceId) {
        return toRecords(firedTriggerCollection.find(session, Filters.eq(INSTANCE_ID, instanceId)));
    }

    public List<FiredTriggerRecord> findAll(Session session) {
        return toRecords(firedTriggerCollection.find(session, Filters.empty()));
    }

    /**
     * @return ids of the instances owning fired records
     */
    public Set<String> findInstanceNames(Session session) {
        return new HashSet<>(firedTriggerCollection.distinct(session, INSTANCE_ID, Filters.empty(), String.class));
    }

    private Bson byJob(JobKey jobKey) {
        return Filters.and(
                Filters.eq(JOB_GROUP, jobKey.getGroup()),
                Filters.eq(JOB_NAME, jobKey.getName()));
    }

    private List<FiredTriggerRecord> toRecords(List<Document> docs) {
        List<FiredTriggerRecord> records = new ArrayList<>(docs.size());
        for (Document doc : docs) {
            records.add(toRecord(doc));
        }
        return records;
    }

    private FiredTriggerRecord toRecord(Document doc) {
        String jobName = doc.getString(JOB_NAME);
        JobKey jobKey = jobName == null ? null : new JobKey(jobName, doc.getString(JOB_GROUP));
        return new FiredTriggerRecord(
                doc.getString(FIRE_INSTANCE_ID),
                doc.getString(INSTANCE_ID),
                new TriggerKey(doc.getString(TRIGGER_NAME), doc.getString(TRIGGER_GROUP)),
                jobKey,
                doc.getDate(FIRED_TIME),
                doc.getDate(SCHEDULED_TIME),
                doc.getInteger(PRIORITY, 5),
                doc.getString(STATE),
                doc.getBoolean(CONCURRENT_EXECUTION_DISALLOWED, false),
                doc.getBoolean(REQUESTS_RECOVERY, false));
    }
}
