package com.novemberain.quartz.store.dao;

import com.mongodb.client.model.Filters;
import com.novemberain.quartz.store.JobConverter;
import com.novemberain.quartz.store.db.DocumentCollection;
import com.novemberain.quartz.store.db.DuplicateKeyException;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.util.Keys;
import com.novemberain.quartz.store.util.QueryHelper;
import org.bson.Document;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.impl.matchers.GroupMatcher;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.novemberain.quartz.store.util.Keys.KEY_GROUP;
import static com.novemberain.quartz.store.util.Keys.toFilter;

public class JobDao {

    private final DocumentCollection jobCollection;
    private final QueryHelper queryHelper;
    private final JobConverter jobConverter;

    public JobDao(DocumentCollection jobCollection,
                  QueryHelper queryHelper, JobConverter jobConverter) {
        this.jobCollection = jobCollection;
        this.queryHelper = queryHelper;
        this.jobConverter = jobConverter;
    }

    public void createIndex() {
        jobCollection.createUniqueIndex(Keys.KEY_GROUP, Keys.KEY_NAME);
    }

    public long clear(Session session) {
        return jobCollection.deleteMany(session, Filters.empty());
    }

    public boolean exists(Session session, JobKey jobKey) {
        return jobCollection.count(session, toFilter(jobKey)) > 0;
    }

    /**
     * @return stored job document or null
     */
    public Document getJob(Session session, JobKey key) {
        return jobCollection.first(session, toFilter(key));
    }

    public int getCount(Session session) {
        return (int) jobCollection.count(session, Filters.empty());
    }

    public List<String> getGroupNames(Session session) {
        return new ArrayList<>(jobCollection.distinct(session, KEY_GROUP, Filters.empty(), String.class));
    }

    public Set<JobKey> getJobKeys(Session session, GroupMatcher<JobKey> matcher) {
        Set<JobKey> keys = new HashSet<>();
        for (Document doc : jobCollection.find(session, queryHelper.matchingKeysConditionFor(matcher))) {
            keys.add(Keys.toJobKey(doc));
        }
        return keys;
    }

    public void insert(Session session, JobDetail newJob) throws JobPersistenceException {
        Document job = jobConverter.toDocument(newJob);
        try {
            jobCollection.insertOne(session, job);
        } catch (DuplicateKeyException e) {
            throw new ObjectAlreadyExistsException(newJob);
        }
    }

    /**
     * @return if the job existed and was replaced
     */
    public boolean replace(Session session, JobDetail job) throws JobPersistenceException {
        return jobCollection.replaceOne(session, toFilter(job.getKey()), jobConverter.toDocument(job)) > 0;
    }

    /**
     * Replaces the stored job data map of the job, leaving its other attributes.
     *
     * @return if the job exists
     */
    public boolean updateJobData(Session session, JobKey jobKey, JobDataMap jobData)
            throws JobPersistenceException {
        Document job = getJob(session, jobKey);
        if (job == null) {
            return false;
        }
        return jobCollection.replaceOne(session, toFilter(jobKey), jobConverter.withJobData(job, jobData)) > 0;
    }

    public boolean remove(Session session, JobKey jobKey) {
        return jobCollection.deleteMany(session, toFilter(jobKey)) > 0;
    }

    /**
     * @return job detail or null when there is no such job
     * @throws JobPersistenceException when the stored job cannot be read
     */
    public JobDetail retrieveJob(Session session, JobKey jobKey) throws JobPersistenceException {
        Document doc = getJob(session, jobKey);
        if (doc == null) {
            //Return null if job does not exist, per interface
            return null;
        }
        return jobConverter.toJobDetail(doc);
    }
}
