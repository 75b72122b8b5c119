package com.novemberain.quartz.store;

import org.bson.Document;
import org.quartz.*;
import org.quartz.spi.ClassLoadHelper;

import static com.novemberain.quartz.store.util.Keys.KEY_GROUP;
import static com.novemberain.quartz.store.util.Keys.KEY_NAME;

public class JobConverter {

    public static final String JOB_DURABILITY = "durability";
    public static final String JOB_REQUESTS_RECOVERY = "requestsRecovery";
    public static final String JOB_CONCURRENT_EXECUTION_DISALLOWED = "concurrentExecutionDisallowed";
    private static final String JOB_PERSIST_DATA_AFTER_EXECUTION = "persistJobDataAfterExecution";
    private static final String JOB_CLASS = "jobClass";
    private static final String JOB_DESCRIPTION = "jobDescription";

    private final ClassLoadHelper loadHelper;
    private final JobDataConverter jobDataConverter;

    public JobConverter(ClassLoadHelper loadHelper, JobDataConverter jobDataConverter) {
        this.loadHelper = loadHelper;
        this.jobDataConverter = jobDataConverter;
    }

    /**
     * Converts job detail into document.
     * The concurrency flags are stored too, so they can be read without
     * loading the job class.
     */
    public Document toDocument(JobDetail newJob) throws JobPersistenceException {
        Document job = new Document();
        job.put(KEY_NAME, newJob.getKey().getName());
        job.put(KEY_GROUP, newJob.getKey().getGroup());
        job.put(JOB_DESCRIPTION, newJob.getDescription());
        job.put(JOB_CLASS, newJob.getJobClass().getName());
        job.put(JOB_DURABILITY, newJob.isDurable());
        job.put(JOB_REQUESTS_RECOVERY, newJob.requestsRecovery());
        job.put(JOB_CONCURRENT_EXECUTION_DISALLOWED, newJob.isConcurrentExectionDisallowed());
        job.put(JOB_PERSIST_DATA_AFTER_EXECUTION, newJob.isPersistJobDataAfterExecution());
        jobDataConverter.toDocument(newJob.getJobDataMap(), job);
        return job;
    }

    /**
     * Converts from document to job detail.
     *
     * @throws CorruptJobDataException when the job class cannot be loaded
     * or the job data cannot be decoded
     */
    public JobDetail toJobDetail(Document doc) throws JobPersistenceException {
        String className = doc.getString(JOB_CLASS);
        Class<? extends Job> jobClass;
        try {
            // Subclasses of the store may plug in their own class loading.
            jobClass = loadHelper.getClassLoader().loadClass(className).asSubclass(Job.class);
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new CorruptJobDataException("Could not load job class " + className, e);
        }

        JobDataMap jobData = new JobDataMap();
        jobDataConverter.toJobData(doc, jobData);

        JobDetail job = JobBuilder.newJob(jobClass)
                .withIdentity(doc.getString(KEY_NAME), doc.getString(KEY_GROUP))
                .withDescription(doc.getString(JOB_DESCRIPTION))
                .storeDurably(doc.getBoolean(JOB_DURABILITY, false))
                .requestRecovery(doc.getBoolean(JOB_REQUESTS_RECOVERY, false))
                .usingJobData(jobData)
                .build();
        job.getJobDataMap().clearDirtyFlag();
        return job;
    }

    /**
     * Returns a copy of the job document carrying the given job data.
     */
    public Document withJobData(Document job, JobDataMap jobData) throws JobPersistenceException {
        Document updated = new Document(job);
        updated.remove(Constants.JOB_DATA);
        updated.remove(Constants.JOB_DATA_PLAIN);
        jobDataConverter.toDocument(jobData, updated);
        return updated;
    }

    public static boolean isDurable(Document job) {
        return job.getBoolean(JOB_DURABILITY, false);
    }

    public static boolean requestsRecovery(Document job) {
        return job.getBoolean(JOB_REQUESTS_RECOVERY, false);
    }

    public static boolean isConcurrentExecutionDisallowed(Document job) {
        return job.getBoolean(JOB_CONCURRENT_EXECUTION_DISALLOWED, false);
    }
}
