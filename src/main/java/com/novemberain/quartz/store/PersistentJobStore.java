package com.novemberain.quartz.store;

import com.novemberain.quartz.store.TransactionTemplate.TransactionCallback;
import com.novemberain.quartz.store.TransactionTemplate.TransactionValidator;
import com.novemberain.quartz.store.db.Database;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.util.Clock;
import org.quartz.*;
import org.quartz.Calendar;
import org.quartz.Trigger.CompletedExecutionInstruction;
import org.quartz.Trigger.TriggerState;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Quartz job store keeping jobs, triggers and calendars in a transactional
 * {@link Database}, by default MongoDB configured with {@link #setMongoUri(String)}
 * or {@link #setAddresses(String)} and {@link #setDbName(String)}. Several schedulers
 * sharing the database form a cluster when
 * {@link #setIsClustered(boolean) clustered}: each trigger fires on exactly one of
 * them, and the work of an instance that stops checking in is taken over by the others.
 */
public class PersistentJobStore implements JobStore, Constants {

    private static final Logger log = LoggerFactory.getLogger(PersistentJobStore.class);

    private final StoreAssembler assembler = new StoreAssembler();

    Database database;
    String databaseClass;
    String mongoUri;
    String[] addresses;
    String dbName;
    String username;
    String password;
    String authDbName;
    Integer mongoOptionMaxConnections;
    Integer mongoOptionConnectTimeoutMillis;
    Integer mongoOptionSocketTimeoutMillis;
    Boolean mongoOptionEnableSSL;
    Boolean mongoOptionSslInvalidHostNameAllowed;
    int mongoOptionWriteConcernTimeoutMillis = 5000;
    String mongoOptionWriteConcernW;
    String transientErrorClassifierClass;
    String collectionPrefix = "quartz_";
    String schedulerName = "QuartzScheduler";
    String instanceId = "NON_CLUSTERED";
    private boolean clustered = false;
    long clusterCheckinIntervalMillis = 7500;
    long misfireThreshold = 60000;
    int maxMisfiresToHandleAtATime = 20;
    long dbRetryIntervalMillis = 15000;
    boolean lockOnInsert = true;
    boolean useDBLocks = false;
    boolean acquireTriggersWithinLock = true;
    boolean doubleCheckLockMisfireHandler = true;
    int retryableActionErrorLogThreshold = 4;
    long lockRetryPeriodMillis = 1000;
    int lockMaxRetry = 3;
    long shutdownTimeoutMillis = 5000;
    boolean jobDataAsBase64 = true;
    Clock clock = Clock.SYSTEM_CLOCK;

    private volatile boolean shutdown;

    public PersistentJobStore() {
    }

    /**
     * @param database store to keep the scheduling data in, stays open on shutdown
     */
    public PersistentJobStore(final Database database) {
        this.database = database;
    }

    /**
     * Override to change class loading mechanism, to e.g. dynamic
     * @param original    default provided by Quartz
     * @return loader to use for loading of Quartz Jobs' classes
     */
    protected ClassLoadHelper getClassLoaderHelper(ClassLoadHelper original) {
        return original;
    }

    @Override
    public void initialize(ClassLoadHelper loadHelper, SchedulerSignaler signaler)
            throws SchedulerConfigException {
        assembler.build(this, loadHelper, signaler);
        log.info("Job store of scheduler {} (instance {}) initialized, clustered: {}",
                schedulerName, instanceId, clustered);
    }

    @Override
    public void schedulerStarted() throws SchedulerException {
        if (isClustered()) {
            assembler.clusterManager.initialize();
        } else {
            try {
                recoverJobs();
            } catch (SchedulerException se) {
                throw new SchedulerConfigException("Failure occured during job recovery.", se);
            }
        }
        assembler.misfireScanner.start(0L);
        assembler.triggerStateManager.setSchedulerRunning(true);
    }

    @Override
    public void schedulerPaused() {
        assembler.triggerStateManager.setSchedulerRunning(false);
    }

    @Override
    public void schedulerResumed() {
        assembler.triggerStateManager.setSchedulerRunning(true);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        assembler.misfireScanner.shutdown(shutdownTimeoutMillis);
        if (assembler.clusterManager != null) {
            assembler.clusterManager.shutdown(shutdownTimeoutMillis);
        }
        assembler.transactionTemplate.shutdown();
        if (assembler.ownsDatabase) {
            assembler.database.close();
        }
        log.info("Job store of scheduler {} (instance {}) shut down", schedulerName, instanceId);
    }

    @Override
    public boolean supportsPersistence() {
        return true;
    }

    @Override
    public long getEstimatedTimeToReleaseAndAcquireTrigger() {
        // this will vary...
        return 200;
    }

    @Override
    public boolean isClustered() {
        return clustered;
    }

    /**
     * Pause before the scheduler retries acquiring triggers after a failure.
     */
    public long getAcquireRetryDelay(int failureCount) {
        return dbRetryIntervalMillis;
    }

    /**
     * Recovers the state left by the previous run of a non-clustered scheduler.
     */
    protected void recoverJobs() throws JobPersistenceException {
        executeInLock(LOCK_TRIGGER_ACCESS, new TransactionCallback<Void>() {
            @Override
            public Void execute(Session session) throws JobPersistenceException {
                assembler.triggerRecoverer.recoverJobs(session);
                return null;
            }
        });
    }

    /**
     * Job and Trigger storage Methods
     */
    @Override
    public void storeJobAndTrigger(final JobDetail newJob, final OperableTrigger newTrigger)
            throws JobPersistenceException {
        executeInLock(lockOnInsert ? LOCK_TRIGGER_ACCESS : null, session -> {
            assembler.persister.storeJobAndTrigger(session, newJob, newTrigger);
            return null;
        });
    }

    @Override
    public void storeJob(final JobDetail newJob, final boolean replaceExisting)
            throws JobPersistenceException {
        executeInLock(insertLock(replaceExisting), session -> {
            assembler.persister.storeJob(session, newJob, replaceExisting);
            return null;
        });
    }

    @Override
    public void storeJobsAndTriggers(final Map<JobDetail, Set<? extends Trigger>> triggersAndJobs,
                                     final boolean replace) throws JobPersistenceException {
        executeInLock(insertLock(replace), session -> {
            assembler.persister.storeJobsAndTriggers(session, triggersAndJobs, replace);
            return null;
        });
    }

    @Override
    public boolean removeJob(final JobKey jobKey) throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS, session -> assembler.persister.removeJob(session, jobKey));
    }

    @Override
    public boolean removeJobs(final List<JobKey> jobKeys) throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS, session -> assembler.persister.removeJobs(session, jobKeys));
    }

    @Override
    public JobDetail retrieveJob(final JobKey jobKey) throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.retrieveJob(session, jobKey));
    }

    @Override
    public void storeTrigger(final OperableTrigger newTrigger, final boolean replaceExisting)
            throws JobPersistenceException {
        executeInLock(insertLock(replaceExisting), session -> {
            assembler.persister.storeTrigger(session, newTrigger, replaceExisting);
            return null;
        });
    }

    @Override
    public boolean removeTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS, session -> assembler.persister.removeTrigger(session, triggerKey));
    }

    @Override
    public boolean removeTriggers(final List<TriggerKey> triggerKeys) throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS,
                session -> assembler.persister.removeTriggers(session, triggerKeys));
    }

    @Override
    public boolean replaceTrigger(final TriggerKey triggerKey, final OperableTrigger newTrigger)
            throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS,
                session -> assembler.persister.replaceTrigger(session, triggerKey, newTrigger));
    }

    @Override
    public OperableTrigger retrieveTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.retrieveTrigger(session, triggerKey));
    }

    @Override
    public boolean checkExists(final JobKey jobKey) throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.checkExists(session, jobKey));
    }

    @Override
    public boolean checkExists(final TriggerKey triggerKey) throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.checkExists(session, triggerKey));
    }

    @Override
    public void clearAllSchedulingData() throws JobPersistenceException {
        executeInLock(LOCK_TRIGGER_ACCESS, session -> {
            assembler.persister.clearAllSchedulingData(session);
            assembler.calendarManager.clearCache();
            return null;
        });
    }

    @Override
    public void storeCalendar(final String name, final Calendar calendar, final boolean replaceExisting,
                              final boolean updateTriggers) throws JobPersistenceException {
        String lockName = updateTriggers ? LOCK_TRIGGER_ACCESS : (lockOnInsert ? LOCK_CALENDAR_ACCESS : null);
        executeInLock(lockName, session -> {
            assembler.calendarManager.storeCalendar(session, name, calendar, replaceExisting, updateTriggers);
            return null;
        });
    }

    @Override
    public boolean removeCalendar(final String calName) throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS,
                session -> assembler.calendarManager.removeCalendar(session, calName));
    }

    @Override
    public Calendar retrieveCalendar(final String calName) throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.calendarManager.retrieveCalendar(session, calName));
    }

    @Override
    public int getNumberOfJobs() throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.getNumberOfJobs(session));
    }

    @Override
    public int getNumberOfTriggers() throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.getNumberOfTriggers(session));
    }

    @Override
    public int getNumberOfCalendars() throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.calendarManager.getNumberOfCalendars(session));
    }

    @Override
    public Set<JobKey> getJobKeys(final GroupMatcher<JobKey> matcher) throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.getJobKeys(session, matcher));
    }

    @Override
    public Set<TriggerKey> getTriggerKeys(final GroupMatcher<TriggerKey> matcher) throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.getTriggerKeys(session, matcher));
    }

    @Override
    public List<String> getJobGroupNames() throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.getJobGroupNames(session));
    }

    @Override
    public List<String> getTriggerGroupNames() throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.getTriggerGroupNames(session));
    }

    @Override
    public List<String> getCalendarNames() throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.calendarManager.getCalendarNames(session));
    }

    @Override
    public List<OperableTrigger> getTriggersForJob(final JobKey jobKey) throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.persister.getTriggersForJob(session, jobKey));
    }

    @Override
    public TriggerState getTriggerState(final TriggerKey triggerKey) throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.triggerStateManager.getState(session, triggerKey));
    }

    /**
     * Moves a trigger in the ERROR state back to WAITING, or to PAUSED when its
     * group is paused.
     */
    public void resetTriggerFromErrorState(final TriggerKey triggerKey) throws JobPersistenceException {
        executeInLock(LOCK_TRIGGER_ACCESS, session -> {
            assembler.triggerStateManager.resetTriggerFromErrorState(session, triggerKey);
            return null;
        });
    }

    @Override
    public void pauseTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
        executeInLock(LOCK_TRIGGER_ACCESS, session -> {
            assembler.triggerStateManager.pause(session, triggerKey);
            return null;
        });
    }

    @Override
    public Collection<String> pauseTriggers(final GroupMatcher<TriggerKey> matcher) throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS, session -> assembler.triggerStateManager.pause(session, matcher));
    }

    @Override
    public void resumeTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
        executeInLock(LOCK_TRIGGER_ACCESS, session -> {
            assembler.triggerStateManager.resume(session, triggerKey);
            return null;
        });
    }

    @Override
    public Collection<String> resumeTriggers(final GroupMatcher<TriggerKey> matcher) throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS, session -> assembler.triggerStateManager.resume(session, matcher));
    }

    @Override
    public Set<String> getPausedTriggerGroups() throws JobPersistenceException {
        return executeWithoutLock(session -> assembler.triggerStateManager.getPausedTriggerGroups(session));
    }

    @Override
    public void pauseAll() throws JobPersistenceException {
        executeInLock(LOCK_TRIGGER_ACCESS, session -> {
            assembler.triggerStateManager.pauseAll(session);
            return null;
        });
    }

    @Override
    public void resumeAll() throws JobPersistenceException {
        executeInLock(LOCK_TRIGGER_ACCESS, session -> {
            assembler.triggerStateManager.resumeAll(session);
            return null;
        });
    }

    @Override
    public void pauseJob(final JobKey jobKey) throws JobPersistenceException {
        executeInLock(LOCK_TRIGGER_ACCESS, session -> {
            assembler.triggerStateManager.pauseJob(session, jobKey);
            return null;
        });
    }

    @Override
    public Collection<String> pauseJobs(final GroupMatcher<JobKey> groupMatcher) throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS,
                session -> assembler.triggerStateManager.pauseJobs(session, groupMatcher));
    }

    @Override
    public void resumeJob(final JobKey jobKey) throws JobPersistenceException {
        executeInLock(LOCK_TRIGGER_ACCESS, session -> {
            assembler.triggerStateManager.resumeJob(session, jobKey);
            return null;
        });
    }

    @Override
    public Collection<String> resumeJobs(final GroupMatcher<JobKey> groupMatcher) throws JobPersistenceException {
        return executeInLock(LOCK_TRIGGER_ACCESS,
                session -> assembler.triggerStateManager.resumeJobs(session, groupMatcher));
    }

    @Override
    public List<OperableTrigger> acquireNextTriggers(final long noLaterThan, final int maxCount,
                                                     final long timeWindow) throws JobPersistenceException {
        // Without the lock, concurrent acquisition relies on compare-and-set alone.
        String lockName = (acquireTriggersWithinLock || maxCount > 1) ? LOCK_TRIGGER_ACCESS : null;
        return assembler.transactionTemplate.executeInLock(lockName,
                new TransactionCallback<List<OperableTrigger>>() {
                    @Override
                    public List<OperableTrigger> execute(Session session) throws JobPersistenceException {
                        return assembler.triggerRunner.acquireNextTriggers(session, noLaterThan, maxCount,
                                timeWindow);
                    }
                },
                new TransactionValidator<List<OperableTrigger>>() {
                    @Override
                    public Boolean validate(Session session, List<OperableTrigger> result) {
                        return assembler.triggerRunner.isAnyRecorded(session, result);
                    }
                });
    }

    @Override
    public void releaseAcquiredTrigger(final OperableTrigger trigger) {
        assembler.transactionTemplate.retryExecuteInLock(LOCK_TRIGGER_ACCESS, new TransactionCallback<Void>() {
            @Override
            public Void execute(Session session) {
                assembler.triggerRunner.releaseAcquiredTrigger(session, trigger);
                return null;
            }

            @Override
            public String toString() {
                return "releasing acquired trigger " + trigger.getKey();
            }
        });
    }

    @Override
    public List<TriggerFiredResult> triggersFired(final List<OperableTrigger> triggers)
            throws JobPersistenceException {
        return assembler.transactionTemplate.executeInLock(LOCK_TRIGGER_ACCESS,
                new TransactionCallback<List<TriggerFiredResult>>() {
                    @Override
                    public List<TriggerFiredResult> execute(Session session) {
                        return assembler.triggerRunner.triggersFired(session, triggers);
                    }
                },
                new TransactionValidator<List<TriggerFiredResult>>() {
                    @Override
                    public Boolean validate(Session session, List<TriggerFiredResult> result) {
                        return assembler.triggerRunner.areAllExecuting(session, result);
                    }
                });
    }

    @Override
    public void triggeredJobComplete(final OperableTrigger trigger, final JobDetail job,
                                     final CompletedExecutionInstruction triggerInstCode) {
        assembler.transactionTemplate.retryExecuteInLock(LOCK_TRIGGER_ACCESS, new TransactionCallback<Void>() {
            @Override
            public Void execute(Session session) throws JobPersistenceException {
                assembler.jobCompleteHandler.jobComplete(session, trigger, job, triggerInstCode);
                return null;
            }

            @Override
            public String toString() {
                return "completing job " + job.getKey() + " fired by " + trigger.getKey();
            }
        });
    }

    @Override
    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void setInstanceName(String schedName) {
        // Used as part of cluster node identifier:
        schedulerName = schedName;
    }

    @Override
    public void setThreadPoolSize(int poolSize) {
        // No-op
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Set whether this instance is part of a cluster.
     */
    public void setIsClustered(boolean isClustered) {
        this.clustered = isClustered;
    }

    /**
     * Set the frequency (in milliseconds) at which this instance "checks-in"
     * with the other instances of the cluster.
     *
     * Affects the rate of detecting failed instances.
     */
    public void setClusterCheckinInterval(long clusterCheckinInterval) {
        this.clusterCheckinIntervalMillis = clusterCheckinInterval;
    }

    /**
     * The number of milliseconds the scheduler will 'tolerate' a trigger to
     * pass its next-fire-time by, before being considered "misfired".
     */
    public void setMisfireThreshold(long misfireThreshold) {
        if (misfireThreshold < 1) {
            throw new IllegalArgumentException("Misfirethreshold must be larger than 0");
        }
        this.misfireThreshold = misfireThreshold;
    }

    /**
     * Maximum number of misfired triggers handled in one transaction.
     */
    public void setMaxMisfiresToHandleAtATime(int maxToHandle) {
        this.maxMisfiresToHandleAtATime = maxToHandle;
    }

    /**
     * Pause between retries of background work and released or completed triggers
     * after a store failure.
     */
    public void setDbRetryInterval(long dbRetryInterval) {
        this.dbRetryIntervalMillis = dbRetryInterval;
    }

    /**
     * Whether inserting jobs, triggers and calendars takes a lock.
     */
    public void setLockOnInsert(boolean lockOnInsert) {
        this.lockOnInsert = lockOnInsert;
    }

    /**
     * Lock in the database even when not clustered.
     */
    public void setUseDBLocks(boolean useDBLocks) {
        this.useDBLocks = useDBLocks;
    }

    public void setAcquireTriggersWithinLock(boolean acquireTriggersWithinLock) {
        this.acquireTriggersWithinLock = acquireTriggersWithinLock;
    }

    /**
     * Whether the misfire scan counts misfires before taking the lock.
     */
    public void setDoubleCheckLockMisfireHandler(boolean doubleCheckLockMisfireHandler) {
        this.doubleCheckLockMisfireHandler = doubleCheckLockMisfireHandler;
    }

    public void setRetryableActionErrorLogThreshold(int retryableActionErrorLogThreshold) {
        this.retryableActionErrorLogThreshold = retryableActionErrorLogThreshold;
    }

    public void setLockRetryPeriod(long lockRetryPeriod) {
        this.lockRetryPeriodMillis = lockRetryPeriod;
    }

    public void setLockMaxRetry(int lockMaxRetry) {
        this.lockMaxRetry = lockMaxRetry;
    }

    /**
     * How long shutdown waits for each background loop to stop.
     */
    public void setShutdownTimeout(long shutdownTimeout) {
        this.shutdownTimeoutMillis = shutdownTimeout;
    }

    public void setCollectionPrefix(String prefix) {
        collectionPrefix = prefix;
    }

    public void setMongoUri(final String mongoUri) {
        this.mongoUri = mongoUri;
    }

    /**
     * @param addresses comma separated host:port list
     */
    public void setAddresses(String addresses) {
        this.addresses = addresses.split(",");
    }

    public void setDbName(String dbName) {
        this.dbName = dbName;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public void setAuthDbName(String authDbName) {
        this.authDbName = authDbName;
    }

    public void setMongoOptionMaxConnections(int maxConnections) {
        this.mongoOptionMaxConnections = maxConnections;
    }

    public void setMongoOptionConnectTimeoutMillis(int connectTimeoutMillis) {
        this.mongoOptionConnectTimeoutMillis = connectTimeoutMillis;
    }

    public void setMongoOptionSocketTimeoutMillis(int socketTimeoutMillis) {
        this.mongoOptionSocketTimeoutMillis = socketTimeoutMillis;
    }

    public void setMongoOptionEnableSSL(boolean enableSSL) {
        this.mongoOptionEnableSSL = enableSSL;
    }

    public void setMongoOptionSslInvalidHostNameAllowed(boolean sslInvalidHostNameAllowed) {
        this.mongoOptionSslInvalidHostNameAllowed = sslInvalidHostNameAllowed;
    }

    public void setMongoOptionWriteConcernTimeoutMillis(int writeConcernTimeoutMillis) {
        this.mongoOptionWriteConcernTimeoutMillis = writeConcernTimeoutMillis;
    }

    /**
     * @param writeConcernW write concern name, e.g. "majority" (default) or "w1"
     */
    public void setMongoOptionWriteConcernW(String writeConcernW) {
        this.mongoOptionWriteConcernW = writeConcernW;
    }

    /**
     * Class name of the {@link Database} to create instead of connecting to MongoDB,
     * when none was passed to the constructor. It needs a public no-arg constructor.
     */
    public void setDatabaseClass(String databaseClass) {
        this.databaseClass = databaseClass;
    }

    /**
     * Class name of the {@link TransientErrorClassifier} to use instead of
     * {@link DefaultTransientErrorClassifier}.
     */
    public void setTransientErrorClassifierClass(String transientErrorClassifierClass) {
        this.transientErrorClassifierClass = transientErrorClassifierClass;
    }

    public boolean isJobDataAsBase64() {
        return jobDataAsBase64;
    }

    /**
     * Configures the way job data is stored. {@link JobDetail}'s
     * or {@link Trigger}'s {@link JobDataMap} can be represented
     * as a {@code Map<String,Object>}.
     * <ul>
     * <li><b>{@code true}</b> (default) - Serialize map with
     * {@link java.io.ObjectOutputStream ObjectOutputStream}
     * and store as {@code base64} encoded string in field
     * '{@value Constants#JOB_DATA}'. Map may contain any
     * {@link java.io.Serializable Serializable} object
     * internally, but will have some performance impact.</li>
     * <li><b>{@code false}</b> - Store map directly in
     * '{@value Constants#JOB_DATA_PLAIN}' field. Use this
     * option is you only store simple types in job data
     * map for better performance.</li>
     * </ul>
     */
    public void setJobDataAsBase64(boolean jobDataAsBase64) {
        this.jobDataAsBase64 = jobDataAsBase64;
    }

    // for tests only
    public void setClock(Clock clock) {
        this.clock = clock;
    }

    // for tests only
    public StoreAssembler getAssembler() {
        return assembler;
    }

    private String insertLock(boolean replaceExisting) {
        return (lockOnInsert || replaceExisting) ? LOCK_TRIGGER_ACCESS : null;
    }

    private <T> T executeInLock(String lockName, TransactionCallback<T> txCallback)
            throws JobPersistenceException {
        return assembler.transactionTemplate.executeInLock(lockName, txCallback);
    }

    private <T> T executeWithoutLock(TransactionCallback<T> txCallback) throws JobPersistenceException {
        return assembler.transactionTemplate.executeWithoutLock(txCallback);
    }
}
