package com.novemberain.quartz.store;

import com.novemberain.quartz.store.cluster.CheckinTask;
import com.novemberain.quartz.store.cluster.ClusterManager;
import com.novemberain.quartz.store.cluster.Recoverer;
import com.novemberain.quartz.store.cluster.RecoveryTriggerFactory;
import com.novemberain.quartz.store.cluster.TriggerRecoverer;
import com.novemberain.quartz.store.dao.*;
import com.novemberain.quartz.store.db.Database;
import com.novemberain.quartz.store.db.DocumentCollection;
import com.novemberain.quartz.store.db.MongoConnector;
import com.novemberain.quartz.store.db.MongoConnectorBuilder;
import com.novemberain.quartz.store.lock.RowLockSemaphore;
import com.novemberain.quartz.store.lock.Semaphore;
import com.novemberain.quartz.store.lock.SimpleSemaphore;
import com.novemberain.quartz.store.trigger.MisfireHandler;
import com.novemberain.quartz.store.trigger.MisfireScanner;
import com.novemberain.quartz.store.trigger.TriggerConverter;
import com.novemberain.quartz.store.util.Clock;
import com.novemberain.quartz.store.util.QueryHelper;
import org.quartz.SchedulerConfigException;
import org.quartz.spi.ClassLoadHelper;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;

/**
 * Wires the components of one {@link PersistentJobStore}.
 */
public class StoreAssembler {

    private static final Logger log = LoggerFactory.getLogger(StoreAssembler.class);

    public Database database;
    public boolean ownsDatabase;
    public Semaphore lockHandler;
    public TransactionTemplate transactionTemplate;

    public JobCompleteHandler jobCompleteHandler;
    public TriggerStateManager triggerStateManager;
    public TriggerRunner triggerRunner;
    public TriggerAndJobPersister persister;
    public CalendarManager calendarManager;
    public MisfireHandler misfireHandler;
    public MisfireScanner misfireScanner;

    public CalendarDao calendarDao;
    public FiredTriggerDao firedTriggerDao;
    public JobDao jobDao;
    public LocksDao locksDao;
    public SchedulerDao schedulerDao;
    public PausedTriggerGroupsDao pausedTriggerGroupsDao;
    public TriggerDao triggerDao;

    public TriggerRecoverer triggerRecoverer;
    public ClusterManager clusterManager;

    private final QueryHelper queryHelper = new QueryHelper();
    private TriggerConverter triggerConverter;

    public void build(PersistentJobStore jobStore, ClassLoadHelper loadHelper, SchedulerSignaler signaler)
            throws SchedulerConfigException {
        Clock clock = jobStore.clock;
        database = createDatabase(jobStore, loadHelper);

        JobDataConverter jobDataConverter = new JobDataConverter(jobStore.isJobDataAsBase64());
        triggerConverter = new TriggerConverter(jobDataConverter);

        jobDao = createJobDao(jobStore, loadHelper, jobDataConverter);
        triggerDao = new TriggerDao(getCollection(jobStore, "triggers"), queryHelper, triggerConverter);
        firedTriggerDao = new FiredTriggerDao(getCollection(jobStore, "fired_triggers"));
        calendarDao = new CalendarDao(getCollection(jobStore, "calendars"));
        locksDao = new LocksDao(getCollection(jobStore, "locks"));
        pausedTriggerGroupsDao = new PausedTriggerGroupsDao(getCollection(jobStore, "paused_trigger_groups"),
                queryHelper);
        schedulerDao = new SchedulerDao(getCollection(jobStore, "scheduler_state"),
                jobStore.schedulerName, jobStore.instanceId, jobStore.clusterCheckinIntervalMillis);

        lockHandler = createLockHandler(jobStore);
        transactionTemplate = new TransactionTemplate(database, lockHandler,
                createErrorClassifier(jobStore, loadHelper), signaler,
                jobStore.dbRetryIntervalMillis, jobStore.retryableActionErrorLogThreshold);

        persister = new TriggerAndJobPersister(jobDao, triggerDao, firedTriggerDao,
                pausedTriggerGroupsDao, calendarDao, signaler);
        // Another instance may change calendars behind a cache.
        calendarManager = new CalendarManager(calendarDao, triggerDao, persister,
                jobStore.misfireThreshold, !jobStore.isClustered());
        misfireHandler = new MisfireHandler(triggerDao, persister, calendarManager, signaler, clock,
                jobStore.misfireThreshold, jobStore.maxMisfiresToHandleAtATime);
        triggerStateManager = new TriggerStateManager(triggerDao, jobDao, pausedTriggerGroupsDao,
                persister, misfireHandler, clock);
        triggerRunner = new TriggerRunner(persister, triggerDao, jobDao, firedTriggerDao, calendarManager,
                misfireHandler, clock, jobStore.instanceId);
        jobCompleteHandler = new JobCompleteHandler(persister, triggerDao, jobDao, firedTriggerDao,
                transactionTemplate);

        triggerRecoverer = new TriggerRecoverer(persister, triggerDao, jobDao, firedTriggerDao, schedulerDao,
                misfireHandler, jobDataConverter, new RecoveryTriggerFactory(clock.millis()));

        misfireScanner = new MisfireScanner(jobStore.schedulerName, misfireHandler, transactionTemplate,
                signaler, clock, jobStore.misfireThreshold, jobStore.dbRetryIntervalMillis,
                jobStore.doubleCheckLockMisfireHandler, jobStore.retryableActionErrorLogThreshold);

        if (jobStore.isClustered()) {
            CheckinTask checkinTask = new CheckinTask(database, lockHandler, schedulerDao,
                    new Recoverer(schedulerDao, firedTriggerDao), triggerRecoverer, clock);
            clusterManager = new ClusterManager(jobStore.schedulerName, checkinTask, signaler, clock,
                    jobStore.clusterCheckinIntervalMillis, jobStore.dbRetryIntervalMillis,
                    jobStore.retryableActionErrorLogThreshold);
        }

        ensureIndexes();
    }

    /**
     * Declares the unique indexes of all collections.
     */
    private void ensureIndexes() {
        jobDao.createIndex();
        triggerDao.createIndex();
        firedTriggerDao.createIndex();
        calendarDao.createIndex();
        locksDao.createIndex();
        pausedTriggerGroupsDao.createIndex();
        schedulerDao.createIndex();
    }

    private Database createDatabase(PersistentJobStore jobStore, ClassLoadHelper loadHelper)
            throws SchedulerConfigException {
        if (jobStore.database != null) {
            ownsDatabase = false;
            return jobStore.database;
        }
        ownsDatabase = true;
        if (jobStore.databaseClass != null) {
            return instantiate(loadHelper, jobStore.databaseClass, Database.class);
        }
        MongoConnector connector = MongoConnectorBuilder.builder()
                .withUri(jobStore.mongoUri)
                .withAddresses(jobStore.addresses)
                .withDatabaseName(jobStore.dbName)
                .withCredentials(jobStore.username, jobStore.password)
                .withAuthDatabaseName(jobStore.authDbName)
                .withMaxConnections(jobStore.mongoOptionMaxConnections)
                .withConnectTimeoutMillis(jobStore.mongoOptionConnectTimeoutMillis)
                .withReadTimeoutMillis(jobStore.mongoOptionSocketTimeoutMillis)
                .withSSL(jobStore.mongoOptionEnableSSL, jobStore.mongoOptionSslInvalidHostNameAllowed)
                .withWriteConcernWriteTimeout(jobStore.mongoOptionWriteConcernTimeoutMillis)
                .withWriteConcernW(jobStore.mongoOptionWriteConcernW)
                .build();
        log.info("Keeping scheduling data of {} in MongoDB database {}", jobStore.instanceId,
                connector.getDatabaseName());
        return connector;
    }

    private Semaphore createLockHandler(PersistentJobStore jobStore) {
        if (jobStore.isClustered() || jobStore.useDBLocks) {
            if (!jobStore.useDBLocks) {
                log.warn("Clustered scheduler requires database locks, ignoring useDBLocks=false.");
            }
            log.info("Using db table-based data access locking (synchronization).");
            return new RowLockSemaphore(locksDao, jobStore.lockMaxRetry, jobStore.lockRetryPeriodMillis);
        }
        log.info("Using thread monitor-based data access locking (synchronization).");
        return new SimpleSemaphore();
    }

    private TransientErrorClassifier createErrorClassifier(PersistentJobStore jobStore, ClassLoadHelper loadHelper)
            throws SchedulerConfigException {
        if (jobStore.transientErrorClassifierClass == null) {
            return new DefaultTransientErrorClassifier();
        }
        return instantiate(loadHelper, jobStore.transientErrorClassifierClass, TransientErrorClassifier.class);
    }

    private JobDao createJobDao(PersistentJobStore jobStore, ClassLoadHelper loadHelper,
                                JobDataConverter jobDataConverter) {
        JobConverter jobConverter = new JobConverter(jobStore.getClassLoaderHelper(loadHelper), jobDataConverter);
        return new JobDao(getCollection(jobStore, "jobs"), queryHelper, jobConverter);
    }

    private DocumentCollection getCollection(PersistentJobStore jobStore, String name) {
        return database.getCollection(jobStore.collectionPrefix + name);
    }

    private static <T> T instantiate(ClassLoadHelper loadHelper, String className, Class<T> type)
            throws SchedulerConfigException {
        try {
            Class<?> aClass = loadHelper.loadClass(className);
            return type.cast(aClass.getDeclaredConstructor().newInstance());
        } catch (ClassNotFoundException | InstantiationException | IllegalAccessException
                | NoSuchMethodException | InvocationTargetException | ClassCastException e) {
            throw new SchedulerConfigException("Failed to instantiate " + type.getSimpleName()
                    + " implementation " + className, e);
        }
    }
}
