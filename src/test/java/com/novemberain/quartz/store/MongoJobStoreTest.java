package com.novemberain.quartz.store;

import com.novemberain.quartz.store.JobStoreTestSupport.NoOpJob;
import org.junit.After;
import org.junit.Test;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.simpl.SimpleClassLoadHelper;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;
import static org.quartz.JobBuilder.newJob;
import static org.quartz.SimpleScheduleBuilder.simpleSchedule;
import static org.quartz.TriggerBuilder.newTrigger;

/**
 * The store running over MongoDB transactions.
 */
public class MongoJobStoreTest extends AbstractEmbeddedServerTest {

    private final List<PersistentJobStore> stores = new ArrayList<>();

    @After
    public void shutdownStores() {
        for (PersistentJobStore store : stores) {
            store.shutdown();
        }
    }

    private PersistentJobStore createStore(String instanceId, boolean clustered) throws Exception {
        PersistentJobStore store = new PersistentJobStore();
        store.setMongoUri(getMongoUri());
        store.setDbName("quartz_test");
        store.setInstanceName("mongoScheduler");
        store.setInstanceId(instanceId);
        store.setIsClustered(clustered);
        store.initialize(new SimpleClassLoadHelper(), mock(SchedulerSignaler.class));
        stores.add(store);
        return store;
    }

    private static OperableTrigger dueTrigger(JobDetail job, String name) {
        OperableTrigger trigger = (OperableTrigger) newTrigger()
                .withIdentity(name, "mongo")
                .forJob(job)
                .startAt(new Date(System.currentTimeMillis() - 1000))
                .withSchedule(simpleSchedule().withIntervalInMinutes(5).repeatForever())
                .build();
        trigger.computeFirstFireTime(null);
        return trigger;
    }

    @Test
    public void shouldKeepJobsAndTriggersAcrossRestart() throws Exception {
        PersistentJobStore first = createStore("first", false);
        JobDetail job = newJob(NoOpJob.class).withIdentity("report", "mongo").usingJobData("pages", 3).build();
        first.storeJobAndTrigger(job, dueTrigger(job, "hourly"));
        first.shutdown();
        stores.remove(first);

        PersistentJobStore second = createStore("second", false);
        JobDetail loaded = second.retrieveJob(new JobKey("report", "mongo"));
        assertNotNull(loaded);
        assertEquals(3, loaded.getJobDataMap().getInt("pages"));
        assertEquals(Trigger.TriggerState.NORMAL, second.getTriggerState(new TriggerKey("hourly", "mongo")));
    }

    @Test
    public void shouldRejectDuplicateJob() throws Exception {
        PersistentJobStore store = createStore("single", false);
        JobDetail job = newJob(NoOpJob.class).withIdentity("unique", "mongo").storeDurably().build();
        store.storeJob(job, false);
        try {
            store.storeJob(job, false);
            fail("Duplicate job was stored");
        } catch (ObjectAlreadyExistsException e) {
            assertEquals(1, store.getNumberOfJobs());
        }
    }

    @Test
    public void shouldHandDueTriggerToOneClusterMember() throws Exception {
        PersistentJobStore first = createStore("node-1", true);
        PersistentJobStore second = createStore("node-2", true);
        JobDetail job = newJob(NoOpJob.class).withIdentity("shared", "mongo").build();
        first.storeJobAndTrigger(job, dueTrigger(job, "shared"));

        long noLaterThan = System.currentTimeMillis() + 1000;
        List<OperableTrigger> acquired = first.acquireNextTriggers(noLaterThan, 1, 0L);
        assertEquals(1, acquired.size());
        assertTrue(second.acquireNextTriggers(noLaterThan, 1, 0L).isEmpty());

        first.releaseAcquiredTrigger(acquired.get(0));
        assertEquals(1, second.acquireNextTriggers(noLaterThan, 1, 0L).size());
    }
}
