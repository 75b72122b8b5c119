package com.novemberain.quartz.store;

import com.novemberain.quartz.store.db.InMemoryDatabase;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.PersistJobDataAfterExecution;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.impl.StdSchedulerFactory;

import java.util.List;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.quartz.JobBuilder.newJob;
import static org.quartz.SimpleScheduleBuilder.simpleSchedule;
import static org.quartz.TriggerBuilder.newTrigger;

public class SchedulerIntegrationTest extends Assert {

    private static volatile CountDownLatch executions;
    private static final List<Integer> observedCounts = new CopyOnWriteArrayList<>();

    private Scheduler scheduler;

    @Before
    public void setUp() throws Exception {
        observedCounts.clear();
        scheduler = createNewScheduler();
    }

    @After
    public void tearDown() throws Exception {
        if (!scheduler.isShutdown()) {
            scheduler.shutdown(true);
        }
    }

    protected Scheduler createNewScheduler() throws SchedulerException {
        StdSchedulerFactory factory = new StdSchedulerFactory();
        Properties props = new Properties();
        props.put(StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, "integration-" + UUID.randomUUID());
        props.put(StdSchedulerFactory.PROP_JOB_STORE_CLASS, PersistentJobStore.class.getName());
        props.put(StdSchedulerFactory.PROP_JOB_STORE_PREFIX + ".databaseClass", InMemoryDatabase.class.getName());
        props.put(StdSchedulerFactory.PROP_JOB_STORE_PREFIX + ".collectionPrefix", "test_");
        props.put(StdSchedulerFactory.PROP_JOB_STORE_PREFIX + ".misfireThreshold", "5000");
        props.put(StdSchedulerFactory.PROP_THREAD_POOL_PREFIX + ".threadCount", "1");

        factory.initialize(props);
        Scheduler scheduler = factory.getScheduler();
        scheduler.start();
        return scheduler;
    }

    @Test
    public void testRepeatingJobFires() throws Exception {
        executions = new CountDownLatch(3);
        JobDetail job = newJob(CountingJob.class).withIdentity("counting").build();
        Trigger trigger = newTrigger()
                .withIdentity("counting")
                .startNow()
                .withSchedule(simpleSchedule().withIntervalInMilliseconds(100).withRepeatCount(2))
                .build();

        scheduler.scheduleJob(job, trigger);

        assertTrue("job fired three times", executions.await(10, TimeUnit.SECONDS));
    }

    @Test
    public void testJobDataIsPersistedBetweenExecutions() throws Exception {
        executions = new CountDownLatch(3);
        JobDetail job = newJob(StatefulCountingJob.class)
                .withIdentity("stateful")
                .usingJobData("count", 0)
                .build();
        Trigger trigger = newTrigger()
                .withIdentity("stateful")
                .startNow()
                .withSchedule(simpleSchedule().withIntervalInMilliseconds(100).withRepeatCount(2))
                .build();

        scheduler.scheduleJob(job, trigger);

        assertTrue(executions.await(10, TimeUnit.SECONDS));
        assertEquals(3, observedCounts.size());
        assertEquals(Integer.valueOf(0), observedCounts.get(0));
        assertEquals(Integer.valueOf(1), observedCounts.get(1));
        assertEquals(Integer.valueOf(2), observedCounts.get(2));
    }

    @Test
    public void testStoredJobsAreVisibleThroughScheduler() throws Exception {
        JobDetail job = newJob(CountingJob.class).withIdentity("later", "reports").storeDurably().build();

        scheduler.addJob(job, false);

        assertTrue(scheduler.checkExists(job.getKey()));
        assertEquals(1, scheduler.getJobKeys(org.quartz.impl.matchers.GroupMatcher.jobGroupEquals("reports")).size());
        assertTrue(scheduler.deleteJob(job.getKey()));
    }

    @Test
    public void testShutdown() throws Exception {
        scheduler.shutdown(true);

        assertTrue(scheduler.isShutdown());
    }

    public static class CountingJob implements Job {
        @Override
        public void execute(JobExecutionContext context) {
            executions.countDown();
        }
    }

    @PersistJobDataAfterExecution
    @DisallowConcurrentExecution
    public static class StatefulCountingJob implements Job {
        @Override
        public void execute(JobExecutionContext context) {
            int count = context.getJobDetail().getJobDataMap().getInt("count");
            observedCounts.add(count);
            context.getJobDetail().getJobDataMap().put("count", count + 1);
            executions.countDown();
        }
    }
}
