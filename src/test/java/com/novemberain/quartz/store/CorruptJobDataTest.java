package com.novemberain.quartz.store;

import com.mongodb.client.model.Filters;
import com.novemberain.quartz.store.db.DocumentCollection;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.util.Keys;
import org.bson.Document;
import org.junit.Before;
import org.junit.Test;
import org.quartz.JobDetail;
import org.quartz.JobPersistenceException;
import org.quartz.Trigger.TriggerState;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.OperableTrigger;

import java.util.Date;
import java.util.List;

import static com.novemberain.quartz.store.Constants.STATE_ERROR;
import static com.novemberain.quartz.store.Constants.STATE_PAUSED;
import static org.junit.Assert.*;
import static org.quartz.JobBuilder.newJob;
import static org.quartz.SimpleScheduleBuilder.simpleSchedule;
import static org.quartz.TriggerBuilder.newTrigger;

public class CorruptJobDataTest extends JobStoreTestSupport {

    private JobDetail job;
    private OperableTrigger trigger;

    @Before
    public void storeJobAndTrigger() throws Exception {
        job = newJob(NoOpJob.class).withIdentity("job").storeDurably().build();
        trigger = scheduled(newTrigger()
                .withIdentity("t", "reports")
                .forJob(job)
                .startAt(new Date(System.currentTimeMillis() - 1000))
                .withSchedule(simpleSchedule().withIntervalInHours(1).repeatForever())
                .build());
        store.storeJobAndTrigger(job, trigger);
    }

    private void setJobClass(String className) {
        DocumentCollection jobs = database.getCollection("quartz_jobs");
        try (Session session = database.openSession()) {
            jobs.updateMany(session, Filters.eq(Keys.KEY_NAME, "job"), new Document("jobClass", className));
            session.commit();
        }
    }

    private List<OperableTrigger> acquire() throws Exception {
        return store.acquireNextTriggers(System.currentTimeMillis() + 1000, 1, 0L);
    }

    @Test
    public void testUnloadableJobClassIsReported() throws Exception {
        setJobClass("com.example.Gone");

        try {
            store.retrieveJob(job.getKey());
            fail("Corrupt job must not load");
        } catch (JobPersistenceException e) {
            assertTrue(e instanceof CorruptJobDataException);
        }
    }

    @Test
    public void testTriggerOfUnloadableJobGoesToErrorState() throws Exception {
        setJobClass("com.example.Gone");

        assertTrue(acquire().isEmpty());
        assertEquals(STATE_ERROR, storedState(trigger.getKey()));
        assertEquals(TriggerState.ERROR, store.getTriggerState(trigger.getKey()));
    }

    @Test
    public void testResetFromErrorStateMakesTriggerEligibleAgain() throws Exception {
        setJobClass("com.example.Gone");
        acquire();
        setJobClass(NoOpJob.class.getName());

        store.resetTriggerFromErrorState(trigger.getKey());

        assertEquals(TriggerState.NORMAL, store.getTriggerState(trigger.getKey()));
        assertEquals(1, acquire().size());
    }

    @Test
    public void testResetInPausedGroupGoesToPaused() throws Exception {
        setJobClass("com.example.Gone");
        acquire();
        store.pauseTriggers(GroupMatcher.triggerGroupEquals("reports"));
        assertEquals("pausing leaves errors alone", STATE_ERROR, storedState(trigger.getKey()));

        store.resetTriggerFromErrorState(trigger.getKey());

        assertEquals(STATE_PAUSED, storedState(trigger.getKey()));
    }
}
