package com.novemberain.quartz.store;

import org.junit.Test;
import org.quartz.Scheduler;
import org.quartz.impl.StdSchedulerFactory;

import java.io.InputStream;
import java.util.Properties;

import static org.junit.Assert.*;

/**
 * Global tests for the initialization of the scheduler.
 */
public class SchedulerInitializationTest {

    @Test
    public void shouldInitializeFromPropertiesFile() throws Exception {
        Properties props = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/SchedulerInitializationTest/quartz.properties")) {
            props.load(in);
        }

        Scheduler scheduler = new StdSchedulerFactory(props).getScheduler();
        try {
            assertNotNull(scheduler);
            assertEquals(PersistentJobStore.class, scheduler.getMetaData().getJobStoreClass());
            assertTrue(scheduler.getMetaData().isJobStoreSupportsPersistence());
            assertTrue(scheduler.getMetaData().isJobStoreClustered());
        } finally {
            scheduler.shutdown();
        }
    }
}
