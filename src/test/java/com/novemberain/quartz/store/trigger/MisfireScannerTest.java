package com.novemberain.quartz.store.trigger;

import com.novemberain.quartz.store.DefaultTransientErrorClassifier;
import com.novemberain.quartz.store.TransactionTemplate;
import com.novemberain.quartz.store.db.InMemoryDatabase;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.lock.SimpleSemaphore;
import com.novemberain.quartz.store.trigger.MisfireHandler.RecoverMisfiredJobsResult;
import com.novemberain.quartz.store.util.MutableClock;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.quartz.JobPersistenceException;
import org.quartz.spi.SchedulerSignaler;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

public class MisfireScannerTest {

    private static final long MISFIRE_THRESHOLD = 60000L;
    private static final long DB_RETRY_INTERVAL = 15000L;

    private InMemoryDatabase database;
    private MisfireHandler misfireHandler;
    private SchedulerSignaler signaler;
    private TransactionTemplate template;
    private MutableClock clock;

    @Before
    public void setUp() {
        database = new InMemoryDatabase();
        misfireHandler = mock(MisfireHandler.class);
        signaler = mock(SchedulerSignaler.class);
        template = new TransactionTemplate(database, new SimpleSemaphore(), new DefaultTransientErrorClassifier(),
                signaler, 10L, 4);
        clock = new MutableClock(1000000L);
    }

    @After
    public void tearDown() {
        database.close();
    }

    private MisfireScanner scanner(boolean doubleCheck) {
        return new MisfireScanner("test", misfireHandler, template, signaler, clock,
                MISFIRE_THRESHOLD, DB_RETRY_INTERVAL, doubleCheck, 4);
    }

    @Test
    public void testDoubleCheckSkipsLockedScanWhenNothingMisfired() throws Exception {
        when(misfireHandler.hasMisfires(any(Session.class))).thenReturn(false);

        RecoverMisfiredJobsResult result = scanner(true).manage();

        assertSame(RecoverMisfiredJobsResult.NO_OP, result);
        verify(misfireHandler, never()).recoverMisfiredJobs(any(Session.class), anyBoolean());
    }

    @Test
    public void testDoubleCheckScansWhenMisfiresExist() throws Exception {
        RecoverMisfiredJobsResult expected = new RecoverMisfiredJobsResult(false, 2, 5000L);
        when(misfireHandler.hasMisfires(any(Session.class))).thenReturn(true);
        when(misfireHandler.recoverMisfiredJobs(any(Session.class), eq(false))).thenReturn(expected);

        assertSame(expected, scanner(true).manage());
    }

    @Test
    public void testScansWithoutPeekingWhenDoubleCheckIsOff() throws Exception {
        when(misfireHandler.recoverMisfiredJobs(any(Session.class), eq(false)))
                .thenReturn(RecoverMisfiredJobsResult.NO_OP);

        scanner(false).manage();

        verify(misfireHandler, never()).hasMisfires(any(Session.class));
        verify(misfireHandler).recoverMisfiredJobs(any(Session.class), eq(false));
    }

    @Test
    public void testSignalsEarliestNewTimeAndHurriesWhenMoreRemain() throws Exception {
        when(misfireHandler.recoverMisfiredJobs(any(Session.class), eq(false)))
                .thenReturn(new RecoverMisfiredJobsResult(true, 20, 7000L));

        long pause = scanner(false).runCycle();

        assertEquals(50L, pause);
        verify(signaler).signalSchedulingChange(7000L);
    }

    @Test
    public void testWaitsMisfireThresholdWhenIdle() throws Exception {
        when(misfireHandler.recoverMisfiredJobs(any(Session.class), eq(false)))
                .thenReturn(RecoverMisfiredJobsResult.NO_OP);

        long pause = scanner(false).runCycle();

        assertEquals(MISFIRE_THRESHOLD, pause);
        verify(signaler, never()).signalSchedulingChange(anyLong());
    }

    @Test
    public void testFailureBacksOffToRetryInterval() throws Exception {
        when(misfireHandler.recoverMisfiredJobs(any(Session.class), eq(false)))
                .thenThrow(new JobPersistenceException("store down"))
                .thenReturn(RecoverMisfiredJobsResult.NO_OP);
        MisfireScanner scanner = new MisfireScanner("test", misfireHandler, template, signaler, clock,
                1000L, DB_RETRY_INTERVAL, false, 4);

        assertEquals(DB_RETRY_INTERVAL, scanner.runCycle());
        assertEquals("recovered", 1000L, scanner.runCycle());
    }
}
