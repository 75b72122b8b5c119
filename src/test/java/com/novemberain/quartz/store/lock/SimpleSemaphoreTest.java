package com.novemberain.quartz.store.lock;

import org.junit.After;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.novemberain.quartz.store.Constants.LOCK_CALENDAR_ACCESS;
import static com.novemberain.quartz.store.Constants.LOCK_TRIGGER_ACCESS;
import static org.junit.Assert.*;

public class SimpleSemaphoreTest {

    private final SimpleSemaphore semaphore = new SimpleSemaphore();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testReentrantObtainReportsExistingOwnership() throws Exception {
        assertTrue(semaphore.obtainLock(null, LOCK_TRIGGER_ACCESS));
        assertFalse(semaphore.obtainLock(null, LOCK_TRIGGER_ACCESS));
        semaphore.releaseLock(LOCK_TRIGGER_ACCESS);
        assertFalse(semaphore.requiresSession());
    }

    @Test
    public void testReleasingUnownedLockIsIgnored() throws Exception {
        semaphore.releaseLock(LOCK_TRIGGER_ACCESS);

        assertTrue(semaphore.obtainLock(null, LOCK_TRIGGER_ACCESS));
        semaphore.releaseLock(LOCK_TRIGGER_ACCESS);
    }

    @Test(timeout = 5000)
    public void testOtherThreadWaitsUntilRelease() throws Exception {
        assertTrue(semaphore.obtainLock(null, LOCK_TRIGGER_ACCESS));

        Future<Boolean> other = executor.submit(() -> {
            boolean obtained = semaphore.obtainLock(null, LOCK_TRIGGER_ACCESS);
            semaphore.releaseLock(LOCK_TRIGGER_ACCESS);
            return obtained;
        });
        try {
            other.get(200, TimeUnit.MILLISECONDS);
            fail("Lock should still be held");
        } catch (TimeoutException expected) {
            // still waiting
        }

        semaphore.releaseLock(LOCK_TRIGGER_ACCESS);
        assertTrue(other.get(2, TimeUnit.SECONDS));
    }

    @Test(timeout = 5000)
    public void testLocksAreIndependentByName() throws Exception {
        assertTrue(semaphore.obtainLock(null, LOCK_TRIGGER_ACCESS));
        final CountDownLatch obtained = new CountDownLatch(1);

        executor.submit(() -> {
            semaphore.obtainLock(null, LOCK_CALENDAR_ACCESS);
            obtained.countDown();
            semaphore.releaseLock(LOCK_CALENDAR_ACCESS);
            return null;
        });

        assertTrue(obtained.await(2, TimeUnit.SECONDS));
        semaphore.releaseLock(LOCK_TRIGGER_ACCESS);
    }
}
