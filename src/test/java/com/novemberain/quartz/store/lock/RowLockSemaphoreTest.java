package com.novemberain.quartz.store.lock;

import com.novemberain.quartz.store.dao.LocksDao;
import com.novemberain.quartz.store.db.InMemoryDatabase;
import com.novemberain.quartz.store.db.Session;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.quartz.impl.jdbcjobstore.LockException;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.novemberain.quartz.store.Constants.LOCK_STATE_ACCESS;
import static com.novemberain.quartz.store.Constants.LOCK_TRIGGER_ACCESS;
import static org.junit.Assert.*;

public class RowLockSemaphoreTest {

    private InMemoryDatabase database;
    private RowLockSemaphore semaphore;
    private ExecutorService executor;

    @Before
    public void setUp() {
        database = new InMemoryDatabase(100);
        LocksDao locksDao = new LocksDao(database.getCollection("quartz_locks"));
        locksDao.createIndex();
        semaphore = new RowLockSemaphore(locksDao, 2, 10);
        executor = Executors.newSingleThreadExecutor();
    }

    @After
    public void tearDown() {
        executor.shutdownNow();
        database.close();
    }

    private Future<Boolean> obtainInOtherThread(final String lockName) {
        return executor.submit(() -> {
            try (Session session = database.openSession()) {
                boolean obtained = semaphore.obtainLock(session, lockName);
                session.commit();
                semaphore.releaseLock(lockName);
                return obtained;
            }
        });
    }

    @Test(expected = LockException.class)
    public void testSessionIsRequired() throws Exception {
        assertTrue(semaphore.requiresSession());
        semaphore.obtainLock(null, LOCK_TRIGGER_ACCESS);
    }

    @Test
    public void testObtainCreatesLockRowAndIsReentrant() throws Exception {
        try (Session session = database.openSession()) {
            assertTrue(semaphore.obtainLock(session, LOCK_TRIGGER_ACCESS));
            assertFalse(semaphore.obtainLock(session, LOCK_TRIGGER_ACCESS));
            session.commit();
            semaphore.releaseLock(LOCK_TRIGGER_ACCESS);
        }
        try (Session session = database.openSession()) {
            assertTrue("existing row is locked again", semaphore.obtainLock(session, LOCK_TRIGGER_ACCESS));
            session.commit();
            semaphore.releaseLock(LOCK_TRIGGER_ACCESS);
        }
    }

    @Test(timeout = 5000)
    public void testLockHeldByOpenTransactionFailsOtherInstance() throws Exception {
        Session session = database.openSession();
        try {
            assertTrue(semaphore.obtainLock(session, LOCK_TRIGGER_ACCESS));

            try {
                obtainInOtherThread(LOCK_TRIGGER_ACCESS).get(2, TimeUnit.SECONDS);
                fail("LockException expected");
            } catch (ExecutionException e) {
                assertTrue(e.getCause() instanceof LockException);
            }

            assertTrue("other lock names are free", obtainInOtherThread(LOCK_STATE_ACCESS).get(2, TimeUnit.SECONDS));
            session.commit();
        } finally {
            semaphore.releaseLock(LOCK_TRIGGER_ACCESS);
            session.close();
        }

        assertTrue("released by commit", obtainInOtherThread(LOCK_TRIGGER_ACCESS).get(2, TimeUnit.SECONDS));
    }
}
