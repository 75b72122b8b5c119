package com.novemberain.quartz.store.db;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.mongodb.client.model.Filters.eq;
import static org.junit.Assert.*;

public class InMemoryDatabaseTest {

    private InMemoryDatabase database;
    private DocumentCollection items;
    private ExecutorService executor;

    @Before
    public void setUp() {
        database = new InMemoryDatabase(200);
        items = database.getCollection("items");
        items.createUniqueIndex("name");
        executor = Executors.newSingleThreadExecutor();
    }

    @After
    public void tearDown() {
        executor.shutdownNow();
        database.close();
    }

    private void insertCommitted(String name, String state) {
        try (Session session = database.openSession()) {
            items.insertOne(session, new Document("name", name).append("state", state));
            session.commit();
        }
    }

    private String stateOf(String name) {
        try (Session session = database.openSession()) {
            Document doc = items.first(session, eq("name", name));
            return doc == null ? null : doc.getString("state");
        }
    }

    @Test
    public void testSameCollectionIsReturnedForName() {
        assertSame(items, database.getCollection("items"));
        assertEquals("items", items.getName());
    }

    @Test
    public void testCommittedWritesAreDurable() {
        insertCommitted("a", "waiting");

        assertEquals("waiting", stateOf("a"));
    }

    @Test
    public void testRollbackUndoesEveryKindOfWrite() {
        insertCommitted("a", "waiting");
        insertCommitted("b", "waiting");

        try (Session session = database.openSession()) {
            items.insertOne(session, new Document("name", "c"));
            items.updateMany(session, eq("name", "a"), new Document("state", "acquired"));
            items.deleteMany(session, eq("name", "b"));
            session.rollback();
        }

        assertEquals("waiting", stateOf("a"));
        assertEquals("waiting", stateOf("b"));
        assertNull(stateOf("c"));
    }

    @Test
    public void testClosingSessionRollsBack() {
        try (Session session = database.openSession()) {
            items.insertOne(session, new Document("name", "a"));
        }

        try (Session session = database.openSession()) {
            assertEquals(0, items.count(session, Filters.empty()));
        }
    }

    @Test
    public void testUniqueIndexRejectsDuplicates() {
        insertCommitted("a", "waiting");

        try (Session session = database.openSession()) {
            items.insertOne(session, new Document("name", "a"));
            fail("Duplicate key expected");
        } catch (DuplicateKeyException e) {
            assertTrue(e.getMessage().contains("items"));
        }
    }

    @Test
    public void testCompareAndSetUpdatesOnlyFromExpectedValue() {
        insertCommitted("a", "waiting");

        try (Session first = database.openSession()) {
            assertEquals(1, items.updateMany(first,
                    Filters.and(eq("name", "a"), eq("state", "waiting")), new Document("state", "acquired")));
            first.commit();
        }
        try (Session second = database.openSession()) {
            assertEquals(0, items.updateMany(second,
                    Filters.and(eq("name", "a"), eq("state", "waiting")), new Document("state", "acquired")));
            second.commit();
        }
    }

    @Test(timeout = 5000)
    public void testWriteWaitsForRowLockAndRechecksFilter() throws Exception {
        insertCommitted("a", "waiting");
        final CountDownLatch locked = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executor.submit(() -> {
            try (Session session = database.openSession()) {
                items.updateMany(session, eq("name", "a"), new Document("state", "acquired"));
                locked.countDown();
                release.await();
                session.commit();
            }
            return null;
        });
        assertTrue(locked.await(2, TimeUnit.SECONDS));

        DocumentCollection sameItems = database.getCollection("items");
        final Session waiting = database.openSession();
        try {
            Thread releaser = new Thread(release::countDown);
            releaser.start();
            long updated = sameItems.updateMany(waiting,
                    Filters.and(eq("name", "a"), eq("state", "waiting")), new Document("state", "other"));
            assertEquals("filter is evaluated after the competing commit", 0, updated);
            waiting.commit();
        } finally {
            waiting.close();
        }
        holder.get();
        assertEquals("acquired", stateOf("a"));
    }

    @Test(timeout = 5000)
    public void testWriteTimesOutOnRowHeldByOtherSession() throws Exception {
        insertCommitted("a", "waiting");
        final CountDownLatch locked = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executor.submit(() -> {
            try (Session session = database.openSession()) {
                assertNotNull(items.findOneForUpdate(session, eq("name", "a")));
                locked.countDown();
                release.await();
                session.commit();
            }
            return null;
        });
        assertTrue(locked.await(2, TimeUnit.SECONDS));

        try (Session session = database.openSession()) {
            items.deleteMany(session, eq("name", "a"));
            fail("Lock timeout expected");
        } catch (LockTimeoutException e) {
            assertTrue(e.isTransient());
        } finally {
            release.countDown();
        }
        holder.get();
        assertEquals("waiting", stateOf("a"));
    }

    @Test
    public void testFindSortsAndLimits() {
        insertCommitted("b", "2");
        insertCommitted("c", "3");
        insertCommitted("a", "1");

        try (Session session = database.openSession()) {
            List<Document> firstTwo = items.find(session, Filters.empty(), Sorts.ascending("name"), 2);
            assertEquals(2, firstTwo.size());
            assertEquals("a", firstTwo.get(0).getString("name"));
            assertEquals("b", firstTwo.get(1).getString("name"));

            List<Document> all = items.find(session, Filters.empty(), Sorts.descending("name"), 0);
            assertEquals("c", all.get(0).getString("name"));
        }
    }

    @Test
    public void testReturnedDocumentsAreCopies() {
        insertCommitted("a", "waiting");

        try (Session session = database.openSession()) {
            items.first(session, eq("name", "a")).put("state", "changed");
        }

        assertEquals("waiting", stateOf("a"));
    }

    @Test(expected = StoreException.class)
    public void testClosedDatabaseRejectsSessions() {
        database.close();
        database.openSession();
    }

    @Test
    public void testUncommittedWritesAreInvisibleToOtherSessions() {
        insertCommitted("a", "waiting");

        try (Session writer = database.openSession()) {
            items.updateMany(writer, eq("name", "a"), new Document("state", "acquired"));
            items.insertOne(writer, new Document("name", "b"));

            assertEquals("acquired", items.first(writer, eq("name", "a")).getString("state"));
            assertEquals("waiting", stateOf("a"));
            try (Session reader = database.openSession()) {
                assertEquals(1, items.count(reader, Filters.empty()));
            }
            writer.commit();
        }

        assertEquals("acquired", stateOf("a"));
    }

    @Test(timeout = 5000)
    public void testInsertWaitsForUncommittedDeleteOfSameKeyAndFailsOnRollback() throws Exception {
        insertCommitted("a", "waiting");
        Session deleting = database.openSession();
        assertEquals(1, items.deleteMany(deleting, eq("name", "a")));

        Future<?> inserting = executor.submit(() -> {
            try (Session session = database.openSession()) {
                items.insertOne(session, new Document("name", "a").append("state", "new"));
                session.commit();
            }
            return null;
        });
        try {
            inserting.get(100, TimeUnit.MILLISECONDS);
            fail("Insert must wait for the deleting session");
        } catch (TimeoutException expected) {
            deleting.rollback();
        } finally {
            deleting.close();
        }

        try {
            inserting.get();
            fail("Duplicate key expected");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof DuplicateKeyException);
        }
        try (Session session = database.openSession()) {
            assertEquals(1, items.count(session, eq("name", "a")));
        }
        assertEquals("waiting", stateOf("a"));
    }

    @Test(timeout = 5000)
    public void testInsertOfKeyDeletedByCommittedSessionSucceeds() throws Exception {
        insertCommitted("a", "waiting");
        Session deleting = database.openSession();
        items.deleteMany(deleting, eq("name", "a"));

        Future<?> inserting = executor.submit(() -> {
            try (Session session = database.openSession()) {
                items.insertOne(session, new Document("name", "a").append("state", "new"));
                session.commit();
            }
            return null;
        });
        try {
            inserting.get(100, TimeUnit.MILLISECONDS);
            fail("Insert must wait for the deleting session");
        } catch (TimeoutException expected) {
            deleting.commit();
        } finally {
            deleting.close();
        }

        inserting.get();
        try (Session session = database.openSession()) {
            assertEquals(1, items.count(session, eq("name", "a")));
        }
        assertEquals("new", stateOf("a"));
    }
}
