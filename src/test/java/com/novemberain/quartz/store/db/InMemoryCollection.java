package com.novemberain.quartz.store.db;

import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Committed rows plus the uncommitted writes of the sessions holding their row
 * locks. A row has at most one pending write, made by the session owning its lock.
 */
class InMemoryCollection implements DocumentCollection {

    private static final Document DELETED = new Document();

    private final InMemoryDatabase database;
    private final Object monitor;
    private final String name;
    private final Map<Long, Document> committed = new TreeMap<Long, Document>();
    private final Map<Long, Document> pending = new HashMap<Long, Document>();
    private final Map<Long, InMemorySession> rowOwners = new HashMap<Long, InMemorySession>();
    private final List<String[]> uniqueIndexes = new ArrayList<String[]>();
    private long nextRowId;

    InMemoryCollection(InMemoryDatabase database, String name) {
        this.database = database;
        this.monitor = database.monitor;
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void createUniqueIndex(String... fields) {
        synchronized (monitor) {
            for (String[] index : uniqueIndexes) {
                if (Arrays.equals(index, fields)) {
                    return;
                }
            }
            uniqueIndexes.add(fields.clone());
        }
    }

    @Override
    public List<Document> find(Session session, Bson filter) {
        return find(session, filter, null, 0);
    }

    @Override
    public List<Document> find(Session session, Bson filter, Bson sort, int limit) {
        synchronized (monitor) {
            InMemorySession owner = checkSession(session);
            BsonMatcher matcher = new BsonMatcher(filter);
            List<Document> result = new ArrayList<Document>();
            for (Document row : view(owner).values()) {
                if (matcher.matches(row)) {
                    result.add(new Document(row));
                }
            }
            if (sort != null) {
                result.sort(BsonMatcher.comparator(sort));
            }
            if (limit > 0 && result.size() > limit) {
                return new ArrayList<Document>(result.subList(0, limit));
            }
            return result;
        }
    }

    @Override
    public Document first(Session session, Bson filter) {
        synchronized (monitor) {
            InMemorySession owner = checkSession(session);
            BsonMatcher matcher = new BsonMatcher(filter);
            for (Document row : view(owner).values()) {
                if (matcher.matches(row)) {
                    return new Document(row);
                }
            }
            return null;
        }
    }

    @Override
    public Document findOneForUpdate(Session session, Bson filter) {
        synchronized (monitor) {
            InMemorySession owner = checkSession(session);
            List<Long> matching = lockMatching(owner, new BsonMatcher(filter), 1);
            if (matching.isEmpty()) {
                return null;
            }
            return new Document(view(owner).get(matching.get(0)));
        }
    }

    @Override
    public long count(Session session, Bson filter) {
        synchronized (monitor) {
            InMemorySession owner = checkSession(session);
            BsonMatcher matcher = new BsonMatcher(filter);
            long count = 0;
            for (Document row : view(owner).values()) {
                if (matcher.matches(row)) {
                    count++;
                }
            }
            return count;
        }
    }

    @Override
    public <T> Set<T> distinct(Session session, String field, Bson filter, Class<T> type) {
        synchronized (monitor) {
            InMemorySession owner = checkSession(session);
            BsonMatcher matcher = new BsonMatcher(filter);
            Set<T> values = new LinkedHashSet<T>();
            for (Document row : view(owner).values()) {
                Object value = row.get(field);
                if (value != null && matcher.matches(row)) {
                    values.add(type.cast(value));
                }
            }
            return values;
        }
    }

    @Override
    public void insertOne(Session session, Document document) {
        synchronized (monitor) {
            InMemorySession owner = checkSession(session);
            long deadline = deadline();
            while (true) {
                Long conflict = findUniqueConflict(owner, document, null);
                if (conflict == null) {
                    break;
                }
                if (isLockedByOther(conflict, owner)) {
                    awaitRowRelease(deadline);
                    continue;
                }
                throw new DuplicateKeyException("Duplicate key in " + name + ": " + document);
            }
            long rowId = nextRowId++;
            lock(rowId, owner);
            pending.put(rowId, new Document(document));
        }
    }

    @Override
    public long updateMany(Session session, Bson filter, Document fields) {
        synchronized (monitor) {
            InMemorySession owner = checkSession(session);
            List<Long> matching = lockMatching(owner, new BsonMatcher(filter), -1);
            Map<Long, Document> view = view(owner);
            for (Long rowId : matching) {
                Document updated = new Document(view.get(rowId));
                updated.putAll(fields);
                pending.put(rowId, updated);
            }
            return matching.size();
        }
    }

    @Override
    public long replaceOne(Session session, Bson filter, Document replacement) {
        synchronized (monitor) {
            InMemorySession owner = checkSession(session);
            List<Long> matching = lockMatching(owner, new BsonMatcher(filter), 1);
            if (matching.isEmpty()) {
                return 0;
            }
            Long rowId = matching.get(0);
            if (findUniqueConflict(owner, replacement, rowId) != null) {
                throw new DuplicateKeyException("Duplicate key in " + name + ": " + replacement);
            }
            pending.put(rowId, new Document(replacement));
            return 1;
        }
    }

    @Override
    public long deleteMany(Session session, Bson filter) {
        synchronized (monitor) {
            InMemorySession owner = checkSession(session);
            List<Long> matching = lockMatching(owner, new BsonMatcher(filter), -1);
            for (Long rowId : matching) {
                pending.put(rowId, DELETED);
            }
            return matching.size();
        }
    }

    @Override
    public String toString() {
        return "InMemoryCollection{" + name + "}";
    }

    /**
     * Ends the session's hold on the row, making its pending write durable on commit.
     */
    void finish(long rowId, InMemorySession session, boolean commit) {
        if (rowOwners.get(rowId) != session) {
            return;
        }
        rowOwners.remove(rowId);
        Document written = pending.remove(rowId);
        if (!commit || written == null) {
            return;
        }
        if (written == DELETED) {
            committed.remove(rowId);
        } else {
            committed.put(rowId, written);
        }
    }

    /**
     * Rows as the session sees them: committed rows overlaid with its own writes.
     */
    private Map<Long, Document> view(InMemorySession session) {
        Map<Long, Document> view = new TreeMap<Long, Document>(committed);
        for (Map.Entry<Long, Document> write : pending.entrySet()) {
            if (rowOwners.get(write.getKey()) != session) {
                continue;
            }
            if (write.getValue() == DELETED) {
                view.remove(write.getKey());
            } else {
                view.put(write.getKey(), write.getValue());
            }
        }
        return view;
    }

    /**
     * Waits until no matching row is locked by another session, then locks the
     * matching rows. Matching is re-evaluated after every wait.
     */
    private List<Long> lockMatching(InMemorySession owner, BsonMatcher matcher, int limit) {
        long deadline = deadline();
        while (true) {
            List<Long> matching = new ArrayList<Long>();
            boolean blocked = false;
            for (Map.Entry<Long, Document> row : view(owner).entrySet()) {
                if (matcher.matches(row.getValue())) {
                    if (isLockedByOther(row.getKey(), owner)) {
                        blocked = true;
                        break;
                    }
                    matching.add(row.getKey());
                    if (limit > 0 && matching.size() == limit) {
                        break;
                    }
                }
            }
            if (blocked) {
                awaitRowRelease(deadline);
                continue;
            }
            for (Long rowId : matching) {
                lock(rowId, owner);
            }
            return matching;
        }
    }

    /**
     * Finds a row holding the candidate's unique key: one the session sees, or one
     * another session is inserting, changing or deleting.
     */
    private Long findUniqueConflict(InMemorySession session, Document candidate, Long self) {
        Map<Long, Document> view = view(session);
        for (String[] index : uniqueIndexes) {
            for (Map.Entry<Long, Document> row : view.entrySet()) {
                if (!row.getKey().equals(self) && sameKey(index, row.getValue(), candidate)) {
                    return row.getKey();
                }
            }
            for (Map.Entry<Long, InMemorySession> owned : rowOwners.entrySet()) {
                Long rowId = owned.getKey();
                if (owned.getValue() == session || rowId.equals(self)) {
                    continue;
                }
                Document before = committed.get(rowId);
                Document after = pending.get(rowId);
                if ((before != null && sameKey(index, before, candidate))
                        || (after != null && after != DELETED && sameKey(index, after, candidate))) {
                    return rowId;
                }
            }
        }
        return null;
    }

    private boolean sameKey(String[] index, Document a, Document b) {
        for (String field : index) {
            Object left = a.get(field);
            Object right = b.get(field);
            if (left == null ? right != null : !left.equals(right)) {
                return false;
            }
        }
        return true;
    }

    private boolean isLockedByOther(Long rowId, InMemorySession session) {
        InMemorySession owner = rowOwners.get(rowId);
        return owner != null && owner != session;
    }

    private void lock(long rowId, InMemorySession session) {
        if (rowOwners.get(rowId) != session) {
            rowOwners.put(rowId, session);
            session.addRowLock(this, rowId);
        }
    }

    private long deadline() {
        return System.currentTimeMillis() + database.getLockWaitTimeoutMillis();
    }

    private void awaitRowRelease(long deadline) {
        long remaining = deadline - System.currentTimeMillis();
        if (remaining <= 0) {
            throw new LockTimeoutException("Timed out waiting for a row lock in " + name);
        }
        try {
            monitor.wait(remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while waiting for a row lock in " + name, e);
        }
    }

    private InMemorySession checkSession(Session session) {
        database.checkOpen();
        if (!(session instanceof InMemorySession)) {
            throw new StoreException("Session " + session + " does not belong to this database");
        }
        InMemorySession inMemorySession = (InMemorySession) session;
        inMemorySession.checkUsable();
        return inMemorySession;
    }
}
