package com.novemberain.quartz.store.db;

import java.util.ArrayList;
import java.util.List;

class InMemorySession implements Session {

    private final InMemoryDatabase database;
    private final String id;
    private final List<RowLock> rowLocks = new ArrayList<RowLock>();
    private boolean closed;

    InMemorySession(InMemoryDatabase database, String id) {
        this.database = database;
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void commit() {
        synchronized (database.monitor) {
            checkUsable();
            database.checkOpen();
            finish(true);
        }
    }

    @Override
    public void rollback() {
        synchronized (database.monitor) {
            if (!closed) {
                finish(false);
            }
        }
    }

    @Override
    public void close() {
        synchronized (database.monitor) {
            if (!closed) {
                rollback();
                closed = true;
            }
        }
    }

    @Override
    public String toString() {
        return id;
    }

    void checkUsable() {
        if (closed) {
            throw new StoreException("Session " + id + " is closed");
        }
    }

    void addRowLock(InMemoryCollection collection, long rowId) {
        rowLocks.add(new RowLock(collection, rowId));
    }

    private void finish(boolean commit) {
        for (RowLock lock : rowLocks) {
            lock.collection.finish(lock.rowId, this, commit);
        }
        rowLocks.clear();
        database.monitor.notifyAll();
    }

    private static final class RowLock {
        private final InMemoryCollection collection;
        private final long rowId;

        private RowLock(InMemoryCollection collection, long rowId) {
            this.collection = collection;
            this.rowId = rowId;
        }
    }
}
