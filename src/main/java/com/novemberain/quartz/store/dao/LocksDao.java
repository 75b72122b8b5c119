package com.novemberain.quartz.store.dao;

import com.mongodb.client.model.Filters;
import com.novemberain.quartz.store.db.DocumentCollection;
import com.novemberain.quartz.store.db.Session;
import org.bson.Document;

/**
 * One row per named lock. Locking a row holds the named lock until
 * the session's transaction ends.
 */
public class LocksDao {

    static final String LOCK_NAME = "lockName";

    private final DocumentCollection locksCollection;

    public LocksDao(DocumentCollection locksCollection) {
        this.locksCollection = locksCollection;
    }

    public void createIndex() {
        locksCollection.createUniqueIndex(LOCK_NAME);
    }

    /**
     * Locks the row of the named lock.
     *
     * @return if the row exists and is now locked by the session
     */
    public boolean selectForUpdate(Session session, String lockName) {
        return locksCollection.findOneForUpdate(session, Filters.eq(LOCK_NAME, lockName)) != null;
    }

    /**
     * Inserts the row of the named lock, locked by the session.
     *
     * @throws com.novemberain.quartz.store.db.DuplicateKeyException when another
     * session inserted it first
     */
    public void insertLock(Session session, String lockName) {
        locksCollection.insertOne(session, new Document(LOCK_NAME, lockName));
    }
}
