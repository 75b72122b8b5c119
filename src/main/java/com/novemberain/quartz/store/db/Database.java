package com.novemberain.quartz.store.db;

/**
 * Transactional document store holding the scheduling data.
 */
public interface Database extends AutoCloseable {

    Session openSession();

    /**
     * Returns the named collection, creating it when it does not exist yet.
     */
    DocumentCollection getCollection(String name);

    @Override
    void close();
}
