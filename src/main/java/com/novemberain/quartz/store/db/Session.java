package com.novemberain.quartz.store.db;

/**
 * A transaction over a {@link Database}. Work done through a session becomes durable
 * on {@link #commit()} and is undone by {@link #rollback()}; both end the current
 * transaction and release the row locks taken by it, after which the session may be
 * used for the next transaction.
 *
 * <p>A session is confined to one thread.</p>
 */
public interface Session extends AutoCloseable {

    String getId();

    /**
     * @throws StoreException when the transaction could not be made durable,
     * the caller must then roll back.
     */
    void commit();

    void rollback();

    /**
     * Rolls back uncommitted work and releases the session.
     */
    @Override
    void close();
}
