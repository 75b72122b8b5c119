package com.novemberain.quartz.store.db;

import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.List;
import java.util.Set;

/**
 * A set of documents. Every operation runs inside the transaction of the given
 * {@link Session}; writes take exclusive row locks held until that transaction ends.
 * Filters and sorts are built with {@link com.mongodb.client.model.Filters} and
 * {@link com.mongodb.client.model.Sorts}.
 */
public interface DocumentCollection {

    String getName();

    /**
     * Declares that no two documents may share the values of the given fields.
     */
    void createUniqueIndex(String... fields);

    List<Document> find(Session session, Bson filter);

    /**
     * @param sort  order of the result, or null
     * @param limit maximum number of documents, zero or negative for all
     */
    List<Document> find(Session session, Bson filter, Bson sort, int limit);

    /**
     * @return first matching document or null
     */
    Document first(Session session, Bson filter);

    /**
     * Like {@link #first(Session, Bson)}, but also locks the returned document
     * until the session's transaction ends.
     */
    Document findOneForUpdate(Session session, Bson filter);

    long count(Session session, Bson filter);

    <T> Set<T> distinct(Session session, String field, Bson filter, Class<T> type);

    /**
     * @throws DuplicateKeyException when a unique index would be violated
     */
    void insertOne(Session session, Document document);

    /**
     * Sets the given fields on every matching document. Used as compare-and-set:
     * two sessions never both update a document from the same old value, the
     * second one waits for the first or fails with a transient {@link StoreException}.
     *
     * @return number of updated documents
     */
    long updateMany(Session session, Bson filter, Document fields);

    /**
     * @return number of replaced documents, zero or one
     */
    long replaceOne(Session session, Bson filter, Document replacement);

    /**
     * @return number of deleted documents
     */
    long deleteMany(Session session, Bson filter);
}
