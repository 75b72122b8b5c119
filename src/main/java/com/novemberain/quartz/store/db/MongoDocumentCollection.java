package com.novemberain.quartz.store.db;

import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Updates;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A MongoDB collection worked on inside the transactions of {@link MongoSession}s.
 * Two transactions writing the same document conflict, the later one fails with
 * {@link LockTimeoutException}.
 */
class MongoDocumentCollection implements DocumentCollection {

    /**
     * Written by {@link #findOneForUpdate(Session, Bson)} to claim the document.
     */
    static final String LOCKED_BY = "lockedBy";

    private final MongoCollection<Document> collection;

    MongoDocumentCollection(MongoCollection<Document> collection) {
        this.collection = collection;
    }

    @Override
    public String getName() {
        return collection.getNamespace().getCollectionName();
    }

    @Override
    public void createUniqueIndex(String... fields) {
        try {
            collection.createIndex(Indexes.ascending(fields), new IndexOptions().unique(true));
        } catch (MongoException e) {
            throw MongoSession.translate("Couldn't create index on " + getName(), e);
        }
    }

    @Override
    public List<Document> find(Session session, Bson filter) {
        return find(session, filter, null, 0);
    }

    @Override
    public List<Document> find(Session session, final Bson filter, final Bson sort, final int limit) {
        return mongoSession(session).execute("find in " + getName(), cs -> {
            FindIterable<Document> found = collection.find(cs, filter);
            if (sort != null) {
                found.sort(sort);
            }
            if (limit > 0) {
                found.limit(limit);
            }
            return found.into(new ArrayList<Document>());
        });
    }

    @Override
    public Document first(Session session, Bson filter) {
        return mongoSession(session).execute("find in " + getName(), cs -> collection.find(cs, filter).first());
    }

    @Override
    public Document findOneForUpdate(Session session, Bson filter) {
        return mongoSession(session).execute("lock in " + getName(), cs -> collection.findOneAndUpdate(cs, filter,
                Updates.set(LOCKED_BY, session.getId()),
                new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER)));
    }

    @Override
    public long count(Session session, Bson filter) {
        return mongoSession(session).execute("count in " + getName(), cs -> collection.countDocuments(cs, filter));
    }

    @Override
    public <T> Set<T> distinct(Session session, String field, Bson filter, Class<T> type) {
        return mongoSession(session).execute("distinct in " + getName(),
                cs -> collection.distinct(cs, field, filter, type).into(new LinkedHashSet<T>()));
    }

    @Override
    public void insertOne(Session session, Document document) {
        mongoSession(session).execute("insert into " + getName(), cs -> collection.insertOne(cs, document));
    }

    @Override
    public long updateMany(Session session, Bson filter, Document fields) {
        return mongoSession(session).execute("update in " + getName(),
                cs -> collection.updateMany(cs, filter, new Document("$set", fields)).getMatchedCount());
    }

    @Override
    public long replaceOne(Session session, Bson filter, Document replacement) {
        return mongoSession(session).execute("replace in " + getName(),
                cs -> collection.replaceOne(cs, filter, replacement).getMatchedCount());
    }

    @Override
    public long deleteMany(Session session, Bson filter) {
        return mongoSession(session).execute("delete from " + getName(),
                cs -> collection.deleteMany(cs, filter).getDeletedCount());
    }

    @Override
    public String toString() {
        return "MongoDocumentCollection{" + collection.getNamespace() + "}";
    }

    private static MongoSession mongoSession(Session session) {
        if (!(session instanceof MongoSession)) {
            throw new StoreException("Session " + session + " does not belong to a MongoDB database");
        }
        return (MongoSession) session;
    }
}
