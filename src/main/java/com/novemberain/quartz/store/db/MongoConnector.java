package com.novemberain.quartz.store.db;

import com.mongodb.ReadConcern;
import com.mongodb.ReadPreference;
import com.mongodb.TransactionOptions;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import com.mongodb.MongoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Database} kept in MongoDB. Every {@link Session} runs a multi-document
 * transaction, so the server has to be a replica set or a sharded cluster.
 */
public class MongoConnector implements Database {

    private static final Logger log = LoggerFactory.getLogger(MongoConnector.class);

    private final MongoClient mongoClient;
    private final boolean ownsClient;
    private final MongoDatabase database;
    private final TransactionOptions transactionOptions;
    private final Map<String, MongoDocumentCollection> collections = new ConcurrentHashMap<>();
    private final AtomicLong sessionIds = new AtomicLong();

    /**
     * @param writeConcern write concern of every transaction
     * @param mongoClient  client to work with
     * @param ownsClient   whether {@link #close()} closes the client
     * @param dbName       name of the database holding the collections
     */
    public MongoConnector(WriteConcern writeConcern, MongoClient mongoClient, boolean ownsClient, String dbName) {
        this.mongoClient = mongoClient;
        this.ownsClient = ownsClient;
        this.database = mongoClient.getDatabase(dbName).withWriteConcern(writeConcern);
        this.transactionOptions = TransactionOptions.builder()
                .readConcern(ReadConcern.SNAPSHOT)
                .writeConcern(writeConcern)
                .readPreference(ReadPreference.primary())
                .build();
    }

    @Override
    public Session openSession() {
        try {
            return new MongoSession(mongoClient.startSession(), transactionOptions,
                    database.getName() + "-session-" + sessionIds.incrementAndGet());
        } catch (MongoException e) {
            throw MongoSession.translate("Couldn't start a session", e);
        }
    }

    @Override
    public DocumentCollection getCollection(String name) {
        return collections.computeIfAbsent(name,
                collectionName -> new MongoDocumentCollection(database.getCollection(collectionName)));
    }

    @Override
    public void close() {
        if (ownsClient) {
            log.debug("Closing MongoDB client of database {}", database.getName());
            mongoClient.close();
        }
    }

    public String getDatabaseName() {
        return database.getName();
    }

    public WriteConcern getWriteConcern() {
        return database.getWriteConcern();
    }
}
