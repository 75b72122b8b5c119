package com.novemberain.quartz.store.db;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;
import com.mongodb.TransactionOptions;
import com.mongodb.client.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * A {@link Session} running one MongoDB transaction at a time. The transaction
 * starts with the first operation after {@link #commit()} or {@link #rollback()}.
 *
 * <p>A failed operation aborts the transaction on the server. When it was the first
 * operation of the transaction the session simply starts over with the next one,
 * otherwise every operation up to {@link #rollback()} fails.</p>
 */
class MongoSession implements Session {

    private static final Logger log = LoggerFactory.getLogger(MongoSession.class);

    private static final int WRITE_CONFLICT = 112;

    private final ClientSession clientSession;
    private final TransactionOptions transactionOptions;
    private final String id;
    private int operations;
    private MongoException failure;
    private boolean closed;

    MongoSession(ClientSession clientSession, TransactionOptions transactionOptions, String id) {
        this.clientSession = clientSession;
        this.transactionOptions = transactionOptions;
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    <T> T execute(String description, Function<ClientSession, T> operation) {
        checkUsable();
        if (!clientSession.hasActiveTransaction()) {
            clientSession.startTransaction(transactionOptions);
            operations = 0;
        }
        try {
            T result = operation.apply(clientSession);
            operations++;
            return result;
        } catch (MongoWriteException e) {
            abortAfter(e);
            if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                throw new DuplicateKeyException(description + ": " + e.getError().getMessage());
            }
            throw translate(description, e);
        } catch (MongoException e) {
            abortAfter(e);
            throw translate(description, e);
        }
    }

    @Override
    public void commit() {
        checkUsable();
        if (!clientSession.hasActiveTransaction()) {
            return;
        }
        try {
            clientSession.commitTransaction();
        } catch (MongoException e) {
            if (e.hasErrorLabel(MongoException.UNKNOWN_TRANSACTION_COMMIT_RESULT_LABEL)) {
                throw new StoreException("Outcome of commit in " + id + " is unknown", e, true);
            }
            throw translate("Couldn't commit " + id, e);
        }
    }

    @Override
    public void rollback() {
        if (closed) {
            return;
        }
        failure = null;
        if (clientSession.hasActiveTransaction()) {
            try {
                clientSession.abortTransaction();
            } catch (MongoException e) {
                throw translate("Couldn't roll back " + id, e);
            }
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        try {
            rollback();
        } finally {
            closed = true;
            clientSession.close();
        }
    }

    @Override
    public String toString() {
        return id;
    }

    private void checkUsable() {
        if (closed) {
            throw new StoreException("Session " + id + " is closed");
        }
        if (failure != null) {
            throw new StoreException("Transaction of " + id + " was aborted by an earlier failure: "
                    + failure.getMessage(), failure, isTransient(failure));
        }
    }

    private void abortAfter(MongoException e) {
        if (clientSession.hasActiveTransaction()) {
            clientSession.abortTransaction();
        }
        if (operations > 0) {
            log.debug("Transaction of {} aborted after {} operations", id, operations, e);
            failure = e;
        }
    }

    static StoreException translate(String description, MongoException e) {
        String message = description + ": " + e.getMessage();
        if (e.getCode() == WRITE_CONFLICT || isWriteConflict(e)) {
            return new LockTimeoutException(message, e);
        }
        return new StoreException(message, e, isTransient(e));
    }

    private static boolean isWriteConflict(MongoException e) {
        return e instanceof MongoCommandException
                && "WriteConflict".equals(((MongoCommandException) e).getErrorCodeName());
    }

    private static boolean isTransient(MongoException e) {
        return e.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)
                || e instanceof MongoSocketException
                || e instanceof MongoTimeoutException;
    }
}
