package com.novemberain.quartz.store.db;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.MongoException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.quartz.SchedulerConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Builder for {@link MongoConnector}.
 */
public class MongoConnectorBuilder {

    private static final String PARAM_NOT_ALLOWED = "'%s' parameter is not allowed. %s";

    private MongoClient client;
    private String writeConcernW;
    private Integer writeConcernWriteTimeout;
    private String dbName;
    private String uri;
    private String[] addresses;
    private String username;
    private String password;
    private String authDbName;
    private Integer maxConnections;
    private Integer connectTimeoutMillis;
    private Integer readTimeoutMillis;
    private Boolean enableSSL;
    private Boolean sslInvalidHostNameAllowed;

    private MongoConnectorBuilder() {
    }

    public static MongoConnectorBuilder builder() {
        return new MongoConnectorBuilder();
    }

    /**
     * Builds a connector from current settings. A client passed in stays open
     * when the connector closes, a client created here is closed with it.
     *
     * @throws SchedulerConfigException if the settings are incomplete or contradict each other
     */
    public MongoConnector build() throws SchedulerConfigException {
        final WriteConcern writeConcern = createWriteConcern();

        resolveDbNameByUriIfNull();
        checkNotNull(dbName, "'Database name' is required, as parameter or in MongoDB URI path.");

        if (client != null) {
            validateForClient();
            return new MongoConnector(writeConcern, client, false, dbName);
        }

        final MongoClientSettings.Builder settingsBuilder = createSettingsBuilder();
        if (uri != null) {
            checkServerPropertiesAreNull("'URI' parameter is used.");
            return new MongoConnector(writeConcern, createClient(uri, settingsBuilder), true, dbName);
        }

        checkNotNull(addresses, "At least one MongoDB address or a MongoDB URI must be specified.");
        settingsBuilder.applyToClusterSettings(builder -> builder.hosts(collectServerAddresses()));
        if (username != null) {
            settingsBuilder.credential(createCredential());
        }
        return new MongoConnector(writeConcern, createClient(settingsBuilder.build()), true, dbName);
    }

    private void resolveDbNameByUriIfNull() throws SchedulerConfigException {
        if (dbName == null && uri != null) {
            dbName = parseUri(uri).getDatabase();
        }
    }

    private List<ServerAddress> collectServerAddresses() {
        final List<ServerAddress> serverAddresses = new ArrayList<>(addresses.length);
        for (final String address : addresses) {
            serverAddresses.add(new ServerAddress(address.trim()));
        }
        return serverAddresses;
    }

    private MongoCredential createCredential() throws SchedulerConfigException {
        checkNotNull(password, "Password is required when a username is given.");
        // authDbName usually names "admin", granting access to the other databases
        String source = authDbName != null ? authDbName : dbName;
        return MongoCredential.createCredential(username, source, password.toCharArray());
    }

    private MongoClientSettings.Builder createSettingsBuilder() {
        final MongoClientSettings.Builder settingsBuilder = MongoClientSettings.builder();
        if (maxConnections != null) {
            settingsBuilder.applyToConnectionPoolSettings(builder -> builder.maxSize(maxConnections));
        }
        if (connectTimeoutMillis != null) {
            settingsBuilder.applyToSocketSettings(
                    builder -> builder.connectTimeout(connectTimeoutMillis, TimeUnit.MILLISECONDS));
        }
        if (readTimeoutMillis != null) {
            settingsBuilder.applyToSocketSettings(
                    builder -> builder.readTimeout(readTimeoutMillis, TimeUnit.MILLISECONDS));
        }
        if (enableSSL != null) {
            settingsBuilder.applyToSslSettings(builder -> builder.enabled(enableSSL));
            if (sslInvalidHostNameAllowed != null) {
                settingsBuilder.applyToSslSettings(
                        builder -> builder.invalidHostNameAllowed(sslInvalidHostNameAllowed));
            }
        }
        return settingsBuilder;
    }

    private WriteConcern createWriteConcern() throws SchedulerConfigException {
        checkNotNull(writeConcernWriteTimeout, "Write timeout is expected.");

        if (writeConcernW != null) {
            WriteConcern named = WriteConcern.valueOf(writeConcernW);
            checkNotNull(named, "Unknown write concern '" + writeConcernW + "'.");
            return named.withWTimeout(writeConcernWriteTimeout, TimeUnit.MILLISECONDS).withJournal(true);
        }

        // MAJORITY keeps locks, state changes and check-ins on the
        // secondaries, so they survive a failover of the primary.
        return WriteConcern.MAJORITY.withWTimeout(writeConcernWriteTimeout, TimeUnit.MILLISECONDS)
                .withJournal(true);
    }

    private static MongoClient createClient(final String uri, final MongoClientSettings.Builder settingsBuilder)
            throws SchedulerConfigException {
        return createClient(settingsBuilder.applyConnectionString(parseUri(uri)).build());
    }

    private static ConnectionString parseUri(final String uri) throws SchedulerConfigException {
        try {
            return new ConnectionString(uri);
        } catch (IllegalArgumentException | MongoException e) {
            throw new SchedulerConfigException("Invalid mongo client uri.", e);
        }
    }

    private static MongoClient createClient(final MongoClientSettings settings) throws SchedulerConfigException {
        try {
            return MongoClients.create(settings);
        } catch (final MongoException e) {
            throw new SchedulerConfigException("MongoDB driver thrown an exception.", e);
        }
    }

    private void validateForClient() throws SchedulerConfigException {
        final String suffix = "'Client' parameter is used.";
        checkIsNull(uri, paramNotAllowed("URI", suffix));
        checkServerPropertiesAreNull(suffix);
        checkIsNull(maxConnections, paramNotAllowed("Max connections", suffix));
        checkIsNull(connectTimeoutMillis, paramNotAllowed("Connect timeout millis", suffix));
        checkIsNull(readTimeoutMillis, paramNotAllowed("Socket timeout millis", suffix));
        checkIsNull(enableSSL, paramNotAllowed("Enable ssl", suffix));
        checkIsNull(sslInvalidHostNameAllowed, paramNotAllowed("SSL invalid hostname allowed", suffix));
    }

    private void checkServerPropertiesAreNull(final String suffix) throws SchedulerConfigException {
        checkIsNull(addresses, paramNotAllowed("Addresses array", suffix));
        checkIsNull(username, paramNotAllowed("Username", suffix));
        checkIsNull(password, paramNotAllowed("Password", suffix));
        checkIsNull(authDbName, paramNotAllowed("Auth database name", suffix));
    }

    private static <T> T checkNotNull(final T reference, final String message) throws SchedulerConfigException {
        if (reference == null) {
            throw new SchedulerConfigException(message);
        }
        return reference;
    }

    private static void checkIsNull(final Object reference, final String message) throws SchedulerConfigException {
        if (reference != null) {
            throw new SchedulerConfigException(message);
        }
    }

    private static String paramNotAllowed(final String paramName, final String suffix) {
        return String.format(PARAM_NOT_ALLOWED, paramName, suffix);
    }

    // mutators below

    public MongoConnectorBuilder withClient(final MongoClient client) {
        this.client = client;
        return this;
    }

    public MongoConnectorBuilder withWriteConcernWriteTimeout(int writeConcernWriteTimeout) {
        this.writeConcernWriteTimeout = writeConcernWriteTimeout;
        return this;
    }

    public MongoConnectorBuilder withWriteConcernW(String writeConcernW) {
        this.writeConcernW = writeConcernW;
        return this;
    }

    public MongoConnectorBuilder withDatabaseName(String dbName) {
        this.dbName = dbName;
        return this;
    }

    public MongoConnectorBuilder withUri(final String uri) {
        this.uri = uri;
        return this;
    }

    public MongoConnectorBuilder withAddresses(final String[] addresses) {
        this.addresses = addresses;
        return this;
    }

    public MongoConnectorBuilder withCredentials(final String username, final String password) {
        this.username = username;
        this.password = password;
        return this;
    }

    public MongoConnectorBuilder withAuthDatabaseName(String authDbName) {
        this.authDbName = authDbName;
        return this;
    }

    public MongoConnectorBuilder withMaxConnections(final Integer maxConnections) {
        this.maxConnections = maxConnections;
        return this;
    }

    public MongoConnectorBuilder withConnectTimeoutMillis(final Integer connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
        return this;
    }

    public MongoConnectorBuilder withReadTimeoutMillis(final Integer readTimeoutMillis) {
        this.readTimeoutMillis = readTimeoutMillis;
        return this;
    }

    public MongoConnectorBuilder withSSL(final Boolean enableSSL, final Boolean sslInvalidHostNameAllowed) {
        this.enableSSL = enableSSL;
        this.sslInvalidHostNameAllowed = sslInvalidHostNameAllowed;
        return this;
    }
}
