package com.novemberain.scheduling.mongodb.db;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import com.novemberain.scheduling.SchedulerConfigException;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Builds the {@link MongoConnector} of a trigger store. Exactly one
 * connection source is allowed, checked in this order: a connector, a
 * database, a client, a URI, or server addresses. Options that the chosen
 * source makes meaningless are rejected.
 */
public class MongoConnectorBuilder {

    private static final String PARAM_NOT_ALLOWED = "'%s' parameter is not allowed. %s";

    private MongoConnector connector;
    private String writeConcernW;
    private Integer writeConcernWriteTimeout;
    private MongoDatabase database;
    private MongoClient client;
    private String dbName;
    private String uri;
    private String[] addresses;
    private String username;
    private String password;
    private String authDbName;
    private Integer maxConnections;
    private Integer connectTimeoutMillis;
    private Integer readTimeoutMillis;

    private MongoConnectorBuilder() {
    }

    public static MongoConnectorBuilder builder() {
        return new MongoConnectorBuilder();
    }

    /**
     * @throws SchedulerConfigException if the combination of parameters is invalid
     */
    public MongoConnector build() throws SchedulerConfigException {
        if (connector != null) {
            validateForConnector();
            return connector;
        }

        final WriteConcern writeConcern = createWriteConcern();

        if (database != null) {
            validateForDatabase();
            return new ExternalMongoConnector(writeConcern, database);
        }

        resolveDbNameByUriIfNull();
        checkNotNull(dbName, "'Database name' is required, as parameter or in MongoDB URI path.");

        if (client != null) {
            validateForClient();
            return new ExternalMongoConnector(writeConcern, client, dbName);
        }

        final MongoClientSettings.Builder settingsBuilder = createSettingsBuilder();
        if (uri != null) {
            validateForUri();
            // credentials in the URI itself take precedence
            createCredentials().ifPresent(settingsBuilder::credential);
            return new InternalMongoConnector(writeConcern, uri, dbName, settingsBuilder);
        }

        checkNotNull(addresses, "At least one MongoDB address or a MongoDB URI must be specified.");
        return new InternalMongoConnector(writeConcern, collectServerAddresses(), createCredentials(),
                settingsBuilder, dbName);
    }

    private void resolveDbNameByUriIfNull() throws SchedulerConfigException {
        if (dbName == null && uri != null) {
            String path;
            try {
                path = URI.create(uri).getPath();
            } catch (IllegalArgumentException e) {
                throw new SchedulerConfigException("Invalid mongo client uri.", e);
            }
            if (path != null && path.startsWith("/") && path.length() > 1) {
                dbName = path.substring(1);
            }
        }
    }

    private List<ServerAddress> collectServerAddresses() {
        final List<ServerAddress> serverAddresses = new ArrayList<ServerAddress>(addresses.length);
        for (final String address : addresses) {
            serverAddresses.add(new ServerAddress(address.trim()));
        }
        return serverAddresses;
    }

    private Optional<MongoCredential> createCredentials() throws SchedulerConfigException {
        if (username == null) {
            return Optional.empty();
        }
        checkNotNull(password, "Password is required together with a username.");
        // the auth database, "admin" usually, grants access to the others
        String source = authDbName != null ? authDbName : dbName;
        return Optional.of(MongoCredential.createCredential(username, source, password.toCharArray()));
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
        return settingsBuilder;
    }

    private WriteConcern createWriteConcern() throws SchedulerConfigException {
        checkNotNull(writeConcernWriteTimeout, "Write timeout is expected.");

        if (writeConcernW != null) {
            WriteConcern named = WriteConcern.valueOf(writeConcernW);
            if (named == null) {
                throw new SchedulerConfigException("Unknown write concern: " + writeConcernW);
            }
            return named.withWTimeout(writeConcernWriteTimeout, TimeUnit.MILLISECONDS).withJournal(true);
        }

        // MAJORITY so that locks and check-ins survive a primary failover
        return WriteConcern.MAJORITY.withWTimeout(writeConcernWriteTimeout, TimeUnit.MILLISECONDS)
                .withJournal(true);
    }

    private void validateForConnector() throws SchedulerConfigException {
        final String suffix = "'Connector' parameter is used.";
        checkIsNull(database, paramNotAllowed("Database", suffix));
        checkIsNull(client, paramNotAllowed("Client", suffix));
        checkIsNull(dbName, paramNotAllowed("Database name", suffix));
        checkIsNull(uri, paramNotAllowed("URI", suffix));
        checkServerPropertiesAreNull(suffix);
        checkConnectionOptionsAreNull(suffix);
    }

    private void validateForDatabase() throws SchedulerConfigException {
        final String suffix = "'Database' parameter is used.";
        checkIsNull(client, paramNotAllowed("Client", suffix));
        checkIsNull(dbName, paramNotAllowed("Database name", suffix));
        checkIsNull(uri, paramNotAllowed("URI", suffix));
        checkServerPropertiesAreNull(suffix);
        checkConnectionOptionsAreNull(suffix);
    }

    private void validateForClient() throws SchedulerConfigException {
        final String suffix = "'Client' parameter is used.";
        checkIsNull(uri, paramNotAllowed("URI", suffix));
        checkServerPropertiesAreNull(suffix);
        checkConnectionOptionsAreNull(suffix);
    }

    private void validateForUri() throws SchedulerConfigException {
        checkIsNull(addresses, paramNotAllowed("Addresses array", "'URI' parameter is used."));
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

    private void checkServerPropertiesAreNull(final String suffix) throws SchedulerConfigException {
        checkIsNull(addresses, paramNotAllowed("Addresses array", suffix));
        checkIsNull(username, paramNotAllowed("Username", suffix));
        checkIsNull(password, paramNotAllowed("Password", suffix));
        checkIsNull(authDbName, paramNotAllowed("Auth database name", suffix));
    }

    private void checkConnectionOptionsAreNull(final String suffix) throws SchedulerConfigException {
        checkIsNull(maxConnections, paramNotAllowed("Max connections", suffix));
        checkIsNull(connectTimeoutMillis, paramNotAllowed("Connect timeout millis", suffix));
        checkIsNull(readTimeoutMillis, paramNotAllowed("Read timeout millis", suffix));
    }

    private static String paramNotAllowed(final String paramName, final String suffix) {
        return String.format(PARAM_NOT_ALLOWED, paramName, suffix);
    }

    public MongoConnectorBuilder withConnector(final MongoConnector connector) {
        this.connector = connector;
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

    public MongoConnectorBuilder withDatabase(final MongoDatabase database) {
        this.database = database;
        return this;
    }

    public MongoConnectorBuilder withClient(final MongoClient client) {
        this.client = client;
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
}
