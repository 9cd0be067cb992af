package com.novemberain.scheduling.mongodb.db;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.MongoException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.novemberain.scheduling.SchedulerConfigException;
import org.bson.Document;

import java.util.List;
import java.util.Optional;

/**
 * A {@link MongoConnector} that creates its client from configuration and
 * closes it on shutdown.
 */
public class InternalMongoConnector implements MongoConnector {

    private final WriteConcern writeConcern;
    private final MongoClient mongoClient;
    private final MongoDatabase database;

    private InternalMongoConnector(final WriteConcern writeConcern, final MongoClient mongoClient,
                                   final String dbName) {
        this.writeConcern = writeConcern;
        this.mongoClient = mongoClient;
        this.database = mongoClient.getDatabase(dbName);
    }

    /**
     * @param uri             MongoDB connection string
     * @param settingsBuilder options applied before the connection string
     * @throws SchedulerConfigException if the URI is invalid or the client cannot be created
     */
    public InternalMongoConnector(final WriteConcern writeConcern, final String uri, final String dbName,
                                  final MongoClientSettings.Builder settingsBuilder) throws SchedulerConfigException {
        this(writeConcern, createClient(uri, settingsBuilder), dbName);
    }

    /**
     * @param seeds       server addresses
     * @param credentials credentials used to authenticate all connections
     * @throws SchedulerConfigException if the client cannot be created
     */
    public InternalMongoConnector(final WriteConcern writeConcern, final List<ServerAddress> seeds,
                                  final Optional<MongoCredential> credentials,
                                  final MongoClientSettings.Builder settingsBuilder,
                                  final String dbName) throws SchedulerConfigException {
        this(writeConcern, createClient(seeds, credentials, settingsBuilder), dbName);
    }

    @Override
    public MongoCollection<Document> getCollection(String collectionName) {
        return database.getCollection(collectionName).withWriteConcern(writeConcern);
    }

    @Override
    public void close() {
        mongoClient.close();
    }

    private static MongoClient createClient(final MongoClientSettings settings) throws SchedulerConfigException {
        try {
            return MongoClients.create(settings);
        } catch (final MongoException e) {
            throw new SchedulerConfigException("MongoDB driver thrown an exception.", e);
        }
    }

    private static MongoClient createClient(final String uri, final MongoClientSettings.Builder settingsBuilder)
            throws SchedulerConfigException {
        final ConnectionString connectionString;
        try {
            connectionString = new ConnectionString(uri);
        } catch (final IllegalArgumentException e) {
            throw new SchedulerConfigException("Invalid mongo client uri.", e);
        }
        return createClient(settingsBuilder.applyConnectionString(connectionString).build());
    }

    private static MongoClient createClient(final List<ServerAddress> seeds,
                                            final Optional<MongoCredential> credentials,
                                            final MongoClientSettings.Builder settingsBuilder)
            throws SchedulerConfigException {
        settingsBuilder.applyToClusterSettings(builder -> builder.hosts(seeds));
        credentials.ifPresent(settingsBuilder::credential);
        return createClient(settingsBuilder.build());
    }
}
