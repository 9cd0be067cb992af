package com.novemberain.scheduling.mongodb.db;

import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;

/**
 * A {@link MongoConnector} over a client owned by the application.
 */
public class ExternalMongoConnector implements MongoConnector {

    private final WriteConcern writeConcern;
    private final MongoDatabase database;

    public ExternalMongoConnector(final WriteConcern writeConcern, final MongoDatabase database) {
        this.database = database;
        this.writeConcern = writeConcern;
    }

    public ExternalMongoConnector(final WriteConcern writeConcern, final MongoClient mongoClient, final String dbName) {
        this(writeConcern, mongoClient.getDatabase(dbName));
    }

    @Override
    public MongoCollection<Document> getCollection(String collectionName) {
        return database.getCollection(collectionName).withWriteConcern(writeConcern);
    }

    @Override
    public void close() {
        // the application closes its own client
    }
}
