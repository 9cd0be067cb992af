package com.novemberain.scheduling.mongodb.db;

import com.mongodb.client.MongoCollection;
import org.bson.Document;

import java.io.Closeable;

/**
 * Source of the collections the trigger store keeps its state in.
 * Collections handed out carry the write concern the store relies on.
 */
public interface MongoConnector extends Closeable {

    MongoCollection<Document> getCollection(String collectionName);

    /**
     * Called on store shutdown. Only a connector that created its own
     * client closes it.
     */
    @Override
    void close();
}
