package com.novemberain.scheduling.mongodb.dao;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.UpdateOptions;
import org.bson.Document;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import static com.novemberain.scheduling.mongodb.util.Keys.KEY_GROUP;

public class PausedJobGroupsDao {

    private final MongoCollection<Document> pausedJobGroupsCollection;

    public PausedJobGroupsDao(MongoCollection<Document> pausedJobGroupsCollection) {
        this.pausedJobGroupsCollection = pausedJobGroupsCollection;
    }

    public void createIndex() {
        pausedJobGroupsCollection.createIndex(Projections.include(KEY_GROUP), new IndexOptions().unique(true));
    }

    public Set<String> getPausedGroups() {
        return pausedJobGroupsCollection.distinct(KEY_GROUP, String.class).into(new HashSet<String>());
    }

    public boolean isPaused(String group) {
        return pausedJobGroupsCollection.countDocuments(Filters.eq(KEY_GROUP, group)) > 0;
    }

    /**
     * Records the groups as paused. Pausing an already paused group is a no-op.
     */
    public void pauseGroups(Collection<String> groups) {
        if (groups == null) {
            throw new IllegalArgumentException("groups cannot be null!");
        }
        for (String group : groups) {
            pausedJobGroupsCollection.updateOne(Filters.eq(KEY_GROUP, group),
                    new Document("$set", new Document(KEY_GROUP, group)),
                    new UpdateOptions().upsert(true));
        }
    }

    public void remove() {
        pausedJobGroupsCollection.deleteMany(new Document());
    }

    public void unpauseGroups(Collection<String> groups) {
        pausedJobGroupsCollection.deleteMany(Filters.in(KEY_GROUP, groups));
    }
}
