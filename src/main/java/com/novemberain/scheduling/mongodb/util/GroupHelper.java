package com.novemberain.scheduling.mongodb.util;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.quartz.impl.matchers.GroupMatcher;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import static com.novemberain.scheduling.mongodb.Constants.TRIGGER_JOB_ID;
import static com.novemberain.scheduling.mongodb.util.Keys.KEY_GROUP;

/**
 * Distinct group names of a key-addressed collection.
 */
public class GroupHelper {
    protected final MongoCollection<Document> collection;
    protected final QueryHelper queryHelper;

    public GroupHelper(MongoCollection<Document> collection, QueryHelper queryHelper) {
        this.collection = collection;
        this.queryHelper = queryHelper;
    }

    public Set<String> groupsThatMatch(GroupMatcher<?> matcher) {
        Bson filter = queryHelper.matchingKeysConditionFor(matcher);
        return collection
                .distinct(KEY_GROUP, String.class)
                .filter(filter)
                .into(new HashSet<String>());
    }

    public List<Document> inGroupsThatMatch(GroupMatcher<?> matcher) {
        return collection
                .find(Filters.in(KEY_GROUP, groupsThatMatch(matcher)))
                .into(new LinkedList<Document>());
    }

    public Set<String> allGroups() {
        return collection
                .distinct(KEY_GROUP, String.class)
                .into(new HashSet<String>());
    }

    /**
     * Trigger groups holding at least one trigger of the given jobs.
     */
    public List<String> groupsForJobIds(Collection<ObjectId> ids) {
        return collection.distinct(KEY_GROUP, String.class)
                .filter(Filters.in(TRIGGER_JOB_ID, ids))
                .into(new LinkedList<String>());
    }
}
