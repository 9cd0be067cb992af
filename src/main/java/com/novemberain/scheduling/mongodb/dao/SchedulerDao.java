package com.novemberain.scheduling.mongodb.dao;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import com.novemberain.scheduling.mongodb.cluster.SchedulerInstance;
import com.novemberain.scheduling.util.Clock;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.mongodb.client.model.Sorts.ascending;

public class SchedulerDao {

    private static final Logger log = LoggerFactory.getLogger(SchedulerDao.class);

    public static final String SCHEDULER_NAME_FIELD = "schedulerName";
    public static final String INSTANCE_ID_FIELD = "instanceId";
    public static final String LAST_CHECKIN_TIME_FIELD = "lastCheckinTime";
    public static final String CHECKIN_INTERVAL_FIELD = "checkinInterval";

    private final MongoCollection<Document> schedulerCollection;

    public final String schedulerName;
    public final String instanceId;
    private final long clusterCheckinIntervalMillis;
    private final Clock clock;

    private final Bson schedulerFilter;

    public SchedulerDao(MongoCollection<Document> schedulerCollection, String schedulerName,
                        String instanceId, long clusterCheckinIntervalMillis, Clock clock) {
        this.schedulerCollection = schedulerCollection;
        this.schedulerName = schedulerName;
        this.instanceId = instanceId;
        this.schedulerFilter = createSchedulerFilter(instanceId);
        this.clusterCheckinIntervalMillis = clusterCheckinIntervalMillis;
        this.clock = clock;
    }

    public MongoCollection<Document> getCollection() {
        return schedulerCollection;
    }

    public void createIndex() {
        schedulerCollection.createIndex(
                Projections.include(SCHEDULER_NAME_FIELD, INSTANCE_ID_FIELD),
                new IndexOptions().unique(true));
    }

    /**
     * Check in to tell the other nodes this instance is alive.
     */
    public void checkIn() {
        long lastCheckinTime = clock.millis();

        log.debug("Saving node data: name='{}', id='{}', checkin time={}, interval={}",
                schedulerName, instanceId, lastCheckinTime, clusterCheckinIntervalMillis);

        // upsert: the first check-in creates the entry from the filter
        UpdateResult result = schedulerCollection
                .updateOne(schedulerFilter, createUpdateClause(lastCheckinTime), new UpdateOptions().upsert(true));

        log.debug("Node {}:{} check-in result: {}", schedulerName, instanceId, result);
    }

    /**
     * @return the instance or null when not found
     */
    public SchedulerInstance findInstance(String instanceId) {
        Document doc = schedulerCollection.find(createSchedulerFilter(instanceId)).first();
        if (doc == null) {
            log.debug("Scheduler instance '{}' not found.", instanceId);
            return null;
        }
        return toSchedulerInstance(doc);
    }

    public boolean isNotSelf(SchedulerInstance scheduler) {
        return !instanceId.equals(scheduler.getInstanceId());
    }

    /**
     * Instances of this scheduler in ascending order of last check-in time.
     */
    public List<SchedulerInstance> getAllByCheckinTime() {
        final List<SchedulerInstance> schedulers = new ArrayList<SchedulerInstance>();
        for (Document doc : schedulerCollection
                .find(Filters.eq(SCHEDULER_NAME_FIELD, schedulerName))
                .sort(ascending(LAST_CHECKIN_TIME_FIELD))) {
            schedulers.add(toSchedulerInstance(doc));
        }
        return schedulers;
    }

    /**
     * Remove an instance entry unless it checked in again after {@code lastCheckinTime}.
     *
     * @return true when removed
     */
    public boolean remove(String instanceId, long lastCheckinTime) {
        log.info("Removing scheduler: {},{},{}", schedulerName, instanceId, lastCheckinTime);
        DeleteResult result = schedulerCollection.deleteOne(Filters.and(
                createSchedulerFilter(instanceId),
                Filters.eq(LAST_CHECKIN_TIME_FIELD, lastCheckinTime)));
        return result.getDeletedCount() == 1;
    }

    private Bson createSchedulerFilter(String instanceId) {
        return Filters.and(
                Filters.eq(SCHEDULER_NAME_FIELD, schedulerName),
                Filters.eq(INSTANCE_ID_FIELD, instanceId));
    }

    private Document createUpdateClause(long lastCheckinTime) {
        return new Document("$set", new Document()
                .append(LAST_CHECKIN_TIME_FIELD, lastCheckinTime)
                .append(CHECKIN_INTERVAL_FIELD, clusterCheckinIntervalMillis));
    }

    private SchedulerInstance toSchedulerInstance(Document document) {
        return new SchedulerInstance(
                document.getString(SCHEDULER_NAME_FIELD),
                document.getString(INSTANCE_ID_FIELD),
                document.getLong(LAST_CHECKIN_TIME_FIELD),
                document.getLong(CHECKIN_INTERVAL_FIELD));
    }
}
