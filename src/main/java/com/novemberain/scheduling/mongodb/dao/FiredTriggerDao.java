package com.novemberain.scheduling.mongodb.dao;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Projections;
import com.novemberain.scheduling.spi.FiredTriggerRecord;
import org.bson.Document;
import org.quartz.JobKey;
import org.quartz.TriggerKey;

import java.util.ArrayList;
import java.util.List;

import static com.novemberain.scheduling.mongodb.util.Keys.KEY_GROUP;
import static com.novemberain.scheduling.mongodb.util.Keys.KEY_NAME;

/**
 * Fire instances between {@code triggersFired} and job completion. What is
 * left here by a dead instance is what recovery works on.
 */
public class FiredTriggerDao {

    public static final String FIRE_INSTANCE_ID = "fireInstanceId";
    public static final String INSTANCE_ID = "instanceId";
    private static final String JOB_NAME = "jobName";
    private static final String JOB_GROUP = "jobGroup";
    private static final String SCHEDULED_FIRE_TIME = "scheduledFireTime";
    private static final String FIRE_TIME = "fireTime";
    private static final String PRIORITY = "priority";
    private static final String REQUESTS_RECOVERY = "requestsRecovery";
    private static final String CONCURRENT_EXECUTION_DISALLOWED = "concurrentExecutionDisallowed";

    private final MongoCollection<Document> firedTriggersCollection;

    public FiredTriggerDao(MongoCollection<Document> firedTriggersCollection) {
        this.firedTriggersCollection = firedTriggersCollection;
    }

    public MongoCollection<Document> getCollection() {
        return firedTriggersCollection;
    }

    public void createIndex() {
        firedTriggersCollection.createIndex(Projections.include(FIRE_INSTANCE_ID),
                new IndexOptions().unique(true));
        firedTriggersCollection.createIndex(Projections.include(INSTANCE_ID));
    }

    public void clear() {
        firedTriggersCollection.deleteMany(new Document());
    }

    public void insert(FiredTriggerRecord record) {
        firedTriggersCollection.insertOne(toDocument(record));
    }

    public boolean remove(String fireInstanceId) {
        return firedTriggersCollection.deleteOne(Filters.eq(FIRE_INSTANCE_ID, fireInstanceId))
                .getDeletedCount() > 0;
    }

    public List<FiredTriggerRecord> findByInstanceId(String instanceId) {
        List<FiredTriggerRecord> records = new ArrayList<FiredTriggerRecord>();
        for (Document doc : firedTriggersCollection.find(Filters.eq(INSTANCE_ID, instanceId))) {
            records.add(toRecord(doc));
        }
        return records;
    }

    private Document toDocument(FiredTriggerRecord record) {
        return new Document(FIRE_INSTANCE_ID, record.getFireInstanceId())
                .append(INSTANCE_ID, record.getInstanceId())
                .append(KEY_NAME, record.getTriggerKey().getName())
                .append(KEY_GROUP, record.getTriggerKey().getGroup())
                .append(JOB_NAME, record.getJobKey().getName())
                .append(JOB_GROUP, record.getJobKey().getGroup())
                .append(SCHEDULED_FIRE_TIME, record.getScheduledFireTime())
                .append(FIRE_TIME, record.getFireTime())
                .append(PRIORITY, record.getPriority())
                .append(REQUESTS_RECOVERY, record.isRequestsRecovery())
                .append(CONCURRENT_EXECUTION_DISALLOWED, record.isConcurrentExecutionDisallowed());
    }

    private FiredTriggerRecord toRecord(Document doc) {
        return new FiredTriggerRecord(
                doc.getString(FIRE_INSTANCE_ID),
                doc.getString(INSTANCE_ID),
                new TriggerKey(doc.getString(KEY_NAME), doc.getString(KEY_GROUP)),
                new JobKey(doc.getString(JOB_NAME), doc.getString(JOB_GROUP)),
                doc.getDate(SCHEDULED_FIRE_TIME),
                doc.getDate(FIRE_TIME),
                doc.getInteger(PRIORITY, 5),
                doc.getBoolean(REQUESTS_RECOVERY, false),
                doc.getBoolean(CONCURRENT_EXECUTION_DISALLOWED, false));
    }
}
