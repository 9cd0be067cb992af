package com.novemberain.scheduling.mongodb.dao;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.result.UpdateResult;
import com.novemberain.scheduling.util.Clock;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;
import java.util.LinkedList;
import java.util.List;

import static com.novemberain.scheduling.mongodb.Constants.LOCK_INSTANCE_ID;
import static com.novemberain.scheduling.mongodb.util.Keys.*;

/**
 * Trigger and job locks. A unique index on (group, name, type) makes
 * inserting a lock the cluster-wide mutual exclusion.
 */
public class LocksDao {

    private static final Logger log = LoggerFactory.getLogger(LocksDao.class);

    private final MongoCollection<Document> locksCollection;
    private final Clock clock;
    public final String instanceId;

    public LocksDao(MongoCollection<Document> locksCollection, Clock clock, String instanceId) {
        this.locksCollection = locksCollection;
        this.clock = clock;
        this.instanceId = instanceId;
    }

    public MongoCollection<Document> getCollection() {
        return locksCollection;
    }

    public void createIndex(boolean clustered) {
        locksCollection.createIndex(
                Projections.include(KEY_GROUP, KEY_NAME, LOCK_TYPE),
                new IndexOptions().unique(true));

        // stops a collection scan when removing the locks of one instance
        locksCollection.createIndex(Projections.include(LOCK_INSTANCE_ID));

        if (!clustered) {
            // nobody else can own them: these are leftovers of a previous run
            locksCollection.deleteMany(Filters.eq(LOCK_INSTANCE_ID, instanceId));
        }
    }

    public Document findJobLock(JobKey job) {
        return locksCollection.find(createJobLockFilter(job)).first();
    }

    public Document findTriggerLock(TriggerKey trigger) {
        return locksCollection.find(createTriggerLockFilter(trigger)).first();
    }

    public List<TriggerKey> findTriggerLocksOf(String ownerId) {
        final List<TriggerKey> keys = new LinkedList<TriggerKey>();
        for (Document doc : locksCollection.find(createTriggersLocksFilter(ownerId))) {
            keys.add(toTriggerKey(doc));
        }
        return keys;
    }

    /**
     * @throws com.mongodb.MongoWriteException when the job is locked already
     */
    public void lockJob(JobKey jobKey) {
        log.debug("Inserting lock for job {}", jobKey);
        locksCollection.insertOne(createJobLock(jobKey, instanceId, clock.now()));
    }

    /**
     * @throws com.mongodb.MongoWriteException when the trigger is locked already
     */
    public void lockTrigger(TriggerKey key) {
        log.debug("Inserting lock for trigger {}", key);
        locksCollection.insertOne(createTriggerLock(key, instanceId, clock.now()));
    }

    /**
     * Lock given trigger iff its <b>lockTime</b> hasn't changed.
     *
     * <p>Update is performed using "Update document if current" pattern
     * to update iff document in DB hasn't changed - hasn't been relocked
     * by other scheduler.</p>
     *
     * @param key         identifies trigger lock
     * @param lockTime    expected current lockTime
     * @return false when not found or caught an exception
     */
    public boolean relock(TriggerKey key, Date lockTime) {
        UpdateResult updateResult;
        try {
            updateResult = locksCollection.updateOne(
                    createRelockFilter(key, lockTime),
                    createLockUpdateDocument(instanceId, clock.now()));
        } catch (MongoException e) {
            log.error("Relock failed because: " + e.getMessage(), e);
            return false;
        }

        if (updateResult.getModifiedCount() == 1) {
            log.info("Scheduler {} relocked the trigger: {}", instanceId, key);
            return true;
        }
        log.info("Scheduler {} couldn't relock the trigger {} with lock time: {}",
                instanceId, key, lockTime.getTime());
        return false;
    }

    public void remove(Bson lock) {
        locksCollection.deleteMany(lock);
    }

    /**
     * Remove every lock, trigger or job, held by {@code ownerId}.
     */
    public long removeAllOf(String ownerId) {
        return locksCollection.deleteMany(Filters.eq(LOCK_INSTANCE_ID, ownerId)).getDeletedCount();
    }

    /**
     * Unlock the trigger if it still belongs to the current scheduler.
     */
    public void unlockTrigger(TriggerKey key) {
        log.debug("Removing trigger lock {}.{}", key, instanceId);
        remove(toTriggerLockFilter(key, instanceId));
    }

    public void unlockJob(JobKey jobKey) {
        log.debug("Removing lock for job {}", jobKey);
        remove(createJobLockFilter(jobKey));
    }

    public void clear() {
        locksCollection.deleteMany(new Document());
    }
}
