package com.novemberain.scheduling.mongodb.dao;

import com.mongodb.MongoWriteException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.ObjectAlreadyExistsException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.mongodb.trigger.TriggerConverter;
import com.novemberain.scheduling.mongodb.util.Keys;
import com.novemberain.scheduling.mongodb.util.QueryHelper;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import static com.novemberain.scheduling.mongodb.Constants.STATE_ACQUIRED;
import static com.novemberain.scheduling.mongodb.Constants.STATE_BLOCKED;
import static com.novemberain.scheduling.mongodb.Constants.STATE_COMPLETE;
import static com.novemberain.scheduling.mongodb.Constants.STATE_PAUSED;
import static com.novemberain.scheduling.mongodb.Constants.STATE_PAUSED_BLOCKED;
import static com.novemberain.scheduling.mongodb.Constants.STATE_WAITING;
import static com.novemberain.scheduling.mongodb.Constants.TRIGGER_CALENDAR_NAME;
import static com.novemberain.scheduling.mongodb.Constants.TRIGGER_JOB_ID;
import static com.novemberain.scheduling.mongodb.Constants.TRIGGER_NEXT_FIRE_TIME;
import static com.novemberain.scheduling.mongodb.Constants.TRIGGER_PRIORITY;
import static com.novemberain.scheduling.mongodb.Constants.TRIGGER_STATE;
import static com.novemberain.scheduling.mongodb.Constants.TRIGGER_VERSION;
import static com.novemberain.scheduling.mongodb.util.Keys.KEY_GROUP;
import static com.novemberain.scheduling.mongodb.util.Keys.toFilter;

/**
 * Trigger documents. Every state change made here also bumps the version,
 * so a trigger read before the change no longer matches a version check.
 */
public class TriggerDao {

    private static final Logger log = LoggerFactory.getLogger(TriggerDao.class);

    private final MongoCollection<Document> triggerCollection;
    private final QueryHelper queryHelper;
    private final TriggerConverter triggerConverter;

    public TriggerDao(MongoCollection<Document> triggerCollection, QueryHelper queryHelper,
                      TriggerConverter triggerConverter) {
        this.triggerCollection = triggerCollection;
        this.queryHelper = queryHelper;
        this.triggerConverter = triggerConverter;
    }

    public void createIndex() {
        triggerCollection.createIndex(Keys.KEY_AND_GROUP_FIELDS,
                new IndexOptions().unique(true));
        triggerCollection.createIndex(Projections.include(TRIGGER_STATE, TRIGGER_NEXT_FIRE_TIME));
        triggerCollection.createIndex(Projections.include(TRIGGER_JOB_ID));
    }

    public void clear() {
        triggerCollection.deleteMany(new Document());
    }

    public MongoCollection<Document> getCollection() {
        return triggerCollection;
    }

    public boolean exists(TriggerKey triggerKey) {
        return triggerCollection.countDocuments(toFilter(triggerKey)) > 0;
    }

    /**
     * Triggers waiting, or acquired by an instance whose lock may have expired,
     * due no later than the given date. Earliest first, then highest priority.
     */
    public FindIterable<Document> findEligibleToRun(Date noLaterThanDate) {
        Bson query = createNextTriggerQuery(noLaterThanDate);
        if (log.isDebugEnabled()) {
            log.debug("Found {} triggers which are eligible to be run.", triggerCollection.countDocuments(query));
        }
        return triggerCollection.find(query)
                .sort(Sorts.orderBy(Sorts.ascending(TRIGGER_NEXT_FIRE_TIME), Sorts.descending(TRIGGER_PRIORITY)));
    }

    public Document findTrigger(TriggerKey triggerKey) {
        return triggerCollection.find(toFilter(triggerKey)).first();
    }

    public List<Document> findByJobId(ObjectId jobId) {
        return triggerCollection.find(Filters.eq(TRIGGER_JOB_ID, jobId)).into(new LinkedList<Document>());
    }

    public List<Document> findUnfinishedByCalendarName(String calName) {
        return triggerCollection.find(Filters.and(
                Filters.eq(TRIGGER_CALENDAR_NAME, calName),
                Filters.ne(TRIGGER_STATE, STATE_COMPLETE)))
                .into(new LinkedList<Document>());
    }

    public boolean hasTriggersWithCalendar(String calName) {
        return triggerCollection.countDocuments(Filters.eq(TRIGGER_CALENDAR_NAME, calName)) > 0;
    }

    public int getCount() {
        return (int) triggerCollection.countDocuments();
    }

    public List<String> getGroupNames() {
        List<String> groups = triggerCollection.distinct(KEY_GROUP, String.class).into(new ArrayList<String>());
        Collections.sort(groups);
        return groups;
    }

    /**
     * @return the stored state, or null if there is no such trigger
     */
    public String getState(TriggerKey triggerKey) {
        Document doc = findTrigger(triggerKey);
        return doc == null ? null : doc.getString(TRIGGER_STATE);
    }

    public Trigger getTrigger(TriggerKey triggerKey) throws JobPersistenceException {
        Document doc = findTrigger(triggerKey);
        if (doc == null) {
            return null;
        }
        return triggerConverter.toTrigger(doc);
    }

    public List<Trigger> getTriggersForJob(Document job) throws JobPersistenceException {
        final List<Trigger> triggers = new LinkedList<Trigger>();
        if (job != null) {
            for (Document item : findByJobId(job.getObjectId("_id"))) {
                triggers.add(triggerConverter.toTrigger(item));
            }
        }
        return triggers;
    }

    public Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) {
        return keysOf(queryHelper.matchingKeysConditionFor(matcher));
    }

    public Set<TriggerKey> getTriggerKeysOfJobs(Collection<ObjectId> jobIds) {
        return keysOf(Filters.in(TRIGGER_JOB_ID, jobIds));
    }

    public boolean hasLastTrigger(Object jobId) {
        List<Document> referencedTriggers = triggerCollection
                .find(Filters.eq(TRIGGER_JOB_ID, jobId))
                .limit(2)
                .into(new ArrayList<Document>(2));
        return referencedTriggers.size() == 1;
    }

    public void insert(Document trigger, TriggerKey offendingKey)
            throws ObjectAlreadyExistsException {
        try {
            triggerCollection.insertOne(trigger);
        } catch (MongoWriteException key) {
            throw new ObjectAlreadyExistsException("Trigger " + offendingKey + " already exists.");
        }
    }

    /**
     * Replace the document only if it still carries {@code expectedVersion}
     * and, when given, {@code expectedState}.
     *
     * @return false if another writer got there first
     */
    public boolean replaceIfCurrent(TriggerKey triggerKey, long expectedVersion, String expectedState,
                                    Document trigger) {
        Bson filter = Filters.and(toFilter(triggerKey), Filters.eq(TRIGGER_VERSION, expectedVersion));
        if (expectedState != null) {
            filter = Filters.and(filter, Filters.eq(TRIGGER_STATE, expectedState));
        }
        return triggerCollection.replaceOne(filter, trigger).getMatchedCount() > 0;
    }

    public boolean remove(TriggerKey triggerKey) {
        return triggerCollection.deleteOne(toFilter(triggerKey)).getDeletedCount() > 0;
    }

    public void removeByJobId(Object id) {
        triggerCollection.deleteMany(Filters.eq(TRIGGER_JOB_ID, id));
    }

    public void setState(TriggerKey triggerKey, String state) {
        triggerCollection.updateOne(toFilter(triggerKey), createTriggerStateUpdateDocument(state));
    }

    public boolean transferState(TriggerKey triggerKey, String oldState, String newState) {
        return triggerCollection.updateOne(
                Filters.and(toFilter(triggerKey), Filters.eq(TRIGGER_STATE, oldState)),
                createTriggerStateUpdateDocument(newState)).getModifiedCount() > 0;
    }

    public void setStateByJobId(ObjectId jobId, String state) {
        setStates(Filters.eq(TRIGGER_JOB_ID, jobId), state);
    }

    public void transferStatesByJobId(ObjectId jobId, Collection<String> oldStates, String newState) {
        setStates(Filters.and(Filters.eq(TRIGGER_JOB_ID, jobId), Filters.in(TRIGGER_STATE, oldStates)), newState);
    }

    public void transferStatesInMatching(GroupMatcher<TriggerKey> matcher, Collection<String> oldStates,
                                         String newState) {
        setStates(Filters.and(queryHelper.matchingKeysConditionFor(matcher), Filters.in(TRIGGER_STATE, oldStates)),
                newState);
    }

    public void transferStatesInGroups(Collection<String> groups, Collection<String> oldStates, String newState) {
        setStates(Filters.and(queryHelper.inGroups(groups), Filters.in(TRIGGER_STATE, oldStates)), newState);
    }

    public void transferStatesInAll(Collection<String> oldStates, String newState) {
        setStates(Filters.in(TRIGGER_STATE, oldStates), newState);
    }

    /**
     * Keep the job's other triggers from being acquired while it runs.
     */
    public void blockByJobId(ObjectId jobId) {
        transferStatesByJobId(jobId, Arrays.asList(STATE_WAITING, STATE_ACQUIRED), STATE_BLOCKED);
        transferStatesByJobId(jobId, Collections.singletonList(STATE_PAUSED), STATE_PAUSED_BLOCKED);
    }

    /**
     * Undo {@link #blockByJobId(ObjectId)}. A blocked trigger without a next
     * fire time has nothing left to wait for and completes.
     */
    public void unblockByJobId(ObjectId jobId) {
        Bson blocked = Filters.and(Filters.eq(TRIGGER_JOB_ID, jobId), Filters.eq(TRIGGER_STATE, STATE_BLOCKED));
        setStates(Filters.and(blocked, Filters.ne(TRIGGER_NEXT_FIRE_TIME, null)), STATE_WAITING);
        setStates(Filters.and(blocked, Filters.eq(TRIGGER_NEXT_FIRE_TIME, null)), STATE_COMPLETE);
        transferStatesByJobId(jobId, Collections.singletonList(STATE_PAUSED_BLOCKED), STATE_PAUSED);
    }

    private Set<TriggerKey> keysOf(Bson query) {
        Set<TriggerKey> keys = new HashSet<TriggerKey>();
        for (Document doc : triggerCollection.find(query).projection(Keys.KEY_AND_GROUP_FIELDS)) {
            keys.add(Keys.toTriggerKey(doc));
        }
        return keys;
    }

    private Bson createNextTriggerQuery(Date noLaterThanDate) {
        return Filters.and(
                Filters.lte(TRIGGER_NEXT_FIRE_TIME, noLaterThanDate),
                Filters.in(TRIGGER_STATE, STATE_WAITING, STATE_ACQUIRED));
    }

    private Bson createTriggerStateUpdateDocument(String state) {
        return new Document("$set", new Document(TRIGGER_STATE, state))
                .append("$inc", new Document(TRIGGER_VERSION, 1L));
    }

    private void setStates(Bson filter, String state) {
        triggerCollection.updateMany(filter, createTriggerStateUpdateDocument(state));
    }
}
