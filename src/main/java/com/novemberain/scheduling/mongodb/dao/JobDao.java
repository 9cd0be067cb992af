package com.novemberain.scheduling.mongodb.dao;

import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.ObjectAlreadyExistsException;
import com.novemberain.scheduling.mongodb.Constants;
import com.novemberain.scheduling.mongodb.JobConverter;
import com.novemberain.scheduling.mongodb.JobDataConverter;
import com.novemberain.scheduling.mongodb.util.GroupHelper;
import com.novemberain.scheduling.mongodb.util.Keys;
import com.novemberain.scheduling.mongodb.util.QueryHelper;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.impl.matchers.GroupMatcher;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.novemberain.scheduling.mongodb.util.Keys.KEY_GROUP;
import static com.novemberain.scheduling.mongodb.util.Keys.toFilter;

public class JobDao {

    private final MongoCollection<Document> jobCollection;
    private final QueryHelper queryHelper;
    private final GroupHelper groupHelper;
    private final JobConverter jobConverter;
    private final JobDataConverter jobDataConverter;

    public JobDao(MongoCollection<Document> jobCollection, QueryHelper queryHelper,
                  JobConverter jobConverter, JobDataConverter jobDataConverter) {
        this.jobCollection = jobCollection;
        this.queryHelper = queryHelper;
        this.groupHelper = new GroupHelper(jobCollection, queryHelper);
        this.jobConverter = jobConverter;
        this.jobDataConverter = jobDataConverter;
    }

    public MongoCollection<Document> getCollection() {
        return jobCollection;
    }

    public void clear() {
        jobCollection.deleteMany(new Document());
    }

    public void createIndex() {
        jobCollection.createIndex(Keys.KEY_AND_GROUP_FIELDS, new IndexOptions().unique(true));
    }

    public boolean exists(JobKey jobKey) {
        return jobCollection.countDocuments(toFilter(jobKey)) > 0;
    }

    public Document getById(Object id) {
        return jobCollection.find(Filters.eq("_id", id)).first();
    }

    public Document getJob(JobKey key) {
        return jobCollection.find(toFilter(key)).first();
    }

    public int getCount() {
        return (int) jobCollection.countDocuments();
    }

    public List<String> getGroupNames() {
        return jobCollection.distinct(KEY_GROUP, String.class).into(new ArrayList<String>());
    }

    public Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) {
        Set<JobKey> keys = new HashSet<JobKey>();
        Bson query = queryHelper.matchingKeysConditionFor(matcher);
        for (Document doc : jobCollection.find(query).projection(Keys.KEY_AND_GROUP_FIELDS)) {
            keys.add(Keys.toJobKey(doc));
        }
        return keys;
    }

    public Collection<ObjectId> idsOfMatching(GroupMatcher<JobKey> matcher) {
        List<ObjectId> list = new ArrayList<ObjectId>();
        for (Document doc : groupHelper.inGroupsThatMatch(matcher)) {
            list.add(doc.getObjectId("_id"));
        }
        return list;
    }

    public void remove(JobKey jobKey) {
        jobCollection.deleteOne(toFilter(jobKey));
    }

    public void removeById(Object id) {
        jobCollection.deleteOne(Filters.eq("_id", id));
    }

    public JobDetail retrieveJob(JobKey jobKey) throws JobPersistenceException {
        Document doc = getJob(jobKey);
        if (doc == null) {
            return null;
        }
        return jobConverter.toJobDetail(doc);
    }

    public JobDetail toJobDetail(Document doc) throws JobPersistenceException {
        return jobConverter.toJobDetail(doc);
    }

    /**
     * Insert the job, or replace the stored one keeping its id.
     *
     * @return the id of the stored job document
     * @throws ObjectAlreadyExistsException if the job exists and {@code replaceExisting} is false
     */
    public ObjectId storeJobInMongo(JobDetail newJob, boolean replaceExisting) throws JobPersistenceException {
        Bson keyDbo = toFilter(newJob.getKey());
        Document job = jobConverter.toDocument(newJob);

        Document existing = jobCollection.find(keyDbo).first();
        if (existing != null) {
            if (!replaceExisting) {
                throw new ObjectAlreadyExistsException(newJob);
            }
            jobCollection.replaceOne(keyDbo, job);
            return existing.getObjectId("_id");
        }
        try {
            jobCollection.insertOne(job);
        } catch (MongoWriteException e) {
            // lost a race with another node storing the same job
            throw new ObjectAlreadyExistsException(newJob);
        }
        return job.getObjectId("_id");
    }

    /**
     * Replace only the data map of a stored job, as done after an execution.
     */
    public void updateJobData(JobKey jobKey, JobDataMap jobData) throws JobPersistenceException {
        Document data = new Document();
        jobDataConverter.toDocument(jobData, data);
        Document update = new Document("$unset", new Document(Constants.JOB_DATA, "")
                .append(Constants.JOB_DATA_PLAIN, ""));
        if (!data.isEmpty()) {
            // $set and $unset may not name the same field
            Document unset = (Document) update.get("$unset");
            for (String field : data.keySet()) {
                unset.remove(field);
            }
            update.append("$set", data);
        }
        jobCollection.updateOne(toFilter(jobKey), update);
    }
}
