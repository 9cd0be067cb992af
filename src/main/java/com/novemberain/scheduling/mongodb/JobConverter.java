package com.novemberain.scheduling.mongodb;

import com.novemberain.scheduling.JobBuilder;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import org.bson.Document;

import static com.novemberain.scheduling.mongodb.util.Keys.KEY_GROUP;
import static com.novemberain.scheduling.mongodb.util.Keys.KEY_NAME;

public class JobConverter {

    public static final String JOB_DURABILITY = "durability";
    public static final String JOB_TYPE = "jobType";
    public static final String JOB_DESCRIPTION = "jobDescription";
    public static final String JOB_REQUESTS_RECOVERY = "requestsRecovery";
    public static final String JOB_PERSIST_DATA = "persistJobDataAfterExecution";
    public static final String JOB_DISALLOW_CONCURRENT = "concurrentExecutionDisallowed";

    private final JobDataConverter jobDataConverter;

    public JobConverter(JobDataConverter jobDataConverter) {
        this.jobDataConverter = jobDataConverter;
    }

    /**
     * Converts job detail into document.
     * Depending on the config, job data map can be stored
     * as a {@code base64} encoded (default) or plain object.
     */
    public Document toDocument(JobDetail job) throws JobPersistenceException {
        Document doc = new Document();
        doc.put(KEY_NAME, job.getKey().getName());
        doc.put(KEY_GROUP, job.getKey().getGroup());
        doc.put(JOB_DESCRIPTION, job.getDescription());
        doc.put(JOB_TYPE, job.getJobType());
        doc.put(JOB_DURABILITY, job.isDurable());
        doc.put(JOB_REQUESTS_RECOVERY, job.requestsRecovery());
        doc.put(JOB_PERSIST_DATA, job.isPersistJobDataAfterExecution());
        doc.put(JOB_DISALLOW_CONCURRENT, job.isConcurrentExecutionDisallowed());
        jobDataConverter.toDocument(job.getJobDataMap(), doc);
        return doc;
    }

    /**
     * Converts from document to job detail.
     */
    public JobDetail toJobDetail(Document doc) throws JobPersistenceException {
        String jobType = doc.getString(JOB_TYPE);
        if (jobType == null) {
            throw new JobPersistenceException("Job document " + doc.get("_id") + " has no " + JOB_TYPE);
        }
        return JobBuilder.newJob(jobType)
                .withIdentity(doc.getString(KEY_NAME), doc.getString(KEY_GROUP))
                .withDescription(doc.getString(JOB_DESCRIPTION))
                .storeDurably(doc.getBoolean(JOB_DURABILITY, false))
                .requestRecovery(doc.getBoolean(JOB_REQUESTS_RECOVERY, false))
                .persistJobDataAfterExecution(doc.getBoolean(JOB_PERSIST_DATA, false))
                .disallowConcurrentExecution(doc.getBoolean(JOB_DISALLOW_CONCURRENT, false))
                .setJobData(jobDataConverter.toJobData(doc))
                .build();
    }
}
