package com.novemberain.scheduling;

import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.utils.Key;

public class JobBuilder {

    private JobKey key;
    private final String jobType;
    private String description;
    private boolean durable;
    private boolean requestsRecovery;
    private boolean persistJobDataAfterExecution;
    private boolean concurrentExecutionDisallowed;
    private JobDataMap jobDataMap = new JobDataMap();

    private JobBuilder(String jobType) {
        this.jobType = jobType;
    }

    /**
     * Start building a job executed by the implementation registered as {@code jobType}.
     */
    public static JobBuilder newJob(String jobType) {
        return new JobBuilder(jobType);
    }

    public JobDetail build() {
        if (jobType == null || jobType.trim().isEmpty()) {
            throw new IllegalArgumentException("Job type cannot be empty.");
        }
        JobKey jobKey = key;
        if (jobKey == null) {
            jobKey = new JobKey(Key.createUniqueName(null), null);
        }
        return new JobDetail(jobKey, jobType, description, durable, requestsRecovery,
                persistJobDataAfterExecution, concurrentExecutionDisallowed, new JobDataMap(jobDataMap));
    }

    public JobBuilder withIdentity(String name) {
        return withIdentity(new JobKey(name, null));
    }

    public JobBuilder withIdentity(String name, String group) {
        return withIdentity(new JobKey(name, group));
    }

    public JobBuilder withIdentity(JobKey jobKey) {
        this.key = jobKey;
        return this;
    }

    public JobBuilder withDescription(String jobDescription) {
        this.description = jobDescription;
        return this;
    }

    public JobBuilder storeDurably() {
        return storeDurably(true);
    }

    public JobBuilder storeDurably(boolean jobDurability) {
        this.durable = jobDurability;
        return this;
    }

    public JobBuilder requestRecovery() {
        return requestRecovery(true);
    }

    public JobBuilder requestRecovery(boolean jobShouldRecover) {
        this.requestsRecovery = jobShouldRecover;
        return this;
    }

    public JobBuilder persistJobDataAfterExecution() {
        return persistJobDataAfterExecution(true);
    }

    public JobBuilder persistJobDataAfterExecution(boolean persist) {
        this.persistJobDataAfterExecution = persist;
        return this;
    }

    public JobBuilder disallowConcurrentExecution() {
        return disallowConcurrentExecution(true);
    }

    public JobBuilder disallowConcurrentExecution(boolean disallow) {
        this.concurrentExecutionDisallowed = disallow;
        return this;
    }

    public JobBuilder usingJobData(String dataKey, Object value) {
        jobDataMap.put(dataKey, value);
        return this;
    }

    public JobBuilder usingJobData(JobDataMap newJobDataMap) {
        jobDataMap.putAll(newJobDataMap);
        return this;
    }

    /**
     * Replace the data map instead of adding to it.
     */
    public JobBuilder setJobData(JobDataMap newJobDataMap) {
        jobDataMap = newJobDataMap == null ? new JobDataMap() : newJobDataMap;
        return this;
    }
}
