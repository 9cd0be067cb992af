package com.novemberain.scheduling;

import org.quartz.JobDataMap;
import org.quartz.JobKey;

/**
 * Definition of a job: its identity, the registered type that executes it,
 * behavioural flags and its data map. Instances are built with {@link JobBuilder}.
 */
public class JobDetail implements Cloneable {

    private final JobKey key;
    private final String jobType;
    private final String description;
    private final boolean durable;
    private final boolean requestsRecovery;
    private final boolean persistJobDataAfterExecution;
    private final boolean concurrentExecutionDisallowed;
    private JobDataMap jobDataMap;

    JobDetail(JobKey key, String jobType, String description, boolean durable,
              boolean requestsRecovery, boolean persistJobDataAfterExecution,
              boolean concurrentExecutionDisallowed, JobDataMap jobDataMap) {
        this.key = key;
        this.jobType = jobType;
        this.description = description;
        this.durable = durable;
        this.requestsRecovery = requestsRecovery;
        this.persistJobDataAfterExecution = persistJobDataAfterExecution;
        this.concurrentExecutionDisallowed = concurrentExecutionDisallowed;
        this.jobDataMap = jobDataMap;
    }

    public JobKey getKey() {
        return key;
    }

    /**
     * Identifier under which the job implementation is registered in the {@link JobRegistry}.
     */
    public String getJobType() {
        return jobType;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Durable jobs stay stored when they no longer have any trigger.
     */
    public boolean isDurable() {
        return durable;
    }

    /**
     * Whether the job is re-executed after a scheduler instance died while running it.
     */
    public boolean requestsRecovery() {
        return requestsRecovery;
    }

    public boolean isPersistJobDataAfterExecution() {
        return persistJobDataAfterExecution;
    }

    public boolean isConcurrentExecutionDisallowed() {
        return concurrentExecutionDisallowed;
    }

    public JobDataMap getJobDataMap() {
        return jobDataMap;
    }

    public JobBuilder getJobBuilder() {
        return JobBuilder.newJob(jobType)
                .withIdentity(key)
                .withDescription(description)
                .storeDurably(durable)
                .requestRecovery(requestsRecovery)
                .persistJobDataAfterExecution(persistJobDataAfterExecution)
                .disallowConcurrentExecution(concurrentExecutionDisallowed)
                .usingJobData(new JobDataMap(jobDataMap));
    }

    @Override
    public JobDetail clone() {
        try {
            JobDetail copy = (JobDetail) super.clone();
            copy.jobDataMap = (JobDataMap) jobDataMap.clone();
            return copy;
        } catch (CloneNotSupportedException e) {
            throw new IncompatibleClassChangeError("Not Cloneable.");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof JobDetail)) {
            return false;
        }
        return key.equals(((JobDetail) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return "JobDetail '" + key + "':  jobType: '" + jobType
                + "' concurrentExecutionDisallowed: " + concurrentExecutionDisallowed
                + " persistJobDataAfterExecution: " + persistJobDataAfterExecution
                + " isDurable: " + durable + " requestsRecovers: " + requestsRecovery;
    }
}
