package com.novemberain.scheduling.spi;

import org.quartz.JobKey;
import org.quartz.TriggerKey;

import java.util.Date;

/**
 * One in-flight fire instance, kept by a store from the moment a trigger
 * fires until its job completes. Records left behind by a dead instance
 * drive job recovery.
 */
public class FiredTriggerRecord {

    private final String fireInstanceId;
    private final String instanceId;
    private final TriggerKey triggerKey;
    private final JobKey jobKey;
    private final Date scheduledFireTime;
    private final Date fireTime;
    private final int priority;
    private final boolean requestsRecovery;
    private final boolean concurrentExecutionDisallowed;

    public FiredTriggerRecord(String fireInstanceId, String instanceId, TriggerKey triggerKey, JobKey jobKey,
                              Date scheduledFireTime, Date fireTime, int priority,
                              boolean requestsRecovery, boolean concurrentExecutionDisallowed) {
        this.fireInstanceId = fireInstanceId;
        this.instanceId = instanceId;
        this.triggerKey = triggerKey;
        this.jobKey = jobKey;
        this.scheduledFireTime = scheduledFireTime;
        this.fireTime = fireTime;
        this.priority = priority;
        this.requestsRecovery = requestsRecovery;
        this.concurrentExecutionDisallowed = concurrentExecutionDisallowed;
    }

    public String getFireInstanceId() {
        return fireInstanceId;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public TriggerKey getTriggerKey() {
        return triggerKey;
    }

    public JobKey getJobKey() {
        return jobKey;
    }

    public Date getScheduledFireTime() {
        return scheduledFireTime;
    }

    public Date getFireTime() {
        return fireTime;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isRequestsRecovery() {
        return requestsRecovery;
    }

    public boolean isConcurrentExecutionDisallowed() {
        return concurrentExecutionDisallowed;
    }

    @Override
    public String toString() {
        return "FiredTriggerRecord{" + fireInstanceId + " on " + instanceId + ", trigger: " + triggerKey
                + ", job: " + jobKey + ", scheduled: " + scheduledFireTime + "}";
    }
}
