package com.novemberain.scheduling.core;

import com.novemberain.scheduling.JobRegistry;
import com.novemberain.scheduling.spi.TriggerStore;
import com.novemberain.scheduling.spi.WorkerPool;

/**
 * Collaborators and tuning values of one scheduler instance.
 */
public class SchedulerResources {

    public static final long DEFAULT_IDLE_WAIT_TIME = 30000L;
    public static final long DEFAULT_ACQUIRE_RETRY_DELAY = 20L;
    public static final long DEFAULT_MAX_ACQUIRE_RETRY_DELAY = 600000L;
    public static final int DEFAULT_MAX_CONSECUTIVE_ACQUIRE_FAILURES = 5;
    public static final long DEFAULT_JOB_COMPLETION_RETRY_DELAY = 15000L;

    private String name = "DefaultScheduler";
    private String instanceId = "NON_CLUSTERED";
    private TriggerStore triggerStore;
    private WorkerPool workerPool;
    private JobRegistry jobRegistry = new JobRegistry();

    private long idleWaitTime = DEFAULT_IDLE_WAIT_TIME;
    private int maxBatchSize = 1;
    private long batchTimeWindow = 0L;
    private long acquireRetryDelay = DEFAULT_ACQUIRE_RETRY_DELAY;
    private long maxAcquireRetryDelay = DEFAULT_MAX_ACQUIRE_RETRY_DELAY;
    private int maxConsecutiveAcquireFailures = DEFAULT_MAX_CONSECUTIVE_ACQUIRE_FAILURES;
    private long jobCompletionRetryDelay = DEFAULT_JOB_COMPLETION_RETRY_DELAY;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Scheduler name cannot be empty.");
        }
        this.name = name;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        if (instanceId == null || instanceId.trim().isEmpty()) {
            throw new IllegalArgumentException("Scheduler instanceId cannot be empty.");
        }
        this.instanceId = instanceId;
    }

    public String getThreadName() {
        return name + "_SchedulerThread";
    }

    public TriggerStore getTriggerStore() {
        return triggerStore;
    }

    public void setTriggerStore(TriggerStore triggerStore) {
        this.triggerStore = triggerStore;
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }

    public void setWorkerPool(WorkerPool workerPool) {
        this.workerPool = workerPool;
    }

    public JobRegistry getJobRegistry() {
        return jobRegistry;
    }

    public void setJobRegistry(JobRegistry jobRegistry) {
        this.jobRegistry = jobRegistry;
    }

    public long getIdleWaitTime() {
        return idleWaitTime;
    }

    public void setIdleWaitTime(long idleWaitTime) {
        if (idleWaitTime <= 0) {
            throw new IllegalArgumentException("Idle wait time must be greater than 0");
        }
        this.idleWaitTime = idleWaitTime;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
        this.maxBatchSize = maxBatchSize;
    }

    public long getBatchTimeWindow() {
        return batchTimeWindow;
    }

    public void setBatchTimeWindow(long batchTimeWindow) {
        if (batchTimeWindow < 0) {
            throw new IllegalArgumentException("Batch time window cannot be negative");
        }
        this.batchTimeWindow = batchTimeWindow;
    }

    public long getAcquireRetryDelay() {
        return acquireRetryDelay;
    }

    public void setAcquireRetryDelay(long acquireRetryDelay) {
        if (acquireRetryDelay < 1) {
            throw new IllegalArgumentException("Acquire retry delay must be at least 1 ms");
        }
        this.acquireRetryDelay = acquireRetryDelay;
    }

    public long getMaxAcquireRetryDelay() {
        return maxAcquireRetryDelay;
    }

    public void setMaxAcquireRetryDelay(long maxAcquireRetryDelay) {
        if (maxAcquireRetryDelay < 1) {
            throw new IllegalArgumentException("Max acquire retry delay must be at least 1 ms");
        }
        this.maxAcquireRetryDelay = maxAcquireRetryDelay;
    }

    public int getMaxConsecutiveAcquireFailures() {
        return maxConsecutiveAcquireFailures;
    }

    public void setMaxConsecutiveAcquireFailures(int maxConsecutiveAcquireFailures) {
        if (maxConsecutiveAcquireFailures < 1) {
            throw new IllegalArgumentException("Max consecutive acquire failures must be at least 1");
        }
        this.maxConsecutiveAcquireFailures = maxConsecutiveAcquireFailures;
    }

    public long getJobCompletionRetryDelay() {
        return jobCompletionRetryDelay;
    }

    public void setJobCompletionRetryDelay(long jobCompletionRetryDelay) {
        this.jobCompletionRetryDelay = jobCompletionRetryDelay;
    }
}
