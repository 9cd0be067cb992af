package com.novemberain.scheduling;

import java.util.Date;

/**
 * Snapshot of a scheduler's identity, state and counters.
 */
public class SchedulerMetaData {

    private final String schedulerName;
    private final String schedulerInstanceId;
    private final Date runningSince;
    private final boolean started;
    private final boolean inStandbyMode;
    private final boolean shutdown;
    private final Class<?> triggerStoreClass;
    private final boolean storeClustered;
    private final int threadPoolSize;
    private final int numberOfJobs;
    private final int numberOfTriggers;
    private final int numberOfCalendars;
    private final long numberOfJobsExecuted;
    private final long numberOfJobsFailed;

    public SchedulerMetaData(String schedulerName, String schedulerInstanceId, Date runningSince,
                             boolean started, boolean inStandbyMode, boolean shutdown,
                             Class<?> triggerStoreClass, boolean storeClustered, int threadPoolSize,
                             int numberOfJobs, int numberOfTriggers, int numberOfCalendars,
                             long numberOfJobsExecuted, long numberOfJobsFailed) {
        this.schedulerName = schedulerName;
        this.schedulerInstanceId = schedulerInstanceId;
        this.runningSince = runningSince;
        this.started = started;
        this.inStandbyMode = inStandbyMode;
        this.shutdown = shutdown;
        this.triggerStoreClass = triggerStoreClass;
        this.storeClustered = storeClustered;
        this.threadPoolSize = threadPoolSize;
        this.numberOfJobs = numberOfJobs;
        this.numberOfTriggers = numberOfTriggers;
        this.numberOfCalendars = numberOfCalendars;
        this.numberOfJobsExecuted = numberOfJobsExecuted;
        this.numberOfJobsFailed = numberOfJobsFailed;
    }

    public String getSchedulerName() {
        return schedulerName;
    }

    public String getSchedulerInstanceId() {
        return schedulerInstanceId;
    }

    /**
     * Time of the first {@code start()}, or null if never started.
     */
    public Date getRunningSince() {
        return runningSince;
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isInStandbyMode() {
        return inStandbyMode;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public Class<?> getTriggerStoreClass() {
        return triggerStoreClass;
    }

    public boolean isStoreClustered() {
        return storeClustered;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public int getNumberOfJobs() {
        return numberOfJobs;
    }

    public int getNumberOfTriggers() {
        return numberOfTriggers;
    }

    public int getNumberOfCalendars() {
        return numberOfCalendars;
    }

    public long getNumberOfJobsExecuted() {
        return numberOfJobsExecuted;
    }

    public long getNumberOfJobsFailed() {
        return numberOfJobsFailed;
    }

    @Override
    public String toString() {
        return "Scheduler '" + schedulerName + "' with instanceId '" + schedulerInstanceId + "'"
                + ", running since: " + runningSince
                + ", started: " + started + ", standby: " + inStandbyMode + ", shutdown: " + shutdown
                + ", store: " + (triggerStoreClass == null ? null : triggerStoreClass.getSimpleName())
                + (storeClustered ? " (clustered)" : "")
                + ", threads: " + threadPoolSize
                + ", jobs: " + numberOfJobs + ", triggers: " + numberOfTriggers
                + ", calendars: " + numberOfCalendars
                + ", executed: " + numberOfJobsExecuted + ", failed: " + numberOfJobsFailed;
    }
}
