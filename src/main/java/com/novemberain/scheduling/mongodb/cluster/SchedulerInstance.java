package com.novemberain.scheduling.mongodb.cluster;

/**
 * A scheduler instance as last seen in the {@code schedulers} collection.
 */
public class SchedulerInstance {

    public static final long TIME_EPSILON = 7500L;

    private final String name;
    private final String instanceId;
    private final long lastCheckinTime;
    private final long checkinInterval;

    public SchedulerInstance(String name, String instanceId, long lastCheckinTime, long checkinInterval) {
        this.name = name;
        this.instanceId = instanceId;
        this.lastCheckinTime = lastCheckinTime;
        this.checkinInterval = checkinInterval;
    }

    public String getName() {
        return name;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public long getLastCheckinTime() {
        return lastCheckinTime;
    }

    public long getCheckinInterval() {
        return checkinInterval;
    }

    /**
     * Return true if the instance missed its check-in as of {@code time}.
     */
    public boolean isDefunct(long time) {
        return expectedCheckinTime() < time;
    }

    private long expectedCheckinTime() {
        return lastCheckinTime + checkinInterval + TIME_EPSILON;
    }

    @Override
    public String toString() {
        return "SchedulerInstance{" + name + "/" + instanceId
                + ", lastCheckinTime=" + lastCheckinTime
                + ", checkinInterval=" + checkinInterval + "}";
    }
}
