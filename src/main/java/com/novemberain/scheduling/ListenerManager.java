package com.novemberain.scheduling;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds the listeners of one scheduler. Safe to modify while the scheduler runs.
 */
public class ListenerManager {

    private final List<JobListener> jobListeners = new CopyOnWriteArrayList<JobListener>();
    private final List<TriggerListener> triggerListeners = new CopyOnWriteArrayList<TriggerListener>();
    private final List<SchedulerListener> schedulerListeners = new CopyOnWriteArrayList<SchedulerListener>();

    public void addJobListener(JobListener listener) {
        checkName(listener.getName());
        removeJobListener(listener.getName());
        jobListeners.add(listener);
    }

    public boolean removeJobListener(String name) {
        for (JobListener listener : jobListeners) {
            if (listener.getName().equals(name)) {
                return jobListeners.remove(listener);
            }
        }
        return false;
    }

    public List<JobListener> getJobListeners() {
        return jobListeners;
    }

    public void addTriggerListener(TriggerListener listener) {
        checkName(listener.getName());
        removeTriggerListener(listener.getName());
        triggerListeners.add(listener);
    }

    public boolean removeTriggerListener(String name) {
        for (TriggerListener listener : triggerListeners) {
            if (listener.getName().equals(name)) {
                return triggerListeners.remove(listener);
            }
        }
        return false;
    }

    public List<TriggerListener> getTriggerListeners() {
        return triggerListeners;
    }

    public void addSchedulerListener(SchedulerListener listener) {
        schedulerListeners.add(listener);
    }

    public boolean removeSchedulerListener(SchedulerListener listener) {
        return schedulerListeners.remove(listener);
    }

    public List<SchedulerListener> getSchedulerListeners() {
        return schedulerListeners;
    }

    private static void checkName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Listener name cannot be empty.");
        }
    }
}
