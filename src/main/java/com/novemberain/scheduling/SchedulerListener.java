package com.novemberain.scheduling;

import org.quartz.JobKey;
import org.quartz.TriggerKey;

/**
 * Receives scheduler-wide events. All methods have empty defaults.
 */
public interface SchedulerListener {

    default void jobScheduled(Trigger trigger) {
    }

    default void jobUnscheduled(TriggerKey triggerKey) {
    }

    /**
     * The trigger will never fire again.
     */
    default void triggerFinalized(Trigger trigger) {
    }

    default void triggerPaused(TriggerKey triggerKey) {
    }

    default void triggersPaused(String triggerGroup) {
    }

    default void triggerResumed(TriggerKey triggerKey) {
    }

    default void triggersResumed(String triggerGroup) {
    }

    default void jobAdded(JobDetail jobDetail) {
    }

    default void jobDeleted(JobKey jobKey) {
    }

    default void jobPaused(JobKey jobKey) {
    }

    default void jobsPaused(String jobGroup) {
    }

    default void jobResumed(JobKey jobKey) {
    }

    default void jobsResumed(String jobGroup) {
    }

    default void schedulerError(String msg, SchedulerException cause) {
    }

    /**
     * Trigger acquisition failed {@code consecutiveFailures} times in a row.
     * Called once per outage.
     */
    default void storeUnavailable(int consecutiveFailures, SchedulerException cause) {
    }

    /**
     * Trigger acquisition succeeded again after {@link #storeUnavailable}.
     */
    default void storeRecovered() {
    }

    default void schedulerInStandbyMode() {
    }

    default void schedulerStarted() {
    }

    default void schedulerShutdown() {
    }

    default void schedulingDataCleared() {
    }
}
