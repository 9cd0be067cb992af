package com.novemberain.scheduling;

import com.novemberain.scheduling.calendar.ExclusionCalendar;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;

import java.util.Date;
import java.util.List;
import java.util.Set;

/**
 * Main interface of a scheduler instance.
 *
 * <p>A scheduler is created by {@link StdSchedulerFactory}, starts in standby
 * and fires triggers only after {@link #start()}. Every operation is
 * synchronous: store and validation failures are thrown to the caller, while
 * job failures are only reported to listeners and logged.</p>
 */
public interface Scheduler {

    /**
     * Group of one-shot triggers created by {@link #triggerNow(JobKey, JobDataMap)}.
     */
    String DEFAULT_MANUAL_TRIGGERS = "MANUAL_TRIGGER";

    /**
     * Group of one-shot triggers that re-run jobs cut off by a dead scheduler instance.
     */
    String DEFAULT_RECOVERY_GROUP = "RECOVERING_JOBS";

    String FAILED_JOB_ORIGINAL_TRIGGER_NAME = "QRTZ_FAILED_JOB_ORIG_TRIGGER_NAME";
    String FAILED_JOB_ORIGINAL_TRIGGER_GROUP = "QRTZ_FAILED_JOB_ORIG_TRIGGER_GROUP";
    String FAILED_JOB_ORIGINAL_TRIGGER_FIRETIME_IN_MILLISECONDS =
            "QRTZ_FAILED_JOB_ORIG_TRIGGER_FIRETIME_IN_MILLISECONDS_AS_STRING";
    String FAILED_JOB_ORIGINAL_TRIGGER_SCHEDULED_FIRETIME_IN_MILLISECONDS =
            "QRTZ_FAILED_JOB_ORIG_TRIGGER_SCHEDULED_FIRETIME_IN_MILLISECONDS_AS_STRING";

    String getSchedulerName() throws SchedulerException;

    String getSchedulerInstanceId() throws SchedulerException;

    SchedulerMetaData getMetaData() throws SchedulerException;

    ListenerManager getListenerManager();

    JobRegistry getJobRegistry();

    // lifecycle

    void start() throws SchedulerException;

    void standby() throws SchedulerException;

    void shutdown() throws SchedulerException;

    void shutdown(boolean waitForJobsToComplete) throws SchedulerException;

    boolean isStarted() throws SchedulerException;

    boolean isInStandbyMode() throws SchedulerException;

    boolean isShutdown() throws SchedulerException;

    // jobs

    /**
     * Store a new job.
     *
     * @throws ObjectAlreadyExistsException if a job with the same key exists
     * @throws ObjectNotFoundException if the job type is not registered
     */
    void defineJob(JobDetail jobDetail) throws SchedulerException;

    void addJob(JobDetail jobDetail, boolean replace) throws SchedulerException;

    /**
     * Replace an existing job definition, keeping its triggers.
     */
    void updateJob(JobDetail jobDetail) throws SchedulerException;

    /**
     * Delete the job and all of its triggers.
     *
     * @throws ObjectNotFoundException if there is no such job
     */
    void deleteJob(JobKey jobKey) throws SchedulerException;

    boolean deleteJobs(List<JobKey> jobKeys) throws SchedulerException;

    JobDetail getJobDetail(JobKey jobKey) throws SchedulerException;

    Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) throws SchedulerException;

    List<String> getJobGroupNames() throws SchedulerException;

    boolean checkExists(JobKey jobKey) throws SchedulerException;

    // triggers

    /**
     * Store a new trigger for an existing job.
     *
     * @return the first fire time
     * @throws ObjectNotFoundException if the job does not exist
     * @throws InvalidScheduleException if the trigger would never fire
     * @throws ObjectAlreadyExistsException if a trigger with the same key exists
     */
    Date defineTrigger(Trigger trigger) throws SchedulerException;

    /**
     * Store the job and its first trigger together.
     *
     * @return the first fire time
     */
    Date scheduleJob(JobDetail jobDetail, Trigger trigger) throws SchedulerException;

    /**
     * Replace the trigger stored under {@code triggerKey}.
     *
     * @return the new trigger's first fire time, or null if there was no such trigger
     */
    Date rescheduleTrigger(TriggerKey triggerKey, Trigger newTrigger) throws SchedulerException;

    /**
     * Store a modified copy of a trigger previously read from this scheduler.
     *
     * @throws ConcurrencyConflictException if the trigger was modified in between
     */
    void updateTrigger(Trigger trigger) throws SchedulerException;

    /**
     * @throws ObjectNotFoundException if there is no such trigger
     */
    void deleteTrigger(TriggerKey triggerKey) throws SchedulerException;

    boolean unscheduleJobs(List<TriggerKey> triggerKeys) throws SchedulerException;

    Trigger getTrigger(TriggerKey triggerKey) throws SchedulerException;

    List<Trigger> getTriggersOfJob(JobKey jobKey) throws SchedulerException;

    Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) throws SchedulerException;

    List<String> getTriggerGroupNames() throws SchedulerException;

    boolean checkExists(TriggerKey triggerKey) throws SchedulerException;

    TriggerState getTriggerState(TriggerKey triggerKey) throws SchedulerException;

    void resetTriggerFromErrorState(TriggerKey triggerKey) throws SchedulerException;

    // manual firing

    void triggerNow(JobKey jobKey) throws SchedulerException;

    /**
     * Fire the job once, now, through a one-shot trigger in {@link #DEFAULT_MANUAL_TRIGGERS}.
     */
    void triggerNow(JobKey jobKey, JobDataMap data) throws SchedulerException;

    // pause and resume

    void pauseTrigger(TriggerKey triggerKey) throws SchedulerException;

    void pauseTriggers(GroupMatcher<TriggerKey> matcher) throws SchedulerException;

    void pauseJob(JobKey jobKey) throws SchedulerException;

    void pauseJobs(GroupMatcher<JobKey> matcher) throws SchedulerException;

    void resumeTrigger(TriggerKey triggerKey) throws SchedulerException;

    void resumeTriggers(GroupMatcher<TriggerKey> matcher) throws SchedulerException;

    void resumeJob(JobKey jobKey) throws SchedulerException;

    void resumeJobs(GroupMatcher<JobKey> matcher) throws SchedulerException;

    void pauseAll() throws SchedulerException;

    void resumeAll() throws SchedulerException;

    Set<String> getPausedTriggerGroups() throws SchedulerException;

    Set<String> getPausedJobGroups() throws SchedulerException;

    // calendars

    void addCalendar(String calName, ExclusionCalendar calendar, boolean replace, boolean updateTriggers)
            throws SchedulerException;

    /**
     * @return false if there was no such calendar
     * @throws JobPersistenceException while a trigger references the calendar
     */
    boolean deleteCalendar(String calName) throws SchedulerException;

    ExclusionCalendar getCalendar(String calName) throws SchedulerException;

    List<String> getCalendarNames() throws SchedulerException;

    // execution

    List<JobExecutionContext> getCurrentlyExecutingJobs() throws SchedulerException;

    /**
     * Interrupt one executing fire instance.
     *
     * @return true if the instance was found executing on this scheduler
     */
    boolean interrupt(String fireInstanceId) throws SchedulerException;

    /**
     * Interrupt every executing instance of the job on this scheduler.
     */
    boolean interrupt(JobKey jobKey) throws SchedulerException;

    /**
     * Delete all jobs, triggers and calendars.
     */
    void clear() throws SchedulerException;
}
