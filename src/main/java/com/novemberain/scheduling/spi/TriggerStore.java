package com.novemberain.scheduling.spi;

import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.ObjectAlreadyExistsException;
import com.novemberain.scheduling.SchedulerConfigException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerState;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.schedule.ScheduleCalculator;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Storage of jobs, triggers and calendars, and the trigger state machine that
 * decides which trigger fires when.
 *
 * <p>Implementations must be safe for use by the dispatch loop, the worker
 * threads and API callers at the same time. Clustered implementations must
 * also guarantee that a trigger is acquired by at most one scheduler
 * instance.</p>
 */
public interface TriggerStore {

    // lifecycle

    void initialize(SchedulerSignaler signaler, ScheduleCalculator calculator) throws SchedulerConfigException;

    /**
     * Called once the scheduler is ready to fire. Stores recover fired
     * triggers left by a previous run of this instance here.
     */
    void schedulerStarted() throws JobPersistenceException;

    void schedulerPaused();

    void schedulerResumed();

    void shutdown();

    boolean isClustered();

    void setInstanceId(String instanceId);

    void setInstanceName(String instanceName);

    void setMisfireThreshold(long misfireThreshold);

    // jobs and triggers

    void storeJob(JobDetail job, boolean replaceExisting) throws JobPersistenceException;

    void storeJobAndTrigger(JobDetail job, Trigger trigger) throws JobPersistenceException;

    /**
     * Store the trigger, computing its first fire time.
     *
     * <p>When replacing a trigger read earlier from this store, its version
     * is compared with the stored one.</p>
     *
     * @throws ObjectAlreadyExistsException if the trigger exists and {@code replaceExisting} is false
     * @throws com.novemberain.scheduling.ConcurrencyConflictException if the stored version differs
     */
    void storeTrigger(Trigger trigger, boolean replaceExisting) throws JobPersistenceException;

    /**
     * Replace the trigger, keeping the old one if the new one cannot be stored.
     *
     * @return false if there was no trigger under {@code triggerKey}
     */
    boolean replaceTrigger(TriggerKey triggerKey, Trigger newTrigger) throws JobPersistenceException;

    boolean removeJob(JobKey jobKey) throws JobPersistenceException;

    /**
     * Remove the trigger, and its job if that is not durable and has no other trigger.
     */
    boolean removeTrigger(TriggerKey triggerKey) throws JobPersistenceException;

    JobDetail retrieveJob(JobKey jobKey) throws JobPersistenceException;

    Trigger retrieveTrigger(TriggerKey triggerKey) throws JobPersistenceException;

    boolean checkExists(JobKey jobKey) throws JobPersistenceException;

    boolean checkExists(TriggerKey triggerKey) throws JobPersistenceException;

    List<Trigger> getTriggersForJob(JobKey jobKey) throws JobPersistenceException;

    // keys and groups

    Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) throws JobPersistenceException;

    Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) throws JobPersistenceException;

    List<String> getJobGroupNames() throws JobPersistenceException;

    List<String> getTriggerGroupNames() throws JobPersistenceException;

    // calendars

    void storeCalendar(String name, ExclusionCalendar calendar, boolean replaceExisting, boolean updateTriggers)
            throws JobPersistenceException;

    /**
     * @return false if there was no such calendar
     * @throws JobPersistenceException if a trigger references the calendar
     */
    boolean removeCalendar(String calName) throws JobPersistenceException;

    ExclusionCalendar retrieveCalendar(String calName) throws JobPersistenceException;

    List<String> getCalendarNames() throws JobPersistenceException;

    // counts

    int getNumberOfJobs() throws JobPersistenceException;

    int getNumberOfTriggers() throws JobPersistenceException;

    int getNumberOfCalendars() throws JobPersistenceException;

    // state

    TriggerState getTriggerState(TriggerKey triggerKey) throws JobPersistenceException;

    void resetTriggerFromErrorState(TriggerKey triggerKey) throws JobPersistenceException;

    void pauseTrigger(TriggerKey triggerKey) throws JobPersistenceException;

    Collection<String> pauseTriggers(GroupMatcher<TriggerKey> matcher) throws JobPersistenceException;

    void pauseJob(JobKey jobKey) throws JobPersistenceException;

    Collection<String> pauseJobs(GroupMatcher<JobKey> groupMatcher) throws JobPersistenceException;

    void resumeTrigger(TriggerKey triggerKey) throws JobPersistenceException;

    Collection<String> resumeTriggers(GroupMatcher<TriggerKey> matcher) throws JobPersistenceException;

    void resumeJob(JobKey jobKey) throws JobPersistenceException;

    Collection<String> resumeJobs(GroupMatcher<JobKey> matcher) throws JobPersistenceException;

    void pauseAll() throws JobPersistenceException;

    void resumeAll() throws JobPersistenceException;

    Set<String> getPausedTriggerGroups() throws JobPersistenceException;

    Set<String> getPausedJobGroups() throws JobPersistenceException;

    void clearAllSchedulingData() throws JobPersistenceException;

    // firing

    /**
     * Acquire triggers due no later than {@code noLaterThan + timeWindow},
     * ordered by fire time, priority and key.
     */
    List<Trigger> acquireNextTriggers(long noLaterThan, int maxCount, long timeWindow)
            throws JobPersistenceException;

    /**
     * Give back a trigger acquired earlier but not fired.
     */
    void releaseAcquiredTrigger(Trigger trigger);

    /**
     * Mark acquired triggers as fired and compute their next fire times.
     *
     * @return bundles for the triggers that may execute; triggers paused,
     * removed or blocked since acquisition are left out, and so are triggers
     * the store failed to fire, which go back to waiting
     * @throws JobPersistenceException only when no trigger was fired, so the
     *                                 caller can release the whole batch
     */
    List<TriggerFiredBundle> triggersFired(List<Trigger> triggers) throws JobPersistenceException;

    void triggeredJobComplete(Trigger trigger, JobDetail jobDetail,
                              CompletedExecutionInstruction instruction) throws JobPersistenceException;
}
