package com.novemberain.scheduling.core;

import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.InterruptableJob;
import com.novemberain.scheduling.Job;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobExecutionContext;
import com.novemberain.scheduling.JobExecutionException;
import com.novemberain.scheduling.JobListener;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.JobRegistry;
import com.novemberain.scheduling.ListenerManager;
import com.novemberain.scheduling.ObjectAlreadyExistsException;
import com.novemberain.scheduling.ObjectNotFoundException;
import com.novemberain.scheduling.Scheduler;
import com.novemberain.scheduling.SchedulerException;
import com.novemberain.scheduling.SchedulerListener;
import com.novemberain.scheduling.SchedulerMetaData;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerBuilder;
import com.novemberain.scheduling.TriggerListener;
import com.novemberain.scheduling.TriggerState;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.schedule.ScheduleCalculator;
import com.novemberain.scheduling.spi.TriggerStore;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.utils.Key;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Default {@link Scheduler}: validates requests, delegates storage to a
 * {@link TriggerStore}, runs the {@link SchedulerThread} and keeps track of
 * executing jobs.
 */
public class StdScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(StdScheduler.class);

    private final SchedulerResources resources;
    private final ScheduleCalculator calculator;
    private final ListenerManager listenerManager = new ListenerManager();
    private final SchedulerThread schedThread;
    private final SchedulerSignalerImpl signaler;

    private final ConcurrentMap<String, JobExecutionContext> executingJobs =
            new ConcurrentHashMap<String, JobExecutionContext>();
    private final AtomicLong numJobsExecuted = new AtomicLong();
    private final AtomicLong numJobsFailed = new AtomicLong();

    private volatile boolean shuttingDown = false;
    private volatile boolean closed = false;
    private volatile Date initialStart = null;

    public StdScheduler(SchedulerResources resources) throws SchedulerException {
        this(resources, new ScheduleCalculator());
    }

    public StdScheduler(SchedulerResources resources, ScheduleCalculator calculator) throws SchedulerException {
        if (resources.getTriggerStore() == null) {
            throw new SchedulerException("A trigger store is required.");
        }
        if (resources.getWorkerPool() == null) {
            throw new SchedulerException("A worker pool is required.");
        }
        this.resources = resources;
        this.calculator = calculator;
        this.schedThread = new SchedulerThread(this, resources);
        this.signaler = new SchedulerSignalerImpl(this, schedThread);

        TriggerStore store = resources.getTriggerStore();
        store.setInstanceId(resources.getInstanceId());
        store.setInstanceName(resources.getName());
        store.initialize(signaler, calculator);
        resources.getWorkerPool().initialize();

        schedThread.start();
        log.info("Scheduler '{}' with instanceId '{}' initialized, using {} with {} threads",
                resources.getName(), resources.getInstanceId(), store.getClass().getSimpleName(),
                resources.getWorkerPool().getPoolSize());
    }

    SchedulerResources getResources() {
        return resources;
    }

    TriggerStore getTriggerStore() {
        return resources.getTriggerStore();
    }

    boolean isShuttingDown() {
        return shuttingDown;
    }

    @Override
    public String getSchedulerName() {
        return resources.getName();
    }

    @Override
    public String getSchedulerInstanceId() {
        return resources.getInstanceId();
    }

    @Override
    public ListenerManager getListenerManager() {
        return listenerManager;
    }

    @Override
    public JobRegistry getJobRegistry() {
        return resources.getJobRegistry();
    }

    @Override
    public SchedulerMetaData getMetaData() throws SchedulerException {
        TriggerStore store = getTriggerStore();
        return new SchedulerMetaData(getSchedulerName(), getSchedulerInstanceId(), initialStart,
                isStarted(), isInStandbyMode(), isShutdown(), store.getClass(), store.isClustered(),
                resources.getWorkerPool().getPoolSize(), store.getNumberOfJobs(), store.getNumberOfTriggers(),
                store.getNumberOfCalendars(), numJobsExecuted.get(), numJobsFailed.get());
    }

    // lifecycle

    @Override
    public void start() throws SchedulerException {
        if (shuttingDown || closed) {
            throw new SchedulerException("The Scheduler cannot be restarted after shutdown() has been called.");
        }
        if (initialStart == null) {
            initialStart = new Date();
            getTriggerStore().schedulerStarted();
        } else {
            getTriggerStore().schedulerResumed();
        }
        schedThread.togglePause(false);
        log.info("Scheduler {}_${} started.", resources.getName(), resources.getInstanceId());
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.schedulerStarted();
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of startup.", e);
            }
        }
    }

    @Override
    public void standby() throws SchedulerException {
        getTriggerStore().schedulerPaused();
        schedThread.togglePause(true);
        log.info("Scheduler {}_${} paused.", resources.getName(), resources.getInstanceId());
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.schedulerInStandbyMode();
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of standby.", e);
            }
        }
    }

    @Override
    public void shutdown() throws SchedulerException {
        shutdown(false);
    }

    @Override
    public void shutdown(boolean waitForJobsToComplete) throws SchedulerException {
        if (shuttingDown || closed) {
            return;
        }
        shuttingDown = true;
        log.info("Scheduler {}_${} shutting down.", resources.getName(), resources.getInstanceId());

        schedThread.togglePause(true);
        schedThread.halt(waitForJobsToComplete);
        resources.getWorkerPool().shutdown(waitForJobsToComplete);
        closed = true;
        getTriggerStore().shutdown();

        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.schedulerShutdown();
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of shutdown.", e);
            }
        }
        log.info("Scheduler {}_${} shutdown complete.", resources.getName(), resources.getInstanceId());
    }

    @Override
    public boolean isStarted() {
        return !shuttingDown && !closed && initialStart != null;
    }

    @Override
    public boolean isInStandbyMode() {
        return schedThread.isPaused();
    }

    @Override
    public boolean isShutdown() {
        return closed;
    }

    private void validateState() throws SchedulerException {
        if (shuttingDown || closed) {
            throw new SchedulerException("The Scheduler has been shutdown.");
        }
    }

    // jobs

    private void checkJobType(JobDetail jobDetail) throws ObjectNotFoundException {
        if (!getJobRegistry().isRegistered(jobDetail.getJobType())) {
            throw new ObjectNotFoundException("No job type registered as '" + jobDetail.getJobType()
                    + "' for job " + jobDetail.getKey());
        }
    }

    @Override
    public void defineJob(JobDetail jobDetail) throws SchedulerException {
        validateState();
        checkJobType(jobDetail);
        getTriggerStore().storeJob(jobDetail, false);
        notifySchedulerListenersJobAdded(jobDetail);
    }

    @Override
    public void addJob(JobDetail jobDetail, boolean replace) throws SchedulerException {
        validateState();
        if (!jobDetail.isDurable() && !replace) {
            throw new SchedulerException("Jobs added with no trigger must be durable.");
        }
        checkJobType(jobDetail);
        getTriggerStore().storeJob(jobDetail, replace);
        signaler.signalSchedulingChange(0L);
        notifySchedulerListenersJobAdded(jobDetail);
    }

    @Override
    public void updateJob(JobDetail jobDetail) throws SchedulerException {
        validateState();
        checkJobType(jobDetail);
        if (!getTriggerStore().checkExists(jobDetail.getKey())) {
            throw new ObjectNotFoundException("Job " + jobDetail.getKey() + " does not exist.");
        }
        getTriggerStore().storeJob(jobDetail, true);
        notifySchedulerListenersJobAdded(jobDetail);
    }

    @Override
    public void deleteJob(JobKey jobKey) throws SchedulerException {
        validateState();
        TriggerStore store = getTriggerStore();
        if (!store.checkExists(jobKey)) {
            throw new ObjectNotFoundException("Job " + jobKey + " does not exist.");
        }
        List<Trigger> triggers = store.getTriggersForJob(jobKey);
        store.removeJob(jobKey);
        for (Trigger trigger : triggers) {
            notifySchedulerListenersUnscheduled(trigger.getKey());
        }
        notifySchedulerListenersJobDeleted(jobKey);
    }

    @Override
    public boolean deleteJobs(List<JobKey> jobKeys) throws SchedulerException {
        boolean allFound = true;
        for (JobKey jobKey : jobKeys) {
            try {
                deleteJob(jobKey);
            } catch (ObjectNotFoundException e) {
                allFound = false;
            }
        }
        return allFound;
    }

    @Override
    public JobDetail getJobDetail(JobKey jobKey) throws SchedulerException {
        validateState();
        return getTriggerStore().retrieveJob(jobKey);
    }

    @Override
    public Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) throws SchedulerException {
        validateState();
        return getTriggerStore().getJobKeys(matcher);
    }

    @Override
    public List<String> getJobGroupNames() throws SchedulerException {
        validateState();
        return getTriggerStore().getJobGroupNames();
    }

    @Override
    public boolean checkExists(JobKey jobKey) throws SchedulerException {
        validateState();
        return getTriggerStore().checkExists(jobKey);
    }

    // triggers

    private ExclusionCalendar calendarOf(Trigger trigger) throws SchedulerException {
        if (trigger.getCalendarName() == null) {
            return null;
        }
        ExclusionCalendar calendar = getTriggerStore().retrieveCalendar(trigger.getCalendarName());
        if (calendar == null) {
            throw new ObjectNotFoundException("Calendar not found: " + trigger.getCalendarName());
        }
        return calendar;
    }

    private Date validateTrigger(Trigger trigger) throws SchedulerException {
        if (trigger.getKey() == null) {
            throw new SchedulerException("Trigger's key cannot be null");
        }
        if (trigger.getJobKey() == null) {
            throw new SchedulerException("Trigger's related Job's key cannot be null");
        }
        return calculator.validate(trigger, calendarOf(trigger));
    }

    @Override
    public Date defineTrigger(Trigger trigger) throws SchedulerException {
        validateState();
        if (trigger.getJobKey() != null && !getTriggerStore().checkExists(trigger.getJobKey())) {
            throw new ObjectNotFoundException("Job " + trigger.getJobKey() + " does not exist.");
        }
        Date firstFireTime = validateTrigger(trigger);
        getTriggerStore().storeTrigger(trigger, false);
        signaler.signalSchedulingChange(firstFireTime.getTime());
        notifySchedulerListenersScheduled(trigger);
        return firstFireTime;
    }

    @Override
    public Date scheduleJob(JobDetail jobDetail, Trigger trigger) throws SchedulerException {
        validateState();
        checkJobType(jobDetail);
        if (trigger.getJobKey() == null) {
            trigger.setJobKey(jobDetail.getKey());
        } else if (!trigger.getJobKey().equals(jobDetail.getKey())) {
            throw new SchedulerException("Trigger does not reference given job!");
        }
        Date firstFireTime = validateTrigger(trigger);
        getTriggerStore().storeJobAndTrigger(jobDetail, trigger);
        notifySchedulerListenersJobAdded(jobDetail);
        signaler.signalSchedulingChange(firstFireTime.getTime());
        notifySchedulerListenersScheduled(trigger);
        return firstFireTime;
    }

    @Override
    public Date rescheduleTrigger(TriggerKey triggerKey, Trigger newTrigger) throws SchedulerException {
        validateState();
        if (newTrigger.getJobKey() == null) {
            Trigger old = getTriggerStore().retrieveTrigger(triggerKey);
            if (old == null) {
                return null;
            }
            newTrigger.setJobKey(old.getJobKey());
        }
        Date firstFireTime = validateTrigger(newTrigger);
        if (!getTriggerStore().replaceTrigger(triggerKey, newTrigger)) {
            return null;
        }
        signaler.signalSchedulingChange(firstFireTime.getTime());
        notifySchedulerListenersUnscheduled(triggerKey);
        notifySchedulerListenersScheduled(newTrigger);
        return newTrigger.getNextFireTime();
    }

    @Override
    public void updateTrigger(Trigger trigger) throws SchedulerException {
        validateState();
        if (!getTriggerStore().checkExists(trigger.getKey())) {
            throw new ObjectNotFoundException("Trigger " + trigger.getKey() + " does not exist.");
        }
        validateTrigger(trigger);
        getTriggerStore().storeTrigger(trigger, true);
        if (trigger.getNextFireTime() != null) {
            signaler.signalSchedulingChange(trigger.getNextFireTime().getTime());
        }
        notifySchedulerListenersScheduled(trigger);
    }

    @Override
    public void deleteTrigger(TriggerKey triggerKey) throws SchedulerException {
        validateState();
        if (!getTriggerStore().removeTrigger(triggerKey)) {
            throw new ObjectNotFoundException("Trigger " + triggerKey + " does not exist.");
        }
        signaler.signalSchedulingChange(0L);
        notifySchedulerListenersUnscheduled(triggerKey);
    }

    @Override
    public boolean unscheduleJobs(List<TriggerKey> triggerKeys) throws SchedulerException {
        boolean allFound = true;
        for (TriggerKey key : triggerKeys) {
            try {
                deleteTrigger(key);
            } catch (ObjectNotFoundException e) {
                allFound = false;
            }
        }
        return allFound;
    }

    @Override
    public Trigger getTrigger(TriggerKey triggerKey) throws SchedulerException {
        validateState();
        return getTriggerStore().retrieveTrigger(triggerKey);
    }

    @Override
    public List<Trigger> getTriggersOfJob(JobKey jobKey) throws SchedulerException {
        validateState();
        return getTriggerStore().getTriggersForJob(jobKey);
    }

    @Override
    public Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) throws SchedulerException {
        validateState();
        return getTriggerStore().getTriggerKeys(matcher);
    }

    @Override
    public List<String> getTriggerGroupNames() throws SchedulerException {
        validateState();
        return getTriggerStore().getTriggerGroupNames();
    }

    @Override
    public boolean checkExists(TriggerKey triggerKey) throws SchedulerException {
        validateState();
        return getTriggerStore().checkExists(triggerKey);
    }

    @Override
    public TriggerState getTriggerState(TriggerKey triggerKey) throws SchedulerException {
        validateState();
        return getTriggerStore().getTriggerState(triggerKey);
    }

    @Override
    public void resetTriggerFromErrorState(TriggerKey triggerKey) throws SchedulerException {
        validateState();
        getTriggerStore().resetTriggerFromErrorState(triggerKey);
    }

    // manual firing

    @Override
    public void triggerNow(JobKey jobKey) throws SchedulerException {
        triggerNow(jobKey, null);
    }

    @Override
    public void triggerNow(JobKey jobKey, JobDataMap data) throws SchedulerException {
        validateState();
        if (!getTriggerStore().checkExists(jobKey)) {
            throw new ObjectNotFoundException("Job " + jobKey + " does not exist.");
        }
        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity(newTriggerName(), DEFAULT_MANUAL_TRIGGERS)
                .forJob(jobKey)
                .startNow()
                .build();
        if (data != null) {
            trigger.setJobDataMap(new JobDataMap(data));
        }
        calculator.computeFirstFireTime(trigger, null);

        boolean collision = true;
        while (collision) {
            try {
                getTriggerStore().storeTrigger(trigger, false);
                collision = false;
            } catch (ObjectAlreadyExistsException e) {
                trigger.setKey(new TriggerKey(newTriggerName(), DEFAULT_MANUAL_TRIGGERS));
            }
        }
        signaler.signalSchedulingChange(trigger.getNextFireTime().getTime());
        notifySchedulerListenersScheduled(trigger);
    }

    private String newTriggerName() {
        return "MT_" + Key.createUniqueName(null);
    }

    // pause and resume

    @Override
    public void pauseTrigger(TriggerKey triggerKey) throws SchedulerException {
        validateState();
        getTriggerStore().pauseTrigger(triggerKey);
        signaler.signalSchedulingChange(0L);
        notifySchedulerListeners("triggerPaused", listener -> listener.triggerPaused(triggerKey));
    }

    @Override
    public void pauseTriggers(GroupMatcher<TriggerKey> matcher) throws SchedulerException {
        validateState();
        Collection<String> pausedGroups = getTriggerStore().pauseTriggers(matcher);
        signaler.signalSchedulingChange(0L);
        for (String group : pausedGroups) {
            notifySchedulerListeners("triggersPaused", listener -> listener.triggersPaused(group));
        }
    }

    @Override
    public void pauseJob(JobKey jobKey) throws SchedulerException {
        validateState();
        getTriggerStore().pauseJob(jobKey);
        signaler.signalSchedulingChange(0L);
        notifySchedulerListeners("jobPaused", listener -> listener.jobPaused(jobKey));
    }

    @Override
    public void pauseJobs(GroupMatcher<JobKey> matcher) throws SchedulerException {
        validateState();
        Collection<String> pausedGroups = getTriggerStore().pauseJobs(matcher);
        signaler.signalSchedulingChange(0L);
        for (String group : pausedGroups) {
            notifySchedulerListeners("jobsPaused", listener -> listener.jobsPaused(group));
        }
    }

    @Override
    public void resumeTrigger(TriggerKey triggerKey) throws SchedulerException {
        validateState();
        getTriggerStore().resumeTrigger(triggerKey);
        signaler.signalSchedulingChange(0L);
        notifySchedulerListeners("triggerResumed", listener -> listener.triggerResumed(triggerKey));
    }

    @Override
    public void resumeTriggers(GroupMatcher<TriggerKey> matcher) throws SchedulerException {
        validateState();
        Collection<String> resumedGroups = getTriggerStore().resumeTriggers(matcher);
        signaler.signalSchedulingChange(0L);
        for (String group : resumedGroups) {
            notifySchedulerListeners("triggersResumed", listener -> listener.triggersResumed(group));
        }
    }

    @Override
    public void resumeJob(JobKey jobKey) throws SchedulerException {
        validateState();
        getTriggerStore().resumeJob(jobKey);
        signaler.signalSchedulingChange(0L);
        notifySchedulerListeners("jobResumed", listener -> listener.jobResumed(jobKey));
    }

    @Override
    public void resumeJobs(GroupMatcher<JobKey> matcher) throws SchedulerException {
        validateState();
        Collection<String> resumedGroups = getTriggerStore().resumeJobs(matcher);
        signaler.signalSchedulingChange(0L);
        for (String group : resumedGroups) {
            notifySchedulerListeners("jobsResumed", listener -> listener.jobsResumed(group));
        }
    }

    @Override
    public void pauseAll() throws SchedulerException {
        validateState();
        getTriggerStore().pauseAll();
        signaler.signalSchedulingChange(0L);
        notifySchedulerListeners("triggersPaused", listener -> listener.triggersPaused(null));
    }

    @Override
    public void resumeAll() throws SchedulerException {
        validateState();
        getTriggerStore().resumeAll();
        signaler.signalSchedulingChange(0L);
        notifySchedulerListeners("triggersResumed", listener -> listener.triggersResumed(null));
    }

    @Override
    public Set<String> getPausedTriggerGroups() throws SchedulerException {
        validateState();
        return getTriggerStore().getPausedTriggerGroups();
    }

    @Override
    public Set<String> getPausedJobGroups() throws SchedulerException {
        validateState();
        return getTriggerStore().getPausedJobGroups();
    }

    // calendars

    @Override
    public void addCalendar(String calName, ExclusionCalendar calendar, boolean replace, boolean updateTriggers)
            throws SchedulerException {
        validateState();
        if (calName == null || calName.isEmpty()) {
            throw new SchedulerException("Calendar name cannot be empty.");
        }
        getTriggerStore().storeCalendar(calName, calendar, replace, updateTriggers);
        if (updateTriggers) {
            signaler.signalSchedulingChange(0L);
        }
    }

    @Override
    public boolean deleteCalendar(String calName) throws SchedulerException {
        validateState();
        return getTriggerStore().removeCalendar(calName);
    }

    @Override
    public ExclusionCalendar getCalendar(String calName) throws SchedulerException {
        validateState();
        return getTriggerStore().retrieveCalendar(calName);
    }

    @Override
    public List<String> getCalendarNames() throws SchedulerException {
        validateState();
        return getTriggerStore().getCalendarNames();
    }

    // execution

    @Override
    public List<JobExecutionContext> getCurrentlyExecutingJobs() {
        return new ArrayList<JobExecutionContext>(executingJobs.values());
    }

    @Override
    public boolean interrupt(String fireInstanceId) {
        JobExecutionContext context = executingJobs.get(fireInstanceId);
        if (context == null) {
            return false;
        }
        interrupt(context);
        return true;
    }

    @Override
    public boolean interrupt(JobKey jobKey) {
        boolean found = false;
        for (JobExecutionContext context : executingJobs.values()) {
            if (context.getJobDetail().getKey().equals(jobKey)) {
                interrupt(context);
                found = true;
            }
        }
        return found;
    }

    private void interrupt(JobExecutionContext context) {
        context.markInterrupted();
        Job job = context.getJobInstance();
        if (job instanceof InterruptableJob) {
            log.info("Interrupting job {} ({})", context.getJobDetail().getKey(), context.getFireInstanceId());
            ((InterruptableJob) job).interrupt();
        }
    }

    @Override
    public void clear() throws SchedulerException {
        validateState();
        getTriggerStore().clearAllSchedulingData();
        notifySchedulerListeners("schedulingDataCleared", listener -> listener.schedulingDataCleared());
    }

    void addExecutingJob(JobExecutionContext context) {
        executingJobs.put(context.getFireInstanceId(), context);
    }

    void removeExecutingJob(JobExecutionContext context) {
        if (context != null) {
            executingJobs.remove(context.getFireInstanceId());
        }
    }

    void jobExecuted(boolean succeeded) {
        numJobsExecuted.incrementAndGet();
        if (!succeeded) {
            numJobsFailed.incrementAndGet();
        }
    }

    // listener notification

    /**
     * @return true if a listener vetoed the execution
     */
    boolean notifyTriggerListenersFired(JobExecutionContext context) {
        boolean vetoed = false;
        for (TriggerListener listener : listenerManager.getTriggerListeners()) {
            try {
                listener.triggerFired(context.getTrigger(), context);
                if (listener.vetoJobExecution(context.getTrigger(), context)) {
                    vetoed = true;
                }
            } catch (RuntimeException e) {
                log.error("TriggerListener '{}' threw exception: {}", listener.getName(), e.getMessage(), e);
            }
        }
        return vetoed;
    }

    void notifyTriggerListenersMisfired(Trigger trigger) {
        for (TriggerListener listener : listenerManager.getTriggerListeners()) {
            try {
                listener.triggerMisfired(trigger);
            } catch (RuntimeException e) {
                log.error("TriggerListener '{}' threw exception: {}", listener.getName(), e.getMessage(), e);
            }
        }
    }

    void notifyTriggerListenersComplete(JobExecutionContext context, CompletedExecutionInstruction instruction) {
        for (TriggerListener listener : listenerManager.getTriggerListeners()) {
            try {
                listener.triggerComplete(context.getTrigger(), context, instruction);
            } catch (RuntimeException e) {
                log.error("TriggerListener '{}' threw exception: {}", listener.getName(), e.getMessage(), e);
            }
        }
    }

    void notifyJobListenersToBeExecuted(JobExecutionContext context) {
        for (JobListener listener : listenerManager.getJobListeners()) {
            try {
                listener.jobToBeExecuted(context);
            } catch (RuntimeException e) {
                log.error("JobListener '{}' threw exception: {}", listener.getName(), e.getMessage(), e);
            }
        }
    }

    void notifyJobListenersWasVetoed(JobExecutionContext context) {
        for (JobListener listener : listenerManager.getJobListeners()) {
            try {
                listener.jobExecutionVetoed(context);
            } catch (RuntimeException e) {
                log.error("JobListener '{}' threw exception: {}", listener.getName(), e.getMessage(), e);
            }
        }
    }

    void notifyJobListenersWasExecuted(JobExecutionContext context, JobExecutionException jobException) {
        for (JobListener listener : listenerManager.getJobListeners()) {
            try {
                listener.jobWasExecuted(context, jobException);
            } catch (RuntimeException e) {
                log.error("JobListener '{}' threw exception: {}", listener.getName(), e.getMessage(), e);
            }
        }
    }

    private void notifySchedulerListeners(String event, Consumer<SchedulerListener> notification) {
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of " + event + ".", e);
            }
        }
    }

    void notifySchedulerListenersError(String msg, SchedulerException se) {
        log.error(msg, se);
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.schedulerError(msg, se);
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of error: ", e);
            }
        }
    }

    void notifySchedulerListenersStoreUnavailable(int consecutiveFailures, JobPersistenceException cause) {
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.storeUnavailable(consecutiveFailures, cause);
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of store outage.", e);
            }
        }
    }

    void notifySchedulerListenersStoreRecovered() {
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.storeRecovered();
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of store recovery.", e);
            }
        }
    }

    void notifySchedulerListenersFinalized(Trigger trigger) {
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.triggerFinalized(trigger);
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of finalized trigger.", e);
            }
        }
    }

    void notifySchedulerListenersJobDeleted(JobKey jobKey) {
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.jobDeleted(jobKey);
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of deleted job.", e);
            }
        }
    }

    private void notifySchedulerListenersJobAdded(JobDetail jobDetail) {
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.jobAdded(jobDetail);
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of added job.", e);
            }
        }
    }

    private void notifySchedulerListenersScheduled(Trigger trigger) {
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.jobScheduled(trigger);
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of scheduled job.", e);
            }
        }
    }

    private void notifySchedulerListenersUnscheduled(TriggerKey triggerKey) {
        for (SchedulerListener listener : listenerManager.getSchedulerListeners()) {
            try {
                listener.jobUnscheduled(triggerKey);
            } catch (RuntimeException e) {
                log.error("Error while notifying SchedulerListener of unscheduled job.", e);
            }
        }
    }
}
