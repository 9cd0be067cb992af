package com.novemberain.scheduling.simpl;

import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.ConcurrencyConflictException;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.ObjectAlreadyExistsException;
import com.novemberain.scheduling.ObjectNotFoundException;
import com.novemberain.scheduling.Scheduler;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerState;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.schedule.MisfireHandler;
import com.novemberain.scheduling.schedule.ScheduleCalculator;
import com.novemberain.scheduling.spi.FiredTriggerRecord;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import com.novemberain.scheduling.spi.TriggerFiredBundle;
import com.novemberain.scheduling.spi.TriggerStore;
import com.novemberain.scheduling.util.Clock;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.impl.matchers.StringMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps all scheduling data in memory. Every operation runs under a single
 * monitor, which also makes acquisition exclusive between schedulers that
 * share one instance of this store.
 *
 * <p>Not persistent and not clustered: fired triggers are lost on restart.</p>
 */
public class RAMTriggerStore implements TriggerStore {

    private static final Logger log = LoggerFactory.getLogger(RAMTriggerStore.class);

    private final Map<JobKey, JobDetail> jobsByKey = new HashMap<JobKey, JobDetail>();
    private final Map<TriggerKey, TriggerWrapper> triggersByKey = new HashMap<TriggerKey, TriggerWrapper>();
    private final Map<String, ExclusionCalendar> calendarsByName = new HashMap<String, ExclusionCalendar>();
    private final Set<String> pausedTriggerGroups = new HashSet<String>();
    private final Set<String> pausedJobGroups = new HashSet<String>();
    private final Set<JobKey> blockedJobs = new HashSet<JobKey>();
    private final Map<String, FiredTriggerRecord> firedTriggers = new LinkedHashMap<String, FiredTriggerRecord>();

    private final Object lock = new Object();
    private final AtomicLong fireInstanceCounter = new AtomicLong(System.currentTimeMillis());

    private SchedulerSignaler signaler;
    private ScheduleCalculator calculator;
    private MisfireHandler misfireHandler;
    private Clock clock = Clock.SYSTEM_CLOCK;
    private long misfireThreshold = MisfireHandler.DEFAULT_MISFIRE_THRESHOLD;
    private String instanceId = "NON_CLUSTERED";
    private String instanceName;

    @Override
    public void initialize(SchedulerSignaler signaler, ScheduleCalculator calculator) {
        this.signaler = signaler;
        this.calculator = calculator;
        this.misfireHandler = new MisfireHandler(calculator, clock, misfireThreshold, signaler);
        log.info("RAMTriggerStore initialized.");
    }

    @Override
    public void schedulerStarted() {
        // nothing to recover
    }

    @Override
    public void schedulerPaused() {
    }

    @Override
    public void schedulerResumed() {
    }

    @Override
    public void shutdown() {
    }

    @Override
    public boolean isClustered() {
        return false;
    }

    @Override
    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void setInstanceName(String instanceName) {
        this.instanceName = instanceName;
    }

    @Override
    public void setMisfireThreshold(long misfireThreshold) {
        if (misfireThreshold < 1) {
            throw new IllegalArgumentException("Misfire threshold must be larger than 0");
        }
        this.misfireThreshold = misfireThreshold;
    }

    /**
     * Replace the time source. Must be called before {@link #initialize}.
     */
    public void setClock(Clock clock) {
        this.clock = clock;
    }

    // jobs and triggers

    @Override
    public void storeJob(JobDetail newJob, boolean replaceExisting) throws ObjectAlreadyExistsException {
        synchronized (lock) {
            if (jobsByKey.containsKey(newJob.getKey()) && !replaceExisting) {
                throw new ObjectAlreadyExistsException(newJob);
            }
            jobsByKey.put(newJob.getKey(), newJob.clone());
        }
    }

    @Override
    public void storeJobAndTrigger(JobDetail newJob, Trigger newTrigger) throws JobPersistenceException {
        synchronized (lock) {
            if (jobsByKey.containsKey(newJob.getKey())) {
                throw new ObjectAlreadyExistsException(newJob);
            }
            if (triggersByKey.containsKey(newTrigger.getKey())) {
                throw new ObjectAlreadyExistsException(newTrigger);
            }
            storeJob(newJob, false);
            try {
                storeTrigger(newTrigger, false);
            } catch (JobPersistenceException e) {
                jobsByKey.remove(newJob.getKey());
                throw e;
            }
        }
    }

    @Override
    public void storeTrigger(Trigger newTrigger, boolean replaceExisting) throws JobPersistenceException {
        synchronized (lock) {
            TriggerWrapper existing = triggersByKey.get(newTrigger.getKey());
            if (existing != null) {
                if (!replaceExisting) {
                    throw new ObjectAlreadyExistsException(newTrigger);
                }
                if (newTrigger.getVersion() != 0 && newTrigger.getVersion() != existing.trigger.getVersion()) {
                    throw new ConcurrencyConflictException("Trigger '" + newTrigger.getKey()
                            + "' was modified concurrently: expected version " + newTrigger.getVersion()
                            + " but found " + existing.trigger.getVersion());
                }
            }
            if (!jobsByKey.containsKey(newTrigger.getJobKey())) {
                throw new ObjectNotFoundException("The job (" + newTrigger.getJobKey()
                        + ") referenced by the trigger does not exist.");
            }
            ExclusionCalendar calendar = calendarFor(newTrigger);

            long version = existing == null ? 1 : existing.trigger.getVersion() + 1;
            Trigger stored = newTrigger.clone();
            stored.setVersion(version);
            stored.setNextFireTime(calculator.fireTimeAfter(stored, calendar, stored.getPreviousFireTime()));

            TriggerWrapper tw = new TriggerWrapper(stored);
            tw.state = initialState(stored);
            triggersByKey.put(stored.getKey(), tw);

            newTrigger.setVersion(version);
            newTrigger.setNextFireTime(stored.getNextFireTime());
            log.debug("Stored trigger {} with next fire time {}", stored.getKey(), stored.getNextFireTime());
        }
    }

    private int initialState(Trigger trigger) {
        if (trigger.getNextFireTime() == null) {
            return TriggerWrapper.STATE_COMPLETE;
        }
        boolean paused = pausedTriggerGroups.contains(trigger.getKey().getGroup())
                || pausedJobGroups.contains(trigger.getJobKey().getGroup());
        boolean blocked = blockedJobs.contains(trigger.getJobKey());
        if (paused) {
            return blocked ? TriggerWrapper.STATE_PAUSED_BLOCKED : TriggerWrapper.STATE_PAUSED;
        }
        return blocked ? TriggerWrapper.STATE_BLOCKED : TriggerWrapper.STATE_WAITING;
    }

    private ExclusionCalendar calendarFor(Trigger trigger) throws ObjectNotFoundException {
        if (trigger.getCalendarName() == null) {
            return null;
        }
        ExclusionCalendar calendar = calendarsByName.get(trigger.getCalendarName());
        if (calendar == null) {
            throw new ObjectNotFoundException("Calendar not found: " + trigger.getCalendarName());
        }
        return calendar;
    }

    @Override
    public boolean replaceTrigger(TriggerKey triggerKey, Trigger newTrigger) throws JobPersistenceException {
        synchronized (lock) {
            TriggerWrapper old = triggersByKey.get(triggerKey);
            if (old == null) {
                return false;
            }
            if (!old.trigger.getJobKey().equals(newTrigger.getJobKey())) {
                throw new JobPersistenceException("New trigger is not related to the same job as the old trigger.");
            }
            triggersByKey.remove(triggerKey);
            try {
                newTrigger.setVersion(0);
                storeTrigger(newTrigger, false);
            } catch (JobPersistenceException e) {
                triggersByKey.put(triggerKey, old);
                throw e;
            }
            return true;
        }
    }

    @Override
    public boolean removeJob(JobKey jobKey) {
        synchronized (lock) {
            boolean found = false;
            for (Trigger trigger : triggersOf(jobKey)) {
                triggersByKey.remove(trigger.getKey());
                found = true;
            }
            found = (jobsByKey.remove(jobKey) != null) || found;
            return found;
        }
    }

    @Override
    public boolean removeTrigger(TriggerKey triggerKey) {
        synchronized (lock) {
            return removeTrigger(triggerKey, true);
        }
    }

    private boolean removeTrigger(TriggerKey triggerKey, boolean removeOrphanedJob) {
        TriggerWrapper tw = triggersByKey.remove(triggerKey);
        if (tw == null) {
            return false;
        }
        JobKey jobKey = tw.trigger.getJobKey();
        JobDetail job = jobsByKey.get(jobKey);
        if (removeOrphanedJob && job != null && !job.isDurable() && triggersOf(jobKey).isEmpty()) {
            jobsByKey.remove(jobKey);
            signaler.notifySchedulerListenersJobDeleted(jobKey);
        }
        return true;
    }

    @Override
    public JobDetail retrieveJob(JobKey jobKey) {
        synchronized (lock) {
            JobDetail job = jobsByKey.get(jobKey);
            return job == null ? null : job.clone();
        }
    }

    @Override
    public Trigger retrieveTrigger(TriggerKey triggerKey) {
        synchronized (lock) {
            TriggerWrapper tw = triggersByKey.get(triggerKey);
            return tw == null ? null : tw.trigger.clone();
        }
    }

    @Override
    public boolean checkExists(JobKey jobKey) {
        synchronized (lock) {
            return jobsByKey.containsKey(jobKey);
        }
    }

    @Override
    public boolean checkExists(TriggerKey triggerKey) {
        synchronized (lock) {
            return triggersByKey.containsKey(triggerKey);
        }
    }

    @Override
    public List<Trigger> getTriggersForJob(JobKey jobKey) {
        synchronized (lock) {
            List<Trigger> result = new ArrayList<Trigger>();
            for (Trigger trigger : triggersOf(jobKey)) {
                result.add(trigger.clone());
            }
            return result;
        }
    }

    private List<Trigger> triggersOf(JobKey jobKey) {
        List<Trigger> result = new ArrayList<Trigger>();
        for (TriggerWrapper tw : triggersByKey.values()) {
            if (tw.trigger.getJobKey().equals(jobKey)) {
                result.add(tw.trigger);
            }
        }
        return result;
    }

    private List<TriggerWrapper> wrappersOf(JobKey jobKey) {
        List<TriggerWrapper> result = new ArrayList<TriggerWrapper>();
        for (TriggerWrapper tw : triggersByKey.values()) {
            if (tw.trigger.getJobKey().equals(jobKey)) {
                result.add(tw);
            }
        }
        return result;
    }

    // keys and groups

    @Override
    public Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) {
        synchronized (lock) {
            Set<JobKey> result = new HashSet<JobKey>();
            for (JobKey key : jobsByKey.keySet()) {
                if (matcher.isMatch(key)) {
                    result.add(key);
                }
            }
            return result;
        }
    }

    @Override
    public Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) {
        synchronized (lock) {
            Set<TriggerKey> result = new HashSet<TriggerKey>();
            for (TriggerKey key : triggersByKey.keySet()) {
                if (matcher.isMatch(key)) {
                    result.add(key);
                }
            }
            return result;
        }
    }

    @Override
    public List<String> getJobGroupNames() {
        synchronized (lock) {
            Set<String> groups = new TreeSet<String>();
            for (JobKey key : jobsByKey.keySet()) {
                groups.add(key.getGroup());
            }
            return new ArrayList<String>(groups);
        }
    }

    @Override
    public List<String> getTriggerGroupNames() {
        synchronized (lock) {
            Set<String> groups = new TreeSet<String>();
            for (TriggerKey key : triggersByKey.keySet()) {
                groups.add(key.getGroup());
            }
            return new ArrayList<String>(groups);
        }
    }

    // calendars

    @Override
    public void storeCalendar(String name, ExclusionCalendar calendar, boolean replaceExisting,
                              boolean updateTriggers) throws ObjectAlreadyExistsException {
        synchronized (lock) {
            if (calendarsByName.containsKey(name) && !replaceExisting) {
                throw new ObjectAlreadyExistsException("Calendar with name '" + name + "' already exists.");
            }
            calendarsByName.put(name, calendar);
            if (updateTriggers) {
                for (TriggerWrapper tw : triggersByKey.values()) {
                    if (name.equals(tw.trigger.getCalendarName()) && tw.state != TriggerWrapper.STATE_COMPLETE) {
                        calculator.updateWithNewCalendar(tw.trigger, calendar);
                        tw.trigger.setVersion(tw.trigger.getVersion() + 1);
                        if (tw.trigger.getNextFireTime() == null) {
                            tw.state = TriggerWrapper.STATE_COMPLETE;
                        }
                    }
                }
            }
        }
    }

    @Override
    public boolean removeCalendar(String calName) throws JobPersistenceException {
        synchronized (lock) {
            for (TriggerWrapper tw : triggersByKey.values()) {
                if (calName.equals(tw.trigger.getCalendarName())) {
                    throw new JobPersistenceException("Calendar '" + calName
                            + "' cannot be removed while it is referenced by trigger " + tw.trigger.getKey());
                }
            }
            return calendarsByName.remove(calName) != null;
        }
    }

    @Override
    public ExclusionCalendar retrieveCalendar(String calName) {
        synchronized (lock) {
            return calendarsByName.get(calName);
        }
    }

    @Override
    public List<String> getCalendarNames() {
        synchronized (lock) {
            return new ArrayList<String>(new TreeSet<String>(calendarsByName.keySet()));
        }
    }

    // counts

    @Override
    public int getNumberOfJobs() {
        synchronized (lock) {
            return jobsByKey.size();
        }
    }

    @Override
    public int getNumberOfTriggers() {
        synchronized (lock) {
            return triggersByKey.size();
        }
    }

    @Override
    public int getNumberOfCalendars() {
        synchronized (lock) {
            return calendarsByName.size();
        }
    }

    // state

    @Override
    public TriggerState getTriggerState(TriggerKey triggerKey) {
        synchronized (lock) {
            TriggerWrapper tw = triggersByKey.get(triggerKey);
            if (tw == null) {
                return TriggerState.NONE;
            }
            switch (tw.state) {
                case TriggerWrapper.STATE_COMPLETE:
                    return TriggerState.COMPLETE;
                case TriggerWrapper.STATE_PAUSED:
                case TriggerWrapper.STATE_PAUSED_BLOCKED:
                    return TriggerState.PAUSED;
                case TriggerWrapper.STATE_BLOCKED:
                    return TriggerState.BLOCKED;
                case TriggerWrapper.STATE_ERROR:
                    return TriggerState.ERROR;
                default:
                    return TriggerState.NORMAL;
            }
        }
    }

    @Override
    public void resetTriggerFromErrorState(TriggerKey triggerKey) {
        synchronized (lock) {
            TriggerWrapper tw = triggersByKey.get(triggerKey);
            if (tw == null || tw.state != TriggerWrapper.STATE_ERROR) {
                return;
            }
            if (pausedTriggerGroups.contains(triggerKey.getGroup())) {
                tw.state = TriggerWrapper.STATE_PAUSED;
            } else {
                tw.state = TriggerWrapper.STATE_WAITING;
            }
            signaler.signalSchedulingChange(0L);
        }
    }

    @Override
    public void pauseTrigger(TriggerKey triggerKey) {
        synchronized (lock) {
            TriggerWrapper tw = triggersByKey.get(triggerKey);
            if (tw == null) {
                return;
            }
            if (tw.state == TriggerWrapper.STATE_BLOCKED) {
                tw.state = TriggerWrapper.STATE_PAUSED_BLOCKED;
            } else if (tw.state == TriggerWrapper.STATE_WAITING || tw.state == TriggerWrapper.STATE_ACQUIRED) {
                tw.state = TriggerWrapper.STATE_PAUSED;
            }
        }
    }

    @Override
    public List<String> pauseTriggers(GroupMatcher<TriggerKey> matcher) {
        synchronized (lock) {
            List<String> pausedGroups = new LinkedList<String>();
            if (matcher.getCompareWithOperator() == StringMatcher.StringOperatorName.EQUALS) {
                if (pausedTriggerGroups.add(matcher.getCompareToValue())) {
                    pausedGroups.add(matcher.getCompareToValue());
                }
            } else {
                for (String group : getTriggerGroupNames()) {
                    if (groupMatches(matcher, group) && pausedTriggerGroups.add(group)) {
                        pausedGroups.add(group);
                    }
                }
            }
            for (TriggerKey key : getTriggerKeys(matcher)) {
                pauseTrigger(key);
            }
            return pausedGroups;
        }
    }

    @Override
    public void pauseJob(JobKey jobKey) {
        synchronized (lock) {
            for (Trigger trigger : triggersOf(jobKey)) {
                pauseTrigger(trigger.getKey());
            }
        }
    }

    @Override
    public List<String> pauseJobs(GroupMatcher<JobKey> matcher) {
        synchronized (lock) {
            List<String> pausedGroups = new LinkedList<String>();
            if (matcher.getCompareWithOperator() == StringMatcher.StringOperatorName.EQUALS) {
                if (pausedJobGroups.add(matcher.getCompareToValue())) {
                    pausedGroups.add(matcher.getCompareToValue());
                }
            } else {
                for (String group : getJobGroupNames()) {
                    if (groupMatches(matcher, group) && pausedJobGroups.add(group)) {
                        pausedGroups.add(group);
                    }
                }
            }
            for (JobKey jobKey : getJobKeys(matcher)) {
                pauseJob(jobKey);
            }
            return pausedGroups;
        }
    }

    @Override
    public void resumeTrigger(TriggerKey triggerKey) {
        synchronized (lock) {
            TriggerWrapper tw = triggersByKey.get(triggerKey);
            if (tw == null) {
                return;
            }
            if (tw.state != TriggerWrapper.STATE_PAUSED && tw.state != TriggerWrapper.STATE_PAUSED_BLOCKED) {
                return;
            }
            if (blockedJobs.contains(tw.trigger.getJobKey())) {
                tw.state = TriggerWrapper.STATE_BLOCKED;
            } else {
                tw.state = TriggerWrapper.STATE_WAITING;
            }
            applyMisfire(tw);
            signaler.signalSchedulingChange(0L);
        }
    }

    @Override
    public List<String> resumeTriggers(GroupMatcher<TriggerKey> matcher) {
        synchronized (lock) {
            Set<String> groups = new HashSet<String>();
            for (TriggerKey key : getTriggerKeys(matcher)) {
                groups.add(key.getGroup());
                resumeTrigger(key);
            }
            for (String group : new ArrayList<String>(pausedTriggerGroups)) {
                if (groupMatches(matcher, group)) {
                    pausedTriggerGroups.remove(group);
                    groups.add(group);
                }
            }
            return new ArrayList<String>(groups);
        }
    }

    @Override
    public void resumeJob(JobKey jobKey) {
        synchronized (lock) {
            for (Trigger trigger : triggersOf(jobKey)) {
                resumeTrigger(trigger.getKey());
            }
        }
    }

    @Override
    public Collection<String> resumeJobs(GroupMatcher<JobKey> matcher) {
        synchronized (lock) {
            Set<String> resumedGroups = new HashSet<String>();
            for (JobKey jobKey : getJobKeys(matcher)) {
                resumedGroups.add(jobKey.getGroup());
                resumeJob(jobKey);
            }
            for (String group : new ArrayList<String>(pausedJobGroups)) {
                if (groupMatches(matcher, group)) {
                    pausedJobGroups.remove(group);
                    resumedGroups.add(group);
                }
            }
            return resumedGroups;
        }
    }

    @Override
    public void pauseAll() {
        synchronized (lock) {
            for (String group : getTriggerGroupNames()) {
                pauseTriggers(GroupMatcher.triggerGroupEquals(group));
            }
        }
    }

    @Override
    public void resumeAll() {
        synchronized (lock) {
            pausedJobGroups.clear();
            resumeTriggers(GroupMatcher.anyTriggerGroup());
            pausedTriggerGroups.clear();
        }
    }

    @Override
    public Set<String> getPausedTriggerGroups() {
        synchronized (lock) {
            return new HashSet<String>(pausedTriggerGroups);
        }
    }

    @Override
    public Set<String> getPausedJobGroups() {
        synchronized (lock) {
            return new HashSet<String>(pausedJobGroups);
        }
    }

    @Override
    public void clearAllSchedulingData() {
        synchronized (lock) {
            triggersByKey.clear();
            jobsByKey.clear();
            calendarsByName.clear();
            pausedTriggerGroups.clear();
            pausedJobGroups.clear();
            blockedJobs.clear();
            firedTriggers.clear();
        }
    }

    private static boolean groupMatches(GroupMatcher<?> matcher, String group) {
        return matcher.getCompareWithOperator().evaluate(group, matcher.getCompareToValue());
    }

    // firing

    private boolean applyMisfire(TriggerWrapper tw) {
        ExclusionCalendar calendar = tw.trigger.getCalendarName() == null
                ? null : calendarsByName.get(tw.trigger.getCalendarName());
        if (!misfireHandler.applyMisfire(tw.trigger, calendar)) {
            return false;
        }
        tw.trigger.setVersion(tw.trigger.getVersion() + 1);
        if (tw.trigger.getNextFireTime() == null) {
            tw.state = TriggerWrapper.STATE_COMPLETE;
            removeIfOneShotGroup(tw);
        }
        return true;
    }

    @Override
    public List<Trigger> acquireNextTriggers(long noLaterThan, int maxCount, long timeWindow) {
        synchronized (lock) {
            List<TriggerWrapper> candidates = new ArrayList<TriggerWrapper>();
            for (TriggerWrapper tw : new ArrayList<TriggerWrapper>(triggersByKey.values())) {
                if (tw.state != TriggerWrapper.STATE_WAITING || tw.trigger.getNextFireTime() == null) {
                    continue;
                }
                applyMisfire(tw);
                if (tw.state == TriggerWrapper.STATE_WAITING && tw.trigger.getNextFireTime() != null) {
                    candidates.add(tw);
                }
            }
            Collections.sort(candidates, TriggerWrapper.FIRE_ORDER);

            List<Trigger> result = new ArrayList<Trigger>();
            Set<JobKey> acquiredJobKeysForNoConcurrentExec = new HashSet<JobKey>();
            long batchEnd = noLaterThan + timeWindow;
            for (TriggerWrapper tw : candidates) {
                if (result.size() >= maxCount || tw.trigger.getNextFireTime().getTime() > batchEnd) {
                    break;
                }
                JobDetail job = jobsByKey.get(tw.trigger.getJobKey());
                if (job == null) {
                    log.warn("Job {} of trigger {} not found, setting trigger to ERROR",
                            tw.trigger.getJobKey(), tw.trigger.getKey());
                    tw.state = TriggerWrapper.STATE_ERROR;
                    continue;
                }
                if (job.isConcurrentExecutionDisallowed()
                        && !acquiredJobKeysForNoConcurrentExec.add(job.getKey())) {
                    continue;
                }
                tw.state = TriggerWrapper.STATE_ACQUIRED;
                tw.trigger.setFireInstanceId(nextFireInstanceId());
                result.add(tw.trigger.clone());
            }
            if (!result.isEmpty()) {
                log.debug("Acquired {} trigger(s)", result.size());
            }
            return result;
        }
    }

    @Override
    public void releaseAcquiredTrigger(Trigger trigger) {
        synchronized (lock) {
            TriggerWrapper tw = triggersByKey.get(trigger.getKey());
            if (tw != null && tw.state == TriggerWrapper.STATE_ACQUIRED) {
                tw.state = TriggerWrapper.STATE_WAITING;
            }
        }
    }

    @Override
    public List<TriggerFiredBundle> triggersFired(List<Trigger> acquired) {
        synchronized (lock) {
            List<TriggerFiredBundle> results = new ArrayList<TriggerFiredBundle>();
            for (Trigger trigger : acquired) {
                TriggerFiredBundle bundle = triggerFired(trigger);
                if (bundle != null) {
                    results.add(bundle);
                }
            }
            return results;
        }
    }

    private TriggerFiredBundle triggerFired(Trigger trigger) {
        TriggerWrapper tw = triggersByKey.get(trigger.getKey());
        // deleted, paused or replaced since being acquired
        if (tw == null || tw.state != TriggerWrapper.STATE_ACQUIRED
                || tw.trigger.getVersion() != trigger.getVersion()) {
            return null;
        }
        ExclusionCalendar calendar = null;
        if (tw.trigger.getCalendarName() != null) {
            calendar = calendarsByName.get(tw.trigger.getCalendarName());
            if (calendar == null) {
                tw.state = TriggerWrapper.STATE_ERROR;
                return null;
            }
        }
        JobDetail job = jobsByKey.get(tw.trigger.getJobKey());
        if (job == null) {
            tw.state = TriggerWrapper.STATE_ERROR;
            return null;
        }
        if (job.isConcurrentExecutionDisallowed() && blockedJobs.contains(job.getKey())) {
            tw.state = TriggerWrapper.STATE_BLOCKED;
            return null;
        }

        Date previousFireTime = tw.trigger.getPreviousFireTime();
        Date scheduledFireTime = tw.trigger.getNextFireTime();
        calculator.triggered(tw.trigger, calendar);
        tw.trigger.setVersion(tw.trigger.getVersion() + 1);

        Date now = clock.now();
        String fireInstanceId = trigger.getFireInstanceId() == null ? nextFireInstanceId() : trigger.getFireInstanceId();
        tw.trigger.setFireInstanceId(fireInstanceId);
        firedTriggers.put(fireInstanceId, new FiredTriggerRecord(fireInstanceId, instanceId,
                tw.trigger.getKey(), job.getKey(), scheduledFireTime, now, tw.trigger.getPriority(),
                job.requestsRecovery(), job.isConcurrentExecutionDisallowed()));

        if (job.isConcurrentExecutionDisallowed()) {
            for (TriggerWrapper sibling : wrappersOf(job.getKey())) {
                if (sibling.state == TriggerWrapper.STATE_WAITING) {
                    sibling.state = TriggerWrapper.STATE_BLOCKED;
                } else if (sibling.state == TriggerWrapper.STATE_PAUSED) {
                    sibling.state = TriggerWrapper.STATE_PAUSED_BLOCKED;
                }
            }
            tw.state = TriggerWrapper.STATE_BLOCKED;
            blockedJobs.add(job.getKey());
        } else if (tw.trigger.getNextFireTime() == null) {
            tw.state = TriggerWrapper.STATE_COMPLETE;
        } else {
            tw.state = TriggerWrapper.STATE_WAITING;
        }

        boolean recovering = Scheduler.DEFAULT_RECOVERY_GROUP.equals(tw.trigger.getKey().getGroup());
        return new TriggerFiredBundle(job.clone(), tw.trigger.clone(), calendar, recovering, fireInstanceId,
                now, scheduledFireTime, previousFireTime, tw.trigger.getNextFireTime());
    }

    @Override
    public void triggeredJobComplete(Trigger trigger, JobDetail jobDetail,
                                     CompletedExecutionInstruction instruction) {
        synchronized (lock) {
            if (trigger.getFireInstanceId() != null) {
                firedTriggers.remove(trigger.getFireInstanceId());
            }
            JobDetail stored = jobsByKey.get(jobDetail.getKey());
            if (stored != null) {
                if (stored.isPersistJobDataAfterExecution()) {
                    JobDataMap newData = jobDetail.getJobDataMap();
                    if (newData != null) {
                        newData = (JobDataMap) newData.clone();
                        newData.clearDirtyFlag();
                    }
                    jobsByKey.put(stored.getKey(), stored.getJobBuilder().setJobData(newData).build());
                }
                if (stored.isConcurrentExecutionDisallowed()) {
                    unblock(stored.getKey());
                    signaler.signalSchedulingChange(0L);
                }
            } else {
                blockedJobs.remove(jobDetail.getKey());
            }

            TriggerWrapper tw = triggersByKey.get(trigger.getKey());
            if (tw == null) {
                return;
            }
            switch (instruction) {
                case DELETE_TRIGGER:
                    removeTrigger(trigger.getKey());
                    signaler.signalSchedulingChange(0L);
                    break;
                case SET_TRIGGER_COMPLETE:
                    tw.state = TriggerWrapper.STATE_COMPLETE;
                    signaler.signalSchedulingChange(0L);
                    break;
                case SET_TRIGGER_ERROR:
                    log.info("Trigger {} set to ERROR state.", trigger.getKey());
                    tw.state = TriggerWrapper.STATE_ERROR;
                    signaler.signalSchedulingChange(0L);
                    break;
                case SET_ALL_JOB_TRIGGERS_ERROR:
                    log.info("All triggers of Job {} set to ERROR state.", trigger.getJobKey());
                    setAllTriggersOfJobToState(trigger.getJobKey(), TriggerWrapper.STATE_ERROR);
                    signaler.signalSchedulingChange(0L);
                    break;
                case SET_ALL_JOB_TRIGGERS_COMPLETE:
                    setAllTriggersOfJobToState(trigger.getJobKey(), TriggerWrapper.STATE_COMPLETE);
                    signaler.signalSchedulingChange(0L);
                    break;
                default:
                    break;
            }
            if (tw.state == TriggerWrapper.STATE_COMPLETE) {
                removeIfOneShotGroup(tw);
            }
        }
    }

    private void unblock(JobKey jobKey) {
        blockedJobs.remove(jobKey);
        for (TriggerWrapper tw : wrappersOf(jobKey)) {
            if (tw.state == TriggerWrapper.STATE_BLOCKED) {
                tw.state = tw.trigger.getNextFireTime() == null
                        ? TriggerWrapper.STATE_COMPLETE : TriggerWrapper.STATE_WAITING;
            } else if (tw.state == TriggerWrapper.STATE_PAUSED_BLOCKED) {
                tw.state = TriggerWrapper.STATE_PAUSED;
            }
        }
    }

    private void setAllTriggersOfJobToState(JobKey jobKey, int state) {
        for (TriggerWrapper tw : wrappersOf(jobKey)) {
            tw.state = state;
        }
    }

    private void removeIfOneShotGroup(TriggerWrapper tw) {
        String group = tw.trigger.getKey().getGroup();
        if (Scheduler.DEFAULT_MANUAL_TRIGGERS.equals(group) || Scheduler.DEFAULT_RECOVERY_GROUP.equals(group)) {
            removeTrigger(tw.trigger.getKey(), false);
        }
    }

    private String nextFireInstanceId() {
        return instanceId + fireInstanceCounter.incrementAndGet();
    }

    /**
     * Fire instances currently executing, in firing order.
     */
    public List<FiredTriggerRecord> getFiredTriggerRecords() {
        synchronized (lock) {
            return new ArrayList<FiredTriggerRecord>(firedTriggers.values());
        }
    }

    @Override
    public String toString() {
        return "RAMTriggerStore{" + instanceName + "/" + instanceId + "}";
    }

    static final class TriggerWrapper {

        static final int STATE_WAITING = 0;
        static final int STATE_ACQUIRED = 1;
        static final int STATE_COMPLETE = 2;
        static final int STATE_PAUSED = 3;
        static final int STATE_BLOCKED = 4;
        static final int STATE_PAUSED_BLOCKED = 5;
        static final int STATE_ERROR = 6;

        static final Comparator<TriggerWrapper> FIRE_ORDER = new Comparator<TriggerWrapper>() {
            @Override
            public int compare(TriggerWrapper tw1, TriggerWrapper tw2) {
                return Trigger.FIRE_ORDER.compare(tw1.trigger, tw2.trigger);
            }
        };

        final Trigger trigger;
        int state = STATE_WAITING;

        TriggerWrapper(Trigger trigger) {
            this.trigger = trigger;
        }
    }
}
