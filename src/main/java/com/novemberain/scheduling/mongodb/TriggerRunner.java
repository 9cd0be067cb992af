package com.novemberain.scheduling.mongodb;

import com.mongodb.MongoException;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.Scheduler;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.mongodb.dao.CalendarDao;
import com.novemberain.scheduling.mongodb.dao.FiredTriggerDao;
import com.novemberain.scheduling.mongodb.dao.JobDao;
import com.novemberain.scheduling.mongodb.dao.TriggerDao;
import com.novemberain.scheduling.mongodb.trigger.TriggerConverter;
import com.novemberain.scheduling.mongodb.util.Keys;
import com.novemberain.scheduling.schedule.MisfireHandler;
import com.novemberain.scheduling.schedule.ScheduleCalculator;
import com.novemberain.scheduling.spi.FiredTriggerRecord;
import com.novemberain.scheduling.spi.TriggerFiredBundle;
import com.novemberain.scheduling.util.Clock;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Acquires due triggers and turns acquired triggers into fired ones.
 *
 * <p>A trigger lock is held from acquisition until the trigger is fired or
 * released. From then on the fired trigger record, and for non-concurrent
 * jobs the job lock, track the execution.</p>
 */
public class TriggerRunner {

    private static final Logger log = LoggerFactory.getLogger(TriggerRunner.class);

    private final TriggerAndJobPersister persister;
    private final TriggerDao triggerDao;
    private final JobDao jobDao;
    private final CalendarDao calendarDao;
    private final FiredTriggerDao firedTriggerDao;
    private final MisfireHandler misfireHandler;
    private final ScheduleCalculator calculator;
    private final TriggerConverter triggerConverter;
    private final LockManager lockManager;
    private final Clock clock;
    private final String instanceId;
    private final AtomicLong fireInstanceCounter;

    public TriggerRunner(TriggerAndJobPersister persister, TriggerDao triggerDao, JobDao jobDao,
                         CalendarDao calendarDao, FiredTriggerDao firedTriggerDao,
                         MisfireHandler misfireHandler, ScheduleCalculator calculator,
                         TriggerConverter triggerConverter, LockManager lockManager,
                         Clock clock, String instanceId) {
        this.persister = persister;
        this.triggerDao = triggerDao;
        this.jobDao = jobDao;
        this.calendarDao = calendarDao;
        this.firedTriggerDao = firedTriggerDao;
        this.misfireHandler = misfireHandler;
        this.calculator = calculator;
        this.triggerConverter = triggerConverter;
        this.lockManager = lockManager;
        this.clock = clock;
        this.instanceId = instanceId;
        this.fireInstanceCounter = new AtomicLong(clock.millis());
    }

    public List<Trigger> acquireNext(long noLaterThan, int maxCount, long timeWindow)
            throws JobPersistenceException {
        Date noLaterThanDate = new Date(noLaterThan + timeWindow);

        log.debug("Finding up to {} triggers which have time less than {}",
                maxCount, noLaterThanDate);

        List<Trigger> triggers = acquireNextTriggers(noLaterThanDate, maxCount);

        // Documents come sorted, but misfire handling may have moved fire times
        Collections.sort(triggers, Trigger.FIRE_ORDER);

        return triggers;
    }

    private List<Trigger> acquireNextTriggers(Date noLaterThanDate, int maxCount)
            throws JobPersistenceException {
        Map<TriggerKey, Trigger> triggers = new LinkedHashMap<TriggerKey, Trigger>();
        Set<JobKey> acquiredJobKeysForNoConcurrentExec = new HashSet<JobKey>();
        try {
            for (Document triggerDoc : triggerDao.findEligibleToRun(noLaterThanDate)) {
                if (maxCount <= triggers.size()) {
                    break;
                }
                TriggerKey key = Keys.toTriggerKey(triggerDoc);
                if (triggers.containsKey(key)) {
                    log.debug("Skipping trigger {} as we have already acquired it.", key);
                    continue;
                }
                if (!lockManager.tryLock(key) && !lockManager.relockExpired(key)) {
                    continue;
                }

                Trigger trigger = prepareForFire(triggerDoc, noLaterThanDate, acquiredJobKeysForNoConcurrentExec);
                if (trigger == null) {
                    lockManager.unlockAcquiredTrigger(key);
                } else {
                    log.debug("Acquired trigger: {}", key);
                    triggers.put(key, trigger);
                }
            }
        } catch (MongoException e) {
            for (TriggerKey key : triggers.keySet()) {
                lockManager.unlockAcquiredTrigger(key);
            }
            log.error("acquireNextTriggers failed due to MongoException: " + e.getMessage(), e);
            throw new JobPersistenceException("acquireNextTriggers failed due to MongoException", e);
        }
        return new ArrayList<Trigger>(triggers.values());
    }

    /**
     * Move a locked trigger to the acquired state.
     *
     * @return the acquired trigger, or null when it must not fire in this batch
     */
    private Trigger prepareForFire(Document triggerDoc, Date noLaterThanDate, Set<JobKey> nonConcurrentJobs)
            throws JobPersistenceException {
        TriggerKey key = Keys.toTriggerKey(triggerDoc);
        String state = triggerDoc.getString(Constants.TRIGGER_STATE);
        ObjectId jobId = triggerDoc.getObjectId(Constants.TRIGGER_JOB_ID);

        Trigger trigger;
        try {
            trigger = triggerConverter.toTriggerWithOptionalJob(triggerDoc);
        } catch (JobPersistenceException e) {
            log.error("Trigger " + key + " cannot be read, setting trigger state to ERROR.", e);
            triggerDao.transferState(key, state, Constants.STATE_ERROR);
            return null;
        }
        Document job = jobDao.getById(jobId);
        if (trigger.getJobKey() == null || job == null) {
            log.error("Error retrieving job for trigger {}, setting trigger state to ERROR.", key);
            triggerDao.transferState(key, state, Constants.STATE_ERROR);
            return null;
        }
        ExclusionCalendar cal = calendarDao.retrieveCalendar(trigger.getCalendarName());
        if (expectedCalendarButNotFound(trigger, cal)) {
            log.error("Calendar {} of trigger {} not found, setting trigger state to ERROR.",
                    trigger.getCalendarName(), key);
            triggerDao.transferState(key, state, Constants.STATE_ERROR);
            return null;
        }

        boolean misfired = misfireHandler.applyMisfire(trigger, cal);
        if (misfired) {
            log.debug("Misfire trigger {}.", key);
            if (trigger.getNextFireTime() == null) {
                if (persister.updateIfCurrent(trigger, jobId, state, Constants.STATE_COMPLETE)) {
                    persister.removeIfOneShotGroup(key);
                }
                return null;
            }
        }

        // The trigger has misfired and was rescheduled, its fire time may be too far in the future
        boolean tooLate = trigger.getNextFireTime().after(noLaterThanDate);
        boolean jobTaken = job.getBoolean(JobConverter.JOB_DISALLOW_CONCURRENT, false)
                && nonConcurrentJobs.contains(trigger.getJobKey());
        if (tooLate || jobTaken) {
            if (misfired) {
                persister.updateIfCurrent(trigger, jobId, state, Constants.STATE_WAITING);
            }
            return null;
        }

        trigger.setFireInstanceId(instanceId + fireInstanceCounter.incrementAndGet());
        if (!persister.updateIfCurrent(trigger, jobId, state, Constants.STATE_ACQUIRED)) {
            log.debug("Trigger {} changed while being acquired.", key);
            return null;
        }
        if (job.getBoolean(JobConverter.JOB_DISALLOW_CONCURRENT, false)) {
            nonConcurrentJobs.add(trigger.getJobKey());
        }
        return trigger;
    }

    public void releaseAcquiredTrigger(Trigger trigger) {
        triggerDao.transferState(trigger.getKey(), Constants.STATE_ACQUIRED, Constants.STATE_WAITING);
        lockManager.unlockAcquiredTrigger(trigger.getKey());
    }

    /**
     * Fires each trigger on its own. A trigger that cannot be fired is put
     * back to waiting and the rest of the batch still fires, so the bundles
     * returned are exactly the executions recorded in the store.
     *
     * @throws JobPersistenceException when no trigger could be fired because
     *                                 of a store failure
     */
    public List<TriggerFiredBundle> triggersFired(List<Trigger> triggers)
            throws JobPersistenceException {
        List<TriggerFiredBundle> results = new ArrayList<TriggerFiredBundle>(triggers.size());
        Exception failure = null;
        for (Trigger trigger : triggers) {
            log.debug("Fired trigger {}", trigger.getKey());
            try {
                try {
                    TriggerFiredBundle bundle = triggerFired(trigger);
                    if (bundle != null) {
                        results.add(bundle);
                    }
                } finally {
                    lockManager.unlockAcquiredTrigger(trigger.getKey());
                }
            } catch (MongoException e) {
                log.error("Firing trigger " + trigger.getKey() + " failed due to MongoException: "
                        + e.getMessage(), e);
                failure = e;
                putBackToWaiting(trigger);
            } catch (JobPersistenceException e) {
                log.error("Firing trigger " + trigger.getKey() + " failed: " + e.getMessage(), e);
                failure = e;
                putBackToWaiting(trigger);
            }
        }
        if (results.isEmpty() && failure != null) {
            throw new JobPersistenceException("triggersFired failed", failure);
        }
        return results;
    }

    private void putBackToWaiting(Trigger trigger) {
        try {
            triggerDao.transferState(trigger.getKey(), Constants.STATE_ACQUIRED, Constants.STATE_WAITING);
        } catch (MongoException e) {
            // the trigger lock expires and the trigger is acquired again
            log.warn("Could not release trigger {}: {}", trigger.getKey(), e.getMessage());
        }
    }

    private TriggerFiredBundle triggerFired(Trigger acquired) throws JobPersistenceException {
        TriggerKey key = acquired.getKey();
        Document triggerDoc = triggerDao.findTrigger(key);
        // deleted, paused or replaced since being acquired
        if (triggerDoc == null
                || !Constants.STATE_ACQUIRED.equals(triggerDoc.getString(Constants.TRIGGER_STATE))
                || TriggerAndJobPersister.versionOf(triggerDoc) != acquired.getVersion()) {
            return null;
        }
        ObjectId jobId = triggerDoc.getObjectId(Constants.TRIGGER_JOB_ID);
        Trigger trigger = triggerConverter.toTriggerWithOptionalJob(triggerDoc);

        ExclusionCalendar cal = calendarDao.retrieveCalendar(trigger.getCalendarName());
        if (expectedCalendarButNotFound(trigger, cal)) {
            triggerDao.transferState(key, Constants.STATE_ACQUIRED, Constants.STATE_ERROR);
            return null;
        }
        JobDetail job = trigger.getJobKey() == null ? null : jobDao.retrieveJob(trigger.getJobKey());
        if (job == null) {
            triggerDao.transferState(key, Constants.STATE_ACQUIRED, Constants.STATE_ERROR);
            return null;
        }

        boolean disallowed = job.isConcurrentExecutionDisallowed();
        if (disallowed && !lockManager.tryLockJob(job.getKey())) {
            if (lockManager.unlockExpired(job.getKey())) {
                triggerDao.transferState(key, Constants.STATE_ACQUIRED, Constants.STATE_WAITING);
            } else {
                triggerDao.transferState(key, Constants.STATE_ACQUIRED, Constants.STATE_BLOCKED);
            }
            return null;
        }

        Date prevFireTime = trigger.getPreviousFireTime();
        Date scheduledFireTime = trigger.getNextFireTime();
        calculator.triggered(trigger, cal);

        String newState;
        if (disallowed) {
            newState = Constants.STATE_BLOCKED;
        } else if (trigger.getNextFireTime() == null) {
            newState = Constants.STATE_COMPLETE;
        } else {
            newState = Constants.STATE_WAITING;
        }
        if (!persister.updateIfCurrent(trigger, jobId, Constants.STATE_ACQUIRED, newState)) {
            if (disallowed) {
                lockManager.unlockJob(job.getKey());
            }
            return null;
        }
        if (disallowed) {
            triggerDao.blockByJobId(jobId);
        }

        Date fireTime = clock.now();
        String fireInstanceId = acquired.getFireInstanceId() == null
                ? instanceId + fireInstanceCounter.incrementAndGet() : acquired.getFireInstanceId();
        trigger.setFireInstanceId(fireInstanceId);
        firedTriggerDao.insert(new FiredTriggerRecord(fireInstanceId, instanceId, key, job.getKey(),
                scheduledFireTime, fireTime, trigger.getPriority(),
                job.requestsRecovery(), disallowed));

        return new TriggerFiredBundle(job, trigger, cal, isRecovering(trigger), fireInstanceId,
                fireTime, scheduledFireTime, prevFireTime, trigger.getNextFireTime());
    }

    private boolean expectedCalendarButNotFound(Trigger trigger, ExclusionCalendar cal) {
        return trigger.getCalendarName() != null && cal == null;
    }

    private boolean isRecovering(Trigger trigger) {
        return trigger.getKey().getGroup().equals(Scheduler.DEFAULT_RECOVERY_GROUP);
    }
}
