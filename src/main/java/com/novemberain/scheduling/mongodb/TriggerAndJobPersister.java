package com.novemberain.scheduling.mongodb;

import com.novemberain.scheduling.ConcurrencyConflictException;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.ObjectAlreadyExistsException;
import com.novemberain.scheduling.ObjectNotFoundException;
import com.novemberain.scheduling.Scheduler;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.mongodb.dao.CalendarDao;
import com.novemberain.scheduling.mongodb.dao.JobDao;
import com.novemberain.scheduling.mongodb.dao.LocksDao;
import com.novemberain.scheduling.mongodb.dao.PausedJobGroupsDao;
import com.novemberain.scheduling.mongodb.dao.PausedTriggerGroupsDao;
import com.novemberain.scheduling.mongodb.dao.TriggerDao;
import com.novemberain.scheduling.mongodb.trigger.TriggerConverter;
import com.novemberain.scheduling.schedule.ScheduleCalculator;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import com.novemberain.scheduling.mongodb.util.Keys;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class TriggerAndJobPersister {

    private static final Logger log = LoggerFactory.getLogger(TriggerAndJobPersister.class);

    private final TriggerDao triggerDao;
    private final JobDao jobDao;
    private final CalendarDao calendarDao;
    private final LocksDao locksDao;
    private final PausedTriggerGroupsDao pausedTriggerGroupsDao;
    private final PausedJobGroupsDao pausedJobGroupsDao;
    private final TriggerConverter triggerConverter;
    private final ScheduleCalculator calculator;
    private final SchedulerSignaler signaler;

    public TriggerAndJobPersister(TriggerDao triggerDao, JobDao jobDao, CalendarDao calendarDao,
                                  LocksDao locksDao, PausedTriggerGroupsDao pausedTriggerGroupsDao,
                                  PausedJobGroupsDao pausedJobGroupsDao, TriggerConverter triggerConverter,
                                  ScheduleCalculator calculator, SchedulerSignaler signaler) {
        this.triggerDao = triggerDao;
        this.jobDao = jobDao;
        this.calendarDao = calendarDao;
        this.locksDao = locksDao;
        this.pausedTriggerGroupsDao = pausedTriggerGroupsDao;
        this.pausedJobGroupsDao = pausedJobGroupsDao;
        this.triggerConverter = triggerConverter;
        this.calculator = calculator;
        this.signaler = signaler;
    }

    public List<Trigger> getTriggersForJob(JobKey jobKey) throws JobPersistenceException {
        final Document doc = jobDao.getJob(jobKey);
        return triggerDao.getTriggersForJob(doc);
    }

    public boolean removeJob(JobKey jobKey) {
        Document item = jobDao.getJob(jobKey);
        if (item != null) {
            jobDao.remove(jobKey);
            triggerDao.removeByJobId(item.get("_id"));
            return true;
        }
        return false;
    }

    public boolean removeTrigger(TriggerKey triggerKey) {
        Document trigger = triggerDao.findTrigger(triggerKey);
        if (trigger != null) {
            triggerDao.remove(triggerKey);
            removeOrphanedJob(trigger);
            return true;
        }
        return false;
    }

    /**
     * Manual and recovery triggers are not kept once complete.
     */
    public boolean removeIfOneShotGroup(TriggerKey triggerKey) {
        String group = triggerKey.getGroup();
        if (Scheduler.DEFAULT_MANUAL_TRIGGERS.equals(group) || Scheduler.DEFAULT_RECOVERY_GROUP.equals(group)) {
            log.debug("Removing completed trigger {}", triggerKey);
            return triggerDao.remove(triggerKey);
        }
        return false;
    }

    public boolean replaceTrigger(TriggerKey triggerKey, Trigger newTrigger)
            throws JobPersistenceException {
        Document oldDoc = triggerDao.findTrigger(triggerKey);
        if (oldDoc == null) {
            return false;
        }
        Trigger oldTrigger = triggerConverter.toTriggerWithOptionalJob(oldDoc);
        if (oldTrigger.getJobKey() == null || !oldTrigger.getJobKey().equals(newTrigger.getJobKey())) {
            throw new JobPersistenceException("New trigger is not related to the same job as the old trigger.");
        }

        // Can't call removeTrigger as if the job is not durable, it will remove the job too
        triggerDao.remove(triggerKey);
        try {
            newTrigger.setVersion(0);
            storeTrigger(newTrigger, false);
        } catch (JobPersistenceException jpe) {
            triggerDao.insert(oldDoc, triggerKey);
            throw jpe;
        }
        return true;
    }

    public void storeJob(JobDetail newJob, boolean replaceExisting) throws JobPersistenceException {
        jobDao.storeJobInMongo(newJob, replaceExisting);
    }

    public void storeJobAndTrigger(JobDetail newJob, Trigger newTrigger)
            throws JobPersistenceException {
        if (triggerDao.exists(newTrigger.getKey())) {
            throw new ObjectAlreadyExistsException(newTrigger);
        }
        ObjectId jobId = jobDao.storeJobInMongo(newJob, false);

        log.debug("Storing job {} and trigger {}", newJob.getKey(), newTrigger.getKey());
        try {
            storeTrigger(newTrigger, false);
        } catch (JobPersistenceException e) {
            jobDao.removeById(jobId);
            throw e;
        }
    }

    /**
     * Store the trigger with a freshly computed next fire time, in the state
     * its groups and its job call for.
     */
    public void storeTrigger(Trigger newTrigger, boolean replaceExisting)
            throws JobPersistenceException {
        if (newTrigger.getJobKey() == null) {
            throw new JobPersistenceException("Trigger must be associated with a job. Please specify a JobKey.");
        }

        Document job = jobDao.getJob(newTrigger.getJobKey());
        if (job == null) {
            throw new ObjectNotFoundException("The job (" + newTrigger.getJobKey()
                    + ") referenced by the trigger does not exist.");
        }
        ExclusionCalendar calendar = calendarDao.retrieveCalendar(newTrigger.getCalendarName());
        if (newTrigger.getCalendarName() != null && calendar == null) {
            throw new ObjectNotFoundException("Calendar not found: " + newTrigger.getCalendarName());
        }

        Document existing = triggerDao.findTrigger(newTrigger.getKey());
        long storedVersion = 0;
        if (existing != null) {
            if (!replaceExisting) {
                throw new ObjectAlreadyExistsException(newTrigger);
            }
            storedVersion = versionOf(existing);
            if (newTrigger.getVersion() != 0 && newTrigger.getVersion() != storedVersion) {
                throw conflict(newTrigger, storedVersion);
            }
        }

        Trigger stored = newTrigger.clone();
        stored.setVersion(storedVersion + 1);
        stored.setNextFireTime(calculator.fireTimeAfter(stored, calendar, stored.getPreviousFireTime()));

        Document doc = triggerConverter.toDocument(stored, job.getObjectId("_id"), initialState(stored));
        if (existing == null) {
            triggerDao.insert(doc, stored.getKey());
        } else if (!triggerDao.replaceIfCurrent(stored.getKey(), storedVersion, null, doc)) {
            throw conflict(newTrigger, storedVersion);
        }

        newTrigger.setVersion(stored.getVersion());
        newTrigger.setNextFireTime(stored.getNextFireTime());
        log.debug("Stored trigger {} with next fire time {}", stored.getKey(), stored.getNextFireTime());
    }

    /**
     * Write back a trigger changed in memory, bumping its version, provided
     * nobody else wrote it since it was read.
     *
     * @param expectedState state the stored document must still be in, or null
     * @return false if the stored trigger changed meanwhile
     */
    public boolean updateIfCurrent(Trigger trigger, ObjectId jobId, String expectedState, String newState)
            throws JobPersistenceException {
        long expectedVersion = trigger.getVersion();
        trigger.setVersion(expectedVersion + 1);
        Document doc = triggerConverter.toDocument(trigger, jobId, newState);
        if (triggerDao.replaceIfCurrent(trigger.getKey(), expectedVersion, expectedState, doc)) {
            return true;
        }
        trigger.setVersion(expectedVersion);
        return false;
    }

    private String initialState(Trigger trigger) {
        if (trigger.getNextFireTime() == null) {
            return Constants.STATE_COMPLETE;
        }
        boolean paused = pausedTriggerGroupsDao.isPaused(trigger.getKey().getGroup())
                || pausedJobGroupsDao.isPaused(trigger.getJobKey().getGroup());
        boolean blocked = locksDao.findJobLock(trigger.getJobKey()) != null;
        if (paused) {
            return blocked ? Constants.STATE_PAUSED_BLOCKED : Constants.STATE_PAUSED;
        }
        return blocked ? Constants.STATE_BLOCKED : Constants.STATE_WAITING;
    }

    static long versionOf(Document trigger) {
        Number version = trigger.get(Constants.TRIGGER_VERSION, Number.class);
        return version == null ? 0L : version.longValue();
    }

    private ConcurrencyConflictException conflict(Trigger trigger, long storedVersion) {
        return new ConcurrencyConflictException("Trigger '" + trigger.getKey()
                + "' was modified concurrently: expected version " + trigger.getVersion()
                + " but found " + storedVersion);
    }

    private boolean isNotDurable(Document job) {
        return !job.getBoolean(JobConverter.JOB_DURABILITY, false);
    }

    // If the removal of the Trigger results in an 'orphaned' Job that is not 'durable',
    // then the job should be removed also.
    private void removeOrphanedJob(Document trigger) {
        Object jobId = trigger.get(Constants.TRIGGER_JOB_ID);
        Document job = jobDao.getById(jobId);
        if (job != null && isNotDurable(job) && triggerDao.findByJobId((ObjectId) jobId).isEmpty()) {
            JobKey jobKey = Keys.toJobKey(job);
            jobDao.removeById(jobId);
            log.debug("Removed orphaned job {}", jobKey);
            signaler.notifySchedulerListenersJobDeleted(jobKey);
        }
    }
}
