package com.novemberain.scheduling.mongodb;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerState;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.mongodb.dao.CalendarDao;
import com.novemberain.scheduling.mongodb.dao.JobDao;
import com.novemberain.scheduling.mongodb.dao.PausedJobGroupsDao;
import com.novemberain.scheduling.mongodb.dao.PausedTriggerGroupsDao;
import com.novemberain.scheduling.mongodb.dao.TriggerDao;
import com.novemberain.scheduling.mongodb.trigger.TriggerConverter;
import com.novemberain.scheduling.mongodb.util.GroupHelper;
import com.novemberain.scheduling.mongodb.util.QueryHelper;
import com.novemberain.scheduling.schedule.MisfireHandler;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.impl.matchers.StringMatcher;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pausing, resuming and error reset. Paused groups are recorded so that
 * triggers stored into them later start out paused.
 */
public class TriggerStateManager {

    private static final List<String> RUNNABLE_STATES =
            Arrays.asList(Constants.STATE_WAITING, Constants.STATE_ACQUIRED);
    private static final List<String> BLOCKED_STATES = Collections.singletonList(Constants.STATE_BLOCKED);

    private final TriggerDao triggerDao;
    private final JobDao jobDao;
    private final CalendarDao calendarDao;
    private final PausedJobGroupsDao pausedJobGroupsDao;
    private final PausedTriggerGroupsDao pausedTriggerGroupsDao;
    private final QueryHelper queryHelper;
    private final TriggerConverter triggerConverter;
    private final TriggerAndJobPersister persister;
    private final LockManager lockManager;
    private final MisfireHandler misfireHandler;
    private final SchedulerSignaler signaler;

    public TriggerStateManager(TriggerDao triggerDao, JobDao jobDao, CalendarDao calendarDao,
                               PausedJobGroupsDao pausedJobGroupsDao,
                               PausedTriggerGroupsDao pausedTriggerGroupsDao,
                               QueryHelper queryHelper, TriggerConverter triggerConverter,
                               TriggerAndJobPersister persister, LockManager lockManager,
                               MisfireHandler misfireHandler, SchedulerSignaler signaler) {
        this.triggerDao = triggerDao;
        this.jobDao = jobDao;
        this.calendarDao = calendarDao;
        this.pausedJobGroupsDao = pausedJobGroupsDao;
        this.pausedTriggerGroupsDao = pausedTriggerGroupsDao;
        this.queryHelper = queryHelper;
        this.triggerConverter = triggerConverter;
        this.persister = persister;
        this.lockManager = lockManager;
        this.misfireHandler = misfireHandler;
        this.signaler = signaler;
    }

    public Set<String> getPausedTriggerGroups() {
        return pausedTriggerGroupsDao.getPausedGroups();
    }

    public Set<String> getPausedJobGroups() {
        return pausedJobGroupsDao.getPausedGroups();
    }

    public TriggerState getState(TriggerKey triggerKey) {
        return getTriggerState(triggerDao.getState(triggerKey));
    }

    public void pause(TriggerKey triggerKey) {
        triggerDao.transferState(triggerKey, Constants.STATE_WAITING, Constants.STATE_PAUSED);
        triggerDao.transferState(triggerKey, Constants.STATE_ACQUIRED, Constants.STATE_PAUSED);
        triggerDao.transferState(triggerKey, Constants.STATE_BLOCKED, Constants.STATE_PAUSED_BLOCKED);
    }

    public Collection<String> pause(GroupMatcher<TriggerKey> matcher) {
        Set<String> groups = groupsToRecord(matcher, new GroupHelper(triggerDao.getCollection(), queryHelper));
        pausedTriggerGroupsDao.pauseGroups(groups);

        triggerDao.transferStatesInMatching(matcher, RUNNABLE_STATES, Constants.STATE_PAUSED);
        triggerDao.transferStatesInMatching(matcher, BLOCKED_STATES, Constants.STATE_PAUSED_BLOCKED);
        return groups;
    }

    public void pauseAll() {
        for (String group : triggerDao.getGroupNames()) {
            pause(GroupMatcher.triggerGroupEquals(group));
        }
    }

    public void pauseJob(JobKey jobKey) {
        Document job = jobDao.getJob(jobKey);
        if (job != null) {
            pauseTriggersOfJob(job.getObjectId("_id"));
        }
    }

    public Collection<String> pauseJobs(GroupMatcher<JobKey> groupMatcher) {
        Set<String> groups = groupsToRecord(groupMatcher, new GroupHelper(jobDao.getCollection(), queryHelper));
        pausedJobGroupsDao.pauseGroups(groups);

        for (ObjectId jobId : jobDao.idsOfMatching(groupMatcher)) {
            pauseTriggersOfJob(jobId);
        }
        return groups;
    }

    public void resume(TriggerKey triggerKey) throws JobPersistenceException {
        Document doc = triggerDao.findTrigger(triggerKey);
        if (doc == null) {
            return;
        }
        String state = doc.getString(Constants.TRIGGER_STATE);
        if (!Constants.STATE_PAUSED.equals(state) && !Constants.STATE_PAUSED_BLOCKED.equals(state)) {
            return;
        }
        Trigger trigger = triggerConverter.toTriggerWithOptionalJob(doc);

        String newState = Constants.STATE_WAITING;
        if (trigger.getJobKey() != null && lockManager.isJobLocked(trigger.getJobKey())) {
            newState = Constants.STATE_BLOCKED;
        }
        ExclusionCalendar cal = calendarDao.retrieveCalendar(trigger.getCalendarName());
        misfireHandler.applyMisfire(trigger, cal);
        if (trigger.getNextFireTime() == null) {
            newState = Constants.STATE_COMPLETE;
        }

        if (persister.updateIfCurrent(trigger, doc.getObjectId(Constants.TRIGGER_JOB_ID), state, newState)) {
            signaler.signalSchedulingChange(0L);
        }
    }

    public Collection<String> resume(GroupMatcher<TriggerKey> matcher) throws JobPersistenceException {
        Set<String> groups = new HashSet<String>();
        for (TriggerKey key : triggerDao.getTriggerKeys(matcher)) {
            groups.add(key.getGroup());
            resume(key);
        }
        Set<String> pausedGroups = pausedGroupsMatching(pausedTriggerGroupsDao.getPausedGroups(), matcher);
        pausedTriggerGroupsDao.unpauseGroups(pausedGroups);
        groups.addAll(pausedGroups);
        return groups;
    }

    public void resume(JobKey jobKey) throws JobPersistenceException {
        Document job = jobDao.getJob(jobKey);
        if (job == null) {
            return;
        }
        for (TriggerKey key : triggerDao.getTriggerKeysOfJobs(Collections.singletonList(job.getObjectId("_id")))) {
            resume(key);
        }
    }

    public Collection<String> resumeJobs(GroupMatcher<JobKey> groupMatcher) throws JobPersistenceException {
        Set<String> groups = new HashSet<String>();
        for (JobKey jobKey : jobDao.getJobKeys(groupMatcher)) {
            groups.add(jobKey.getGroup());
        }
        for (TriggerKey key : triggerDao.getTriggerKeysOfJobs(jobDao.idsOfMatching(groupMatcher))) {
            resume(key);
        }
        Set<String> pausedGroups = pausedGroupsMatching(pausedJobGroupsDao.getPausedGroups(), groupMatcher);
        pausedJobGroupsDao.unpauseGroups(pausedGroups);
        groups.addAll(pausedGroups);
        return groups;
    }

    public void resumeAll() throws JobPersistenceException {
        pausedJobGroupsDao.remove();
        resume(GroupMatcher.anyTriggerGroup());
        pausedTriggerGroupsDao.remove();
    }

    public void resetTriggerFromErrorState(TriggerKey triggerKey) {
        // Atomic updates cannot be done with the current model - across collections.
        String currentState = triggerDao.getState(triggerKey);
        if (!Constants.STATE_ERROR.equals(currentState)) {
            return;
        }
        String newState = Constants.STATE_WAITING;
        if (pausedTriggerGroupsDao.isPaused(triggerKey.getGroup())) {
            newState = Constants.STATE_PAUSED;
        }
        if (triggerDao.transferState(triggerKey, Constants.STATE_ERROR, newState)) {
            signaler.signalSchedulingChange(0L);
        }
    }

    private void pauseTriggersOfJob(ObjectId jobId) {
        triggerDao.transferStatesByJobId(jobId, RUNNABLE_STATES, Constants.STATE_PAUSED);
        triggerDao.transferStatesByJobId(jobId, BLOCKED_STATES, Constants.STATE_PAUSED_BLOCKED);
    }

    /**
     * An exact group name is recorded even when nothing is stored in it yet.
     */
    private Set<String> groupsToRecord(GroupMatcher<?> matcher, GroupHelper groupHelper) {
        if (matcher.getCompareWithOperator() == StringMatcher.StringOperatorName.EQUALS) {
            return Collections.singleton(matcher.getCompareToValue());
        }
        return groupHelper.groupsThatMatch(matcher);
    }

    private Set<String> pausedGroupsMatching(Set<String> pausedGroups, GroupMatcher<?> matcher) {
        Set<String> result = new HashSet<String>();
        for (String group : pausedGroups) {
            if (QueryHelper.groupMatches(matcher, group)) {
                result.add(group);
            }
        }
        return result;
    }

    private TriggerState getTriggerState(String value) {
        if (value == null) {
            return TriggerState.NONE;
        }

        if (value.equals(Constants.STATE_COMPLETE)) {
            return TriggerState.COMPLETE;
        }

        if (value.equals(Constants.STATE_PAUSED)) {
            return TriggerState.PAUSED;
        }

        if (value.equals(Constants.STATE_PAUSED_BLOCKED)) {
            return TriggerState.PAUSED;
        }

        if (value.equals(Constants.STATE_ERROR)) {
            return TriggerState.ERROR;
        }

        if (value.equals(Constants.STATE_BLOCKED)) {
            return TriggerState.BLOCKED;
        }

        // waiting or acquired
        return TriggerState.NORMAL;
    }
}
