package com.novemberain.scheduling.mongodb;

import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.mongodb.dao.FiredTriggerDao;
import com.novemberain.scheduling.mongodb.dao.JobDao;
import com.novemberain.scheduling.mongodb.dao.TriggerDao;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bookkeeping after a job execution: job data, the job lock, the fired
 * trigger record and the instruction returned by the execution.
 */
public class JobCompleteHandler {

    private static final Logger log = LoggerFactory.getLogger(JobCompleteHandler.class);

    private final TriggerAndJobPersister persister;
    private final SchedulerSignaler signaler;
    private final JobDao jobDao;
    private final LockManager lockManager;
    private final TriggerDao triggerDao;
    private final FiredTriggerDao firedTriggerDao;

    public JobCompleteHandler(TriggerAndJobPersister persister, SchedulerSignaler signaler,
                              JobDao jobDao, LockManager lockManager, TriggerDao triggerDao,
                              FiredTriggerDao firedTriggerDao) {
        this.persister = persister;
        this.signaler = signaler;
        this.jobDao = jobDao;
        this.lockManager = lockManager;
        this.triggerDao = triggerDao;
        this.firedTriggerDao = firedTriggerDao;
    }

    public void jobComplete(Trigger trigger, JobDetail job,
                            CompletedExecutionInstruction executionInstruction) throws JobPersistenceException {
        log.debug("Trigger completed {}", trigger.getKey());

        Document storedJob = jobDao.getJob(job.getKey());
        if (storedJob != null) {
            if (job.isPersistJobDataAfterExecution() && job.getJobDataMap().isDirty()) {
                log.debug("Job data map dirty, will store {}", job.getKey());
                jobDao.updateJobData(job.getKey(), job.getJobDataMap());
            }
            if (job.isConcurrentExecutionDisallowed()) {
                triggerDao.unblockByJobId(storedJob.getObjectId("_id"));
                signaler.signalSchedulingChange(0L);
            }
        }
        if (job.isConcurrentExecutionDisallowed()) {
            lockManager.unlockJob(job.getKey());
        }

        if (trigger.getFireInstanceId() != null) {
            firedTriggerDao.remove(trigger.getFireInstanceId());
        }

        process(trigger, executionInstruction);
    }

    private void process(Trigger trigger, CompletedExecutionInstruction executionInstruction) {
        // check for trigger deleted during execution...
        Document dbTrigger = triggerDao.findTrigger(trigger.getKey());
        if (dbTrigger == null) {
            return;
        }
        ObjectId jobId = dbTrigger.getObjectId(Constants.TRIGGER_JOB_ID);
        switch (executionInstruction) {
            case DELETE_TRIGGER:
                if (trigger.getNextFireTime() == null) {
                    // double check for possible reschedule within job
                    // execution, which would cancel the need to delete...
                    if (dbTrigger.getDate(Constants.TRIGGER_NEXT_FIRE_TIME) == null) {
                        persister.removeTrigger(trigger.getKey());
                    }
                } else {
                    persister.removeTrigger(trigger.getKey());
                    signaler.signalSchedulingChange(0L);
                }
                return;
            case SET_TRIGGER_COMPLETE:
                triggerDao.setState(trigger.getKey(), Constants.STATE_COMPLETE);
                signaler.signalSchedulingChange(0L);
                break;
            case SET_TRIGGER_ERROR:
                log.info("Trigger {} set to ERROR state.", trigger.getKey());
                triggerDao.setState(trigger.getKey(), Constants.STATE_ERROR);
                signaler.signalSchedulingChange(0L);
                break;
            case SET_ALL_JOB_TRIGGERS_ERROR:
                log.info("All triggers of Job {} set to ERROR state.", trigger.getJobKey());
                triggerDao.setStateByJobId(jobId, Constants.STATE_ERROR);
                signaler.signalSchedulingChange(0L);
                break;
            case SET_ALL_JOB_TRIGGERS_COMPLETE:
                triggerDao.setStateByJobId(jobId, Constants.STATE_COMPLETE);
                signaler.signalSchedulingChange(0L);
                break;
            default:
                break;
        }
        if (Constants.STATE_COMPLETE.equals(triggerDao.getState(trigger.getKey()))) {
            persister.removeIfOneShotGroup(trigger.getKey());
        }
    }
}
