package com.novemberain.scheduling.mongodb.cluster;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.ObjectAlreadyExistsException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.mongodb.Constants;
import com.novemberain.scheduling.mongodb.LockManager;
import com.novemberain.scheduling.mongodb.TriggerAndJobPersister;
import com.novemberain.scheduling.mongodb.dao.FiredTriggerDao;
import com.novemberain.scheduling.mongodb.dao.JobDao;
import com.novemberain.scheduling.mongodb.dao.LocksDao;
import com.novemberain.scheduling.mongodb.dao.TriggerDao;
import com.novemberain.scheduling.spi.FiredTriggerRecord;
import org.bson.Document;
import org.quartz.JobDataMap;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Cleans up after a scheduler instance that went away: its acquired
 * triggers, its locks and the executions it never completed.
 */
public class TriggerRecoverer {

    private static final Logger log = LoggerFactory.getLogger(TriggerRecoverer.class);

    private final LocksDao locksDao;
    private final FiredTriggerDao firedTriggerDao;
    private final TriggerDao triggerDao;
    private final JobDao jobDao;
    private final TriggerAndJobPersister persister;
    private final LockManager lockManager;
    private final RecoveryTriggerFactory recoveryTriggerFactory;

    public TriggerRecoverer(LocksDao locksDao, FiredTriggerDao firedTriggerDao, TriggerDao triggerDao,
                            JobDao jobDao, TriggerAndJobPersister persister, LockManager lockManager,
                            RecoveryTriggerFactory recoveryTriggerFactory) {
        this.locksDao = locksDao;
        this.firedTriggerDao = firedTriggerDao;
        this.triggerDao = triggerDao;
        this.jobDao = jobDao;
        this.persister = persister;
        this.lockManager = lockManager;
        this.recoveryTriggerFactory = recoveryTriggerFactory;
    }

    /**
     * Recover everything left behind by {@code ownerId}.
     *
     * @return the recovery triggers stored
     */
    public int recover(String ownerId) throws JobPersistenceException {
        List<FiredTriggerRecord> records = firedTriggerDao.findByInstanceId(ownerId);

        for (TriggerKey key : locksDao.findTriggerLocksOf(ownerId)) {
            if (triggerDao.transferState(key, Constants.STATE_ACQUIRED, Constants.STATE_WAITING)) {
                log.info("Released trigger {} acquired by {}", key, ownerId);
            }
        }
        long locks = locksDao.removeAllOf(ownerId);
        log.debug("Removed {} locks of {}", locks, ownerId);

        int recovered = 0;
        for (FiredTriggerRecord record : records) {
            // whoever deletes the record owns its recovery
            if (!firedTriggerDao.remove(record.getFireInstanceId())) {
                log.debug("Fired trigger {} was already claimed by another scheduler",
                        record.getFireInstanceId());
                continue;
            }
            if (recoverFired(record)) {
                recovered++;
            }
        }
        log.info("Recovered {} of {} executions left by scheduler {}", recovered, records.size(), ownerId);
        return recovered;
    }

    /**
     * Nothing can be in flight when a non-clustered scheduler starts, so
     * acquired and blocked triggers go back to waiting.
     */
    public void resetStates() {
        triggerDao.transferStatesInAll(
                Arrays.asList(Constants.STATE_ACQUIRED, Constants.STATE_BLOCKED), Constants.STATE_WAITING);
        triggerDao.transferStatesInAll(
                Collections.singletonList(Constants.STATE_PAUSED_BLOCKED), Constants.STATE_PAUSED);
    }

    private boolean recoverFired(FiredTriggerRecord record) throws JobPersistenceException {
        Document job = jobDao.getJob(record.getJobKey());
        if (job == null) {
            log.debug("Job {} of fired trigger {} is gone", record.getJobKey(), record.getTriggerKey());
            return false;
        }

        if (record.isConcurrentExecutionDisallowed() && !lockManager.isJobLocked(record.getJobKey())) {
            triggerDao.unblockByJobId(job.getObjectId("_id"));
        }

        if (!record.isRequestsRecovery()) {
            return false;
        }
        Trigger original = triggerDao.getTrigger(record.getTriggerKey());
        JobDataMap data = original == null ? new JobDataMap() : original.getJobDataMap();
        Trigger recoveryTrigger = recoveryTriggerFactory.from(record, data);
        log.info("Recovering job {} of fired trigger {} with {}",
                record.getJobKey(), record.getTriggerKey(), recoveryTrigger.getKey());
        try {
            persister.storeTrigger(recoveryTrigger, false);
        } catch (ObjectAlreadyExistsException e) {
            log.info("Recovery trigger {} already exists", recoveryTrigger.getKey());
            return false;
        }
        return true;
    }
}
