package com.novemberain.scheduling.mongodb;

import com.mongodb.MongoWriteException;
import com.novemberain.scheduling.mongodb.dao.LocksDao;
import com.novemberain.scheduling.mongodb.util.ExpiryCalculator;
import org.bson.Document;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LockManager {

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final LocksDao locksDao;
    private final ExpiryCalculator expiryCalculator;

    public LockManager(LocksDao locksDao, ExpiryCalculator expiryCalculator) {
        this.locksDao = locksDao;
        this.expiryCalculator = expiryCalculator;
    }

    /**
     * Take the run lock of a job that disallows concurrent execution.
     *
     * @return false when another execution holds it
     */
    public boolean tryLockJob(JobKey jobKey) {
        try {
            locksDao.lockJob(jobKey);
            return true;
        } catch (MongoWriteException e) {
            log.debug("Job {} disallows concurrent execution and is already running", jobKey);
        }
        return false;
    }

    public void unlockJob(JobKey jobKey) {
        locksDao.unlockJob(jobKey);
    }

    public boolean isJobLocked(JobKey jobKey) {
        return locksDao.findJobLock(jobKey) != null;
    }

    public void unlockAcquiredTrigger(TriggerKey key) {
        locksDao.unlockTrigger(key);
    }

    /**
     * Unlock job that have existing, expired lock.
     *
     * @param jobKey    job to potentially unlock
     * @return true when an expired lock was removed
     */
    public boolean unlockExpired(JobKey jobKey) {
        Document existingLock = locksDao.findJobLock(jobKey);
        if (existingLock != null && expiryCalculator.isJobLockExpired(existingLock)) {
            log.debug("Removing expired lock for job {}", jobKey);
            locksDao.remove(existingLock);
            return true;
        }
        return false;
    }

    /**
     * Try to lock given trigger, ignoring errors.
     * @param key    trigger to lock
     * @return true when successfully locked, false otherwise
     */
    public boolean tryLock(TriggerKey key) {
        try {
            locksDao.lockTrigger(key);
            return true;
        } catch (MongoWriteException e) {
            log.debug("Failed to lock trigger {}, reason: {}", key, e.getError());
        }
        return false;
    }

    /**
     * Relock trigger if its lock has expired.
     *
     * @param key    trigger to lock
     * @return true when successfully relocked
     */
    public boolean relockExpired(TriggerKey key) {
        Document existingLock = locksDao.findTriggerLock(key);
        if (existingLock != null) {
            if (expiryCalculator.isTriggerLockExpired(existingLock)) {
                // When a scheduler is defunct then its triggers become expired
                // after sometime and can be recovered by other schedulers.
                // Relock may not be successful when some other scheduler has done
                // it first.
                log.info("Trigger {} is expired - re-locking", key);
                return locksDao.relock(key, existingLock.getDate(Constants.LOCK_TIME));
            } else {
                log.debug("Trigger {} hasn't expired yet. Lock time: {}",
                        key, existingLock.getDate(Constants.LOCK_TIME));
            }
        } else {
            log.debug("No lock found for trigger {}. Maybe it was deleted", key);
        }
        return false;
    }
}
