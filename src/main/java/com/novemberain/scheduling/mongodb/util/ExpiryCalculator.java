package com.novemberain.scheduling.mongodb.util;

import com.novemberain.scheduling.mongodb.Constants;
import com.novemberain.scheduling.mongodb.cluster.SchedulerInstance;
import com.novemberain.scheduling.mongodb.dao.SchedulerDao;
import com.novemberain.scheduling.util.Clock;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;

/**
 * Decides whether a lock may be taken over: its owner held it too long or
 * stopped checking in.
 */
public class ExpiryCalculator {

    private static final Logger log = LoggerFactory.getLogger(ExpiryCalculator.class);

    private final SchedulerDao schedulerDao;
    private final Clock clock;
    private final long jobTimeoutMillis;
    private final long triggerTimeoutMillis;

    public ExpiryCalculator(SchedulerDao schedulerDao, Clock clock,
                            long jobTimeoutMillis, long triggerTimeoutMillis) {
        this.schedulerDao = schedulerDao;
        this.clock = clock;
        this.jobTimeoutMillis = jobTimeoutMillis;
        this.triggerTimeoutMillis = triggerTimeoutMillis;
    }

    public boolean isJobLockExpired(Document lock) {
        return isLockExpired(lock, jobTimeoutMillis) || hasDefunctScheduler(lock);
    }

    public boolean isTriggerLockExpired(Document lock) {
        return isLockExpired(lock, triggerTimeoutMillis) || hasDefunctScheduler(lock);
    }

    private boolean hasDefunctScheduler(Document lock) {
        String schedulerId = lock.getString(Constants.LOCK_INSTANCE_ID);
        SchedulerInstance scheduler = schedulerDao.findInstance(schedulerId);
        if (scheduler == null) {
            log.debug("No such scheduler: {}", schedulerId);
            return false;
        }
        return scheduler.isDefunct(clock.millis()) && schedulerDao.isNotSelf(scheduler);
    }

    private boolean isLockExpired(Document lock, long timeoutMillis) {
        Date lockTime = lock.getDate(Constants.LOCK_TIME);
        long elapsedTime = clock.millis() - lockTime.getTime();
        return (elapsedTime > timeoutMillis);
    }
}
