package com.novemberain.scheduling.mongodb.cluster;

import com.mongodb.MongoException;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.mongodb.dao.SchedulerDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks this node in to the cluster, then recovers the nodes that
 * stopped checking in.
 */
public class CheckinTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CheckinTask.class);

    private final SchedulerDao schedulerDao;
    private final Recoverer recoverer;
    private Runnable errorHandler;

    public CheckinTask(SchedulerDao schedulerDao, Recoverer recoverer, Runnable errorHandler) {
        this.schedulerDao = schedulerDao;
        this.recoverer = recoverer;
        this.errorHandler = errorHandler;
    }

    // for tests only
    void setErrorHandler(Runnable errorHandler) {
        this.errorHandler = errorHandler;
    }

    @Override
    public void run() {
        log.info("Node {}:{} checks-in.", schedulerDao.schedulerName, schedulerDao.instanceId);
        try {
            schedulerDao.checkIn();
        } catch (MongoException e) {
            log.error("Node " + schedulerDao.instanceId + " could not check-in: " + e.getMessage(), e);
            errorHandler.run();
            return;
        }

        try {
            recoverer.recover();
        } catch (JobPersistenceException e) {
            log.error("Recovery of defunct nodes failed: " + e.getMessage(), e);
        } catch (MongoException e) {
            log.error("Recovery of defunct nodes failed: " + e.getMessage(), e);
        }
    }
}
