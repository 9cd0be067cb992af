package com.novemberain.scheduling.mongodb.cluster;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.mongodb.dao.SchedulerDao;
import com.novemberain.scheduling.util.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedList;
import java.util.List;

/**
 * Recovers defunct schedulers, those that missed their expected check-in.
 *
 * For each of them it:
 * - recovers its fired triggers and releases its trigger locks,
 * - removes the scheduler entry.
 */
public class Recoverer {

    private static final Logger log = LoggerFactory.getLogger(Recoverer.class);

    private final SchedulerDao schedulerDao;
    private final TriggerRecoverer triggerRecoverer;
    private final Clock clock;

    public Recoverer(SchedulerDao schedulerDao, TriggerRecoverer triggerRecoverer, Clock clock) {
        this.schedulerDao = schedulerDao;
        this.triggerRecoverer = triggerRecoverer;
        this.clock = clock;
    }

    public void recover() throws JobPersistenceException {
        for (SchedulerInstance defunct : findDefunctSchedulers()) {
            triggerRecoverer.recover(defunct.getInstanceId());
            // so other instances won't try to recover it anymore
            schedulerDao.remove(defunct.getInstanceId(), defunct.getLastCheckinTime());
        }
    }

    private List<SchedulerInstance> findDefunctSchedulers() {
        // compare all schedulers using the same moment
        final long now = clock.millis();

        List<SchedulerInstance> forRecovery = new LinkedList<SchedulerInstance>();
        for (SchedulerInstance scheduler : schedulerDao.getAllByCheckinTime()) {
            if (scheduler.isDefunct(now) && schedulerDao.isNotSelf(scheduler)) {
                log.info("Found defunct scheduler: {}", scheduler);
                forRecovery.add(scheduler);
            }
        }
        return forRecovery;
    }
}
