package com.novemberain.scheduling.mongodb.cluster;

import com.novemberain.scheduling.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops firing triggers when this node cannot check in. Another node may
 * already consider it defunct and recover its work.
 */
public class StandbyErrorHandler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StandbyErrorHandler.class);

    private final SchedulerSignaler signaler;

    public StandbyErrorHandler(SchedulerSignaler signaler) {
        this.signaler = signaler;
    }

    @Override
    public void run() {
        log.error("Check-in failed, putting the scheduler in standby.");
        signaler.requestStandby("Cluster check-in failed");
    }
}
