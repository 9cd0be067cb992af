package com.novemberain.scheduling.mongodb.cluster;

import com.novemberain.scheduling.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shuts the scheduler down when this node cannot check in.
 */
public class ShutdownErrorHandler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ShutdownErrorHandler.class);

    private final SchedulerSignaler signaler;

    public ShutdownErrorHandler(SchedulerSignaler signaler) {
        this.signaler = signaler;
    }

    @Override
    public void run() {
        log.error("Check-in failed, shutting the scheduler down.");
        signaler.requestShutdown("Cluster check-in failed");
    }
}
