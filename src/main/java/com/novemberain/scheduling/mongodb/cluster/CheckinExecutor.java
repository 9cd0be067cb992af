package com.novemberain.scheduling.mongodb.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Runs the {@link CheckinTask} of one scheduler instance at a fixed rate.
 */
public class CheckinExecutor {

    private static final Logger log = LoggerFactory.getLogger(CheckinExecutor.class);

    private static final int INITIAL_DELAY = 0;
    private final Runnable checkinTask;
    private final long checkinIntervalMillis;
    private final String instanceId;

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "checkin-executor");
        thread.setDaemon(true);
        return thread;
    });

    public CheckinExecutor(Runnable checkinTask, long checkinIntervalMillis, String instanceId) {
        this.checkinTask = checkinTask;
        this.checkinIntervalMillis = checkinIntervalMillis;
        this.instanceId = instanceId;
    }

    public void start() {
        log.info("Starting check-in task for scheduler instance: {}", instanceId);
        executor.scheduleAtFixedRate(checkinTask, INITIAL_DELAY, checkinIntervalMillis, MILLISECONDS);
    }

    public void shutdown() {
        log.info("Stopping CheckinExecutor for scheduler instance: {}", instanceId);
        executor.shutdownNow();
    }
}
