package com.novemberain.scheduling.core;

import com.novemberain.scheduling.SchedulerException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import org.quartz.JobKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes store callbacks to the scheduler's listeners and dispatch loop.
 */
public class SchedulerSignalerImpl implements SchedulerSignaler {

    private static final Logger log = LoggerFactory.getLogger(SchedulerSignalerImpl.class);

    private final StdScheduler scheduler;
    private final SchedulerThread schedThread;

    SchedulerSignalerImpl(StdScheduler scheduler, SchedulerThread schedThread) {
        this.scheduler = scheduler;
        this.schedThread = schedThread;
        log.info("Initialized Scheduler Signaller of type: {}", getClass());
    }

    @Override
    public void notifyTriggerListenersMisfired(Trigger trigger) {
        scheduler.notifyTriggerListenersMisfired(trigger);
    }

    @Override
    public void notifySchedulerListenersFinalized(Trigger trigger) {
        scheduler.notifySchedulerListenersFinalized(trigger);
    }

    @Override
    public void notifySchedulerListenersJobDeleted(JobKey jobKey) {
        scheduler.notifySchedulerListenersJobDeleted(jobKey);
    }

    @Override
    public void notifySchedulerListenersError(String message, SchedulerException cause) {
        scheduler.notifySchedulerListenersError(message, cause);
    }

    @Override
    public void signalSchedulingChange(long candidateNewNextFireTime) {
        schedThread.signalSchedulingChange(candidateNewNextFireTime);
    }

    @Override
    public void requestStandby(String reason) {
        log.warn("Putting scheduler '{}' in standby: {}", scheduler.getResources().getName(), reason);
        try {
            scheduler.standby();
        } catch (SchedulerException e) {
            log.error("Could not put scheduler in standby", e);
        }
    }

    @Override
    public void requestShutdown(final String reason) {
        log.warn("Shutting down scheduler '{}': {}", scheduler.getResources().getName(), reason);
        // the caller may be a thread the shutdown itself waits for
        Thread shutdownThread = new Thread(new Runnable() {
            @Override
            public void run() {
                try {
                    scheduler.shutdown(false);
                } catch (SchedulerException e) {
                    log.error("Could not shut down scheduler", e);
                }
            }
        }, scheduler.getResources().getName() + "_Shutdown");
        shutdownThread.start();
    }
}
