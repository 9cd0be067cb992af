package com.novemberain.scheduling.core;

import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.SchedulerException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.spi.TriggerFiredBundle;
import com.novemberain.scheduling.spi.TriggerStore;
import com.novemberain.scheduling.spi.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The dispatch loop: acquires due triggers from the store, waits for their
 * fire time, marks them fired and hands each one to the worker pool.
 *
 * <p>Store failures during acquisition never stop the loop. They are retried
 * with exponential backoff; after too many failures in a row the loop
 * reports the store as unavailable once and keeps probing at the maximum
 * delay until acquisition succeeds again.</p>
 */
public class SchedulerThread extends Thread {

    private static final Logger log = LoggerFactory.getLogger(SchedulerThread.class);

    private static final long MAX_IDLE_WAIT_VARIABLENESS = 7500L;

    private final StdScheduler scheduler;
    private final SchedulerResources resources;

    private final Object sigLock = new Object();
    private boolean signaled;
    private long signaledNextFireTime;
    private boolean paused;
    private final AtomicBoolean halted;

    private final Random random = new Random(System.currentTimeMillis());

    private int consecutiveFailures;
    private boolean circuitOpen;

    SchedulerThread(StdScheduler scheduler, SchedulerResources resources) {
        super(resources.getThreadName());
        this.scheduler = scheduler;
        this.resources = resources;
        setDaemon(false);

        // start paused, the scheduler unpauses on start()
        paused = true;
        halted = new AtomicBoolean(false);
    }

    void togglePause(boolean pause) {
        synchronized (sigLock) {
            paused = pause;
            if (paused) {
                signalSchedulingChange(0);
            } else {
                sigLock.notifyAll();
            }
        }
    }

    void halt(boolean wait) {
        synchronized (sigLock) {
            halted.set(true);
            if (paused) {
                sigLock.notifyAll();
            } else {
                signalSchedulingChange(0);
            }
        }
        if (wait) {
            boolean interrupted = false;
            try {
                while (true) {
                    try {
                        join();
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    boolean isPaused() {
        return paused;
    }

    /**
     * Wake the loop because a trigger may need to fire earlier than the one it is waiting for.
     *
     * @param candidateNewNextFireTime the new time, or 0 when unknown
     */
    public void signalSchedulingChange(long candidateNewNextFireTime) {
        synchronized (sigLock) {
            signaled = true;
            signaledNextFireTime = candidateNewNextFireTime;
            sigLock.notifyAll();
        }
    }

    private void clearSignaledSchedulingChange() {
        synchronized (sigLock) {
            signaled = false;
            signaledNextFireTime = 0;
        }
    }

    private boolean isScheduleChanged() {
        synchronized (sigLock) {
            return signaled;
        }
    }

    int getConsecutiveFailures() {
        synchronized (sigLock) {
            return consecutiveFailures;
        }
    }

    boolean isCircuitOpen() {
        synchronized (sigLock) {
            return circuitOpen;
        }
    }

    @Override
    public void run() {
        TriggerStore store = resources.getTriggerStore();
        WorkerPool pool = resources.getWorkerPool();

        while (!halted.get()) {
            try {
                synchronized (sigLock) {
                    while (paused && !halted.get()) {
                        try {
                            sigLock.wait(1000L);
                        } catch (InterruptedException ignore) {
                            // re-check the flags
                        }
                    }
                    if (halted.get()) {
                        break;
                    }
                }

                if (getConsecutiveFailures() > 0) {
                    waitBeforeRetry(computeDelayForRepeatedErrors());
                    if (halted.get()) {
                        break;
                    }
                }

                int availThreadCount = pool.blockForAvailableThreads();
                if (availThreadCount <= 0) {
                    continue;
                }

                List<Trigger> triggers;
                long now = System.currentTimeMillis();
                clearSignaledSchedulingChange();
                try {
                    triggers = store.acquireNextTriggers(now + resources.getIdleWaitTime(),
                            Math.min(availThreadCount, resources.getMaxBatchSize()),
                            resources.getBatchTimeWindow());
                    acquisitionSucceeded();
                    if (triggers == null) {
                        triggers = new ArrayList<Trigger>();
                    } else {
                        triggers = new ArrayList<Trigger>(triggers);
                    }
                } catch (JobPersistenceException jpe) {
                    acquisitionFailed(jpe);
                    continue;
                } catch (RuntimeException e) {
                    acquisitionFailed(new JobPersistenceException("Unexpected runtime exception: "
                            + e.getMessage(), e));
                    continue;
                }

                if (!triggers.isEmpty()) {
                    fire(store, pool, triggers);
                    continue;
                }

                now = System.currentTimeMillis();
                long waitTime = now + getRandomizedIdleWaitTime();
                long timeUntilContinue = waitTime - now;
                synchronized (sigLock) {
                    try {
                        if (!halted.get() && !isScheduleChanged()) {
                            sigLock.wait(timeUntilContinue);
                        }
                    } catch (InterruptedException ignore) {
                        // loop again
                    }
                }
            } catch (RuntimeException re) {
                log.error("Runtime error occurred in main trigger firing loop.", re);
            }
        }
        log.debug("Dispatch loop of '{}' exited", resources.getName());
    }

    private void fire(TriggerStore store, WorkerPool pool, List<Trigger> triggers) {
        long now = System.currentTimeMillis();
        long triggerTime = triggers.get(0).getNextFireTime().getTime();
        long timeUntilTrigger = triggerTime - now;
        while (timeUntilTrigger > 2) {
            synchronized (sigLock) {
                if (halted.get()) {
                    break;
                }
                if (!isCandidateNewTimeEarlierWithinReason(triggerTime, false)) {
                    try {
                        now = System.currentTimeMillis();
                        timeUntilTrigger = triggerTime - now;
                        if (timeUntilTrigger >= 1) {
                            sigLock.wait(timeUntilTrigger);
                        }
                    } catch (InterruptedException ignore) {
                        // re-check below
                    }
                }
            }
            if (releaseIfScheduleChangedSignificantly(store, triggers, triggerTime)) {
                return;
            }
            now = System.currentTimeMillis();
            timeUntilTrigger = triggerTime - now;
        }

        if (halted.get()) {
            for (Trigger trigger : triggers) {
                store.releaseAcquiredTrigger(trigger);
            }
            return;
        }

        List<TriggerFiredBundle> bundles;
        try {
            bundles = store.triggersFired(triggers);
        } catch (JobPersistenceException se) {
            scheduler.notifySchedulerListenersError("An error occurred while firing triggers '"
                    + triggers + "'", se);
            for (Trigger trigger : triggers) {
                store.releaseAcquiredTrigger(trigger);
            }
            return;
        }

        for (TriggerFiredBundle bundle : bundles) {
            JobRunShell shell = new JobRunShell(scheduler, bundle);
            try {
                shell.initialize();
            } catch (SchedulerException se) {
                log.error("Unable to instantiate job of type '{}' for trigger {}",
                        bundle.getJobDetail().getJobType(), bundle.getTrigger().getKey(), se);
                completeWithError(store, bundle);
                continue;
            }
            if (!pool.runInThread(shell)) {
                log.error("Worker pool rejected job {} of trigger {}",
                        bundle.getJobDetail().getKey(), bundle.getTrigger().getKey());
                completeWithError(store, bundle);
            }
        }
    }

    private void completeWithError(TriggerStore store, TriggerFiredBundle bundle) {
        try {
            store.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
                    CompletedExecutionInstruction.SET_ALL_JOB_TRIGGERS_ERROR);
        } catch (JobPersistenceException e) {
            scheduler.notifySchedulerListenersError("Unable to set triggers of job "
                    + bundle.getJobDetail().getKey() + " to error state", e);
        }
    }

    private boolean releaseIfScheduleChangedSignificantly(TriggerStore store, List<Trigger> triggers,
                                                          long triggerTime) {
        if (isCandidateNewTimeEarlierWithinReason(triggerTime, true)) {
            for (Trigger trigger : triggers) {
                store.releaseAcquiredTrigger(trigger);
            }
            triggers.clear();
            return true;
        }
        return false;
    }

    /**
     * Worth giving the acquired triggers back only when the signalled time is
     * earlier by more than the cost of acquiring again.
     */
    private boolean isCandidateNewTimeEarlierWithinReason(long oldTime, boolean clearSignal) {
        synchronized (sigLock) {
            if (!isScheduleChanged()) {
                return false;
            }
            boolean earlier = false;
            if (signaledNextFireTime == 0) {
                earlier = true;
            } else if (signaledNextFireTime < oldTime) {
                earlier = true;
            }
            if (earlier) {
                long diff = oldTime - System.currentTimeMillis();
                long cost = resources.getTriggerStore().isClustered() ? 70 : 7;
                if (diff < cost) {
                    earlier = false;
                }
            }
            if (clearSignal) {
                clearSignaledSchedulingChange();
            }
            return earlier;
        }
    }

    private void acquisitionSucceeded() {
        boolean recovered;
        int failures;
        synchronized (sigLock) {
            recovered = circuitOpen;
            failures = consecutiveFailures;
            circuitOpen = false;
            consecutiveFailures = 0;
        }
        if (recovered) {
            log.info("Trigger store of '{}' is available again after {} failed acquisitions",
                    resources.getName(), failures);
            scheduler.notifySchedulerListenersStoreRecovered();
        }
    }

    private void acquisitionFailed(JobPersistenceException e) {
        int failures;
        boolean opened = false;
        synchronized (sigLock) {
            failures = ++consecutiveFailures;
            if (!circuitOpen && failures >= resources.getMaxConsecutiveAcquireFailures()) {
                circuitOpen = true;
                opened = true;
            }
        }
        if (failures == 1) {
            scheduler.notifySchedulerListenersError(
                    "An error occurred while scanning for the next triggers to fire.", e);
        } else {
            log.warn("Trigger acquisition failed {} times in a row: {}", failures, e.getMessage());
        }
        if (opened) {
            log.error("Trigger store of '{}' unavailable after {} consecutive failures, "
                    + "retrying every {} ms", resources.getName(), failures,
                    resources.getMaxAcquireRetryDelay(), e);
            scheduler.notifySchedulerListenersStoreUnavailable(failures, e);
        }
    }

    long computeDelayForRepeatedErrors() {
        int failures;
        boolean open;
        synchronized (sigLock) {
            failures = consecutiveFailures;
            open = circuitOpen;
        }
        long max = resources.getMaxAcquireRetryDelay();
        if (open) {
            return max;
        }
        long delay = resources.getAcquireRetryDelay();
        for (int i = 1; i < failures && delay < max; i++) {
            delay *= 2;
        }
        return Math.min(delay, max);
    }

    private void waitBeforeRetry(long delay) {
        long deadline = System.currentTimeMillis() + delay;
        synchronized (sigLock) {
            long remaining = delay;
            while (!halted.get() && remaining > 0) {
                try {
                    sigLock.wait(remaining);
                } catch (InterruptedException ignore) {
                    // keep waiting until the deadline or halt
                }
                remaining = deadline - System.currentTimeMillis();
            }
        }
    }

    private long getRandomizedIdleWaitTime() {
        long idleWaitTime = resources.getIdleWaitTime();
        int variableness = (int) Math.min(MAX_IDLE_WAIT_VARIABLENESS, idleWaitTime / 5);
        if (variableness <= 0) {
            return idleWaitTime;
        }
        return idleWaitTime - random.nextInt(variableness);
    }
}
