package com.novemberain.scheduling.spi;

import com.novemberain.scheduling.SchedulerConfigException;

/**
 * Executes job run shells on a bounded set of threads.
 */
public interface WorkerPool {

    void initialize() throws SchedulerConfigException;

    /**
     * Execute the runnable on an idle thread.
     *
     * @return false if the pool is shut down or has no idle thread
     */
    boolean runInThread(Runnable runnable);

    /**
     * Block until at least one thread is idle.
     *
     * @return number of idle threads, or 0 when the pool is shutting down
     */
    int blockForAvailableThreads();

    int getPoolSize();

    void shutdown(boolean waitForJobsToComplete);
}
