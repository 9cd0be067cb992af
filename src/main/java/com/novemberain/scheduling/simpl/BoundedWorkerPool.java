package com.novemberain.scheduling.simpl;

import com.novemberain.scheduling.SchedulerConfigException;
import com.novemberain.scheduling.spi.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed number of named worker threads. A runnable is only accepted when a
 * thread is idle, so work never queues up behind running jobs.
 */
public class BoundedWorkerPool implements WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(BoundedWorkerPool.class);

    private final int threadCount;
    private final String threadNamePrefix;
    private final Object busyLock = new Object();

    private ThreadPoolExecutor executor;
    private int busyCount;
    private volatile boolean shutdown;

    public BoundedWorkerPool(int threadCount, String threadNamePrefix) {
        this.threadCount = threadCount;
        this.threadNamePrefix = threadNamePrefix;
    }

    @Override
    public void initialize() throws SchedulerConfigException {
        if (threadCount <= 0) {
            throw new SchedulerConfigException("Thread count must be > 0");
        }
        executor = new ThreadPoolExecutor(threadCount, threadCount, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<Runnable>(), new NamedThreadFactory(threadNamePrefix));
        executor.prestartAllCoreThreads();
        log.info("Worker pool '{}' started with {} threads", threadNamePrefix, threadCount);
    }

    @Override
    public boolean runInThread(final Runnable runnable) {
        if (runnable == null) {
            return false;
        }
        synchronized (busyLock) {
            if (shutdown || busyCount >= threadCount) {
                return false;
            }
            busyCount++;
        }
        try {
            executor.execute(new Runnable() {
                @Override
                public void run() {
                    try {
                        runnable.run();
                    } finally {
                        release();
                    }
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected a job", e);
            release();
            return false;
        }
    }

    private void release() {
        synchronized (busyLock) {
            busyCount--;
            busyLock.notifyAll();
        }
    }

    @Override
    public int blockForAvailableThreads() {
        synchronized (busyLock) {
            while (busyCount >= threadCount && !shutdown) {
                try {
                    busyLock.wait(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return 0;
                }
            }
            return shutdown ? 0 : threadCount - busyCount;
        }
    }

    @Override
    public int getPoolSize() {
        return threadCount;
    }

    public int getBusyCount() {
        synchronized (busyLock) {
            return busyCount;
        }
    }

    @Override
    public void shutdown(boolean waitForJobsToComplete) {
        synchronized (busyLock) {
            shutdown = true;
            busyLock.notifyAll();
        }
        if (executor == null) {
            return;
        }
        if (waitForJobsToComplete) {
            executor.shutdown();
            try {
                while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    log.debug("Waiting for {} running job(s) to complete", getBusyCount());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        } else {
            executor.shutdownNow();
        }
        log.info("Worker pool '{}' shut down", threadNamePrefix);
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
