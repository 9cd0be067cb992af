package com.novemberain.scheduling.simpl;

import com.novemberain.scheduling.SchedulerConfigException;
import org.junit.After;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BoundedWorkerPoolTest {

    private BoundedWorkerPool pool;

    @After
    public void tearDown() {
        if (pool != null) {
            pool.shutdown(false);
        }
    }

    @Test(expected = SchedulerConfigException.class)
    public void threadCountMustBePositive() throws Exception {
        new BoundedWorkerPool(0, "empty").initialize();
    }

    @Test
    public void rejectsWorkWhenEveryThreadIsBusy() throws Exception {
        pool = new BoundedWorkerPool(2, "busy");
        pool.initialize();
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch started = new CountDownLatch(2);
        Runnable blocking = new Runnable() {
            @Override
            public void run() {
                started.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };

        assertEquals(2, pool.blockForAvailableThreads());
        assertTrue(pool.runInThread(blocking));
        assertTrue(pool.runInThread(blocking));
        assertTrue(started.await(10, TimeUnit.SECONDS));

        assertFalse(pool.runInThread(blocking));
        assertEquals(2, pool.getBusyCount());

        release.countDown();
        assertTrue(pool.blockForAvailableThreads() > 0);
    }

    @Test
    public void workerThreadsCarryThePrefix() throws Exception {
        pool = new BoundedWorkerPool(1, "named");
        pool.initialize();
        final CountDownLatch done = new CountDownLatch(1);
        final String[] threadName = new String[1];

        pool.runInThread(new Runnable() {
            @Override
            public void run() {
                threadName[0] = Thread.currentThread().getName();
                done.countDown();
            }
        });

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertTrue(threadName[0].startsWith("named-"));
    }

    @Test
    public void acceptsNothingAfterShutdown() throws Exception {
        pool = new BoundedWorkerPool(1, "closed");
        pool.initialize();

        pool.shutdown(true);

        assertFalse(pool.runInThread(new Runnable() {
            @Override
            public void run() {
            }
        }));
        assertEquals(0, pool.blockForAvailableThreads());
    }
}
