package com.novemberain.scheduling.core;

import com.novemberain.scheduling.InterruptableJob;
import com.novemberain.scheduling.Job;
import com.novemberain.scheduling.JobBuilder;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobExecutionContext;
import com.novemberain.scheduling.JobExecutionException;
import com.novemberain.scheduling.JobListener;
import com.novemberain.scheduling.JobRegistry;
import com.novemberain.scheduling.ObjectNotFoundException;
import com.novemberain.scheduling.SchedulerException;
import com.novemberain.scheduling.SchedulerListener;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerBuilder;
import com.novemberain.scheduling.TriggerListener;
import com.novemberain.scheduling.TriggerState;
import com.novemberain.scheduling.schedule.SimpleSchedule;
import com.novemberain.scheduling.simpl.BoundedWorkerPool;
import com.novemberain.scheduling.simpl.RAMTriggerStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.quartz.JobDataMap;
import org.quartz.TriggerKey;

import java.util.Date;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class StdSchedulerTest {

    private final AtomicInteger executions = new AtomicInteger();
    private final AtomicReference<Object> lastValue = new AtomicReference<Object>();
    private volatile CountDownLatch executed = new CountDownLatch(1);
    private final CountDownLatch interrupted = new CountDownLatch(1);

    private StdScheduler scheduler;

    @Before
    public void setUp() throws Exception {
        JobRegistry registry = new JobRegistry()
                .register("counting", () -> new CountingJob())
                .register("unscheduling", () -> new UnschedulingJob())
                .register("waiting", () -> new WaitingJob());

        SchedulerResources resources = new SchedulerResources();
        resources.setName("StdSchedulerTest");
        resources.setInstanceId("test-node");
        resources.setTriggerStore(new RAMTriggerStore());
        resources.setWorkerPool(new BoundedWorkerPool(2, "StdSchedulerTest_Worker"));
        resources.setJobRegistry(registry);
        resources.setIdleWaitTime(1000L);

        scheduler = new StdScheduler(resources);
        scheduler.start();
    }

    @After
    public void tearDown() throws Exception {
        scheduler.shutdown(true);
    }

    @Test
    public void runsScheduledJobForEveryRepeat() throws Exception {
        executed = new CountDownLatch(3);
        JobDetail job = JobBuilder.newJob("counting").withIdentity("job", "group").build();
        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity("trigger", "group")
                .withSchedule(SimpleSchedule.repeat(50L, 2))
                .startNow()
                .build();

        scheduler.scheduleJob(job, trigger);

        assertTrue(executed.await(10, TimeUnit.SECONDS));
    }

    @Test
    public void failingSchedulerListenerDoesNotBreakPause() throws Exception {
        scheduler.getListenerManager().addSchedulerListener(new SchedulerListener() {
            @Override
            public void triggerPaused(TriggerKey triggerKey) {
                throw new IllegalStateException("listener failure");
            }
        });
        JobDetail job = JobBuilder.newJob("counting").withIdentity("paused", "group").build();
        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity("paused", "group")
                .withSchedule(SimpleSchedule.repeatForever(60000L))
                .startAt(new Date(System.currentTimeMillis() + 60000L))
                .build();
        scheduler.scheduleJob(job, trigger);

        scheduler.pauseTrigger(trigger.getKey());

        assertEquals(TriggerState.PAUSED, scheduler.getTriggerState(trigger.getKey()));
    }

    @Test
    public void triggerNowRunsDurableJobWithGivenData() throws Exception {
        JobDetail job = JobBuilder.newJob("counting").withIdentity("durable", "group").storeDurably().build();
        scheduler.addJob(job, false);
        JobDataMap data = new JobDataMap();
        data.put("value", "manual");

        scheduler.triggerNow(job.getKey(), data);

        assertTrue(executed.await(10, TimeUnit.SECONDS));
        assertEquals("manual", lastValue.get());
        assertTrue(scheduler.checkExists(job.getKey()));
    }

    @Test
    public void vetoedExecutionIsSkipped() throws Exception {
        final CountDownLatch vetoed = new CountDownLatch(1);
        scheduler.getListenerManager().addTriggerListener(new TriggerListener() {
            @Override
            public String getName() {
                return "veto";
            }

            @Override
            public boolean vetoJobExecution(Trigger trigger, JobExecutionContext context) {
                return true;
            }
        });
        scheduler.getListenerManager().addJobListener(new JobListener() {
            @Override
            public String getName() {
                return "vetoWatcher";
            }

            @Override
            public void jobExecutionVetoed(JobExecutionContext context) {
                vetoed.countDown();
            }
        });
        JobDetail job = JobBuilder.newJob("counting").withIdentity("job", "group").build();

        scheduler.scheduleJob(job, TriggerBuilder.newTrigger().withIdentity("trigger", "group").startNow().build());

        assertTrue(vetoed.await(10, TimeUnit.SECONDS));
        assertEquals(0, executions.get());
    }

    @Test
    public void jobCanUnscheduleItsFiringTrigger() throws Exception {
        JobDetail job = JobBuilder.newJob("unscheduling").withIdentity("job", "group").build();
        TriggerKey triggerKey = new TriggerKey("trigger", "group");

        scheduler.scheduleJob(job, TriggerBuilder.newTrigger()
                .withIdentity(triggerKey)
                .withSchedule(SimpleSchedule.repeatForever(60000L))
                .startNow()
                .build());

        assertTrue(executed.await(10, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + 5000L;
        while (scheduler.getTriggerState(triggerKey) != TriggerState.COMPLETE
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20L);
        }
        assertEquals(TriggerState.COMPLETE, scheduler.getTriggerState(triggerKey));
    }

    @Test
    public void runningJobCanBeInterrupted() throws Exception {
        JobDetail job = JobBuilder.newJob("waiting").withIdentity("job", "group").build();
        scheduler.scheduleJob(job, TriggerBuilder.newTrigger().withIdentity("trigger", "group").startNow().build());

        assertTrue(executed.await(10, TimeUnit.SECONDS));
        assertTrue(scheduler.interrupt(job.getKey()));

        assertTrue(interrupted.await(10, TimeUnit.SECONDS));
    }

    @Test(expected = ObjectNotFoundException.class)
    public void unregisteredJobTypeIsRejected() throws Exception {
        JobDetail job = JobBuilder.newJob("unknown").withIdentity("job", "group").build();

        scheduler.scheduleJob(job, TriggerBuilder.newTrigger().withIdentity("trigger", "group").startNow().build());
    }

    @Test
    public void cannotRestartAfterShutdown() throws Exception {
        scheduler.shutdown();

        assertTrue(scheduler.isShutdown());
        assertFalse(scheduler.isStarted());
        try {
            scheduler.start();
            throw new AssertionError("start() after shutdown must fail");
        } catch (SchedulerException expected) {
            assertTrue(expected.getMessage().contains("cannot be restarted"));
        }
    }

    @Test
    public void metaDataDescribesTheScheduler() throws Exception {
        scheduler.addJob(JobBuilder.newJob("counting").withIdentity("durable", "group").storeDurably().build(),
                false);

        assertEquals("StdSchedulerTest", scheduler.getMetaData().getSchedulerName());
        assertEquals("test-node", scheduler.getMetaData().getSchedulerInstanceId());
        assertEquals(2, scheduler.getMetaData().getThreadPoolSize());
        assertEquals(1, scheduler.getMetaData().getNumberOfJobs());
        assertEquals(RAMTriggerStore.class, scheduler.getMetaData().getTriggerStoreClass());
    }

    private class CountingJob implements Job {
        @Override
        public void execute(JobExecutionContext context) {
            executions.incrementAndGet();
            lastValue.set(context.getMergedJobDataMap().get("value"));
            executed.countDown();
        }
    }

    private class UnschedulingJob implements Job {
        @Override
        public void execute(JobExecutionContext context) throws JobExecutionException {
            executed.countDown();
            JobExecutionException e = new JobExecutionException("done for good");
            e.setUnscheduleFiringTrigger(true);
            throw e;
        }
    }

    private class WaitingJob implements InterruptableJob {
        private final CountDownLatch stop = new CountDownLatch(1);

        @Override
        public void execute(JobExecutionContext context) throws JobExecutionException {
            executed.countDown();
            try {
                if (stop.await(10, TimeUnit.SECONDS)) {
                    interrupted.countDown();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobExecutionException(e);
            }
        }

        @Override
        public void interrupt() {
            stop.countDown();
        }
    }
}
