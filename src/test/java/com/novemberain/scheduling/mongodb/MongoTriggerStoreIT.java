package com.novemberain.scheduling.mongodb;

import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.JobBuilder;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.ObjectAlreadyExistsException;
import com.novemberain.scheduling.Scheduler;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerBuilder;
import com.novemberain.scheduling.TriggerState;
import com.novemberain.scheduling.calendar.WeeklyCalendar;
import com.novemberain.scheduling.schedule.CronSchedule;
import com.novemberain.scheduling.schedule.ScheduleCalculator;
import com.novemberain.scheduling.schedule.SimpleSchedule;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import com.novemberain.scheduling.spi.TriggerFiredBundle;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;

public class MongoTriggerStoreIT extends AbstractEmbeddedServerTest {

    private final List<MongoTriggerStore> stores = new ArrayList<MongoTriggerStore>();
    private long now;

    @Before
    public void setUp() {
        now = System.currentTimeMillis();
    }

    @After
    public void shutDownStores() {
        for (MongoTriggerStore store : stores) {
            store.shutdown();
        }
    }

    @Test
    public void storesJobTriggerAndCalendar() throws Exception {
        MongoTriggerStore store = newStore("node-a");
        store.storeCalendar("weekends", new WeeklyCalendar(
                EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), ZoneOffset.UTC), false, false);
        JobDetail job = JobBuilder.newJob("report").withIdentity("report", "reports")
                .usingJobData("format", "pdf").build();
        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity("noon", "reports")
                .forJob(job)
                .withSchedule(CronSchedule.cronSchedule("0 0 12 * * ?"))
                .modifiedByCalendar("weekends")
                .startAt(new Date(now))
                .build();

        store.storeJobAndTrigger(job, trigger);

        Trigger stored = store.retrieveTrigger(trigger.getKey());
        ZonedDateTime next = stored.getNextFireTime().toInstant().atZone(ZoneOffset.UTC);
        assertEquals(12, next.getHour());
        assertFalse(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY).contains(next.getDayOfWeek()));
        assertEquals(TriggerState.NORMAL, store.getTriggerState(trigger.getKey()));
        assertEquals("pdf", store.retrieveJob(job.getKey()).getJobDataMap().getString("format"));
        assertEquals(Collections.singletonList("weekends"), store.getCalendarNames());
        assertEquals(Collections.singleton(trigger.getKey()),
                store.getTriggerKeys(GroupMatcher.triggerGroupEquals("reports")));
    }

    @Test
    public void duplicateTriggerIsRejected() throws Exception {
        MongoTriggerStore store = newStore("node-a");
        JobDetail job = JobBuilder.newJob("report").withIdentity("report", "reports").build();
        store.storeJobAndTrigger(job, oneShot("once", job));

        try {
            store.storeTrigger(oneShot("once", job), false);
            fail("a trigger with the same key must not be stored twice");
        } catch (ObjectAlreadyExistsException expected) {
            assertEquals(1, store.getNumberOfTriggers());
        }
    }

    @Test
    public void referencedCalendarCannotBeRemoved() throws Exception {
        MongoTriggerStore store = newStore("node-a");
        store.storeCalendar("weekends", new WeeklyCalendar(
                EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), ZoneOffset.UTC), false, false);
        JobDetail job = JobBuilder.newJob("report").withIdentity("report", "reports").build();
        store.storeJobAndTrigger(job, TriggerBuilder.newTrigger()
                .withIdentity("hourly", "reports")
                .forJob(job)
                .withSchedule(SimpleSchedule.repeatForever(3600000L))
                .modifiedByCalendar("weekends")
                .startAt(new Date(now))
                .build());

        try {
            store.removeCalendar("weekends");
            fail("a calendar in use must not be removed");
        } catch (JobPersistenceException expected) {
            assertNotNull(store.retrieveCalendar("weekends"));
        }
    }

    @Test
    public void oneShotTriggerFiresOnceAndIsKeptComplete() throws Exception {
        MongoTriggerStore store = newStore("node-a");
        JobDetail job = JobBuilder.newJob("report").withIdentity("report", "reports").build();
        Trigger trigger = oneShot("once", job);
        store.storeJobAndTrigger(job, trigger);

        List<Trigger> acquired = store.acquireNextTriggers(now + 1000L, 5, 0L);
        assertEquals(1, acquired.size());
        assertTrue(store.acquireNextTriggers(now + 1000L, 5, 0L).isEmpty());

        TriggerFiredBundle bundle = store.triggersFired(acquired).get(0);
        assertEquals(new Date(now), bundle.getScheduledFireTime());
        store.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(), CompletedExecutionInstruction.NOOP);

        assertEquals(TriggerState.COMPLETE, store.getTriggerState(trigger.getKey()));
        assertTrue(store.acquireNextTriggers(now + 1000L, 5, 0L).isEmpty());
    }

    @Test
    public void nonConcurrentJobBlocksItsOtherTriggers() throws Exception {
        MongoTriggerStore store = newStore("node-a");
        JobDetail job = JobBuilder.newJob("report").withIdentity("report", "reports")
                .disallowConcurrentExecution().build();
        store.storeJob(job, false);
        store.storeTrigger(repeating("first", job), false);
        store.storeTrigger(repeating("second", job), false);

        List<Trigger> acquired = store.acquireNextTriggers(now + 1000L, 5, 0L);
        assertEquals(1, acquired.size());
        TriggerFiredBundle bundle = store.triggersFired(acquired).get(0);
        TriggerKey other = otherKey(bundle.getTrigger().getKey());

        assertEquals(TriggerState.BLOCKED, store.getTriggerState(other));
        assertTrue(store.acquireNextTriggers(now + 1000L, 5, 0L).isEmpty());

        store.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(), CompletedExecutionInstruction.NOOP);

        assertEquals(TriggerState.NORMAL, store.getTriggerState(other));
        assertEquals(TriggerState.NORMAL, store.getTriggerState(bundle.getTrigger().getKey()));
    }

    @Test
    public void racingNodesNeverAcquireTheSameTrigger() throws Exception {
        final MongoTriggerStore nodeA = newStore("node-a");
        final MongoTriggerStore nodeB = newStore("node-b");
        JobDetail job = JobBuilder.newJob("report").withIdentity("report", "reports").storeDurably().build();
        nodeA.storeJob(job, false);
        for (int i = 0; i < 20; i++) {
            nodeA.storeTrigger(oneShot("race-" + i, job), false);
        }

        final CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<List<Trigger>> fromA = executor.submit(acquireAfter(start, nodeA));
            Future<List<Trigger>> fromB = executor.submit(acquireAfter(start, nodeB));
            start.countDown();

            Set<TriggerKey> acquiredByA = keys(fromA.get(30, TimeUnit.SECONDS));
            Set<TriggerKey> acquiredByB = keys(fromB.get(30, TimeUnit.SECONDS));

            Set<TriggerKey> both = new HashSet<TriggerKey>(acquiredByA);
            both.retainAll(acquiredByB);
            assertTrue("acquired by both nodes: " + both, both.isEmpty());
            assertTrue(acquiredByA.size() + acquiredByB.size() <= 20);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void pausedGroupIsNotAcquired() throws Exception {
        MongoTriggerStore store = newStore("node-a");
        JobDetail job = JobBuilder.newJob("report").withIdentity("report", "reports").build();
        Trigger trigger = oneShot("once", job);
        store.storeJobAndTrigger(job, trigger);

        store.pauseTriggers(GroupMatcher.triggerGroupEquals("reports"));

        assertEquals(TriggerState.PAUSED, store.getTriggerState(trigger.getKey()));
        assertEquals(Collections.singleton("reports"), store.getPausedTriggerGroups());
        assertTrue(store.acquireNextTriggers(now + 1000L, 5, 0L).isEmpty());

        store.resumeTriggers(GroupMatcher.triggerGroupEquals("reports"));

        assertEquals(1, store.acquireNextTriggers(now + 1000L, 5, 0L).size());
    }

    @Test
    public void interruptedExecutionIsRecoveredOnRestart() throws Exception {
        MongoTriggerStore first = newStore("node-a");
        JobDetail job = JobBuilder.newJob("report").withIdentity("report", "reports").requestRecovery().build();
        Trigger trigger = oneShot("once", job);
        first.storeJobAndTrigger(job, trigger);
        first.triggersFired(first.acquireNextTriggers(now + 1000L, 1, 0L));
        // the node dies before the job completes
        first.shutdown();
        stores.remove(first);

        MongoTriggerStore restarted = newStore("node-a");
        restarted.schedulerStarted();

        Set<TriggerKey> recovering = restarted.getTriggerKeys(
                GroupMatcher.triggerGroupEquals(Scheduler.DEFAULT_RECOVERY_GROUP));
        assertEquals(1, recovering.size());
        Trigger recovery = restarted.retrieveTrigger(recovering.iterator().next());
        assertEquals(job.getKey(), recovery.getJobKey());
        assertEquals("once", recovery.getJobDataMap().getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_NAME));
    }

    private Callable<List<Trigger>> acquireAfter(final CountDownLatch start, final MongoTriggerStore store) {
        return () -> {
            start.await();
            List<Trigger> acquired = new ArrayList<Trigger>();
            for (int i = 0; i < 4; i++) {
                acquired.addAll(store.acquireNextTriggers(now + 1000L, 5, 0L));
            }
            return acquired;
        };
    }

    private static Set<TriggerKey> keys(List<Trigger> triggers) {
        Set<TriggerKey> keys = new HashSet<TriggerKey>();
        for (Trigger trigger : triggers) {
            assertTrue("acquired twice by one node: " + trigger.getKey(), keys.add(trigger.getKey()));
        }
        return keys;
    }

    private MongoTriggerStore newStore(String instanceId) throws Exception {
        MongoTriggerStore store = new MongoTriggerStore(getMongoClient());
        store.setDbName("scheduling_it");
        store.setInstanceName("MongoTriggerStoreIT");
        store.setInstanceId(instanceId);
        store.initialize(mock(SchedulerSignaler.class), new ScheduleCalculator());
        stores.add(store);
        return store;
    }

    private Trigger oneShot(String name, JobDetail job) {
        return TriggerBuilder.newTrigger()
                .withIdentity(name, "reports")
                .forJob(job)
                .startAt(new Date(now))
                .build();
    }

    private Trigger repeating(String name, JobDetail job) {
        return TriggerBuilder.newTrigger()
                .withIdentity(name, "reports")
                .forJob(job)
                .withSchedule(SimpleSchedule.repeatForever(3600000L))
                .startAt(new Date(now))
                .build();
    }

    private static TriggerKey otherKey(TriggerKey fired) {
        return new TriggerKey("first".equals(fired.getName()) ? "second" : "first", "reports");
    }
}
