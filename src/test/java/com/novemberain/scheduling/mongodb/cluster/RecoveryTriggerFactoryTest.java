package com.novemberain.scheduling.mongodb.cluster;

import com.novemberain.scheduling.MisfireInstruction;
import com.novemberain.scheduling.Scheduler;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.schedule.SimpleSchedule;
import com.novemberain.scheduling.spi.FiredTriggerRecord;
import com.novemberain.scheduling.util.Clock;
import org.junit.Test;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.TriggerKey;

import java.util.Date;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;

public class RecoveryTriggerFactoryTest {

    private static final long NOW = 1704067200000L;

    private final RecoveryTriggerFactory factory = new RecoveryTriggerFactory(Clock.fixed(NOW));

    @Test
    public void recoveryTriggerFiresOnceRightAway() {
        FiredTriggerRecord record = record();
        JobDataMap original = new JobDataMap();
        original.put("format", "pdf");

        Trigger trigger = factory.from(record, original);

        assertEquals(Scheduler.DEFAULT_RECOVERY_GROUP, trigger.getKey().getGroup());
        assertEquals(new JobKey("report", "reports"), trigger.getJobKey());
        assertEquals(new Date(NOW), trigger.getStartTime());
        assertEquals(MisfireInstruction.IGNORE_MISFIRE_POLICY, trigger.getMisfireInstruction());
        assertEquals(8, trigger.getPriority());
        assertEquals(SimpleSchedule.oneShot(), trigger.getSchedule());
    }

    @Test
    public void originalTriggerIsRecordedInData() {
        JobDataMap original = new JobDataMap();
        original.put("format", "pdf");

        JobDataMap data = factory.from(record(), original).getJobDataMap();

        assertEquals("pdf", data.getString("format"));
        assertEquals("noon", data.getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_NAME));
        assertEquals("reports", data.getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_GROUP));
        assertEquals(String.valueOf(NOW - 5000L),
                data.getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_FIRETIME_IN_MILLISECONDS));
        assertEquals(String.valueOf(NOW - 6000L),
                data.getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_SCHEDULED_FIRETIME_IN_MILLISECONDS));
        assertFalse(original.containsKey(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_NAME));
    }

    @Test
    public void sameExecutionGetsSameNameOnEveryNode() {
        RecoveryTriggerFactory otherNode = new RecoveryTriggerFactory(Clock.fixed(NOW + 1000L));

        assertEquals(factory.from(record(), new JobDataMap()).getKey(),
                otherNode.from(record(), new JobDataMap()).getKey());
    }

    @Test
    public void reusedFireInstanceIdOfAnEarlierRunGetsAnotherName() {
        // fire instance counters restart with the process
        FiredTriggerRecord earlierRun = record("NON_CLUSTERED1", NOW - 86400000L);
        FiredTriggerRecord laterRun = record("NON_CLUSTERED1", NOW - 5000L);

        assertNotEquals(factory.from(earlierRun, new JobDataMap()).getKey(),
                new RecoveryTriggerFactory(Clock.fixed(NOW)).from(laterRun, new JobDataMap()).getKey());
    }

    private static FiredTriggerRecord record() {
        return record("fire-1", NOW - 5000L);
    }

    private static FiredTriggerRecord record(String fireInstanceId, long fireTime) {
        return new FiredTriggerRecord(fireInstanceId, "dead-node", new TriggerKey("noon", "reports"),
                new JobKey("report", "reports"), new Date(fireTime - 1000L), new Date(fireTime), 8, true, false);
    }
}
