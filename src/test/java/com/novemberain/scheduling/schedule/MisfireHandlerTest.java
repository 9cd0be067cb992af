package com.novemberain.scheduling.schedule;

import com.novemberain.scheduling.MisfireInstruction;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerBuilder;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import com.novemberain.scheduling.util.Clock;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.Date;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class MisfireHandlerTest {

    private static final Date START = utc("2024-01-01T00:00:00Z");
    private static final Date NOW = utc("2024-01-01T01:30:00Z");

    private SchedulerSignaler signaler;
    private ScheduleCalculator calculator;
    private MisfireHandler handler;

    @Before
    public void setUp() {
        signaler = mock(SchedulerSignaler.class);
        calculator = new ScheduleCalculator();
        handler = new MisfireHandler(calculator, Clock.fixed(NOW.getTime()),
                MisfireHandler.DEFAULT_MISFIRE_THRESHOLD, signaler);
    }

    @Test
    public void triggerIsMisfiredOnlyPastTheThreshold() {
        Trigger late = overdue(SimpleSchedule.repeatForever(60000L), MisfireInstruction.FIRE_NOW);
        Trigger slightlyLate = overdue(SimpleSchedule.repeatForever(60000L), MisfireInstruction.FIRE_NOW);
        slightlyLate.setNextFireTime(new Date(NOW.getTime() - 30000L));

        assertTrue(handler.isMisfired(late));
        assertFalse(handler.isMisfired(slightlyLate));
        assertFalse(handler.applyMisfire(slightlyLate, null));
        verifyNoInteractions(signaler);
    }

    @Test
    public void fireNowMovesSimpleTriggerToNow() {
        Trigger trigger = overdue(SimpleSchedule.repeatForever(60000L), MisfireInstruction.FIRE_NOW);

        assertTrue(handler.applyMisfire(trigger, null));

        assertEquals(NOW, trigger.getNextFireTime());
        assertEquals(NOW, trigger.getStartTime());
        verify(signaler).notifyTriggerListenersMisfired(any(Trigger.class));
    }

    @Test
    public void doNothingWaitsForNextScheduledTime() throws Exception {
        Trigger trigger = overdue(CronSchedule.cronSchedule("0 0 * * * ?"), MisfireInstruction.DO_NOTHING);

        assertTrue(handler.applyMisfire(trigger, null));

        assertEquals(utc("2024-01-01T02:00:00Z"), trigger.getNextFireTime());
    }

    @Test
    public void rescheduleNextKeepsRemainingCount() {
        Trigger trigger = overdue(SimpleSchedule.repeat(60000L, 100), MisfireInstruction.RESCHEDULE_NEXT);

        assertTrue(handler.applyMisfire(trigger, null));

        assertEquals(utc("2024-01-01T01:31:00Z"), trigger.getNextFireTime());
        assertEquals(100, ((SimpleSchedule) trigger.getSchedule()).getRepeatCount());
    }

    @Test
    public void ignorePolicyLeavesTriggerAlone() {
        Trigger trigger = overdue(SimpleSchedule.repeatForever(60000L), MisfireInstruction.IGNORE_MISFIRE_POLICY);

        assertFalse(handler.applyMisfire(trigger, null));

        assertEquals(START, trigger.getNextFireTime());
        verifyNoInteractions(signaler);
    }

    @Test
    public void expiredTriggerIsFinalized() {
        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity("expired", "group")
                .forJob("job", "group")
                .withSchedule(SimpleSchedule.repeatForever(60000L))
                .startAt(START)
                .endAt(utc("2024-01-01T01:00:00Z"))
                .build();
        trigger.setNextFireTime(START);

        assertTrue(handler.applyMisfire(trigger, null));

        assertNull(trigger.getNextFireTime());
        verify(signaler).notifySchedulerListenersFinalized(trigger);
    }

    @Test
    public void recoveryAppliesInstructionRegardlessOfThreshold() {
        Trigger trigger = overdue(SimpleSchedule.repeatForever(60000L), MisfireInstruction.FIRE_NOW);
        trigger.setNextFireTime(new Date(NOW.getTime() - 1000L));

        assertTrue(handler.applyMisfireOnRecovery(trigger, null));

        assertEquals(NOW, trigger.getNextFireTime());
        verify(signaler).notifyTriggerListenersMisfired(any(Trigger.class));
        verify(signaler, never()).notifySchedulerListenersFinalized(any(Trigger.class));
    }

    private static Trigger overdue(ScheduleSpec schedule, MisfireInstruction instruction) {
        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity("late", "group")
                .forJob("job", "group")
                .withSchedule(schedule)
                .startAt(START)
                .withMisfireInstruction(instruction)
                .build();
        trigger.setNextFireTime(START);
        return trigger;
    }

    private static Date utc(String instant) {
        return Date.from(Instant.parse(instant));
    }
}
