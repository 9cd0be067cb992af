package com.novemberain.scheduling.mongodb.trigger.schedules;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.schedule.CalendarIntervalSchedule;
import com.novemberain.scheduling.schedule.CronSchedule;
import com.novemberain.scheduling.schedule.DailyTimeIntervalSchedule;
import com.novemberain.scheduling.schedule.IntervalUnit;
import com.novemberain.scheduling.schedule.ScheduleSpec;
import com.novemberain.scheduling.schedule.SimpleSchedule;
import org.bson.Document;
import org.junit.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ScheduleConverterTest {

    @Test
    public void eachScheduleKindHasItsOwnDiscriminator() throws Exception {
        assertEquals("simple", storedType(SimpleSchedule.repeat(1000L, 3)));
        assertEquals("cron", storedType(CronSchedule.cronSchedule("0 0 12 * * ?")));
        assertEquals("calendarInterval", storedType(new CalendarIntervalSchedule(1, IntervalUnit.MONTH)));
        assertEquals("dailyTimeInterval", storedType(new DailyTimeIntervalSchedule(
                LocalTime.of(9, 0), LocalTime.of(17, 0), 15, IntervalUnit.MINUTE)));
    }

    @Test
    public void injectingLeavesTheOriginalDocumentAlone() {
        Document original = new Document("name", "trigger");

        Document withSchedule = ScheduleConverter.getConverterFor(SimpleSchedule.repeatForever(500L))
                .injectScheduleProperties(SimpleSchedule.repeatForever(500L), original);

        assertFalse(original.containsKey(ScheduleConverter.SCHEDULE_TYPE));
        assertEquals("trigger", withSchedule.getString("name"));
        assertEquals(Long.valueOf(500L), withSchedule.getLong("repeatInterval"));
        assertEquals(Integer.valueOf(SimpleSchedule.REPEAT_INDEFINITELY), withSchedule.getInteger("repeatCount"));
    }

    @Test
    public void dailyTimeIntervalScheduleIsRestored() throws Exception {
        DailyTimeIntervalSchedule schedule = new DailyTimeIntervalSchedule(
                LocalTime.of(8, 30), LocalTime.of(18, 0, 15), 2, IntervalUnit.HOUR,
                EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), ZoneId.of("Asia/Tokyo"));

        assertEquals(schedule, restore(schedule));
    }

    @Test
    public void cronZoneIsRestored() throws Exception {
        CronSchedule schedule = CronSchedule.cronSchedule("0 15 10 ? * MON-FRI", ZoneId.of("Europe/Berlin"));

        CronSchedule restored = (CronSchedule) restore(schedule);

        assertEquals(ZoneId.of("Europe/Berlin"), restored.getZone());
        assertEquals("0 15 10 ? * MON-FRI", restored.getExpression());
    }

    @Test
    public void unknownDiscriminatorHasNoConverter() {
        assertNull(ScheduleConverter.getConverterFor(new Document(ScheduleConverter.SCHEDULE_TYPE, "lunar")));
        assertNull(ScheduleConverter.getConverterFor(new Document()));
    }

    @Test(expected = JobPersistenceException.class)
    public void corruptCronExpressionIsRejected() throws Exception {
        new CronScheduleConverter().toSchedule(new Document(ScheduleConverter.SCHEDULE_TYPE, "cron")
                .append("cronExpression", "every tuesday")
                .append("timezone", "UTC"));
    }

    @Test
    public void corruptIntervalUnitIsRejected() {
        Document stored = new Document(ScheduleConverter.SCHEDULE_TYPE, "calendarInterval")
                .append("repeatInterval", 1)
                .append("repeatIntervalUnit", "FORTNIGHT")
                .append("timezone", "UTC");
        try {
            new CalendarIntervalScheduleConverter().toSchedule(stored);
            throw new AssertionError("an unknown unit must not be restored");
        } catch (JobPersistenceException expected) {
            assertTrue(expected.getCause() instanceof IllegalArgumentException);
        }
    }

    private static String storedType(ScheduleSpec schedule) {
        return ScheduleConverter.getConverterFor(schedule)
                .injectScheduleProperties(schedule, new Document())
                .getString(ScheduleConverter.SCHEDULE_TYPE);
    }

    private static ScheduleSpec restore(ScheduleSpec schedule) throws JobPersistenceException {
        Document stored = ScheduleConverter.getConverterFor(schedule)
                .injectScheduleProperties(schedule, new Document());
        return ScheduleConverter.getConverterFor(stored).toSchedule(stored);
    }
}
