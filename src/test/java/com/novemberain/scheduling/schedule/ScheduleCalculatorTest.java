package com.novemberain.scheduling.schedule;

import com.novemberain.scheduling.InvalidScheduleException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerBuilder;
import com.novemberain.scheduling.calendar.DailyCalendar;
import com.novemberain.scheduling.calendar.HolidayCalendar;
import com.novemberain.scheduling.calendar.WeeklyCalendar;
import org.junit.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Date;
import java.util.EnumSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ScheduleCalculatorTest {

    private static final Date START = utc("2024-01-01T00:00:00Z");

    private final ScheduleCalculator calculator = new ScheduleCalculator();

    @Test
    public void simpleScheduleFiresOnItsGrid() {
        Trigger trigger = trigger(SimpleSchedule.repeat(60000L, 3), START, null, null);

        assertEquals(START, calculator.computeFirstFireTime(trigger, null));
        assertEquals(utc("2024-01-01T00:01:00Z"), calculator.fireTimeAfter(trigger, null, START));
        assertEquals(utc("2024-01-01T00:02:00Z"),
                calculator.fireTimeAfter(trigger, null, utc("2024-01-01T00:01:30Z")));
        assertNull(calculator.fireTimeAfter(trigger, null, utc("2024-01-01T00:03:00Z")));
    }

    @Test
    public void endTimeIsInclusive() {
        Trigger trigger = trigger(SimpleSchedule.repeatForever(60000L), START,
                utc("2024-01-01T00:02:00Z"), null);

        assertEquals(utc("2024-01-01T00:02:00Z"),
                calculator.fireTimeAfter(trigger, null, utc("2024-01-01T00:01:00Z")));
        assertNull(calculator.fireTimeAfter(trigger, null, utc("2024-01-01T00:02:00Z")));
    }

    @Test
    public void cronScheduleSkipsWeekendCalendar() throws Exception {
        WeeklyCalendar weekends = new WeeklyCalendar(
                EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), ZoneOffset.UTC);
        Trigger trigger = trigger(CronSchedule.cronSchedule("0 0 12 * * ?"), START, null, "weekends");

        assertEquals(utc("2024-01-01T12:00:00Z"), calculator.computeFirstFireTime(trigger, weekends));
        // Friday noon is followed by Monday noon
        assertEquals(utc("2024-01-08T12:00:00Z"),
                calculator.fireTimeAfter(trigger, weekends, utc("2024-01-05T12:00:00Z")));
    }

    @Test
    public void cronScheduleSkipsHolidays() throws Exception {
        HolidayCalendar holidays = new HolidayCalendar(
                Collections.singleton(LocalDate.of(2024, 1, 2)), ZoneOffset.UTC);
        Trigger trigger = trigger(CronSchedule.cronSchedule("0 0 12 * * ?"), START, null, "holidays");

        assertEquals(utc("2024-01-03T12:00:00Z"),
                calculator.fireTimeAfter(trigger, holidays, utc("2024-01-01T12:00:00Z")));
    }

    @Test
    public void cronScheduleUsesItsZone() throws Exception {
        Trigger trigger = trigger(CronSchedule.cronSchedule("0 0 9 * * ?", ZoneId.of("Europe/Berlin")),
                START, null, null);

        assertEquals(utc("2024-01-01T08:00:00Z"), calculator.computeFirstFireTime(trigger, null));
    }

    @Test(expected = InvalidScheduleException.class)
    public void malformedCronExpressionIsRejected() throws Exception {
        CronSchedule.cronSchedule("every day at noon");
    }

    @Test
    public void simpleScheduleJumpsOverDailyExclusion() {
        DailyCalendar businessHours = new DailyCalendar(LocalTime.of(9, 0), LocalTime.of(17, 0),
                false, ZoneOffset.UTC);
        Trigger trigger = trigger(SimpleSchedule.repeatForever(3600000L), utc("2024-01-01T08:00:00Z"),
                null, "businessHours");

        assertEquals(utc("2024-01-01T17:00:00Z"),
                calculator.fireTimeAfter(trigger, businessHours, utc("2024-01-01T08:00:00Z")));
    }

    @Test
    public void monthlyIntervalClampsToMonthEndWithoutDrifting() {
        Date lastOfJanuary = utc("2024-01-31T10:00:00Z");
        Trigger trigger = trigger(new CalendarIntervalSchedule(1, IntervalUnit.MONTH), lastOfJanuary, null, null);

        Date february = calculator.fireTimeAfter(trigger, null, lastOfJanuary);
        assertEquals(utc("2024-02-29T10:00:00Z"), february);
        assertEquals(utc("2024-03-31T10:00:00Z"), calculator.fireTimeAfter(trigger, null, february));
    }

    @Test
    public void dailyIntervalKeepsWallClockTimeAcrossDaylightSaving() {
        ZoneId newYork = ZoneId.of("America/New_York");
        Date start = utc("2024-03-09T17:00:00Z");
        Trigger trigger = trigger(new CalendarIntervalSchedule(1, IntervalUnit.DAY, newYork), start, null, null);

        // noon in New York both days, only 23 hours apart
        assertEquals(utc("2024-03-10T16:00:00Z"), calculator.fireTimeAfter(trigger, null, start));
    }

    @Test
    public void dailyTimeIntervalStaysInsideItsWindow() {
        Trigger trigger = trigger(new DailyTimeIntervalSchedule(LocalTime.of(9, 0), LocalTime.of(10, 0),
                20, IntervalUnit.MINUTE), START, null, null);

        assertEquals(utc("2024-01-01T09:00:00Z"), calculator.computeFirstFireTime(trigger, null));
        assertEquals(utc("2024-01-01T09:20:00Z"),
                calculator.fireTimeAfter(trigger, null, utc("2024-01-01T09:00:00Z")));
        assertEquals(utc("2024-01-02T09:00:00Z"),
                calculator.fireTimeAfter(trigger, null, utc("2024-01-01T09:40:00Z")));
    }

    @Test
    public void dailyTimeIntervalHonoursDaysOfWeek() {
        Trigger trigger = trigger(new DailyTimeIntervalSchedule(LocalTime.of(9, 0), LocalTime.of(10, 0),
                20, IntervalUnit.MINUTE, EnumSet.of(DayOfWeek.MONDAY), ZoneOffset.UTC), START, null, null);

        assertEquals(utc("2024-01-08T09:00:00Z"),
                calculator.fireTimeAfter(trigger, null, utc("2024-01-01T09:40:00Z")));
    }

    @Test(expected = InvalidScheduleException.class)
    public void triggerThatNeverFiresFailsValidation() throws Exception {
        Trigger trigger = trigger(CronSchedule.cronSchedule("0 0 12 * * ?"), START,
                utc("2024-01-01T06:00:00Z"), null);

        calculator.validate(trigger, null);
    }

    @Test
    public void triggeredAdvancesTheTrigger() {
        Trigger trigger = trigger(SimpleSchedule.repeat(60000L, 1), START, null, null);
        calculator.computeFirstFireTime(trigger, null);

        calculator.triggered(trigger, null);
        assertEquals(1, trigger.getTimesTriggered());
        assertEquals(START, trigger.getPreviousFireTime());
        assertEquals(utc("2024-01-01T00:01:00Z"), trigger.getNextFireTime());
        assertTrue(calculator.mayFireAgain(trigger));

        calculator.triggered(trigger, null);
        assertNull(trigger.getNextFireTime());
        assertFalse(calculator.mayFireAgain(trigger));
    }

    @Test
    public void newCalendarMovesTheNextFireTime() throws Exception {
        Trigger trigger = trigger(CronSchedule.cronSchedule("0 0 12 * * ?"), START, null, "holidays");
        calculator.computeFirstFireTime(trigger, null);

        calculator.updateWithNewCalendar(trigger, new HolidayCalendar(
                Collections.singleton(LocalDate.of(2024, 1, 1)), ZoneOffset.UTC));

        assertEquals(utc("2024-01-02T12:00:00Z"), trigger.getNextFireTime());
    }

    @Test
    public void finalFireTimeOfBoundedSimpleSchedules() {
        assertEquals(utc("2024-01-01T00:03:00Z"),
                calculator.getFinalFireTime(trigger(SimpleSchedule.repeat(60000L, 3), START, null, null)));
        assertEquals(utc("2024-01-01T00:02:00Z"),
                calculator.getFinalFireTime(trigger(SimpleSchedule.repeatForever(60000L), START,
                        utc("2024-01-01T00:02:30Z"), null)));
        assertNull(calculator.getFinalFireTime(trigger(SimpleSchedule.repeatForever(60000L), START, null, null)));
    }

    private static Trigger trigger(ScheduleSpec schedule, Date start, Date end, String calendarName) {
        TriggerBuilder builder = TriggerBuilder.newTrigger()
                .withIdentity("trigger", "group")
                .forJob("job", "group")
                .withSchedule(schedule)
                .startAt(start)
                .modifiedByCalendar(calendarName);
        if (end != null) {
            builder.endAt(end);
        }
        return builder.build();
    }

    private static Date utc(String instant) {
        return Date.from(Instant.parse(instant));
    }
}
