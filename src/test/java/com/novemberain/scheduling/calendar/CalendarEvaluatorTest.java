package com.novemberain.scheduling.calendar;

import org.junit.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CalendarEvaluatorTest {

    private final CalendarEvaluator evaluator = new CalendarEvaluator();

    @Test
    public void weeklyCalendarExcludesWeekends() {
        WeeklyCalendar weekends = new WeeklyCalendar(
                EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), ZoneOffset.UTC);

        assertTrue(evaluator.isExcluded(weekends, utc("2024-01-06T10:00:00Z")));
        assertTrue(evaluator.isExcluded(weekends, utc("2024-01-07T23:59:59Z")));
        assertTrue(evaluator.isIncluded(weekends, utc("2024-01-05T12:00:00Z")));
        assertEquals(utc("2024-01-08T00:00:00Z"),
                evaluator.nextIncludedTime(weekends, utc("2024-01-06T10:00:00Z")));
    }

    @Test
    public void weeklyCalendarUsesItsOwnZone() {
        WeeklyCalendar weekends = new WeeklyCalendar(
                EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), ZoneId.of("America/New_York"));

        // Saturday in UTC, still Friday evening in New York
        assertTrue(evaluator.isIncluded(weekends, utc("2024-01-06T03:00:00Z")));
        assertTrue(evaluator.isExcluded(weekends, utc("2024-01-06T06:00:00Z")));
    }

    @Test
    public void dailyRangeIsHalfOpen() {
        DailyCalendar businessHours = new DailyCalendar(LocalTime.of(9, 0), LocalTime.of(17, 0),
                false, ZoneOffset.UTC);

        assertTrue(evaluator.isExcluded(businessHours, utc("2024-01-01T09:00:00Z")));
        assertTrue(evaluator.isExcluded(businessHours, utc("2024-01-01T12:00:00Z")));
        assertFalse(evaluator.isExcluded(businessHours, utc("2024-01-01T17:00:00Z")));
        assertFalse(evaluator.isExcluded(businessHours, utc("2024-01-01T08:59:59Z")));
        assertEquals(utc("2024-01-01T17:00:00Z"),
                evaluator.nextIncludedTime(businessHours, utc("2024-01-01T12:00:00Z")));
    }

    @Test
    public void invertedDailyRangeExcludesEverythingOutsideIt() {
        DailyCalendar onlyBusinessHours = new DailyCalendar(LocalTime.of(9, 0), LocalTime.of(17, 0),
                true, ZoneOffset.UTC);

        assertTrue(evaluator.isExcluded(onlyBusinessHours, utc("2024-01-01T08:00:00Z")));
        assertTrue(evaluator.isExcluded(onlyBusinessHours, utc("2024-01-01T17:00:00Z")));
        assertTrue(evaluator.isIncluded(onlyBusinessHours, utc("2024-01-01T10:00:00Z")));

        assertEquals(utc("2024-01-01T09:00:00Z"),
                evaluator.nextIncludedTime(onlyBusinessHours, utc("2024-01-01T08:00:00Z")));
        assertEquals(utc("2024-01-02T09:00:00Z"),
                evaluator.nextIncludedTime(onlyBusinessHours, utc("2024-01-01T18:00:00Z")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void dailyRangeMustNotBeEmpty() {
        new DailyCalendar(LocalTime.of(17, 0), LocalTime.of(9, 0), false, ZoneOffset.UTC);
    }

    @Test
    public void monthlyCalendarExcludesDaysOfMonth() {
        MonthlyCalendar payDays = new MonthlyCalendar(new HashSet<Integer>(Arrays.asList(1, 15)), ZoneOffset.UTC);

        assertTrue(evaluator.isExcluded(payDays, utc("2024-01-15T10:00:00Z")));
        assertTrue(evaluator.isExcluded(payDays, utc("2024-02-01T00:00:00Z")));
        assertFalse(evaluator.isExcluded(payDays, utc("2024-01-16T00:00:00Z")));
        assertEquals(utc("2024-01-16T00:00:00Z"),
                evaluator.nextIncludedTime(payDays, utc("2024-01-15T10:00:00Z")));
    }

    @Test
    public void annualCalendarRepeatsEveryYear() {
        AnnualCalendar christmas = new AnnualCalendar(Collections.singleton(MonthDay.of(12, 25)), ZoneOffset.UTC);

        assertTrue(evaluator.isExcluded(christmas, utc("2024-12-25T08:00:00Z")));
        assertTrue(evaluator.isExcluded(christmas, utc("2031-12-25T08:00:00Z")));
        assertFalse(evaluator.isExcluded(christmas, utc("2024-12-24T08:00:00Z")));
        assertEquals(utc("2024-12-26T00:00:00Z"),
                evaluator.nextIncludedTime(christmas, utc("2024-12-25T08:00:00Z")));
    }

    @Test
    public void holidayCalendarExcludesOnlyTheGivenDates() {
        HolidayCalendar holidays = new HolidayCalendar(
                new HashSet<LocalDate>(Arrays.asList(LocalDate.of(2024, 7, 4), LocalDate.of(2024, 7, 5))),
                ZoneOffset.UTC);

        assertTrue(evaluator.isExcluded(holidays, utc("2024-07-04T12:00:00Z")));
        assertFalse(evaluator.isExcluded(holidays, utc("2025-07-04T12:00:00Z")));
        // consecutive holidays are skipped together
        assertEquals(utc("2024-07-06T00:00:00Z"),
                evaluator.nextIncludedTime(holidays, utc("2024-07-04T12:00:00Z")));
    }

    @Test
    public void cronCalendarExcludesMatchingSeconds() {
        CronCalendar maintenance = new CronCalendar("* * 3 ? * *", ZoneOffset.UTC);

        assertTrue(evaluator.isExcluded(maintenance, utc("2024-01-01T03:30:00Z")));
        assertFalse(evaluator.isExcluded(maintenance, utc("2024-01-01T04:00:00Z")));
        assertEquals(utc("2024-01-01T04:00:00Z"),
                evaluator.nextIncludedTime(maintenance, utc("2024-01-01T03:30:00Z")));
    }

    @Test
    public void nextIncludedTimeIsStrictlyAfterAnIncludedInstant() {
        WeeklyCalendar weekends = new WeeklyCalendar(
                EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), ZoneOffset.UTC);
        Date friday = utc("2024-01-05T12:00:00Z");

        assertEquals(new Date(friday.getTime() + 1), evaluator.nextIncludedTime(weekends, friday));
    }

    @Test(expected = IllegalArgumentException.class)
    public void weeklyCalendarCannotExcludeEveryDay() {
        new WeeklyCalendar(EnumSet.allOf(DayOfWeek.class), ZoneOffset.UTC);
    }

    @Test
    public void calendarsAcceptSetsThatRejectNullLookups() {
        HolidayCalendar christmas = new HolidayCalendar(Set.of(LocalDate.of(2025, 12, 25)), ZoneOffset.UTC);
        HolidayCalendar sorted = new HolidayCalendar(
                new TreeSet<LocalDate>(Arrays.asList(LocalDate.of(2025, 12, 25))), ZoneOffset.UTC);
        AnnualCalendar everyChristmas = new AnnualCalendar(Set.of(MonthDay.of(12, 25)), ZoneOffset.UTC);

        assertTrue(evaluator.isExcluded(christmas, utc("2025-12-25T12:00:00Z")));
        assertEquals(christmas.getExcludedDates(), sorted.getExcludedDates());
        assertEquals(utc("2025-12-26T00:00:00Z"), evaluator.nextIncludedTime(christmas, utc("2025-12-25T12:00:00Z")));
        assertTrue(evaluator.isExcluded(everyChristmas, utc("2030-12-25T12:00:00Z")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void holidayCalendarRejectsNullDate() {
        new HolidayCalendar(new HashSet<LocalDate>(Arrays.asList(LocalDate.of(2025, 12, 25), null)), ZoneOffset.UTC);
    }

    @Test(expected = IllegalArgumentException.class)
    public void annualCalendarRejectsNullDay() {
        new AnnualCalendar(new HashSet<MonthDay>(Arrays.asList(MonthDay.of(12, 25), null)), ZoneOffset.UTC);
    }

    private static Date utc(String instant) {
        return Date.from(Instant.parse(instant));
    }
}
