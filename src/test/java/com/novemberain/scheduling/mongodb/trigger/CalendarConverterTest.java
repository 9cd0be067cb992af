package com.novemberain.scheduling.mongodb.trigger;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.calendar.CalendarEvaluator;
import com.novemberain.scheduling.calendar.DailyCalendar;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.calendar.HolidayCalendar;
import com.novemberain.scheduling.calendar.WeeklyCalendar;
import org.bson.Document;
import org.junit.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Date;
import java.util.EnumSet;
import java.util.HashSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CalendarConverterTest {

    private final CalendarConverter converter = new CalendarConverter();
    private final CalendarEvaluator evaluator = new CalendarEvaluator();

    @Test
    public void dailyCalendarIsStoredAsTypedDocument() {
        DailyCalendar nights = new DailyCalendar(LocalTime.of(22, 0), LocalTime.of(6, 0), true,
                ZoneId.of("Europe/Berlin"), "nights only");

        Document doc = converter.toDocument("nights", nights);

        assertEquals("nights", doc.getString(CalendarConverter.CALENDAR_NAME));
        assertEquals(CalendarConverter.TYPE_DAILY, doc.getString(CalendarConverter.CALENDAR_TYPE));
        assertEquals("22:00", doc.getString("rangeStart"));
        assertEquals("06:00", doc.getString("rangeEnd"));
        assertEquals(Boolean.TRUE, doc.getBoolean("invert"));
        assertEquals("Europe/Berlin", doc.getString("zone"));
        assertEquals("nights only", doc.getString("description"));
    }

    @Test
    public void restoredCalendarExcludesTheSameTimes() throws Exception {
        HolidayCalendar holidays = new HolidayCalendar(
                new HashSet<LocalDate>(Arrays.asList(LocalDate.of(2024, 7, 4), LocalDate.of(2024, 12, 25))),
                ZoneId.of("America/New_York"));

        ExclusionCalendar restored = converter.toCalendar(converter.toDocument("holidays", holidays));

        assertTrue(restored instanceof HolidayCalendar);
        assertEquals(holidays.getExcludedDates(), ((HolidayCalendar) restored).getExcludedDates());
        // still July 4th in New York
        assertTrue(evaluator.isExcluded(restored, utc("2024-07-05T03:00:00Z")));
        assertTrue(evaluator.isIncluded(restored, utc("2024-07-05T05:00:00Z")));
    }

    @Test
    public void weeklyDaysAreStoredAsIsoNumbers() throws Exception {
        WeeklyCalendar weekends = new WeeklyCalendar(
                EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), ZoneId.of("UTC"));

        Document doc = converter.toDocument("weekends", weekends);

        assertEquals(new HashSet<Integer>(Arrays.asList(6, 7)),
                new HashSet<Integer>(doc.getList("excluded", Integer.class)));
        assertEquals(weekends.getExcludedDays(), ((WeeklyCalendar) converter.toCalendar(doc)).getExcludedDays());
    }

    @Test(expected = JobPersistenceException.class)
    public void unknownTypeIsRejected() throws Exception {
        converter.toCalendar(new Document(CalendarConverter.CALENDAR_NAME, "odd")
                .append(CalendarConverter.CALENDAR_TYPE, "lunar")
                .append("zone", "UTC"));
    }

    @Test(expected = JobPersistenceException.class)
    public void malformedRangeIsRejected() throws Exception {
        converter.toCalendar(new Document(CalendarConverter.CALENDAR_NAME, "broken")
                .append(CalendarConverter.CALENDAR_TYPE, CalendarConverter.TYPE_DAILY)
                .append("zone", "UTC")
                .append("rangeStart", "nine o'clock")
                .append("rangeEnd", "17:00"));
    }

    @Test(expected = JobPersistenceException.class)
    public void missingZoneIsRejected() throws Exception {
        converter.toCalendar(new Document(CalendarConverter.CALENDAR_NAME, "zoneless")
                .append(CalendarConverter.CALENDAR_TYPE, CalendarConverter.TYPE_MONTHLY)
                .append("excluded", Arrays.asList(1, 15)));
    }

    private static Date utc(String instant) {
        return Date.from(Instant.parse(instant));
    }
}
