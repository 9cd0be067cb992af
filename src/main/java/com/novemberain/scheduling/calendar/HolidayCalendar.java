package com.novemberain.scheduling.calendar;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Excludes an explicit set of dates.
 */
public class HolidayCalendar extends ExclusionCalendar {

    private final SortedSet<LocalDate> excludedDates;

    public HolidayCalendar(Set<LocalDate> excludedDates, ZoneId zone) {
        this(excludedDates, zone, null);
    }

    public HolidayCalendar(Set<LocalDate> excludedDates, ZoneId zone, String description) {
        super(zone, description);
        if (excludedDates == null) {
            throw new IllegalArgumentException("Excluded dates cannot be null.");
        }
        TreeSet<LocalDate> dates = new TreeSet<LocalDate>();
        for (LocalDate date : excludedDates) {
            if (date == null) {
                throw new IllegalArgumentException("Excluded dates cannot contain null.");
            }
            dates.add(date);
        }
        this.excludedDates = Collections.unmodifiableSortedSet(dates);
    }

    public SortedSet<LocalDate> getExcludedDates() {
        return excludedDates;
    }

    @Override
    public <R> R accept(CalendarVisitor<R> visitor) {
        return visitor.visitHoliday(this);
    }

    @Override
    public HolidayCalendar withDescription(String description) {
        return new HolidayCalendar(excludedDates, getZone(), description);
    }

    @Override
    public String toString() {
        return "HolidayCalendar{" + excludedDates + ", " + getZone() + "}";
    }
}
