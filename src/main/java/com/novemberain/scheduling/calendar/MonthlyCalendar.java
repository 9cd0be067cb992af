package com.novemberain.scheduling.calendar;

import java.time.ZoneId;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Excludes days of the month, numbered from 1 to 31.
 */
public class MonthlyCalendar extends ExclusionCalendar {

    private static final int MAX_DAY_OF_MONTH = 31;

    private final Set<Integer> excludedDays;

    public MonthlyCalendar(Set<Integer> excludedDays, ZoneId zone) {
        this(excludedDays, zone, null);
    }

    public MonthlyCalendar(Set<Integer> excludedDays, ZoneId zone, String description) {
        super(zone, description);
        if (excludedDays == null) {
            throw new IllegalArgumentException("Excluded days cannot be null.");
        }
        for (Integer day : excludedDays) {
            if (day == null || day < 1 || day > MAX_DAY_OF_MONTH) {
                throw new IllegalArgumentException("Day of month must be between 1 and 31, was " + day);
            }
        }
        if (excludedDays.size() >= MAX_DAY_OF_MONTH) {
            throw new IllegalArgumentException("A monthly calendar cannot exclude every day of the month.");
        }
        this.excludedDays = Collections.unmodifiableSet(new TreeSet<Integer>(excludedDays));
    }

    public Set<Integer> getExcludedDays() {
        return excludedDays;
    }

    @Override
    public <R> R accept(CalendarVisitor<R> visitor) {
        return visitor.visitMonthly(this);
    }

    @Override
    public MonthlyCalendar withDescription(String description) {
        return new MonthlyCalendar(excludedDays, getZone(), description);
    }

    @Override
    public String toString() {
        return "MonthlyCalendar{" + excludedDays + ", " + getZone() + "}";
    }
}
