package com.novemberain.scheduling.calendar;

import java.time.MonthDay;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Excludes the same month-days every year.
 */
public class AnnualCalendar extends ExclusionCalendar {

    private static final int DAYS_IN_LEAP_YEAR = 366;

    private final Set<MonthDay> excludedDays;

    public AnnualCalendar(Set<MonthDay> excludedDays, ZoneId zone) {
        this(excludedDays, zone, null);
    }

    public AnnualCalendar(Set<MonthDay> excludedDays, ZoneId zone, String description) {
        super(zone, description);
        if (excludedDays == null) {
            throw new IllegalArgumentException("Excluded days cannot be null.");
        }
        TreeSet<MonthDay> days = new TreeSet<MonthDay>();
        for (MonthDay day : excludedDays) {
            if (day == null) {
                throw new IllegalArgumentException("Excluded days cannot contain null.");
            }
            days.add(day);
        }
        if (days.size() >= DAYS_IN_LEAP_YEAR) {
            throw new IllegalArgumentException("An annual calendar cannot exclude every day of the year.");
        }
        this.excludedDays = Collections.unmodifiableSet(days);
    }

    public Set<MonthDay> getExcludedDays() {
        return excludedDays;
    }

    @Override
    public <R> R accept(CalendarVisitor<R> visitor) {
        return visitor.visitAnnual(this);
    }

    @Override
    public AnnualCalendar withDescription(String description) {
        return new AnnualCalendar(excludedDays, getZone(), description);
    }

    @Override
    public String toString() {
        return "AnnualCalendar{" + excludedDays + ", " + getZone() + "}";
    }
}
