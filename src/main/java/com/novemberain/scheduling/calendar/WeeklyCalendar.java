package com.novemberain.scheduling.calendar;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Excludes whole days of the week.
 */
public class WeeklyCalendar extends ExclusionCalendar {

    private final Set<DayOfWeek> excludedDays;

    public WeeklyCalendar(Set<DayOfWeek> excludedDays, ZoneId zone) {
        this(excludedDays, zone, null);
    }

    public WeeklyCalendar(Set<DayOfWeek> excludedDays, ZoneId zone, String description) {
        super(zone, description);
        if (excludedDays == null) {
            throw new IllegalArgumentException("Excluded days cannot be null.");
        }
        if (excludedDays.size() >= DayOfWeek.values().length) {
            throw new IllegalArgumentException("A weekly calendar cannot exclude every day of the week.");
        }
        this.excludedDays = excludedDays.isEmpty()
                ? Collections.<DayOfWeek>emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(excludedDays));
    }

    public Set<DayOfWeek> getExcludedDays() {
        return excludedDays;
    }

    @Override
    public <R> R accept(CalendarVisitor<R> visitor) {
        return visitor.visitWeekly(this);
    }

    @Override
    public WeeklyCalendar withDescription(String description) {
        return new WeeklyCalendar(excludedDays, getZone(), description);
    }

    @Override
    public String toString() {
        return "WeeklyCalendar{" + excludedDays + ", " + getZone() + "}";
    }
}
