package com.novemberain.scheduling.schedule;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Fires every {@code interval} calendar units from the trigger's start time.
 * Day-based and larger units are added in the schedule's zone, so a daily
 * schedule keeps its wall-clock time across daylight saving changes.
 */
public final class CalendarIntervalSchedule extends ScheduleSpec {

    private final int interval;
    private final IntervalUnit unit;
    private final ZoneId zone;

    public CalendarIntervalSchedule(int interval, IntervalUnit unit) {
        this(interval, unit, ZoneOffset.UTC);
    }

    public CalendarIntervalSchedule(int interval, IntervalUnit unit, ZoneId zone) {
        if (interval < 1) {
            throw new IllegalArgumentException("Interval must be a positive value.");
        }
        if (unit == null) {
            throw new IllegalArgumentException("Interval unit cannot be null.");
        }
        if (zone == null) {
            throw new IllegalArgumentException("Time zone cannot be null.");
        }
        this.interval = interval;
        this.unit = unit;
        this.zone = zone;
    }

    public int getInterval() {
        return interval;
    }

    public IntervalUnit getUnit() {
        return unit;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public <R> R accept(ScheduleVisitor<R> visitor) {
        return visitor.visitCalendarInterval(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CalendarIntervalSchedule)) {
            return false;
        }
        CalendarIntervalSchedule that = (CalendarIntervalSchedule) o;
        return interval == that.interval && unit == that.unit && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return (31 * interval + unit.hashCode()) * 31 + zone.hashCode();
    }

    @Override
    public String toString() {
        return "CalendarIntervalSchedule{every " + interval + " " + unit + ", " + zone + "}";
    }
}
