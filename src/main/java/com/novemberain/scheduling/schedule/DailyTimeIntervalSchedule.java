package com.novemberain.scheduling.schedule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Fires every {@code interval} units inside the daily window
 * {@code [startTimeOfDay, endTimeOfDay)} on the selected days of the week.
 */
public final class DailyTimeIntervalSchedule extends ScheduleSpec {

    private static final Set<DayOfWeek> ALL_DAYS = Collections.unmodifiableSet(EnumSet.allOf(DayOfWeek.class));

    private final LocalTime startTimeOfDay;
    private final LocalTime endTimeOfDay;
    private final int interval;
    private final IntervalUnit unit;
    private final Set<DayOfWeek> daysOfWeek;
    private final ZoneId zone;

    public DailyTimeIntervalSchedule(LocalTime startTimeOfDay, LocalTime endTimeOfDay,
                                     int interval, IntervalUnit unit) {
        this(startTimeOfDay, endTimeOfDay, interval, unit, ALL_DAYS, ZoneOffset.UTC);
    }

    public DailyTimeIntervalSchedule(LocalTime startTimeOfDay, LocalTime endTimeOfDay,
                                     int interval, IntervalUnit unit,
                                     Set<DayOfWeek> daysOfWeek, ZoneId zone) {
        if (startTimeOfDay == null || endTimeOfDay == null) {
            throw new IllegalArgumentException("Start and end time of day cannot be null.");
        }
        if (!startTimeOfDay.isBefore(endTimeOfDay)) {
            throw new IllegalArgumentException("Start time of day " + startTimeOfDay
                    + " must be before end time of day " + endTimeOfDay);
        }
        if (interval < 1) {
            throw new IllegalArgumentException("Interval must be a positive value.");
        }
        if (unit != IntervalUnit.SECOND && unit != IntervalUnit.MINUTE && unit != IntervalUnit.HOUR) {
            throw new IllegalArgumentException("Interval unit must be SECOND, MINUTE or HOUR, was " + unit);
        }
        if (daysOfWeek == null || daysOfWeek.isEmpty()) {
            throw new IllegalArgumentException("At least one day of the week is required.");
        }
        if (zone == null) {
            throw new IllegalArgumentException("Time zone cannot be null.");
        }
        this.startTimeOfDay = startTimeOfDay;
        this.endTimeOfDay = endTimeOfDay;
        this.interval = interval;
        this.unit = unit;
        this.daysOfWeek = Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
        this.zone = zone;
    }

    public LocalTime getStartTimeOfDay() {
        return startTimeOfDay;
    }

    public LocalTime getEndTimeOfDay() {
        return endTimeOfDay;
    }

    public int getInterval() {
        return interval;
    }

    public IntervalUnit getUnit() {
        return unit;
    }

    public Set<DayOfWeek> getDaysOfWeek() {
        return daysOfWeek;
    }

    public ZoneId getZone() {
        return zone;
    }

    public long getIntervalMillis() {
        return interval * unit.approximateMillis();
    }

    @Override
    public <R> R accept(ScheduleVisitor<R> visitor) {
        return visitor.visitDailyTimeInterval(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DailyTimeIntervalSchedule)) {
            return false;
        }
        DailyTimeIntervalSchedule that = (DailyTimeIntervalSchedule) o;
        return interval == that.interval
                && unit == that.unit
                && startTimeOfDay.equals(that.startTimeOfDay)
                && endTimeOfDay.equals(that.endTimeOfDay)
                && daysOfWeek.equals(that.daysOfWeek)
                && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        int result = startTimeOfDay.hashCode();
        result = 31 * result + endTimeOfDay.hashCode();
        result = 31 * result + interval;
        result = 31 * result + unit.hashCode();
        result = 31 * result + daysOfWeek.hashCode();
        return 31 * result + zone.hashCode();
    }

    @Override
    public String toString() {
        return "DailyTimeIntervalSchedule{" + startTimeOfDay + "-" + endTimeOfDay + " every "
                + interval + " " + unit + " on " + daysOfWeek + ", " + zone + "}";
    }
}
