package com.novemberain.scheduling.calendar;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Excludes the time-of-day range {@code [rangeStart, rangeEnd)} on every day,
 * or everything outside it when inverted.
 */
public class DailyCalendar extends ExclusionCalendar {

    private final LocalTime rangeStart;
    private final LocalTime rangeEnd;
    private final boolean invert;

    public DailyCalendar(LocalTime rangeStart, LocalTime rangeEnd, boolean invert, ZoneId zone) {
        this(rangeStart, rangeEnd, invert, zone, null);
    }

    public DailyCalendar(LocalTime rangeStart, LocalTime rangeEnd, boolean invert,
                         ZoneId zone, String description) {
        super(zone, description);
        if (rangeStart == null || rangeEnd == null) {
            throw new IllegalArgumentException("Daily range bounds cannot be null.");
        }
        if (!rangeStart.isBefore(rangeEnd)) {
            throw new IllegalArgumentException("Range start " + rangeStart
                    + " must be before range end " + rangeEnd);
        }
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.invert = invert;
    }

    public LocalTime getRangeStart() {
        return rangeStart;
    }

    public LocalTime getRangeEnd() {
        return rangeEnd;
    }

    public boolean isInvert() {
        return invert;
    }

    @Override
    public <R> R accept(CalendarVisitor<R> visitor) {
        return visitor.visitDaily(this);
    }

    @Override
    public DailyCalendar withDescription(String description) {
        return new DailyCalendar(rangeStart, rangeEnd, invert, getZone(), description);
    }

    @Override
    public String toString() {
        return "DailyCalendar{" + rangeStart + "-" + rangeEnd + (invert ? ", inverted" : "")
                + ", " + getZone() + "}";
    }
}
