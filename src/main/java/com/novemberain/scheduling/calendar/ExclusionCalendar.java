package com.novemberain.scheduling.calendar;

import java.time.ZoneId;

/**
 * A named rule excluding instants from being valid fire times.
 *
 * <p>Calendars are immutable and validated when constructed. Each variant
 * is evaluated in its own time zone by {@link CalendarEvaluator}.</p>
 */
public abstract class ExclusionCalendar {

    private final ZoneId zone;
    private final String description;

    protected ExclusionCalendar(ZoneId zone, String description) {
        if (zone == null) {
            throw new IllegalArgumentException("Calendar time zone cannot be null.");
        }
        this.zone = zone;
        this.description = description;
    }

    public ZoneId getZone() {
        return zone;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Dispatch to the visitor method matching this variant.
     */
    public abstract <R> R accept(CalendarVisitor<R> visitor);

    /**
     * Copy of this calendar with a different description.
     */
    public abstract ExclusionCalendar withDescription(String description);
}
