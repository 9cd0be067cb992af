package com.novemberain.scheduling.schedule;

import java.time.temporal.ChronoUnit;

public enum IntervalUnit {
    MILLISECOND(ChronoUnit.MILLIS),
    SECOND(ChronoUnit.SECONDS),
    MINUTE(ChronoUnit.MINUTES),
    HOUR(ChronoUnit.HOURS),
    DAY(ChronoUnit.DAYS),
    WEEK(ChronoUnit.WEEKS),
    MONTH(ChronoUnit.MONTHS),
    YEAR(ChronoUnit.YEARS);

    private final ChronoUnit chronoUnit;

    IntervalUnit(ChronoUnit chronoUnit) {
        this.chronoUnit = chronoUnit;
    }

    public ChronoUnit toChronoUnit() {
        return chronoUnit;
    }

    /**
     * Units that are a fixed number of milliseconds regardless of the zone.
     */
    public boolean isFixedLength() {
        return this == MILLISECOND || this == SECOND || this == MINUTE || this == HOUR;
    }

    public long approximateMillis() {
        return chronoUnit.getDuration().toMillis();
    }
}
