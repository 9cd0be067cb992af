package com.novemberain.scheduling.schedule;

/**
 * When a trigger should fire, independently of start/end bounds and calendars.
 *
 * <p>The set of variants is closed: {@link CronSchedule}, {@link SimpleSchedule},
 * {@link DailyTimeIntervalSchedule} and {@link CalendarIntervalSchedule}.
 * Code that needs to tell them apart goes through {@link ScheduleVisitor}.</p>
 */
public abstract class ScheduleSpec {

    ScheduleSpec() {
    }

    public abstract <R> R accept(ScheduleVisitor<R> visitor);
}
