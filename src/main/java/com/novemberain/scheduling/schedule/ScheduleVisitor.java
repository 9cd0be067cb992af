package com.novemberain.scheduling.schedule;

public interface ScheduleVisitor<R> {

    R visitCron(CronSchedule schedule);

    R visitSimple(SimpleSchedule schedule);

    R visitDailyTimeInterval(DailyTimeIntervalSchedule schedule);

    R visitCalendarInterval(CalendarIntervalSchedule schedule);
}
