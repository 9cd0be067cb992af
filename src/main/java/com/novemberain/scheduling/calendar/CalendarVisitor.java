package com.novemberain.scheduling.calendar;

public interface CalendarVisitor<R> {

    R visitCron(CronCalendar calendar);

    R visitDaily(DailyCalendar calendar);

    R visitWeekly(WeeklyCalendar calendar);

    R visitMonthly(MonthlyCalendar calendar);

    R visitAnnual(AnnualCalendar calendar);

    R visitHoliday(HolidayCalendar calendar);
}
