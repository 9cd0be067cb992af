package com.novemberain.scheduling.calendar;

import org.quartz.CronExpression;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Answers whether an instant is excluded by a calendar, and where the next
 * included instant lies. Both questions are pure functions of the calendar
 * and the instant.
 */
public class CalendarEvaluator {

    // Ten years of day-by-day stepping.
    static final int MAX_DAY_STEPS = 3660;
    static final int MAX_CRON_STEPS = 10000;
    private static final int MINUTES_IN_TWO_DAYS = 2 * 24 * 60;

    public boolean isExcluded(ExclusionCalendar calendar, Date instant) {
        return calendar.accept(new ExclusionTest(instant.getTime()));
    }

    public boolean isIncluded(ExclusionCalendar calendar, Date instant) {
        return !isExcluded(calendar, instant);
    }

    /**
     * Return the first instant strictly after the given one that the
     * calendar does not exclude.
     *
     * @param calendar    calendar to evaluate
     * @param instant     exclusive lower bound
     * @return next included instant or null when none exists within the search bound
     */
    public Date nextIncludedTime(ExclusionCalendar calendar, Date instant) {
        long candidate = instant.getTime() + 1;
        if (!calendar.accept(new ExclusionTest(candidate))) {
            return new Date(candidate);
        }
        Long next = calendar.accept(new NextIncludedSearch(candidate));
        return next == null ? null : new Date(next);
    }

    private static ZonedDateTime toZoned(long millis, ExclusionCalendar calendar) {
        return Instant.ofEpochMilli(millis).atZone(calendar.getZone());
    }

    private static boolean inDailyRange(DailyCalendar calendar, LocalTime time) {
        return !time.isBefore(calendar.getRangeStart()) && time.isBefore(calendar.getRangeEnd());
    }

    private static final class ExclusionTest implements CalendarVisitor<Boolean> {

        private final long millis;

        ExclusionTest(long millis) {
            this.millis = millis;
        }

        @Override
        public Boolean visitCron(CronCalendar calendar) {
            return calendar.getCronExpression().isSatisfiedBy(new Date(millis));
        }

        @Override
        public Boolean visitDaily(DailyCalendar calendar) {
            LocalTime time = toZoned(millis, calendar).toLocalTime();
            return inDailyRange(calendar, time) != calendar.isInvert();
        }

        @Override
        public Boolean visitWeekly(WeeklyCalendar calendar) {
            return calendar.getExcludedDays().contains(toZoned(millis, calendar).getDayOfWeek());
        }

        @Override
        public Boolean visitMonthly(MonthlyCalendar calendar) {
            return calendar.getExcludedDays().contains(toZoned(millis, calendar).getDayOfMonth());
        }

        @Override
        public Boolean visitAnnual(AnnualCalendar calendar) {
            return calendar.getExcludedDays().contains(MonthDay.from(toZoned(millis, calendar)));
        }

        @Override
        public Boolean visitHoliday(HolidayCalendar calendar) {
            return calendar.getExcludedDates().contains(toZoned(millis, calendar).toLocalDate());
        }
    }

    /**
     * Searches forward from an excluded instant. Returns epoch millis or null.
     */
    private static final class NextIncludedSearch implements CalendarVisitor<Long> {

        private final long excluded;

        NextIncludedSearch(long excluded) {
            this.excluded = excluded;
        }

        @Override
        public Long visitCron(CronCalendar calendar) {
            CronExpression expression = calendar.getCronExpression();
            Date candidate = new Date(excluded);
            for (int i = 0; i < MAX_CRON_STEPS; i++) {
                candidate = expression.getNextInvalidTimeAfter(candidate);
                if (candidate == null) {
                    return null;
                }
                if (!expression.isSatisfiedBy(candidate)) {
                    return candidate.getTime();
                }
            }
            return null;
        }

        @Override
        public Long visitDaily(DailyCalendar calendar) {
            ZonedDateTime zoned = toZoned(excluded, calendar);
            LocalDate date = zoned.toLocalDate();
            ZonedDateTime next;
            if (!calendar.isInvert()) {
                // inside the excluded range, leave it at its end
                next = ZonedDateTime.of(date, calendar.getRangeEnd(), calendar.getZone());
            } else if (zoned.toLocalTime().isBefore(calendar.getRangeStart())) {
                next = ZonedDateTime.of(date, calendar.getRangeStart(), calendar.getZone());
            } else {
                next = ZonedDateTime.of(date.plusDays(1), calendar.getRangeStart(), calendar.getZone());
            }
            long millis = next.toInstant().toEpochMilli();
            if (millis <= excluded || calendar.accept(new ExclusionTest(millis))) {
                // zone transition moved the boundary
                return scanByMinute(calendar);
            }
            return millis;
        }

        private Long scanByMinute(DailyCalendar calendar) {
            long minute = 60 * 1000L;
            long start = excluded - (excluded % minute);
            for (int i = 1; i <= MINUTES_IN_TWO_DAYS; i++) {
                long millis = start + i * minute;
                if (!calendar.accept(new ExclusionTest(millis))) {
                    return millis;
                }
            }
            return null;
        }

        @Override
        public Long visitWeekly(WeeklyCalendar calendar) {
            return firstIncludedDayStart(calendar, nextDay(calendar));
        }

        @Override
        public Long visitMonthly(MonthlyCalendar calendar) {
            return firstIncludedDayStart(calendar, nextDay(calendar));
        }

        @Override
        public Long visitAnnual(AnnualCalendar calendar) {
            return firstIncludedDayStart(calendar, nextDay(calendar));
        }

        @Override
        public Long visitHoliday(HolidayCalendar calendar) {
            return firstIncludedDayStart(calendar, nextDay(calendar));
        }

        private LocalDate nextDay(ExclusionCalendar calendar) {
            return toZoned(excluded, calendar).toLocalDate().plusDays(1);
        }

        private Long firstIncludedDayStart(ExclusionCalendar calendar, LocalDate from) {
            LocalDate day = from;
            for (int i = 0; i < MAX_DAY_STEPS; i++) {
                long millis = day.atStartOfDay(calendar.getZone()).toInstant().toEpochMilli();
                if (millis > excluded && !calendar.accept(new ExclusionTest(millis))) {
                    return millis;
                }
                day = day.plusDays(1);
            }
            return null;
        }
    }
}
