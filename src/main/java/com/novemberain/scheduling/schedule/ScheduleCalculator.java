package com.novemberain.scheduling.schedule;

import com.novemberain.scheduling.InvalidScheduleException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.calendar.CalendarEvaluator;
import com.novemberain.scheduling.calendar.ExclusionCalendar;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Computes fire times from a schedule, its start and end bounds and an
 * optional exclusion calendar.
 *
 * <p>Every result is strictly later than the instant it was asked about.
 * Calendar exclusions are skipped by jumping to the calendar's next included
 * instant rather than walking the schedule one tick at a time.</p>
 */
public class ScheduleCalculator {

    static final int MAX_EXCLUSION_SKIPS = 1000;
    static final int MAX_YEAR = 2299;

    // Enough to cover a week of disallowed days plus the day we start from.
    private static final int DAILY_SEARCH_DAYS = 9;
    private static final int CALENDAR_UNIT_SEARCH_STEPS = 1000;

    private final CalendarEvaluator evaluator;

    public ScheduleCalculator(CalendarEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public ScheduleCalculator() {
        this(new CalendarEvaluator());
    }

    public CalendarEvaluator getEvaluator() {
        return evaluator;
    }

    /**
     * Next fire time strictly after {@code after}.
     *
     * @param schedule when to fire
     * @param start    first instant the schedule may fire at
     * @param end      last instant the schedule may fire at, or null
     * @param calendar exclusions, or null
     * @param after    exclusive lower bound, or null for "before start"
     * @return the next fire time or null when the schedule is exhausted
     */
    public Date nextFireAfter(ScheduleSpec schedule, Date start, Date end,
                              ExclusionCalendar calendar, Date after) {
        long startMillis = start.getTime();
        long afterMillis = after == null ? startMillis - 1 : Math.max(after.getTime(), startMillis - 1);

        Date candidate = schedule.accept(new NextScheduleTime(startMillis, afterMillis));
        int skips = 0;
        while (candidate != null) {
            if (end != null && candidate.after(end)) {
                return null;
            }
            if (yearOf(candidate) > MAX_YEAR) {
                return null;
            }
            if (calendar == null || !evaluator.isExcluded(calendar, candidate)) {
                return candidate;
            }
            if (++skips > MAX_EXCLUSION_SKIPS) {
                return null;
            }
            Date included = evaluator.nextIncludedTime(calendar, candidate);
            if (included == null) {
                return null;
            }
            long jump = Math.max(candidate.getTime(), included.getTime() - 1);
            candidate = schedule.accept(new NextScheduleTime(startMillis, jump));
        }
        return null;
    }

    public Date fireTimeAfter(Trigger trigger, ExclusionCalendar calendar, Date after) {
        return nextFireAfter(trigger.getSchedule(), trigger.getStartTime(), trigger.getEndTime(),
                calendar, after);
    }

    /**
     * Compute and set the trigger's first fire time.
     */
    public Date computeFirstFireTime(Trigger trigger, ExclusionCalendar calendar) {
        Date first = fireTimeAfter(trigger, calendar, new Date(trigger.getStartTime().getTime() - 1));
        trigger.setNextFireTime(first);
        return first;
    }

    /**
     * Compute the first fire time and reject triggers that would never fire.
     */
    public Date validate(Trigger trigger, ExclusionCalendar calendar) throws InvalidScheduleException {
        if (trigger.getSchedule() == null || trigger.getStartTime() == null) {
            throw new InvalidScheduleException("Trigger '" + trigger.getKey() + "' has no schedule or start time.");
        }
        Date first = computeFirstFireTime(trigger, calendar);
        if (first == null) {
            throw new InvalidScheduleException("Based on configured schedule, the given trigger '"
                    + trigger.getKey() + "' will never fire.");
        }
        return first;
    }

    /**
     * Advance the trigger past its current fire time.
     */
    public void triggered(Trigger trigger, ExclusionCalendar calendar) {
        trigger.setTimesTriggered(trigger.getTimesTriggered() + 1);
        trigger.setPreviousFireTime(trigger.getNextFireTime());
        Date from = trigger.getNextFireTime();
        trigger.setNextFireTime(from == null ? null : fireTimeAfter(trigger, calendar, from));
    }

    /**
     * Recompute the next fire time after the trigger's calendar was replaced.
     * Fires already done stay done; an overdue result is left to misfire handling.
     */
    public void updateWithNewCalendar(Trigger trigger, ExclusionCalendar calendar) {
        trigger.setNextFireTime(fireTimeAfter(trigger, calendar, trigger.getPreviousFireTime()));
    }

    public boolean mayFireAgain(Trigger trigger) {
        return trigger.getNextFireTime() != null;
    }

    /**
     * Last fire time a bounded simple schedule will produce, ignoring
     * calendars. Null for unbounded schedules and for other schedule kinds.
     */
    public Date getFinalFireTime(Trigger trigger) {
        if (!(trigger.getSchedule() instanceof SimpleSchedule)) {
            return null;
        }
        SimpleSchedule simple = (SimpleSchedule) trigger.getSchedule();
        long start = trigger.getStartTime().getTime();
        Date end = trigger.getEndTime();
        if (simple.getRepeatCount() == 0) {
            return end != null && end.getTime() < start ? null : new Date(start);
        }
        long last;
        if (simple.repeatsForever()) {
            if (end == null) {
                return null;
            }
            last = Long.MAX_VALUE;
        } else {
            last = start + simple.getRepeatCount() * simple.getIntervalMillis();
        }
        if (end != null && end.getTime() < last) {
            long slots = (end.getTime() - start) / simple.getIntervalMillis();
            if (slots < 0) {
                return null;
            }
            last = start + slots * simple.getIntervalMillis();
        }
        return new Date(last);
    }

    private static int yearOf(Date date) {
        return Instant.ofEpochMilli(date.getTime()).atZone(ZoneOffset.UTC).getYear();
    }

    /**
     * Schedule-only candidate strictly after {@code after}, before calendars
     * and end bounds are taken into account.
     */
    private static final class NextScheduleTime implements ScheduleVisitor<Date> {

        private final long start;
        private final long after;

        NextScheduleTime(long start, long after) {
            this.start = start;
            this.after = after;
        }

        @Override
        public Date visitCron(CronSchedule schedule) {
            return schedule.nextMatchAfter(new Date(after));
        }

        @Override
        public Date visitSimple(SimpleSchedule schedule) {
            return nextOnGrid(schedule.getIntervalMillis(), schedule.getRepeatCount());
        }

        @Override
        public Date visitCalendarInterval(CalendarIntervalSchedule schedule) {
            IntervalUnit unit = schedule.getUnit();
            if (unit.isFixedLength()) {
                return nextOnGrid(schedule.getInterval() * unit.approximateMillis(),
                        SimpleSchedule.REPEAT_INDEFINITELY);
            }
            if (after < start) {
                return new Date(start);
            }
            ZonedDateTime base = Instant.ofEpochMilli(start).atZone(schedule.getZone());
            long approximateStep = schedule.getInterval() * unit.approximateMillis();
            long k = Math.max(1, (after - start) / approximateStep - 2);
            for (int i = 0; i < CALENDAR_UNIT_SEARCH_STEPS; i++, k++) {
                // always from the original start, so month ends clamp without drifting
                ZonedDateTime candidate = base.plus(k * schedule.getInterval(), unit.toChronoUnit());
                if (candidate.getYear() > MAX_YEAR) {
                    return null;
                }
                long millis = candidate.toInstant().toEpochMilli();
                if (millis > after) {
                    return new Date(millis);
                }
            }
            return null;
        }

        @Override
        public Date visitDailyTimeInterval(DailyTimeIntervalSchedule schedule) {
            long interval = schedule.getIntervalMillis();
            LocalDate day = Instant.ofEpochMilli(after).atZone(schedule.getZone()).toLocalDate();
            for (int i = 0; i < DAILY_SEARCH_DAYS; i++, day = day.plusDays(1)) {
                if (!schedule.getDaysOfWeek().contains(day.getDayOfWeek())) {
                    continue;
                }
                long windowStart = ZonedDateTime.of(day, schedule.getStartTimeOfDay(), schedule.getZone())
                        .toInstant().toEpochMilli();
                long windowEnd = ZonedDateTime.of(day, schedule.getEndTimeOfDay(), schedule.getZone())
                        .toInstant().toEpochMilli();
                if (after < windowStart) {
                    return new Date(windowStart);
                }
                if (after < windowEnd) {
                    long candidate = windowStart + ((after - windowStart) / interval + 1) * interval;
                    if (candidate < windowEnd) {
                        return new Date(candidate);
                    }
                }
            }
            return null;
        }

        private Date nextOnGrid(long interval, int repeatCount) {
            if (after < start) {
                return new Date(start);
            }
            if (interval <= 0) {
                return null;
            }
            long k = (after - start) / interval + 1;
            if (repeatCount != SimpleSchedule.REPEAT_INDEFINITELY && k > repeatCount) {
                return null;
            }
            if (k > (Long.MAX_VALUE - start) / interval) {
                return null;
            }
            return new Date(start + k * interval);
        }
    }
}
