package com.novemberain.scheduling.mongodb.trigger.schedules;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.schedule.DailyTimeIntervalSchedule;
import com.novemberain.scheduling.schedule.IntervalUnit;
import com.novemberain.scheduling.schedule.ScheduleSpec;
import org.bson.Document;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public class DailyTimeIntervalScheduleConverter extends ScheduleConverter {

    private static final String TRIGGER_REPEAT_INTERVAL_UNIT = "repeatIntervalUnit";
    private static final String TRIGGER_REPEAT_INTERVAL = "repeatInterval";
    private static final String TRIGGER_START_TIME_OF_DAY = "startTimeOfDay";
    private static final String TRIGGER_END_TIME_OF_DAY = "endTimeOfDay";
    private static final String TRIGGER_DAYS_OF_WEEK = "daysOfWeek";
    private static final String TRIGGER_TIMEZONE = "timezone";

    @Override
    protected boolean canHandle(ScheduleSpec schedule) {
        return schedule instanceof DailyTimeIntervalSchedule;
    }

    @Override
    protected String getTypeName() {
        return "dailyTimeInterval";
    }

    @Override
    protected void appendProperties(ScheduleSpec schedule, Document doc) {
        DailyTimeIntervalSchedule s = (DailyTimeIntervalSchedule) schedule;
        List<Integer> days = new ArrayList<Integer>();
        for (DayOfWeek day : s.getDaysOfWeek()) {
            days.add(day.getValue());
        }
        doc.append(TRIGGER_REPEAT_INTERVAL_UNIT, s.getUnit().name())
                .append(TRIGGER_REPEAT_INTERVAL, s.getInterval())
                .append(TRIGGER_START_TIME_OF_DAY, toDocument(s.getStartTimeOfDay()))
                .append(TRIGGER_END_TIME_OF_DAY, toDocument(s.getEndTimeOfDay()))
                .append(TRIGGER_DAYS_OF_WEEK, days)
                .append(TRIGGER_TIMEZONE, s.getZone().getId());
    }

    private Document toDocument(LocalTime tod) {
        return new Document().
                append("hour", tod.getHour()).
                append("minute", tod.getMinute()).
                append("second", tod.getSecond());
    }

    @Override
    public ScheduleSpec toSchedule(Document stored) throws JobPersistenceException {
        try {
            Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
            for (Integer day : stored.getList(TRIGGER_DAYS_OF_WEEK, Integer.class)) {
                days.add(DayOfWeek.of(day));
            }
            return new DailyTimeIntervalSchedule(
                    fromDocument(stored.get(TRIGGER_START_TIME_OF_DAY, Document.class)),
                    fromDocument(stored.get(TRIGGER_END_TIME_OF_DAY, Document.class)),
                    stored.getInteger(TRIGGER_REPEAT_INTERVAL),
                    IntervalUnit.valueOf(stored.getString(TRIGGER_REPEAT_INTERVAL_UNIT)),
                    days,
                    ZoneId.of(stored.getString(TRIGGER_TIMEZONE)));
        } catch (IllegalArgumentException | DateTimeException | NullPointerException e) {
            throw new JobPersistenceException("Invalid daily time interval schedule", e);
        }
    }

    private LocalTime fromDocument(Document tod) {
        return LocalTime.of(tod.getInteger("hour"), tod.getInteger("minute"), tod.getInteger("second"));
    }
}
