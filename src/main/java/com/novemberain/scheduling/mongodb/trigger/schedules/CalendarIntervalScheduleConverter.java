package com.novemberain.scheduling.mongodb.trigger.schedules;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.schedule.CalendarIntervalSchedule;
import com.novemberain.scheduling.schedule.IntervalUnit;
import com.novemberain.scheduling.schedule.ScheduleSpec;
import org.bson.Document;

import java.time.DateTimeException;
import java.time.ZoneId;

public class CalendarIntervalScheduleConverter extends ScheduleConverter {

    private static final String TRIGGER_REPEAT_INTERVAL_UNIT = "repeatIntervalUnit";
    private static final String TRIGGER_REPEAT_INTERVAL = "repeatInterval";
    private static final String TRIGGER_TIMEZONE = "timezone";

    @Override
    protected boolean canHandle(ScheduleSpec schedule) {
        return schedule instanceof CalendarIntervalSchedule;
    }

    @Override
    protected String getTypeName() {
        return "calendarInterval";
    }

    @Override
    protected void appendProperties(ScheduleSpec schedule, Document doc) {
        CalendarIntervalSchedule s = (CalendarIntervalSchedule) schedule;
        doc.append(TRIGGER_REPEAT_INTERVAL_UNIT, s.getUnit().name())
                .append(TRIGGER_REPEAT_INTERVAL, s.getInterval())
                .append(TRIGGER_TIMEZONE, s.getZone().getId());
    }

    @Override
    public ScheduleSpec toSchedule(Document stored) throws JobPersistenceException {
        try {
            return new CalendarIntervalSchedule(
                    stored.getInteger(TRIGGER_REPEAT_INTERVAL),
                    IntervalUnit.valueOf(stored.getString(TRIGGER_REPEAT_INTERVAL_UNIT)),
                    ZoneId.of(stored.getString(TRIGGER_TIMEZONE)));
        } catch (IllegalArgumentException | DateTimeException | NullPointerException e) {
            throw new JobPersistenceException("Invalid calendar interval schedule", e);
        }
    }
}
