package com.novemberain.scheduling.mongodb.trigger.schedules;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.schedule.ScheduleSpec;
import com.novemberain.scheduling.schedule.SimpleSchedule;
import org.bson.Document;

public class SimpleScheduleConverter extends ScheduleConverter {

    private static final String TRIGGER_REPEAT_COUNT = "repeatCount";
    private static final String TRIGGER_REPEAT_INTERVAL = "repeatInterval";

    @Override
    protected boolean canHandle(ScheduleSpec schedule) {
        return schedule instanceof SimpleSchedule;
    }

    @Override
    protected String getTypeName() {
        return "simple";
    }

    @Override
    protected void appendProperties(ScheduleSpec schedule, Document doc) {
        SimpleSchedule s = (SimpleSchedule) schedule;
        doc.append(TRIGGER_REPEAT_COUNT, s.getRepeatCount())
                .append(TRIGGER_REPEAT_INTERVAL, s.getIntervalMillis());
    }

    @Override
    public ScheduleSpec toSchedule(Document stored) throws JobPersistenceException {
        Number interval = stored.get(TRIGGER_REPEAT_INTERVAL, Number.class);
        Integer repeatCount = stored.getInteger(TRIGGER_REPEAT_COUNT);
        try {
            return new SimpleSchedule(interval == null ? 0L : interval.longValue(),
                    repeatCount == null ? 0 : repeatCount);
        } catch (IllegalArgumentException e) {
            throw new JobPersistenceException("Invalid simple schedule: " + e.getMessage(), e);
        }
    }
}
