package com.novemberain.scheduling.mongodb.trigger.schedules;

import com.novemberain.scheduling.InvalidScheduleException;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.schedule.CronSchedule;
import com.novemberain.scheduling.schedule.ScheduleSpec;
import org.bson.Document;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

public class CronScheduleConverter extends ScheduleConverter {

    private static final String TRIGGER_CRON_EXPRESSION = "cronExpression";
    private static final String TRIGGER_TIMEZONE = "timezone";

    @Override
    protected boolean canHandle(ScheduleSpec schedule) {
        return schedule instanceof CronSchedule;
    }

    @Override
    protected String getTypeName() {
        return "cron";
    }

    @Override
    protected void appendProperties(ScheduleSpec schedule, Document doc) {
        CronSchedule s = (CronSchedule) schedule;
        doc.append(TRIGGER_CRON_EXPRESSION, s.getExpression())
                .append(TRIGGER_TIMEZONE, s.getZone().getId());
    }

    @Override
    public ScheduleSpec toSchedule(Document stored) throws JobPersistenceException {
        String expression = stored.getString(TRIGGER_CRON_EXPRESSION);
        String tz = stored.getString(TRIGGER_TIMEZONE);
        try {
            ZoneId zone = tz == null ? ZoneOffset.UTC : ZoneId.of(tz);
            return CronSchedule.cronSchedule(expression, zone);
        } catch (InvalidScheduleException | DateTimeException e) {
            throw new JobPersistenceException("Stored cron schedule '" + expression
                    + "' cannot be restored", e);
        }
    }
}
