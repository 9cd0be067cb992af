package com.novemberain.scheduling.schedule;

import com.novemberain.scheduling.InvalidScheduleException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.TimeZone;

/**
 * Fires at every second matched by a Quartz cron expression, evaluated in
 * the schedule's time zone (UTC unless given).
 */
public final class CronSchedule extends ScheduleSpec {

    private final String expression;
    private final ZoneId zone;
    private final CronExpression cronExpression;

    private CronSchedule(String expression, ZoneId zone, CronExpression cronExpression) {
        this.expression = expression;
        this.zone = zone;
        this.cronExpression = cronExpression;
    }

    public static CronSchedule cronSchedule(String expression) throws InvalidScheduleException {
        return cronSchedule(expression, ZoneOffset.UTC);
    }

    public static CronSchedule cronSchedule(String expression, ZoneId zone) throws InvalidScheduleException {
        if (expression == null) {
            throw new InvalidScheduleException("Cron expression cannot be null.");
        }
        if (zone == null) {
            throw new InvalidScheduleException("Cron time zone cannot be null.");
        }
        CronExpression cron;
        try {
            cron = new CronExpression(expression);
        } catch (ParseException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "': "
                    + e.getMessage(), e);
        }
        cron.setTimeZone(TimeZone.getTimeZone(zone));
        return new CronSchedule(expression, zone, cron);
    }

    public String getExpression() {
        return expression;
    }

    public ZoneId getZone() {
        return zone;
    }

    Date nextMatchAfter(Date after) {
        return cronExpression.getNextValidTimeAfter(after);
    }

    @Override
    public <R> R accept(ScheduleVisitor<R> visitor) {
        return visitor.visitCron(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronSchedule)) {
            return false;
        }
        CronSchedule that = (CronSchedule) o;
        return expression.equals(that.expression) && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return 31 * expression.hashCode() + zone.hashCode();
    }

    @Override
    public String toString() {
        return "CronSchedule{" + expression + ", " + zone + "}";
    }
}
