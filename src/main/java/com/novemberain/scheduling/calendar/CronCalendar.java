package com.novemberain.scheduling.calendar;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.ZoneId;
import java.util.TimeZone;

/**
 * Excludes every second matched by a cron expression.
 */
public class CronCalendar extends ExclusionCalendar {

    private final String expression;
    private final CronExpression cronExpression;

    public CronCalendar(String expression, ZoneId zone) {
        this(expression, zone, null);
    }

    public CronCalendar(String expression, ZoneId zone, String description) {
        super(zone, description);
        if (expression == null) {
            throw new IllegalArgumentException("Cron expression cannot be null.");
        }
        try {
            this.cronExpression = new CronExpression(expression);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + expression
                    + "': " + e.getMessage(), e);
        }
        this.cronExpression.setTimeZone(TimeZone.getTimeZone(zone));
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }

    CronExpression getCronExpression() {
        return cronExpression;
    }

    @Override
    public <R> R accept(CalendarVisitor<R> visitor) {
        return visitor.visitCron(this);
    }

    @Override
    public CronCalendar withDescription(String description) {
        return new CronCalendar(expression, getZone(), description);
    }

    @Override
    public String toString() {
        return "CronCalendar{" + expression + ", " + getZone() + "}";
    }
}
