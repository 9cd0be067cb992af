package com.novemberain.scheduling.mongodb.trigger.schedules;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.schedule.ScheduleSpec;
import org.bson.Document;

import java.util.Arrays;
import java.util.List;

/**
 * Converts schedule type specific properties.
 */
public abstract class ScheduleConverter {

    public static final String SCHEDULE_TYPE = "scheduleType";

    private static final List<ScheduleConverter> scheduleConverters = Arrays.asList(
            new SimpleScheduleConverter(),
            new CalendarIntervalScheduleConverter(),
            new CronScheduleConverter(),
            new DailyTimeIntervalScheduleConverter());

    /**
     * Returns the converter for the given schedule or null when not found.
     */
    public static ScheduleConverter getConverterFor(ScheduleSpec schedule) {
        for (ScheduleConverter converter : scheduleConverters) {
            if (converter.canHandle(schedule)) {
                return converter;
            }
        }
        return null;
    }

    /**
     * Returns the converter that wrote the given document or null when not found.
     */
    public static ScheduleConverter getConverterFor(Document stored) {
        String type = stored.getString(SCHEDULE_TYPE);
        for (ScheduleConverter converter : scheduleConverters) {
            if (converter.getTypeName().equals(type)) {
                return converter;
            }
        }
        return null;
    }

    protected abstract boolean canHandle(ScheduleSpec schedule);

    protected abstract String getTypeName();

    /**
     * Returns a copy of {@code original} with the discriminator and the schedule fields added.
     */
    public Document injectScheduleProperties(ScheduleSpec schedule, Document original) {
        Document doc = new Document(original).append(SCHEDULE_TYPE, getTypeName());
        appendProperties(schedule, doc);
        return doc;
    }

    protected abstract void appendProperties(ScheduleSpec schedule, Document doc);

    public abstract ScheduleSpec toSchedule(Document stored) throws JobPersistenceException;
}
