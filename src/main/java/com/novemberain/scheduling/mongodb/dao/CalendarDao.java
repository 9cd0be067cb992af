package com.novemberain.scheduling.mongodb.dao;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReplaceOptions;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.mongodb.trigger.CalendarConverter;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.novemberain.scheduling.mongodb.trigger.CalendarConverter.CALENDAR_NAME;

public class CalendarDao {

    private final MongoCollection<Document> calendarCollection;
    private final CalendarConverter calendarConverter;

    public CalendarDao(MongoCollection<Document> calendarCollection, CalendarConverter calendarConverter) {
        this.calendarCollection = calendarCollection;
        this.calendarConverter = calendarConverter;
    }

    public void clear() {
        calendarCollection.deleteMany(new Document());
    }

    public void createIndex() {
        calendarCollection.createIndex(
                Projections.include(CALENDAR_NAME),
                new IndexOptions().unique(true));
    }

    public MongoCollection<Document> getCollection() {
        return calendarCollection;
    }

    public int getCount() {
        return (int) calendarCollection.countDocuments();
    }

    public boolean exists(String name) {
        return calendarCollection.countDocuments(Filters.eq(CALENDAR_NAME, name)) > 0;
    }

    public boolean remove(String name) {
        return calendarCollection.deleteOne(Filters.eq(CALENDAR_NAME, name)).getDeletedCount() > 0;
    }

    /**
     * @return the calendar, or null if {@code calName} is null or unknown
     */
    public ExclusionCalendar retrieveCalendar(String calName) throws JobPersistenceException {
        if (calName == null) {
            return null;
        }
        Document doc = calendarCollection.find(Filters.eq(CALENDAR_NAME, calName)).first();
        return doc == null ? null : calendarConverter.toCalendar(doc);
    }

    public List<String> getCalendarNames() {
        List<String> names = calendarCollection.distinct(CALENDAR_NAME, String.class)
                .into(new ArrayList<String>());
        Collections.sort(names);
        return names;
    }

    public void store(String name, ExclusionCalendar calendar) {
        Bson filter = Filters.eq(CALENDAR_NAME, name);
        calendarCollection.replaceOne(filter, calendarConverter.toDocument(name, calendar),
                new ReplaceOptions().upsert(true));
    }
}
