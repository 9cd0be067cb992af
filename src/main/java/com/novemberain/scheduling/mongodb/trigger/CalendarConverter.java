package com.novemberain.scheduling.mongodb.trigger;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.calendar.AnnualCalendar;
import com.novemberain.scheduling.calendar.CalendarVisitor;
import com.novemberain.scheduling.calendar.CronCalendar;
import com.novemberain.scheduling.calendar.DailyCalendar;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.calendar.HolidayCalendar;
import com.novemberain.scheduling.calendar.MonthlyCalendar;
import com.novemberain.scheduling.calendar.WeeklyCalendar;
import org.bson.Document;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stores calendars as typed documents, discriminated by {@value #CALENDAR_TYPE}.
 */
public class CalendarConverter {

    public static final String CALENDAR_NAME = "name";
    public static final String CALENDAR_TYPE = "type";
    private static final String CALENDAR_ZONE = "zone";
    private static final String CALENDAR_DESCRIPTION = "description";
    private static final String CALENDAR_EXPRESSION = "expression";
    private static final String CALENDAR_RANGE_START = "rangeStart";
    private static final String CALENDAR_RANGE_END = "rangeEnd";
    private static final String CALENDAR_INVERT = "invert";
    private static final String CALENDAR_EXCLUDED = "excluded";

    static final String TYPE_CRON = "cron";
    static final String TYPE_DAILY = "daily";
    static final String TYPE_WEEKLY = "weekly";
    static final String TYPE_MONTHLY = "monthly";
    static final String TYPE_ANNUAL = "annual";
    static final String TYPE_HOLIDAY = "holiday";

    public Document toDocument(String name, ExclusionCalendar calendar) {
        Document doc = calendar.accept(new DocumentWriter());
        doc.put(CALENDAR_NAME, name);
        doc.put(CALENDAR_ZONE, calendar.getZone().getId());
        doc.put(CALENDAR_DESCRIPTION, calendar.getDescription());
        return doc;
    }

    public ExclusionCalendar toCalendar(Document doc) throws JobPersistenceException {
        String type = doc.getString(CALENDAR_TYPE);
        String description = doc.getString(CALENDAR_DESCRIPTION);
        try {
            ZoneId zone = ZoneId.of(doc.getString(CALENDAR_ZONE));
            if (TYPE_CRON.equals(type)) {
                return new CronCalendar(doc.getString(CALENDAR_EXPRESSION), zone, description);
            }
            if (TYPE_DAILY.equals(type)) {
                return new DailyCalendar(LocalTime.parse(doc.getString(CALENDAR_RANGE_START)),
                        LocalTime.parse(doc.getString(CALENDAR_RANGE_END)),
                        doc.getBoolean(CALENDAR_INVERT, false), zone, description);
            }
            if (TYPE_WEEKLY.equals(type)) {
                Set<DayOfWeek> days = new HashSet<DayOfWeek>();
                for (Integer day : doc.getList(CALENDAR_EXCLUDED, Integer.class)) {
                    days.add(DayOfWeek.of(day));
                }
                return new WeeklyCalendar(days, zone, description);
            }
            if (TYPE_MONTHLY.equals(type)) {
                return new MonthlyCalendar(new HashSet<Integer>(doc.getList(CALENDAR_EXCLUDED, Integer.class)),
                        zone, description);
            }
            if (TYPE_ANNUAL.equals(type)) {
                Set<MonthDay> days = new HashSet<MonthDay>();
                for (String day : doc.getList(CALENDAR_EXCLUDED, String.class)) {
                    days.add(MonthDay.parse(day));
                }
                return new AnnualCalendar(days, zone, description);
            }
            if (TYPE_HOLIDAY.equals(type)) {
                Set<LocalDate> dates = new HashSet<LocalDate>();
                for (String date : doc.getList(CALENDAR_EXCLUDED, String.class)) {
                    dates.add(LocalDate.parse(date));
                }
                return new HolidayCalendar(dates, zone, description);
            }
        } catch (DateTimeParseException e) {
            throw new JobPersistenceException("Malformed calendar " + doc.getString(CALENDAR_NAME), e);
        } catch (DateTimeException | IllegalArgumentException | NullPointerException e) {
            throw new JobPersistenceException("Invalid calendar " + doc.getString(CALENDAR_NAME), e);
        }
        throw new JobPersistenceException("Unknown calendar type '" + type + "' of calendar "
                + doc.getString(CALENDAR_NAME));
    }

    private static class DocumentWriter implements CalendarVisitor<Document> {

        @Override
        public Document visitCron(CronCalendar calendar) {
            return new Document(CALENDAR_TYPE, TYPE_CRON)
                    .append(CALENDAR_EXPRESSION, calendar.getExpression());
        }

        @Override
        public Document visitDaily(DailyCalendar calendar) {
            return new Document(CALENDAR_TYPE, TYPE_DAILY)
                    .append(CALENDAR_RANGE_START, calendar.getRangeStart().toString())
                    .append(CALENDAR_RANGE_END, calendar.getRangeEnd().toString())
                    .append(CALENDAR_INVERT, calendar.isInvert());
        }

        @Override
        public Document visitWeekly(WeeklyCalendar calendar) {
            List<Integer> days = new ArrayList<Integer>();
            for (DayOfWeek day : calendar.getExcludedDays()) {
                days.add(day.getValue());
            }
            return new Document(CALENDAR_TYPE, TYPE_WEEKLY).append(CALENDAR_EXCLUDED, days);
        }

        @Override
        public Document visitMonthly(MonthlyCalendar calendar) {
            return new Document(CALENDAR_TYPE, TYPE_MONTHLY)
                    .append(CALENDAR_EXCLUDED, new ArrayList<Integer>(calendar.getExcludedDays()));
        }

        @Override
        public Document visitAnnual(AnnualCalendar calendar) {
            List<String> days = new ArrayList<String>();
            for (MonthDay day : calendar.getExcludedDays()) {
                days.add(day.toString());
            }
            return new Document(CALENDAR_TYPE, TYPE_ANNUAL).append(CALENDAR_EXCLUDED, days);
        }

        @Override
        public Document visitHoliday(HolidayCalendar calendar) {
            List<String> dates = new ArrayList<String>();
            for (LocalDate date : calendar.getExcludedDates()) {
                dates.add(date.toString());
            }
            return new Document(CALENDAR_TYPE, TYPE_HOLIDAY).append(CALENDAR_EXCLUDED, dates);
        }
    }
}
