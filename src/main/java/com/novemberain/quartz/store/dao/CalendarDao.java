package com.novemberain.quartz.store.dao;

import com.mongodb.client.model.Filters;
import com.novemberain.quartz.store.db.DocumentCollection;
import com.novemberain.quartz.store.db.DuplicateKeyException;
import com.novemberain.quartz.store.db.Session;
import com.novemberain.quartz.store.util.SerialUtils;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.quartz.Calendar;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;

import java.util.ArrayList;
import java.util.List;

public class CalendarDao {

    static final String CALENDAR_NAME = "name";
    static final String CALENDAR_SERIALIZED_OBJECT = "serializedObject";

    private final DocumentCollection calendarCollection;

    public CalendarDao(DocumentCollection calendarCollection) {
        this.calendarCollection = calendarCollection;
    }

    public void createIndex() {
        calendarCollection.createUniqueIndex(CALENDAR_NAME);
    }

    public long clear(Session session) {
        return calendarCollection.deleteMany(session, Filters.empty());
    }

    public boolean exists(Session session, String name) {
        return calendarCollection.count(session, byName(name)) > 0;
    }

    public int getCount(Session session) {
        return (int) calendarCollection.count(session, Filters.empty());
    }

    public List<String> getNames(Session session) {
        return new ArrayList<>(calendarCollection.distinct(session, CALENDAR_NAME, Filters.empty(), String.class));
    }

    public boolean remove(Session session, String name) {
        return calendarCollection.deleteMany(session, byName(name)) > 0;
    }

    /**
     * @return calendar or null when there is none with such name
     */
    public Calendar retrieveCalendar(Session session, String calName) throws JobPersistenceException {
        if (calName != null) {
            Document doc = calendarCollection.first(session, byName(calName));
            if (doc != null) {
                byte[] serializedCalendar = doc.get(CALENDAR_SERIALIZED_OBJECT, byte[].class);
                return SerialUtils.deserialize(serializedCalendar, Calendar.class);
            }
        }
        return null;
    }

    public void insert(Session session, String name, Calendar calendar) throws JobPersistenceException {
        try {
            calendarCollection.insertOne(session, toDocument(name, calendar));
        } catch (DuplicateKeyException e) {
            throw new ObjectAlreadyExistsException("Calendar with name '" + name + "' already exists.");
        }
    }

    /**
     * @return number of updated calendars
     */
    public long update(Session session, String name, Calendar calendar) throws JobPersistenceException {
        return calendarCollection.replaceOne(session, byName(name), toDocument(name, calendar));
    }

    private Document toDocument(String name, Calendar calendar) throws JobPersistenceException {
        return new Document(CALENDAR_NAME, name)
                .append(CALENDAR_SERIALIZED_OBJECT, SerialUtils.serialize(calendar));
    }

    private Bson byName(String name) {
        return Filters.eq(CALENDAR_NAME, name);
    }
}
