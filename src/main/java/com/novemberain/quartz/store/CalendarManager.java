package com.novemberain.quartz.store;

import com.novemberain.quartz.store.dao.CalendarDao;
import com.novemberain.quartz.store.dao.TriggerDao;
import com.novemberain.quartz.store.db.Session;
import org.quartz.Calendar;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class CalendarManager {

    private static final Logger log = LoggerFactory.getLogger(CalendarManager.class);

    private final CalendarDao calendarDao;
    private final TriggerDao triggerDao;
    private final TriggerAndJobPersister persister;
    private final long misfireThreshold;
    private final boolean cacheCalendars;
    private final ConcurrentMap<String, Calendar> calendarCache = new ConcurrentHashMap<>();

    /**
     * @param cacheCalendars keep retrieved calendars in memory, only safe when
     *                       no other scheduler instance changes them
     */
    public CalendarManager(CalendarDao calendarDao, TriggerDao triggerDao, TriggerAndJobPersister persister,
                           long misfireThreshold, boolean cacheCalendars) {
        this.calendarDao = calendarDao;
        this.triggerDao = triggerDao;
        this.persister = persister;
        this.misfireThreshold = misfireThreshold;
        this.cacheCalendars = cacheCalendars;
    }

    public void storeCalendar(Session session, String name, Calendar calendar, boolean replaceExisting,
                              boolean updateTriggers) throws JobPersistenceException {
        boolean existingCal = calendarDao.exists(session, name);
        if (existingCal && !replaceExisting) {
            throw new ObjectAlreadyExistsException("Calendar with name '" + name + "' already exists.");
        }
        calendarCache.remove(name);

        if (!existingCal) {
            calendarDao.insert(session, name, calendar);
            return;
        }

        if (calendarDao.update(session, name, calendar) < 1) {
            throw new JobPersistenceException("Couldn't store calendar.  Update failed.");
        }
        if (updateTriggers) {
            for (TriggerKey key : triggerDao.getTriggerKeysForCalendar(session, name)) {
                OperableTrigger trigger = triggerDao.getTrigger(session, key);
                String state = triggerDao.getState(session, key);
                trigger.updateWithNewCalendar(calendar, misfireThreshold);
                log.debug("Updated trigger {} for new calendar '{}', next fire time {}",
                        key, name, trigger.getNextFireTime());
                persister.storeTrigger(session, trigger, null, true, state, false, false);
            }
        }
    }

    /**
     * @throws JobPersistenceException when a trigger still references the calendar
     */
    public boolean removeCalendar(Session session, String name) throws JobPersistenceException {
        if (triggerDao.isCalendarReferenced(session, name)) {
            throw new JobPersistenceException("Calender cannot be removed if it referenced by a trigger!");
        }
        calendarCache.remove(name);
        return calendarDao.remove(session, name);
    }

    /**
     * @return calendar or null when there is none with such name
     */
    public Calendar retrieveCalendar(Session session, String name) throws JobPersistenceException {
        if (name == null) {
            return null;
        }
        Calendar calendar = cacheCalendars ? calendarCache.get(name) : null;
        if (calendar != null) {
            return calendar;
        }
        calendar = calendarDao.retrieveCalendar(session, name);
        if (calendar != null && cacheCalendars) {
            calendarCache.put(name, calendar);
        }
        return calendar;
    }

    public int getNumberOfCalendars(Session session) {
        return calendarDao.getCount(session);
    }

    public List<String> getCalendarNames(Session session) {
        return calendarDao.getNames(session);
    }

    public void clearCache() {
        calendarCache.clear();
    }
}
