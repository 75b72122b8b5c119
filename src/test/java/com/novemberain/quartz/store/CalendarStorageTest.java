package com.novemberain.quartz.store;

import org.junit.Before;
import org.junit.Test;
import org.quartz.Calendar;
import org.quartz.DateBuilder;
import org.quartz.JobDetail;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.impl.calendar.HolidayCalendar;
import org.quartz.impl.calendar.WeeklyCalendar;
import org.quartz.spi.OperableTrigger;

import java.util.Date;

import static com.novemberain.quartz.store.Constants.STATE_WAITING;
import static org.junit.Assert.*;
import static org.quartz.JobBuilder.newJob;
import static org.quartz.SimpleScheduleBuilder.simpleSchedule;
import static org.quartz.TriggerBuilder.newTrigger;

public class CalendarStorageTest extends JobStoreTestSupport {

    private static final long DAY = 24 * 60 * 60 * 1000L;

    private JobDetail job;

    @Before
    public void storeJob() throws Exception {
        job = newJob(NoOpJob.class).withIdentity("job").storeDurably().build();
        store.storeJob(job, false);
    }

    private OperableTrigger storeDailyTrigger(String calendarName, Date start) throws Exception {
        OperableTrigger trigger = scheduled(newTrigger()
                .withIdentity("daily")
                .forJob(job)
                .startAt(start)
                .modifiedByCalendar(calendarName)
                .withSchedule(simpleSchedule().withIntervalInHours(24).repeatForever())
                .build());
        store.storeTrigger(trigger, false);
        return trigger;
    }

    @Test
    public void testStoreAndRetrieveCalendar() throws Exception {
        HolidayCalendar holidays = new HolidayCalendar();
        Date christmas = DateBuilder.dateOf(0, 0, 0, 25, 12, 2030);
        holidays.addExcludedDate(christmas);
        holidays.setDescription("public holidays");

        store.storeCalendar("holidays", holidays, false, false);

        Calendar stored = store.retrieveCalendar("holidays");
        assertTrue(stored instanceof HolidayCalendar);
        assertEquals("public holidays", stored.getDescription());
        assertFalse(stored.isTimeIncluded(christmas.getTime() + 1000));
        assertEquals(1, store.getNumberOfCalendars());
        assertEquals(1, store.getCalendarNames().size());
        assertEquals("holidays", store.getCalendarNames().get(0));
        assertNull(store.retrieveCalendar("missing"));
    }

    @Test(expected = ObjectAlreadyExistsException.class)
    public void testDuplicateCalendarIsRejected() throws Exception {
        store.storeCalendar("weekly", new WeeklyCalendar(), false, false);
        store.storeCalendar("weekly", new WeeklyCalendar(), false, false);
    }

    @Test
    public void testReplacingCalendar() throws Exception {
        store.storeCalendar("cal", new WeeklyCalendar(), false, false);
        store.storeCalendar("cal", new HolidayCalendar(), true, false);

        assertTrue(store.retrieveCalendar("cal") instanceof HolidayCalendar);
        assertEquals(1, store.getNumberOfCalendars());
    }

    @Test
    public void testReferencedCalendarCannotBeRemoved() throws Exception {
        store.storeCalendar("holidays", new HolidayCalendar(), false, false);
        OperableTrigger trigger = storeDailyTrigger("holidays", DateBuilder.tomorrowAt(12, 0, 0));

        try {
            store.removeCalendar("holidays");
            fail("Calendar in use must not be removed");
        } catch (JobPersistenceException expected) {
            assertNotNull(store.retrieveCalendar("holidays"));
        }

        store.removeTrigger(trigger.getKey());
        assertTrue(store.removeCalendar("holidays"));
        assertFalse(store.removeCalendar("holidays"));
        assertEquals(0, store.getNumberOfCalendars());
    }

    @Test
    public void testUpdatingCalendarReschedulesItsTriggers() throws Exception {
        Date start = DateBuilder.tomorrowAt(12, 0, 0);
        store.storeCalendar("holidays", new HolidayCalendar(), false, false);
        OperableTrigger trigger = storeDailyTrigger("holidays", start);

        HolidayCalendar holidays = new HolidayCalendar();
        holidays.addExcludedDate(start);
        store.storeCalendar("holidays", holidays, true, true);

        OperableTrigger stored = store.retrieveTrigger(trigger.getKey());
        assertEquals(start.getTime() + DAY, stored.getNextFireTime().getTime());
        assertEquals(STATE_WAITING, storedState(trigger.getKey()));
    }

    @Test
    public void testReplacingCalendarWithoutUpdateKeepsFireTimes() throws Exception {
        Date start = DateBuilder.tomorrowAt(12, 0, 0);
        store.storeCalendar("holidays", new HolidayCalendar(), false, false);
        OperableTrigger trigger = storeDailyTrigger("holidays", start);

        HolidayCalendar holidays = new HolidayCalendar();
        holidays.addExcludedDate(start);
        store.storeCalendar("holidays", holidays, true, false);

        assertEquals(start, store.retrieveTrigger(trigger.getKey()).getNextFireTime());
    }
}
