package com.novemberain.quartz.store.trigger.properties;

import com.novemberain.quartz.store.trigger.TriggerPropertiesConverter;
import org.bson.Document;
import org.quartz.DateBuilder.IntervalUnit;
import org.quartz.impl.triggers.CalendarIntervalTriggerImpl;
import org.quartz.spi.OperableTrigger;

import java.util.TimeZone;

public class CalendarIntervalTriggerPropertiesConverter extends TriggerPropertiesConverter {

    private static final String INTERVAL_UNIT = "repeatIntervalUnit";
    private static final String INTERVAL = "repeatInterval";
    private static final String TIMES_TRIGGERED = "timesTriggered";
    private static final String TIME_ZONE = "timezone";
    private static final String PRESERVE_HOUR_OF_DAY = "preserveHourOfDayAcrossDaylightSavings";
    private static final String SKIP_MISSING_HOUR = "skipDayIfHourDoesNotExist";

    @Override
    public String getType() {
        return "CAL_INT";
    }

    @Override
    protected boolean canHandle(OperableTrigger trigger) {
        return trigger.getClass() == CalendarIntervalTriggerImpl.class
                && !((CalendarIntervalTriggerImpl) trigger).hasAdditionalProperties();
    }

    @Override
    public OperableTrigger newTrigger(Document stored) {
        return new CalendarIntervalTriggerImpl();
    }

    @Override
    public Document injectExtraPropertiesForInsert(OperableTrigger trigger, Document original) {
        CalendarIntervalTriggerImpl calendarInterval = (CalendarIntervalTriggerImpl) trigger;
        Document withProperties = new Document(original);
        withProperties.put(INTERVAL_UNIT, calendarInterval.getRepeatIntervalUnit().name());
        withProperties.put(INTERVAL, calendarInterval.getRepeatInterval());
        withProperties.put(TIMES_TRIGGERED, calendarInterval.getTimesTriggered());
        withProperties.put(TIME_ZONE, calendarInterval.getTimeZone().getID());
        withProperties.put(PRESERVE_HOUR_OF_DAY, calendarInterval.isPreserveHourOfDayAcrossDaylightSavings());
        withProperties.put(SKIP_MISSING_HOUR, calendarInterval.isSkipDayIfHourDoesNotExist());
        return withProperties;
    }

    @Override
    public void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, Document stored) {
        final CalendarIntervalTriggerImpl calendarInterval = (CalendarIntervalTriggerImpl) trigger;
        restore(stored, INTERVAL_UNIT, String.class,
                unit -> calendarInterval.setRepeatIntervalUnit(IntervalUnit.valueOf(unit)));
        restore(stored, INTERVAL, Integer.class, calendarInterval::setRepeatInterval);
        restore(stored, TIMES_TRIGGERED, Integer.class, calendarInterval::setTimesTriggered);
        restore(stored, TIME_ZONE, String.class,
                zone -> calendarInterval.setTimeZone(TimeZone.getTimeZone(zone)));
        calendarInterval.setPreserveHourOfDayAcrossDaylightSavings(stored.getBoolean(PRESERVE_HOUR_OF_DAY, false));
        calendarInterval.setSkipDayIfHourDoesNotExist(stored.getBoolean(SKIP_MISSING_HOUR, false));
    }
}
