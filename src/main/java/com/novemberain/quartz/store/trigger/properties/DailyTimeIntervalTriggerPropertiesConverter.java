package com.novemberain.quartz.store.trigger.properties;

import com.novemberain.quartz.store.trigger.TriggerPropertiesConverter;
import org.bson.Document;
import org.quartz.DateBuilder.IntervalUnit;
import org.quartz.TimeOfDay;
import org.quartz.impl.triggers.DailyTimeIntervalTriggerImpl;
import org.quartz.spi.OperableTrigger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Times of day are kept as {hour, minute, second} sub-documents.
 */
public class DailyTimeIntervalTriggerPropertiesConverter extends TriggerPropertiesConverter {

    private static final String INTERVAL_UNIT = "repeatIntervalUnit";
    private static final String INTERVAL = "repeatInterval";
    private static final String REPEAT_COUNT = "repeatCount";
    private static final String TIMES_TRIGGERED = "timesTriggered";
    private static final String START_TIME_OF_DAY = "startTimeOfDay";
    private static final String END_TIME_OF_DAY = "endTimeOfDay";
    private static final String DAYS_OF_WEEK = "daysOfWeek";

    private static final String HOUR = "hour";
    private static final String MINUTE = "minute";
    private static final String SECOND = "second";

    @Override
    public String getType() {
        return "DAILY_I";
    }

    @Override
    protected boolean canHandle(OperableTrigger trigger) {
        return trigger.getClass() == DailyTimeIntervalTriggerImpl.class
                && !((DailyTimeIntervalTriggerImpl) trigger).hasAdditionalProperties();
    }

    @Override
    public OperableTrigger newTrigger(Document stored) {
        return new DailyTimeIntervalTriggerImpl();
    }

    @Override
    public Document injectExtraPropertiesForInsert(OperableTrigger trigger, Document original) {
        DailyTimeIntervalTriggerImpl daily = (DailyTimeIntervalTriggerImpl) trigger;
        Document withProperties = new Document(original);
        withProperties.put(INTERVAL_UNIT, daily.getRepeatIntervalUnit().name());
        withProperties.put(INTERVAL, daily.getRepeatInterval());
        withProperties.put(REPEAT_COUNT, daily.getRepeatCount());
        withProperties.put(TIMES_TRIGGERED, daily.getTimesTriggered());
        withProperties.put(START_TIME_OF_DAY, timeOfDayDocument(daily.getStartTimeOfDay()));
        withProperties.put(END_TIME_OF_DAY, timeOfDayDocument(daily.getEndTimeOfDay()));
        withProperties.put(DAYS_OF_WEEK, new ArrayList<>(daily.getDaysOfWeek()));
        return withProperties;
    }

    @Override
    public void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, Document stored) {
        final DailyTimeIntervalTriggerImpl daily = (DailyTimeIntervalTriggerImpl) trigger;
        restore(stored, INTERVAL_UNIT, String.class,
                unit -> daily.setRepeatIntervalUnit(IntervalUnit.valueOf(unit)));
        restore(stored, INTERVAL, Integer.class, daily::setRepeatInterval);
        restore(stored, REPEAT_COUNT, Integer.class, daily::setRepeatCount);
        restore(stored, TIMES_TRIGGERED, Integer.class, daily::setTimesTriggered);
        restore(stored, START_TIME_OF_DAY, Document.class,
                tod -> daily.setStartTimeOfDay(timeOfDay(tod)));
        restore(stored, END_TIME_OF_DAY, Document.class,
                tod -> daily.setEndTimeOfDay(timeOfDay(tod)));

        List<Integer> days = stored.getList(DAYS_OF_WEEK, Integer.class);
        if (days != null) {
            daily.setDaysOfWeek(new HashSet<>(days));
        }
    }

    private static Document timeOfDayDocument(TimeOfDay timeOfDay) {
        return new Document(HOUR, timeOfDay.getHour())
                .append(MINUTE, timeOfDay.getMinute())
                .append(SECOND, timeOfDay.getSecond());
    }

    private static TimeOfDay timeOfDay(Document stored) {
        return new TimeOfDay(stored.getInteger(HOUR), stored.getInteger(MINUTE), stored.getInteger(SECOND));
    }
}
