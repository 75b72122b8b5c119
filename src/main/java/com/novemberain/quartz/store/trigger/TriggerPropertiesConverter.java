package com.novemberain.quartz.store.trigger;

import com.novemberain.quartz.store.CorruptJobDataException;
import com.novemberain.quartz.store.trigger.properties.BlobTriggerPropertiesConverter;
import com.novemberain.quartz.store.trigger.properties.CalendarIntervalTriggerPropertiesConverter;
import com.novemberain.quartz.store.trigger.properties.CronTriggerPropertiesConverter;
import com.novemberain.quartz.store.trigger.properties.DailyTimeIntervalTriggerPropertiesConverter;
import com.novemberain.quartz.store.trigger.properties.SimpleTriggerPropertiesConverter;
import org.bson.Document;
import org.quartz.JobPersistenceException;
import org.quartz.spi.OperableTrigger;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Converts trigger type specific properties. Each converter owns one type
 * discriminator stored with the trigger; the blob converter comes last and
 * accepts any trigger.
 */
public abstract class TriggerPropertiesConverter {

    private static final List<TriggerPropertiesConverter> propertiesConverters = Arrays.asList(
            new SimpleTriggerPropertiesConverter(),
            new CalendarIntervalTriggerPropertiesConverter(),
            new CronTriggerPropertiesConverter(),
            new DailyTimeIntervalTriggerPropertiesConverter(),
            new BlobTriggerPropertiesConverter());

    /**
     * Returns properties converter for given trigger.
     * @param trigger    a trigger instance
     * @return converter, never null
     */
    public static TriggerPropertiesConverter getConverterFor(OperableTrigger trigger) {
        for (TriggerPropertiesConverter converter : propertiesConverters) {
            if (converter.canHandle(trigger)) {
                return converter;
            }
        }
        throw new IllegalStateException("No converter for " + trigger.getClass().getName());
    }

    /**
     * Returns properties converter registered for the stored type discriminator.
     * @throws CorruptJobDataException for an unknown discriminator
     */
    public static TriggerPropertiesConverter getConverterFor(String type) throws CorruptJobDataException {
        for (TriggerPropertiesConverter converter : propertiesConverters) {
            if (converter.getType().equals(type)) {
                return converter;
            }
        }
        throw new CorruptJobDataException("Unknown trigger type: " + type);
    }

    public abstract String getType();

    protected abstract boolean canHandle(OperableTrigger trigger);

    /**
     * Creates an empty trigger of this converter's type.
     */
    public abstract OperableTrigger newTrigger(Document stored) throws JobPersistenceException;

    public abstract Document injectExtraPropertiesForInsert(OperableTrigger trigger, Document original)
            throws JobPersistenceException;

    public abstract void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, Document stored)
            throws JobPersistenceException;

    /**
     * Passes the stored value to {@code setter}, unless the field is absent.
     */
    protected static <T> void restore(Document stored, String field, Class<T> type, Consumer<T> setter) {
        T value = stored.get(field, type);
        if (value != null) {
            setter.accept(value);
        }
    }
}
