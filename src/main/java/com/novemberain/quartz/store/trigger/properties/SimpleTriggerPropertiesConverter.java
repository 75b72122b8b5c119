package com.novemberain.quartz.store.trigger.properties;

import com.novemberain.quartz.store.trigger.TriggerPropertiesConverter;
import org.bson.Document;
import org.quartz.impl.triggers.SimpleTriggerImpl;
import org.quartz.spi.OperableTrigger;

/**
 * Repeat count and interval of {@link SimpleTriggerImpl}, with the number of
 * times it already fired so the remaining repeats survive a restart.
 */
public class SimpleTriggerPropertiesConverter extends TriggerPropertiesConverter {

    private static final String REPEAT_COUNT = "repeatCount";
    private static final String REPEAT_INTERVAL = "repeatInterval";
    private static final String TIMES_TRIGGERED = "timesTriggered";

    @Override
    public String getType() {
        return "SIMPLE";
    }

    @Override
    protected boolean canHandle(OperableTrigger trigger) {
        return trigger.getClass() == SimpleTriggerImpl.class
                && !((SimpleTriggerImpl) trigger).hasAdditionalProperties();
    }

    @Override
    public OperableTrigger newTrigger(Document stored) {
        return new SimpleTriggerImpl();
    }

    @Override
    public Document injectExtraPropertiesForInsert(OperableTrigger trigger, Document original) {
        SimpleTriggerImpl simple = (SimpleTriggerImpl) trigger;
        Document withProperties = new Document(original);
        withProperties.put(REPEAT_COUNT, simple.getRepeatCount());
        withProperties.put(REPEAT_INTERVAL, simple.getRepeatInterval());
        withProperties.put(TIMES_TRIGGERED, simple.getTimesTriggered());
        return withProperties;
    }

    @Override
    public void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, Document stored) {
        final SimpleTriggerImpl simple = (SimpleTriggerImpl) trigger;
        restore(stored, REPEAT_COUNT, Integer.class, simple::setRepeatCount);
        restore(stored, REPEAT_INTERVAL, Long.class, simple::setRepeatInterval);
        restore(stored, TIMES_TRIGGERED, Integer.class, simple::setTimesTriggered);
    }
}
