package com.novemberain.quartz.store.trigger.properties;

import com.novemberain.quartz.store.CorruptJobDataException;
import com.novemberain.quartz.store.trigger.TriggerPropertiesConverter;
import org.bson.Document;
import org.quartz.CronTrigger;
import org.quartz.impl.triggers.CronTriggerImpl;
import org.quartz.spi.OperableTrigger;

import java.text.ParseException;
import java.util.TimeZone;

public class CronTriggerPropertiesConverter extends TriggerPropertiesConverter {

    private static final String TRIGGER_CRON_EXPRESSION = "cronExpression";
    private static final String TRIGGER_TIMEZONE = "timezone";

    @Override
    public String getType() {
        return "CRON";
    }

    @Override
    protected boolean canHandle(OperableTrigger trigger) {
        return trigger.getClass() == CronTriggerImpl.class
                && !((CronTriggerImpl) trigger).hasAdditionalProperties();
    }

    @Override
    public OperableTrigger newTrigger(Document stored) {
        return new CronTriggerImpl();
    }

    @Override
    public Document injectExtraPropertiesForInsert(OperableTrigger trigger, Document original) {
        CronTrigger t = (CronTrigger) trigger;

        return new Document(original)
                .append(TRIGGER_CRON_EXPRESSION, t.getCronExpression())
                .append(TRIGGER_TIMEZONE, t.getTimeZone().getID());
    }

    @Override
    public void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, Document stored)
            throws CorruptJobDataException {
        CronTriggerImpl t = (CronTriggerImpl) trigger;

        // Time zone first, setCronExpression copies it into the expression.
        String tz = stored.getString(TRIGGER_TIMEZONE);
        if (tz != null) {
            t.setTimeZone(TimeZone.getTimeZone(tz));
        }
        String expression = stored.getString(TRIGGER_CRON_EXPRESSION);
        if (expression != null) {
            try {
                t.setCronExpression(expression);
            } catch (ParseException e) {
                throw new CorruptJobDataException("Stored cron expression of trigger "
                        + t.getKey() + " is invalid: " + expression, e);
            }
        }
    }
}
