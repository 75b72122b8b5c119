package com.novemberain.quartz.store.trigger.properties;

import com.novemberain.quartz.store.trigger.TriggerPropertiesConverter;
import com.novemberain.quartz.store.util.SerialUtils;
import org.bson.Document;
import org.quartz.JobPersistenceException;
import org.quartz.spi.OperableTrigger;

/**
 * Stores triggers of any other type as a whole, serialized.
 */
public class BlobTriggerPropertiesConverter extends TriggerPropertiesConverter {

    private static final String TRIGGER_BLOB = "blob";

    @Override
    public String getType() {
        return "BLOB";
    }

    @Override
    protected boolean canHandle(OperableTrigger trigger) {
        return true;
    }

    @Override
    public OperableTrigger newTrigger(Document stored) throws JobPersistenceException {
        return SerialUtils.deserialize(stored.get(TRIGGER_BLOB, byte[].class), OperableTrigger.class);
    }

    @Override
    public Document injectExtraPropertiesForInsert(OperableTrigger trigger, Document original)
            throws JobPersistenceException {
        return new Document(original).append(TRIGGER_BLOB, SerialUtils.serialize(trigger));
    }

    @Override
    public void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, Document stored) {
        // Everything was restored by newTrigger().
    }
}
