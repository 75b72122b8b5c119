package com.novemberain.quartz.store.trigger;

import com.novemberain.quartz.store.Constants;
import com.novemberain.quartz.store.JobDataConverter;
import com.novemberain.quartz.store.util.Keys;
import org.bson.Document;
import org.quartz.JobPersistenceException;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.novemberain.quartz.store.util.Keys.KEY_GROUP;
import static com.novemberain.quartz.store.util.Keys.KEY_NAME;

public class TriggerConverter {

    public static final String TRIGGER_TYPE = "type";
    private static final String TRIGGER_DESCRIPTION = "description";
    private static final String TRIGGER_END_TIME = "endTime";
    private static final String TRIGGER_FINAL_FIRE_TIME = "finalFireTime";
    private static final String TRIGGER_PREVIOUS_FIRE_TIME = "previousFireTime";
    private static final String TRIGGER_START_TIME = "startTime";

    private static final Logger log = LoggerFactory.getLogger(TriggerConverter.class);

    private final JobDataConverter jobDataConverter;

    public TriggerConverter(JobDataConverter jobDataConverter) {
        this.jobDataConverter = jobDataConverter;
    }

    /**
     * Converts trigger into document carrying the given state.
     * Depending on the config, job data map can be stored
     * as a {@code base64} encoded (default) or plain object.
     */
    public Document toDocument(OperableTrigger newTrigger, String state)
            throws JobPersistenceException {
        TriggerPropertiesConverter tpd = TriggerPropertiesConverter.getConverterFor(newTrigger);

        Document trigger = convertToBson(newTrigger, state);
        trigger.put(TRIGGER_TYPE, tpd.getType());
        jobDataConverter.toDocument(newTrigger.getJobDataMap(), trigger);
        return tpd.injectExtraPropertiesForInsert(newTrigger, trigger);
    }

    /**
     * Restores trigger from a stored document.
     *
     * @throws JobPersistenceException if could not construct trigger instance
     * or could not deserialize job data map.
     */
    public OperableTrigger toTrigger(Document triggerDoc) throws JobPersistenceException {
        TriggerPropertiesConverter tpd =
                TriggerPropertiesConverter.getConverterFor(triggerDoc.getString(TRIGGER_TYPE));
        OperableTrigger trigger = tpd.newTrigger(triggerDoc);

        loadCommonProperties(Keys.toTriggerKey(triggerDoc), triggerDoc, trigger);

        trigger.getJobDataMap().clear();
        jobDataConverter.toJobData(triggerDoc, trigger.getJobDataMap());

        loadStartAndEndTime(triggerDoc, trigger);

        tpd.setExtraPropertiesAfterInstantiation(trigger, triggerDoc);

        trigger.getJobDataMap().clearDirtyFlag();
        return trigger;
    }

    private Document convertToBson(OperableTrigger newTrigger, String state) {
        Document trigger = new Document();
        trigger.put(KEY_NAME, newTrigger.getKey().getName());
        trigger.put(KEY_GROUP, newTrigger.getKey().getGroup());
        trigger.put(Constants.TRIGGER_JOB_NAME, newTrigger.getJobKey().getName());
        trigger.put(Constants.TRIGGER_JOB_GROUP, newTrigger.getJobKey().getGroup());
        trigger.put(Constants.TRIGGER_STATE, state);
        trigger.put(Constants.TRIGGER_CALENDAR_NAME, newTrigger.getCalendarName());
        trigger.put(TRIGGER_DESCRIPTION, newTrigger.getDescription());
        trigger.put(TRIGGER_END_TIME, newTrigger.getEndTime());
        trigger.put(TRIGGER_FINAL_FIRE_TIME, newTrigger.getFinalFireTime());
        trigger.put(Constants.TRIGGER_MISFIRE_INSTRUCTION, newTrigger.getMisfireInstruction());
        trigger.put(Constants.TRIGGER_NEXT_FIRE_TIME, newTrigger.getNextFireTime());
        trigger.put(TRIGGER_PREVIOUS_FIRE_TIME, newTrigger.getPreviousFireTime());
        trigger.put(Constants.TRIGGER_PRIORITY, newTrigger.getPriority());
        trigger.put(TRIGGER_START_TIME, newTrigger.getStartTime());
        return trigger;
    }

    private void loadCommonProperties(TriggerKey triggerKey, Document triggerDoc, OperableTrigger trigger) {
        trigger.setKey(triggerKey);
        trigger.setJobKey(Keys.toJobKeyOfTrigger(triggerDoc));
        trigger.setCalendarName(triggerDoc.getString(Constants.TRIGGER_CALENDAR_NAME));
        trigger.setDescription(triggerDoc.getString(TRIGGER_DESCRIPTION));
        trigger.setMisfireInstruction(triggerDoc.getInteger(Constants.TRIGGER_MISFIRE_INSTRUCTION, 0));
        trigger.setNextFireTime(triggerDoc.getDate(Constants.TRIGGER_NEXT_FIRE_TIME));
        trigger.setPreviousFireTime(triggerDoc.getDate(TRIGGER_PREVIOUS_FIRE_TIME));
        trigger.setPriority(triggerDoc.getInteger(Constants.TRIGGER_PRIORITY, 5));
    }

    private void loadStartAndEndTime(Document triggerDoc, OperableTrigger trigger) {
        try {
            trigger.setStartTime(triggerDoc.getDate(TRIGGER_START_TIME));
            trigger.setEndTime(triggerDoc.getDate(TRIGGER_END_TIME));
        } catch (IllegalArgumentException e) {
            //Ignore illegal arg exceptions thrown by triggers doing JIT validation of start and endtime
            log.warn("Trigger had illegal start / end time combination: {}", trigger.getKey(), e);
        }
    }
}
