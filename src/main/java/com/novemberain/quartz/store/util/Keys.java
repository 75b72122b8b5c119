package com.novemberain.quartz.store.util;

import com.mongodb.client.model.Filters;
import com.novemberain.quartz.store.Constants;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.quartz.utils.Key;

public class Keys {

    public static final String KEY_NAME = "keyName";
    public static final String KEY_GROUP = "keyGroup";

    public static Bson toFilter(Key<?> key) {
        return Filters.and(
                Filters.eq(KEY_GROUP, key.getGroup()),
                Filters.eq(KEY_NAME, key.getName()));
    }

    /**
     * Selects trigger documents pointing at the given job.
     */
    public static Bson triggersOf(JobKey jobKey) {
        return Filters.and(
                Filters.eq(Constants.TRIGGER_JOB_GROUP, jobKey.getGroup()),
                Filters.eq(Constants.TRIGGER_JOB_NAME, jobKey.getName()));
    }

    public static Document toDocument(Key<?> key) {
        return new Document(KEY_NAME, key.getName()).append(KEY_GROUP, key.getGroup());
    }

    public static JobKey toJobKey(Document dbo) {
        return new JobKey(dbo.getString(KEY_NAME), dbo.getString(KEY_GROUP));
    }

    public static TriggerKey toTriggerKey(Document dbo) {
        return new TriggerKey(dbo.getString(KEY_NAME), dbo.getString(KEY_GROUP));
    }

    public static JobKey toJobKeyOfTrigger(Document trigger) {
        return new JobKey(trigger.getString(Constants.TRIGGER_JOB_NAME),
                trigger.getString(Constants.TRIGGER_JOB_GROUP));
    }
}
