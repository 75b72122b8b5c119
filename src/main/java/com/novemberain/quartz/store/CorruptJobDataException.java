package com.novemberain.quartz.store;

import org.quartz.JobPersistenceException;

/**
 * Stored job, trigger or calendar data could not be turned back into objects:
 * the class is missing or the serialized form is unreadable.
 */
public class CorruptJobDataException extends JobPersistenceException {

    public CorruptJobDataException(String msg) {
        super(msg);
    }

    public CorruptJobDataException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
