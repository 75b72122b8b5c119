package com.novemberain.quartz.store.util;

import java.util.Date;

/**
 * Source of the current time for everything the store schedules or compares.
 */
public abstract class Clock {

    public static final Clock SYSTEM_CLOCK = new Clock() {
        @Override
        public long millis() {
            return System.currentTimeMillis();
        }
    };

    public abstract long millis();

    public Date now() {
        return new Date(millis());
    }

    /**
     * Milliseconds passed since {@code startMillis}, as measured by this clock.
     */
    public long elapsedSince(long startMillis) {
        return millis() - startMillis;
    }
}
