package com.novemberain.scheduling.util;

import java.util.Date;

/**
 * Source of the current time for stores, misfire checks and the dispatch loop.
 */
public abstract class Clock {

    public abstract long millis();

    public Date now() {
        return new Date(millis());
    }

    public static final Clock SYSTEM_CLOCK = new Clock() {
        @Override
        public long millis() {
            return System.currentTimeMillis();
        }
    };

    /**
     * Clock stuck at the given instant.
     */
    public static Clock fixed(final long millis) {
        return new Clock() {
            @Override
            public long millis() {
                return millis;
            }
        };
    }
}
