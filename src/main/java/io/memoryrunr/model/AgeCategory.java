package io.memoryrunr.model;

import java.time.Duration;

/**
 * Age buckets of a long-term record.
 */
public enum AgeCategory {
    RECENT,
    WEEK_OLD,
    MONTH_OLD,
    REMOTE;

    private static final long DAY = Duration.ofDays(1).toSeconds();
    private static final long WEEK = Duration.ofDays(7).toSeconds();
    private static final long MONTH = Duration.ofDays(30).toSeconds();

    public static AgeCategory of(long ageSeconds) {
        if (ageSeconds < DAY) return RECENT;
        if (ageSeconds < WEEK) return WEEK_OLD;
        if (ageSeconds < MONTH) return MONTH_OLD;
        return REMOTE;
    }
}
