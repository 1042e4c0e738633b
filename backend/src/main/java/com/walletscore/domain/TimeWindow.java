package com.walletscore.domain;

/**
 * Inclusive [startTs, endTs] interval of unix seconds.
 */
public record TimeWindow(long startTs, long endTs) {

    public static final long SECONDS_PER_DAY = 86_400L;

    public TimeWindow {
        if (startTs > endTs) {
            throw new IllegalArgumentException("startTs must not be after endTs: " + startTs + " > " + endTs);
        }
    }

    /**
     * Window of windowDays ending offsetDays before nowTs.
     */
    public static TimeWindow of(long nowTs, int offsetDays, int windowDays) {
        if (offsetDays < 0 || windowDays < 0) {
            throw new IllegalArgumentException("offsetDays and windowDays must be non-negative");
        }
        long end = nowTs - offsetDays * SECONDS_PER_DAY;
        long start = end - windowDays * SECONDS_PER_DAY;
        return new TimeWindow(start, end);
    }

    public boolean contains(long ts) {
        return ts >= startTs && ts <= endTs;
    }
}
