package com.walletscore.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Minimum-interval rate limiter for explorer API calls. The upstream budget belongs to the API key, so a single
 * instance is shared by every wallet and every in-flight request in the process.
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final AtomicLong nextFreeAtNanos;

    /**
     * @param minInterval minimum spacing between two permits, e.g. 400ms for 3 calls/sec with headroom
     */
    public RateLimiter(Duration minInterval) {
        this(minInterval, System::nanoTime, Sleeper.threadSleep());
    }

    public RateLimiter(Duration minInterval, LongSupplier nanoClock, Sleeper sleeper) {
        if (minInterval == null || minInterval.isNegative() || minInterval.isZero()) {
            throw new IllegalArgumentException("minInterval must be positive");
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.nextFreeAtNanos = new AtomicLong(nanoClock.getAsLong());
    }

    /**
     * Blocks until at least the minimum interval has passed since the previous permit, then takes a permit.
     */
    public void acquire() {
        long now;
        long next;
        do {
            now = nanoClock.getAsLong();
            next = nextFreeAtNanos.get();
            if (now - next >= 0) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
            } else {
                try {
                    sleeper.sleep(Duration.ofNanos(next - now));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Rate limiter interrupted", e);
                }
            }
        } while (true);
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
