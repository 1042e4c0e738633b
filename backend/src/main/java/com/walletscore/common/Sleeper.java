package com.walletscore.common;

import java.time.Duration;

/**
 * Blocking pause used by the rate limiter and retry loop. Replaced by a fake in tests so timing is deterministic.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeper backed by {@link Thread#sleep(long, int)}.
     */
    static Sleeper threadSleep() {
        return duration -> {
            if (duration.isNegative() || duration.isZero()) {
                return;
            }
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        };
    }
}
