package com.autopost.scheduler.ratelimit;

import java.time.Duration;

/**
 * Blocking pause used by the rate limiter, the quota guard and the publish loop.
 * Tests replace it to record waits instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        long millis = duration.toMillis();
        if (duration.minusMillis(millis).getNano() > 0) {
            millis++;
        }
        Thread.sleep(millis);
    };

    void sleep(Duration duration) throws InterruptedException;
}
