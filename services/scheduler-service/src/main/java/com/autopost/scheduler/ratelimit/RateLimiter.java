package com.autopost.scheduler.ratelimit;

import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.dto.RateLimiterStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps a minimum spacing between calls to a quota-limited service and counts the calls
 * made in the current window. State is in memory and starts over on restart.
 *
 * <p>Spacing comes from a warm-up Guava token bucket at one permit per interval. A permit never
 * costs less than the interval, so calls are at least {@code minInterval} apart, a little more
 * right after an idle spell.
 */
@Component
@Slf4j
public class RateLimiter {

    private final com.google.common.util.concurrent.RateLimiter throttle;
    private final Duration window;
    private final Clock clock;
    private final ReentrantLock statsLock = new ReentrantLock();

    private OffsetDateTime lastCallTime;
    private OffsetDateTime windowResetTime;
    private long count;

    @Autowired
    public RateLimiter(AutopostProperties properties, Clock clock) {
        this(properties.getRateLimiter().getMinInterval(), properties.getRateLimiter().getWindow(), clock);
    }

    public RateLimiter(Duration minInterval, Duration window, Clock clock) {
        this.throttle = minInterval.isZero() || minInterval.isNegative()
                ? null
                : com.google.common.util.concurrent.RateLimiter.create(1_000_000_000d / minInterval.toNanos(), minInterval);
        this.window = window;
        this.clock = clock;
        this.windowResetTime = OffsetDateTime.now(clock).plus(window);
    }

    /**
     * Blocks until the minimum interval has passed since the previous call was let through.
     *
     * @throws InterruptedException if the caller was interrupted before taking its turn
     */
    public void waitIfNeeded() throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted while waiting for the rate limiter");
        }
        if (throttle != null) {
            double waitedSeconds = throttle.acquire();
            if (waitedSeconds > 0) {
                log.debug("Rate limiter: waited {} ms before call", Math.round(waitedSeconds * 1000));
            }
        }
        recordCall();
    }

    public RateLimiterStats stats() {
        statsLock.lock();
        try {
            return RateLimiterStats.builder()
                    .count(count)
                    .lastCallTime(lastCallTime)
                    .windowResetTime(windowResetTime)
                    .build();
        } finally {
            statsLock.unlock();
        }
    }

    private void recordCall() {
        statsLock.lock();
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            if (!now.isBefore(windowResetTime)) {
                count = 0;
                windowResetTime = now.plus(window);
            }
            lastCallTime = now;
            count++;
        } finally {
            statsLock.unlock();
        }
    }
}
