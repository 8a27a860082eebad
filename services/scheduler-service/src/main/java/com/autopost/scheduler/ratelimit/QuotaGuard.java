package com.autopost.scheduler.ratelimit;

import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.exception.QuotaExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs calls to a quota-limited service behind the shared {@link RateLimiter} and retries
 * them with backoff while the service reports an exhausted quota.
 */
@Component
@Slf4j
public class QuotaGuard {

    private final RateLimiter rateLimiter;
    private final Sleeper sleeper;
    private final QuotaRetryPolicy interactivePolicy;
    private final QuotaRetryPolicy batchPolicy;

    public QuotaGuard(RateLimiter rateLimiter, Sleeper sleeper, AutopostProperties properties) {
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
        this.interactivePolicy = QuotaRetryPolicy.interactive(properties.getQuota());
        this.batchPolicy = QuotaRetryPolicy.batch(properties.getQuota());
    }

    public <T> T call(String operation, CallMode mode, Supplier<T> call) throws InterruptedException {
        QuotaRetryPolicy policy = mode == CallMode.BATCH ? batchPolicy : interactivePolicy;
        int attempt = 0;
        while (true) {
            rateLimiter.waitIfNeeded();
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!QuotaRetryPolicy.isQuotaExceeded(e.getMessage())) {
                    throw e;
                }
                attempt++;
                if (!policy.canRetryAfter(attempt)) {
                    log.warn("{}: quota still exhausted after {} attempts", operation, attempt);
                    throw new QuotaExceededException(
                            operation + " failed: quota exhausted after " + attempt + " attempts", e);
                }
                Duration delay = policy.delayFor(e.getMessage(), attempt - 1);
                log.info("{}: quota exhausted, retrying in {} s (attempt {})", operation, delay.toSeconds(), attempt + 1);
                waitOut(operation, delay, mode, policy.getProgressChunk());
            }
        }
    }

    private void waitOut(String operation, Duration delay, CallMode mode, Duration chunk) throws InterruptedException {
        if (mode == CallMode.INTERACTIVE || chunk == null || delay.compareTo(chunk) <= 0) {
            sleeper.sleep(delay);
            return;
        }
        Duration remaining = delay;
        while (!remaining.isZero() && !remaining.isNegative()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException(operation + " cancelled while waiting for quota");
            }
            Duration step = remaining.compareTo(chunk) < 0 ? remaining : chunk;
            sleeper.sleep(step);
            remaining = remaining.minus(step);
            if (!remaining.isZero() && !remaining.isNegative()) {
                log.info("{}: {} s left before retry", operation, remaining.toSeconds());
            }
        }
    }
}
