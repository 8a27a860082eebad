package com.autopost.scheduler.ratelimit;

import com.autopost.scheduler.config.AutopostProperties;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Backoff rules for calls rejected by a quota-limited service.
 */
@Getter
@Builder
public class QuotaRetryPolicy {

    private static final Pattern RETRY_IN = Pattern.compile("retry in (\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final List<String> QUOTA_MARKERS =
            List.of("429", "quota", "rate limit", "resource_exhausted", "too many requests");
    private static final int MAX_EXPONENT = 16;

    /**
     * Total attempts allowed, the first call included. Zero means unbounded.
     */
    private final int maxAttempts;
    private final Duration fallbackDelay;
    private final Duration safetyMargin;

    /**
     * Upper bound of a single wait, or null for no bound.
     */
    private final Duration maxWaitPerAttempt;
    private final Duration progressChunk;

    public static QuotaRetryPolicy interactive(AutopostProperties.Quota quota) {
        return QuotaRetryPolicy.builder()
                .maxAttempts(quota.getMaxInteractiveAttempts())
                .fallbackDelay(quota.getFallbackDelay())
                .safetyMargin(quota.getSafetyMargin())
                .maxWaitPerAttempt(quota.getMaxInteractiveWait())
                .progressChunk(quota.getProgressChunk())
                .build();
    }

    public static QuotaRetryPolicy batch(AutopostProperties.Quota quota) {
        return QuotaRetryPolicy.builder()
                .maxAttempts(0)
                .fallbackDelay(quota.getFallbackDelay())
                .safetyMargin(quota.getSafetyMargin())
                .maxWaitPerAttempt(null)
                .progressChunk(quota.getProgressChunk())
                .build();
    }

    public static boolean isQuotaExceeded(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return QUOTA_MARKERS.stream().anyMatch(lower::contains);
    }

    /**
     * @param attemptsMade attempts already made, the failed one included
     */
    public boolean canRetryAfter(int attemptsMade) {
        return maxAttempts <= 0 || attemptsMade < maxAttempts;
    }

    /**
     * Delay advertised by the service ("retry in 12.4s" gives 13 s), or the fallback delay.
     */
    public Duration suggestedDelay(String message) {
        if (message != null) {
            Matcher matcher = RETRY_IN.matcher(message);
            if (matcher.find()) {
                long seconds = (long) Math.min(Double.parseDouble(matcher.group(1)), Integer.MAX_VALUE);
                return Duration.ofSeconds(seconds + 1);
            }
        }
        return fallbackDelay;
    }

    /**
     * @param attempt zero-based index of the retry being prepared
     */
    public Duration delayFor(String message, int attempt) {
        long factor = 1L << Math.min(Math.max(attempt, 0), MAX_EXPONENT);
        Duration delay = suggestedDelay(message).multipliedBy(factor).plus(safetyMargin);
        if (maxWaitPerAttempt != null && delay.compareTo(maxWaitPerAttempt) > 0) {
            return maxWaitPerAttempt;
        }
        return delay;
    }
}
