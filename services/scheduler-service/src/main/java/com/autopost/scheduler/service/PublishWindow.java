package com.autopost.scheduler.service;

import com.autopost.scheduler.config.AutopostProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Decides what the publish loop does with a scheduled post at a given moment.
 * Staleness is checked first, so a post is never both due and stale.
 */
@Component
public class PublishWindow {

    private final Duration earlyTolerance;
    private final Duration gracePeriod;
    private final Duration staleThreshold;

    @Autowired
    public PublishWindow(AutopostProperties properties) {
        this(properties.getPublisher().getEarlyTolerance(),
                properties.getPublisher().getGracePeriod(),
                properties.getPublisher().getStaleThreshold());
    }

    public PublishWindow(Duration earlyTolerance, Duration gracePeriod, Duration staleThreshold) {
        this.earlyTolerance = earlyTolerance;
        this.gracePeriod = gracePeriod;
        this.staleThreshold = staleThreshold;
    }

    public PublishDecision classify(OffsetDateTime scheduledTime, OffsetDateTime now) {
        Duration diff = Duration.between(scheduledTime, now);
        if (diff.compareTo(staleThreshold) > 0) {
            return PublishDecision.STALE;
        }
        if (diff.compareTo(earlyTolerance.negated()) < 0) {
            return PublishDecision.PENDING;
        }
        return PublishDecision.DUE;
    }

    /**
     * True for a due post published after the grace period.
     */
    public boolean isLate(OffsetDateTime scheduledTime, OffsetDateTime now) {
        return Duration.between(scheduledTime, now).compareTo(gracePeriod) > 0;
    }
}
