package com.autopost.scheduler.service;

import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.exception.HardPublishFailureException;
import com.autopost.scheduler.exception.TimingViolationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Per-account pacing enforced right before a publish: a daily cap and a minimum gap
 * after the account's last publish of the day.
 */
@Component
@RequiredArgsConstructor
public class PostingLimitGuard {

    private final PostStore postStore;
    private final AutopostProperties properties;
    private final Clock clock;

    public void check(String accountId) {
        AutopostProperties.Posting posting = properties.getPosting();
        ZonedDateTime now = ZonedDateTime.now(clock);
        OffsetDateTime startOfDay = now.truncatedTo(ChronoUnit.DAYS).toOffsetDateTime();

        long publishedToday = postStore.countPublishedSince(accountId, startOfDay);
        if (publishedToday >= posting.getMaxPostsPerDay()) {
            throw new HardPublishFailureException("Daily limit reached: at most "
                    + posting.getMaxPostsPerDay() + " posts per day");
        }

        if (publishedToday > 0) {
            Optional<OffsetDateTime> last = postStore.lastPublishedTime(accountId);
            if (last.isPresent() && !last.get().isBefore(startOfDay)) {
                Duration elapsed = Duration.between(last.get(), now.toOffsetDateTime());
                if (elapsed.compareTo(posting.getMinPostInterval()) < 0) {
                    long minutesLeft = posting.getMinPostInterval().minus(elapsed).toMinutes() + 1;
                    throw new TimingViolationException("Too soon: wait " + minutesLeft + " more minute(s) before the next post");
                }
            }
        }
    }
}
