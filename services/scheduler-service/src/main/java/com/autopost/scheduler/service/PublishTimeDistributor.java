package com.autopost.scheduler.service;

import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Spreads a batch of posts over consecutive days inside the daily posting window.
 *
 * <p>Posts are grouped into buckets of {@code postsPerDay}. Each bucket is spaced evenly
 * across what is left of its day's window, never closer than the minimum interval. A
 * bucket that does not fit moves to the next day's full window and every later bucket
 * moves with it.
 */
@Component
@Slf4j
public class PublishTimeDistributor {

    private final AutopostProperties.Posting posting;
    private final Clock clock;

    @Autowired
    public PublishTimeDistributor(AutopostProperties properties, Clock clock) {
        this(properties.getPosting(), clock);
    }

    PublishTimeDistributor(AutopostProperties.Posting posting, Clock clock) {
        this.posting = posting;
        this.clock = clock;
    }

    public record Slot(int postIndex, ZonedDateTime time) {

        public OffsetDateTime offsetTime() {
            return time.toOffsetDateTime();
        }
    }

    /**
     * @param count       number of posts in the batch
     * @param postsPerDay posts per day, or null for the configured default
     * @param startTime   earliest publish time, or null for now
     * @return one slot per post that received a future time, in post order
     */
    public List<Slot> distribute(int count, Integer postsPerDay, OffsetDateTime startTime) {
        int perDay = postsPerDay != null ? postsPerDay : posting.getDefaultPostsPerDay();
        validate(perDay);
        if (count <= 0) {
            return List.of();
        }

        ZoneId zone = clock.getZone();
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime start = startTime != null ? startTime.atZoneSameInstant(zone) : now;
        if (start.isBefore(now)) {
            start = now;
        }

        Duration minInterval = minIntervalMinutes();
        ZonedDateTime dayStart = clampToWindow(start, minInterval).truncatedTo(ChronoUnit.MINUTES);

        List<Slot> slots = new ArrayList<>();
        int index = 0;
        while (index < count) {
            int bucketSize = Math.min(perDay, count - index);

            Duration remaining = Duration.between(dayStart, windowEnd(dayStart.toLocalDate(), zone));
            if (remaining.compareTo(minInterval.multipliedBy(bucketSize)) < 0) {
                log.debug("Only {} min left on {} for {} post(s), moving to next day",
                        remaining.toMinutes(), dayStart.toLocalDate(), bucketSize);
                dayStart = windowStart(dayStart.toLocalDate().plusDays(1), zone);
                remaining = Duration.between(dayStart, windowEnd(dayStart.toLocalDate(), zone));
            }

            Duration interval = Duration.ofMinutes(remaining.toMinutes() / bucketSize);
            if (interval.compareTo(minInterval) < 0) {
                interval = minInterval;
            }

            for (int i = 0; i < bucketSize; i++, index++) {
                ZonedDateTime time = dayStart.plus(interval.multipliedBy(i));
                if (!time.isAfter(now)) {
                    log.warn("Slot {} for post #{} is already past, leaving the post unscheduled", time, index);
                    continue;
                }
                slots.add(new Slot(index, time));
            }

            dayStart = windowStart(dayStart.toLocalDate().plusDays(1), zone);
        }
        return slots;
    }

    /**
     * Most posts that fit into one full window at the minimum interval.
     */
    public int windowCapacity() {
        long windowMinutes = (long) (posting.getWindowEndHour() - posting.getWindowStartHour()) * 60;
        return (int) (windowMinutes / minIntervalMinutes().toMinutes());
    }

    private void validate(int perDay) {
        if (perDay < 1) {
            throw new ValidationException("postsPerDay must be at least 1");
        }
        if (perDay > posting.getMaxPostsPerDay()) {
            throw new ValidationException("postsPerDay must not exceed " + posting.getMaxPostsPerDay());
        }
        if (perDay > windowCapacity()) {
            throw new ValidationException("postsPerDay " + perDay + " does not fit the posting window ("
                    + windowCapacity() + " posts at most)");
        }
    }

    private ZonedDateTime clampToWindow(ZonedDateTime start, Duration minInterval) {
        LocalDate day = start.toLocalDate();
        ZonedDateTime windowStart = windowStart(day, start.getZone());
        if (start.isBefore(windowStart)) {
            return windowStart;
        }
        if (!start.isBefore(windowEnd(day, start.getZone()))) {
            return windowStart(day.plusDays(1), start.getZone());
        }
        return start.plus(minInterval);
    }

    private Duration minIntervalMinutes() {
        long minutes = Math.max(1, posting.getMinPostInterval().toMinutes());
        return Duration.ofMinutes(minutes);
    }

    private ZonedDateTime windowStart(LocalDate day, ZoneId zone) {
        return day.atStartOfDay(zone).withHour(posting.getWindowStartHour());
    }

    private ZonedDateTime windowEnd(LocalDate day, ZoneId zone) {
        return day.atStartOfDay(zone).withHour(posting.getWindowEndHour());
    }
}
