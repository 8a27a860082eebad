package com.autopost.scheduler.service;

import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PublishTimeDistributorTest {

    private final AutopostProperties.Posting posting = new AutopostProperties.Posting();

    private PublishTimeDistributor distributorAt(String instant) {
        return new PublishTimeDistributor(posting, Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
    }

    @Test
    void spreadsSevenPostsOverThreeDays() {
        List<PublishTimeDistributor.Slot> slots = distributorAt("2026-03-10T09:00:00Z").distribute(7, 3, null);

        assertEquals(List.of(
                "2026-03-10T09:30Z",
                "2026-03-10T14:00Z",
                "2026-03-10T18:30Z",
                "2026-03-11T08:00Z",
                "2026-03-11T13:00Z",
                "2026-03-11T18:00Z",
                "2026-03-12T08:00Z"
        ), times(slots));
        for (int i = 0; i < slots.size(); i++) {
            assertEquals(i, slots.get(i).postIndex());
        }
    }

    @Test
    void bucketThatDoesNotFitMovesToNextDay() {
        List<PublishTimeDistributor.Slot> slots = distributorAt("2026-03-10T22:00:00Z").distribute(3, 3, null);

        assertEquals(List.of(
                "2026-03-11T08:00Z",
                "2026-03-11T13:00Z",
                "2026-03-11T18:00Z"
        ), times(slots));
    }

    @Test
    void startBeforeWindowOpensAtWindowStart() {
        List<PublishTimeDistributor.Slot> slots = distributorAt("2026-03-10T05:00:00Z").distribute(2, 2, null);

        assertEquals(List.of("2026-03-10T08:00Z", "2026-03-10T15:30Z"), times(slots));
    }

    @Test
    void startAfterWindowMovesToNextMorning() {
        List<PublishTimeDistributor.Slot> slots = distributorAt("2026-03-10T23:15:00Z").distribute(1, 1, null);

        assertEquals(List.of("2026-03-11T08:00Z"), times(slots));
    }

    @Test
    void pastStartTimeIsTreatedAsNow() {
        PublishTimeDistributor distributor = distributorAt("2026-03-10T09:00:00Z");

        List<PublishTimeDistributor.Slot> slots = distributor.distribute(1, 1, OffsetDateTime.parse("2026-03-01T10:00:00Z"));

        assertEquals(List.of("2026-03-10T09:30Z"), times(slots));
    }

    @Test
    void futureStartTimeIsHonoured() {
        PublishTimeDistributor distributor = distributorAt("2026-03-10T09:00:00Z");

        List<PublishTimeDistributor.Slot> slots = distributor.distribute(2, 2, OffsetDateTime.parse("2026-03-15T06:00:00Z"));

        assertEquals(List.of("2026-03-15T08:00Z", "2026-03-15T15:30Z"), times(slots));
    }

    @Test
    void slotsAreInTheFutureAndNeverCloserThanMinimumInterval() {
        Instant now = Instant.parse("2026-03-10T20:47:13Z");
        List<PublishTimeDistributor.Slot> slots = distributorAt(now.toString()).distribute(25, 10, null);

        assertEquals(25, slots.size());
        for (int i = 0; i < slots.size(); i++) {
            ZonedDateTime time = slots.get(i).time();
            assertTrue(time.toInstant().isAfter(now));
            assertTrue(time.getHour() >= 8 && time.getHour() < 23, "outside window: " + time);
            if (i > 0) {
                Duration gap = Duration.between(slots.get(i - 1).time(), time);
                assertTrue(gap.compareTo(Duration.ofMinutes(30)) >= 0, "gap too small before " + time);
            }
        }
    }

    @Test
    void usesDefaultPostsPerDayWhenNotGiven() {
        List<PublishTimeDistributor.Slot> slots = distributorAt("2026-03-10T09:00:00Z").distribute(4, null, null);

        assertEquals("2026-03-11T08:00Z", times(slots).get(3));
    }

    @Test
    void rejectsPostsPerDayOutsideLimits() {
        PublishTimeDistributor distributor = distributorAt("2026-03-10T09:00:00Z");

        assertThrows(ValidationException.class, () -> distributor.distribute(3, 0, null));
        assertThrows(ValidationException.class, () -> distributor.distribute(3, 11, null));
    }

    @Test
    void rejectsPostsPerDayThatCannotFitTheWindow() {
        posting.setWindowStartHour(20);
        posting.setWindowEndHour(22);
        posting.setMaxPostsPerDay(10);
        PublishTimeDistributor distributor = distributorAt("2026-03-10T09:00:00Z");

        assertEquals(4, distributor.windowCapacity());
        assertThrows(ValidationException.class, () -> distributor.distribute(5, 5, null));
    }

    private List<String> times(List<PublishTimeDistributor.Slot> slots) {
        return slots.stream().map(slot -> slot.offsetTime().toString()).toList();
    }
}
