package com.autopost.scheduler.service;

import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.dto.PublishResult;
import com.autopost.scheduler.entity.Post;
import com.autopost.scheduler.entity.PostStatus;
import com.autopost.scheduler.events.PostEventPublisher;
import com.autopost.scheduler.ratelimit.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PublishLoopTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-10T12:00:00Z");

    @Mock
    private PostStore postStore;

    @Mock
    private PostScheduler postScheduler;

    @Mock
    private PostPublisher postPublisher;

    @Mock
    private PostEventPublisher eventPublisher;

    private final List<Duration> pauses = new ArrayList<>();
    private AutopostProperties properties;
    private PublishLoop loop;

    @BeforeEach
    void setUp() {
        properties = new AutopostProperties();
        Sleeper sleeper = pauses::add;
        loop = new PublishLoop(postStore, postScheduler, postPublisher, new PublishWindow(properties), eventPublisher,
                properties, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC), sleeper);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    void tickDemotesStalePostsAndPublishesDueOnes() throws Exception {
        Post due = scheduled(NOW.minusSeconds(90));
        Post stale = scheduled(NOW.minusSeconds(3700));
        Post pending = scheduled(NOW.plusSeconds(500));
        when(postStore.listByStatus(PostStatus.SCHEDULED)).thenReturn(List.of(due, stale, pending));
        Post demoted = Post.builder().id(stale.getId()).accountId("acc-1").status(PostStatus.DRAFT).build();
        when(postStore.demoteToDraft(eq(stale.getId()), anyString())).thenReturn(demoted);
        when(postPublisher.publishScheduled(due)).thenReturn(PublishResult.published(due.getId(), "m-1"));

        PublishLoop.TickReport report = loop.tick();

        assertEquals(new PublishLoop.TickReport(1, 1, 0, 0, 1, 1), report);
        InOrder order = inOrder(postStore, postPublisher);
        order.verify(postStore).demoteToDraft(eq(stale.getId()), eq(properties.getPublisher().getMissedNote()));
        order.verify(postPublisher).publishScheduled(due);
        verify(postScheduler).unschedule(demoted);
        verify(eventPublisher).demoted(demoted, properties.getPublisher().getMissedNote());
        verify(postPublisher, never()).publishScheduled(pending);
        verify(postPublisher, never()).publishScheduled(stale);
        assertEquals(NOW, loop.getLastTickAt());
    }

    @Test
    void duePostsArePublishedOldestFirstWithPauseBetween() throws Exception {
        Post later = scheduled(NOW.minusSeconds(30));
        Post earlier = scheduled(NOW.minusSeconds(1200));
        when(postStore.listByStatus(PostStatus.SCHEDULED)).thenReturn(List.of(later, earlier));
        when(postPublisher.publishScheduled(earlier)).thenReturn(PublishResult.published(earlier.getId(), "m-1"));
        when(postPublisher.publishScheduled(later)).thenReturn(PublishResult.deferred(later.getId(), "Too soon"));

        PublishLoop.TickReport report = loop.tick();

        InOrder order = inOrder(postPublisher);
        order.verify(postPublisher).publishScheduled(earlier);
        order.verify(postPublisher).publishScheduled(later);
        assertEquals(1, report.published());
        assertEquals(1, report.deferred());
        assertEquals(List.of(Duration.ofSeconds(5)), pauses);
    }

    @Test
    void failedDemotionDoesNotStopTheTick() throws Exception {
        Post stale = scheduled(NOW.minusSeconds(7200));
        Post due = scheduled(NOW);
        when(postStore.listByStatus(PostStatus.SCHEDULED)).thenReturn(List.of(stale, due));
        when(postStore.demoteToDraft(eq(stale.getId()), anyString())).thenThrow(new IllegalStateException("db down"));
        when(postPublisher.publishScheduled(due)).thenReturn(PublishResult.failed(due.getId(), "boom"));

        PublishLoop.TickReport report = loop.tick();

        assertEquals(0, report.demoted());
        assertEquals(1, report.failed());
    }

    @Test
    void safeTickSwallowsStoreFailures() {
        when(postStore.listByStatus(PostStatus.SCHEDULED)).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> loop.safeTick());
    }

    @Test
    void startAndStopAreIdempotent() {
        properties.getPublisher().setTickInterval(Duration.ofHours(1));
        lenient().when(postStore.listByStatus(PostStatus.SCHEDULED)).thenReturn(List.of());

        assertTrue(loop.start());
        assertFalse(loop.start());
        assertTrue(loop.isRunning());

        assertTrue(loop.stop());
        assertFalse(loop.stop());
        assertFalse(loop.isRunning());
    }

    @Test
    void statusStaysReadableWhileStopWaitsForTheTick() throws Exception {
        properties.getPublisher().setStopTimeout(Duration.ofSeconds(5));
        CountDownLatch tickStarted = new CountDownLatch(1);
        CountDownLatch releaseTick = new CountDownLatch(1);
        when(postStore.listByStatus(PostStatus.SCHEDULED)).thenAnswer(invocation -> {
            tickStarted.countDown();
            releaseTick.await();
            return List.of();
        });
        loop.start();
        assertTrue(tickStarted.await(2, TimeUnit.SECONDS));

        Thread stopper = new Thread(loop::stop, "stopper");
        stopper.start();
        try {
            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
                while (loop.isRunning()) {
                    Thread.sleep(10);
                }
            });
        } finally {
            releaseTick.countDown();
        }

        stopper.join(2000);
        assertFalse(stopper.isAlive());
    }

    @Test
    void autoStartCanBeDisabled() {
        properties.getPublisher().setAutoStart(false);

        loop.onApplicationReady();

        assertFalse(loop.isRunning());
        verify(postStore, never()).listByStatus(any());
    }

    private Post scheduled(OffsetDateTime time) {
        return Post.builder()
                .id(UUID.randomUUID())
                .accountId("acc-1")
                .media(new ArrayList<>(List.of("a.jpg")))
                .status(PostStatus.SCHEDULED)
                .scheduledTime(time)
                .build();
    }
}
