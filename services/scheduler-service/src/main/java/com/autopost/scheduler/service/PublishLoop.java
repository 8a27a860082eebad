package com.autopost.scheduler.service;

import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.dto.PublishResult;
import com.autopost.scheduler.entity.Post;
import com.autopost.scheduler.entity.PostStatus;
import com.autopost.scheduler.events.PostEventPublisher;
import com.autopost.scheduler.ratelimit.Sleeper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background poller that publishes due posts and returns stale ones to draft.
 *
 * <p>Ticks run on one daemon thread with a fixed delay between them, so two ticks never
 * overlap. A tick never throws: per-post failures are recorded on the post and anything
 * else is logged.
 */
@Service
@Slf4j
public class PublishLoop {

    private static final String THREAD_NAME = "publish-loop";

    private final PostStore postStore;
    private final PostScheduler postScheduler;
    private final PostPublisher postPublisher;
    private final PublishWindow publishWindow;
    private final PostEventPublisher eventPublisher;
    private final AutopostProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    private volatile ScheduledExecutorService executor;
    private volatile OffsetDateTime lastTickAt;

    public PublishLoop(PostStore postStore,
                       PostScheduler postScheduler,
                       PostPublisher postPublisher,
                       PublishWindow publishWindow,
                       PostEventPublisher eventPublisher,
                       AutopostProperties properties,
                       Clock clock,
                       Sleeper sleeper) {
        this.postStore = postStore;
        this.postScheduler = postScheduler;
        this.postPublisher = postPublisher;
        this.publishWindow = publishWindow;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public record TickReport(int due, int published, int deferred, int failed, int demoted, int pending) {
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(2)
    public void onApplicationReady() {
        if (!properties.getPublisher().isAutoStart()) {
            log.info("Publish loop auto-start disabled");
            return;
        }
        start();
    }

    /**
     * @return false if the loop was already running
     */
    public synchronized boolean start() {
        if (isRunning()) {
            return false;
        }
        Duration tick = properties.getPublisher().getTickInterval();
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::safeTick, 0, tick.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Publish loop started, checking every {} s", tick.toSeconds());
        return true;
    }

    /**
     * Lets the current tick finish within the stop timeout, then interrupts it.
     *
     * @return false if the loop was not running
     */
    @PreDestroy
    public synchronized boolean stop() {
        if (!isRunning()) {
            return false;
        }
        long timeoutMillis = properties.getPublisher().getStopTimeout().toMillis();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Publish loop did not stop within {} ms, interrupting", timeoutMillis);
                executor.shutdownNow();
                if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                    log.error("Publish loop thread did not terminate");
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Publish loop stopped");
        return true;
    }

    public boolean isRunning() {
        ScheduledExecutorService current = executor;
        return current != null && !current.isShutdown();
    }

    public OffsetDateTime getLastTickAt() {
        return lastTickAt;
    }

    void safeTick() {
        try {
            tick();
        } catch (InterruptedException e) {
            log.info("Publish loop tick interrupted");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Publish loop tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One pass over the scheduled posts: demotions first, then due posts oldest first.
     */
    public TickReport tick() throws InterruptedException {
        OffsetDateTime now = OffsetDateTime.now(clock);
        lastTickAt = now;

        List<Post> stale = new ArrayList<>();
        List<Post> due = new ArrayList<>();
        int pending = 0;
        for (Post post : postStore.listByStatus(PostStatus.SCHEDULED)) {
            if (post.getScheduledTime() == null) {
                continue;
            }
            switch (publishWindow.classify(post.getScheduledTime(), now)) {
                case STALE -> stale.add(post);
                case DUE -> due.add(post);
                case PENDING -> pending++;
            }
        }

        int demoted = 0;
        for (Post post : stale) {
            if (demote(post)) {
                demoted++;
            }
        }

        due.sort(Comparator.comparing(Post::getScheduledTime));
        if (!due.isEmpty()) {
            log.info("Found {} post(s) to publish", due.size());
        }

        int published = 0;
        int deferred = 0;
        int failed = 0;
        for (int i = 0; i < due.size(); i++) {
            Post post = due.get(i);
            if (publishWindow.isLate(post.getScheduledTime(), now)) {
                log.warn("Post {} is late: scheduled for {}", post.getId(), post.getScheduledTime());
            }

            PublishResult result = postPublisher.publishScheduled(post);
            switch (result.getOutcome()) {
                case PUBLISHED -> published++;
                case DEFERRED -> deferred++;
                case FAILED -> failed++;
                case SKIPPED -> {
                }
            }

            if (i < due.size() - 1) {
                sleeper.sleep(properties.getPublisher().getPublishPause());
            }
        }

        TickReport report = new TickReport(due.size(), published, deferred, failed, demoted, pending);
        if (report.due() > 0 || report.demoted() > 0) {
            log.info("Tick done: {}", report);
        } else {
            log.debug("Tick done: {}", report);
        }
        return report;
    }

    private boolean demote(Post post) {
        String note = properties.getPublisher().getMissedNote();
        try {
            Post demoted = postStore.demoteToDraft(post.getId(), note);
            postScheduler.unschedule(demoted);
            eventPublisher.demoted(demoted, note);
            log.warn("Post {} missed its slot at {} and was returned to draft", post.getId(), post.getScheduledTime());
            return true;
        } catch (RuntimeException e) {
            log.error("Could not demote stale post {}: {}", post.getId(), e.getMessage());
            return false;
        }
    }
}
