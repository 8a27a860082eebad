package com.autopost.scheduler.service;

import com.autopost.scheduler.dto.ScheduleEntry;
import com.autopost.scheduler.dto.ScheduleMirrorStatus;
import com.autopost.scheduler.entity.Post;
import com.autopost.scheduler.entity.PostStatus;
import com.autopost.scheduler.events.PostEventPublisher;
import com.autopost.scheduler.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Assigns publish times to batches of draft posts and keeps the per-account schedule
 * index in line with the post store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostScheduler {

    private final PostStore postStore;
    private final PublishTimeDistributor distributor;
    private final ScheduleIndex scheduleIndex;
    private final PostEventPublisher eventPublisher;

    /**
     * Schedules the account's draft posts among {@code postIds}, in the given order. Ids
     * that are unknown, not drafts or owned by another account are skipped.
     *
     * @return the posts that were scheduled
     */
    public List<Post> assign(String accountId, List<UUID> postIds, Integer postsPerDay, OffsetDateTime startTime) {
        if (accountId == null || accountId.isBlank()) {
            throw new ValidationException("accountId is required");
        }
        if (postIds == null || postIds.isEmpty()) {
            throw new ValidationException("postIds must not be empty");
        }

        List<Post> eligible = new ArrayList<>();
        for (UUID id : new LinkedHashSet<>(postIds)) {
            if (id == null) {
                continue;
            }
            Optional<Post> found = postStore.find(id);
            if (found.isEmpty()) {
                log.warn("Skipping unknown post {} in schedule for account {}", id, accountId);
            } else if (!accountId.equals(found.get().getAccountId())) {
                log.warn("Skipping post {}: it belongs to account {}, not {}", id, found.get().getAccountId(), accountId);
            } else if (found.get().getStatus() != PostStatus.DRAFT) {
                log.warn("Skipping post {}: status is {}, only drafts can be scheduled", id, found.get().getStatus());
            } else {
                eligible.add(found.get());
            }
        }

        List<PublishTimeDistributor.Slot> slots = distributor.distribute(eligible.size(), postsPerDay, startTime);

        List<Post> scheduled = new ArrayList<>();
        for (PublishTimeDistributor.Slot slot : slots) {
            Post post = postStore.schedule(eligible.get(slot.postIndex()).getId(), slot.offsetTime());
            scheduleIndex.put(entryFor(post));
            eventPublisher.scheduled(post);
            scheduled.add(post);
        }

        log.info("Scheduled {} of {} requested post(s) for account {}", scheduled.size(), postIds.size(), accountId);
        return scheduled;
    }

    /**
     * Brings the index entry of one post in line with its current state.
     */
    public void syncEntry(Post post) {
        if (post.getStatus() == PostStatus.SCHEDULED || post.getStatus() == PostStatus.PUBLISHED) {
            scheduleIndex.put(entryFor(post));
        } else {
            scheduleIndex.remove(post.getAccountId(), post.getId());
        }
    }

    public void unschedule(Post post) {
        scheduleIndex.remove(post.getAccountId(), post.getId());
    }

    public void markPublished(Post post) {
        scheduleIndex.put(entryFor(post));
    }

    public List<ScheduleEntry> calendar(String accountId) {
        return scheduleIndex.entries(accountId);
    }

    /**
     * Recreates the whole index from scheduled and published posts.
     *
     * @return number of entries written
     */
    public int rebuildIndex() {
        List<ScheduleEntry> entries = new ArrayList<>();
        for (Post post : postStore.listByStatus(PostStatus.SCHEDULED)) {
            entries.add(entryFor(post));
        }
        for (Post post : postStore.listByStatus(PostStatus.PUBLISHED)) {
            entries.add(entryFor(post));
        }
        scheduleIndex.replaceAll(entries);
        return entries.size();
    }

    private ScheduleEntry entryFor(Post post) {
        boolean published = post.getStatus() == PostStatus.PUBLISHED;
        return ScheduleEntry.builder()
                .accountId(post.getAccountId())
                .postId(post.getId())
                .scheduledTime(published ? post.getPublishedTime() : post.getScheduledTime())
                .status(published ? ScheduleMirrorStatus.PUBLISHED : ScheduleMirrorStatus.SCHEDULED)
                .build();
    }
}
