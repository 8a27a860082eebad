package com.autopost.scheduler.service;

import com.autopost.scheduler.client.GenerationServiceClient;
import com.autopost.scheduler.dto.*;
import com.autopost.scheduler.entity.Post;
import com.autopost.scheduler.entity.PostStatus;
import com.autopost.scheduler.exception.InvalidTransitionException;
import com.autopost.scheduler.exception.ValidationException;
import com.autopost.scheduler.ratelimit.CallMode;
import com.autopost.scheduler.ratelimit.QuotaGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PostService {

    private final PostStore postStore;
    private final PostScheduler postScheduler;
    private final PostPublisher postPublisher;
    private final PublishLoop publishLoop;
    private final GenerationServiceClient generationClient;
    private final QuotaGuard quotaGuard;

    public PostResponse createPost(CreatePostRequest request) {
        Post post = postStore.create(request.getAccountId(), request.getText(), request.getMedia(), request.getFormat());
        return mapToResponse(post);
    }

    public PostResponse getPost(UUID postId) {
        return mapToResponse(postStore.get(postId));
    }

    public List<PostResponse> listPosts(PostStatus status, String accountId) {
        List<Post> posts = accountId != null && !accountId.isBlank()
                ? postStore.listByAccount(accountId, status)
                : postStore.listAll(status);
        return posts.stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public PostResponse updatePost(UUID postId, UpdatePostRequest request) {
        Post post = postPublisher.whileHeld(postId, "edited", () -> {
            Post updated = postStore.update(postId, request);
            postScheduler.syncEntry(updated);
            return updated;
        });
        log.info("Updated post {} (status {})", postId, post.getStatus());
        return mapToResponse(post);
    }

    public void deletePost(UUID postId) {
        postPublisher.whileHeld(postId, "deleted", () -> {
            Optional<Post> post = postStore.find(postId);
            if (post.isEmpty()) {
                return false;
            }
            postScheduler.unschedule(post.get());
            return postStore.delete(postId);
        });
    }

    public PostResponse publishNow(UUID postId) {
        postPublisher.publishNow(postId);
        return mapToResponse(postStore.get(postId));
    }

    /**
     * Replaces the caption of an editable post with one from the generation service.
     */
    public PostResponse regenerateText(UUID postId, RegenerateTextRequest request) {
        Post post = postStore.get(postId);
        if (!post.getStatus().isEditable()) {
            throw new InvalidTransitionException("Post " + postId + " is " + post.getStatus() + " and can no longer be edited");
        }

        String text;
        try {
            text = quotaGuard.call("regenerate caption", CallMode.INTERACTIVE,
                    () -> generationClient.generateCaption(post.getText(), request.getTheme(),
                            request.getLanguage(), request.getKeywords()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Caption generation interrupted", e);
        }

        Post updated = postPublisher.whileHeld(postId, "edited",
                () -> postStore.update(postId, UpdatePostRequest.builder().text(text).build()));
        log.info("Regenerated caption of post {}", postId);
        return mapToResponse(updated);
    }

    public List<PostResponse> assignSchedule(String accountId, AssignScheduleRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        return postScheduler.assign(accountId, request.getPostIds(), request.getPostsPerDay(), request.getStartTime())
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public List<ScheduleEntry> getCalendar(String accountId) {
        return postScheduler.calendar(accountId);
    }

    public int rebuildScheduleIndex() {
        return postScheduler.rebuildIndex();
    }

    public PublisherStatusResponse getPublisherStatus() {
        List<PostResponse> scheduled = new ArrayList<>();
        for (Post post : postStore.listByStatus(PostStatus.SCHEDULED)) {
            scheduled.add(mapToResponse(post));
        }
        return PublisherStatusResponse.builder()
                .running(publishLoop.isRunning())
                .scheduledPostsCount(scheduled.size())
                .lastTickAt(publishLoop.getLastTickAt())
                .scheduledPosts(scheduled)
                .build();
    }

    private PostResponse mapToResponse(Post post) {
        return PostResponse.builder()
                .id(post.getId())
                .accountId(post.getAccountId())
                .text(post.getText())
                .media(post.getMedia())
                .format(post.getFormat())
                .status(post.getStatus())
                .scheduledTime(post.getScheduledTime())
                .publishedTime(post.getPublishedTime())
                .publishedMediaId(post.getPublishedMediaId())
                .errorMessage(post.getErrorMessage())
                .createdAt(post.getCreatedAt())
                .build();
    }
}
