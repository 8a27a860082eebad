package com.autopost.scheduler.service;

import com.autopost.scheduler.dto.UpdatePostRequest;
import com.autopost.scheduler.entity.Post;
import com.autopost.scheduler.entity.PostFormat;
import com.autopost.scheduler.entity.PostStatus;
import com.autopost.scheduler.exception.InvalidTransitionException;
import com.autopost.scheduler.exception.PostNotFoundException;
import com.autopost.scheduler.exception.ValidationException;
import com.autopost.scheduler.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage of posts and the only place their status changes. Every method that
 * mutates a post saves it before returning; concurrent writers are caught by the
 * entity's version column.
 *
 * <p>Status and time fields move together: {@code scheduledTime} is set exactly while a
 * post is SCHEDULED, {@code publishedTime} exactly once it is PUBLISHED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostStore {

    private final PostRepository postRepository;
    private final Clock clock;

    @Transactional
    public Post create(String accountId, String text, List<String> media, PostFormat format) {
        if (accountId == null || accountId.isBlank()) {
            throw new ValidationException("accountId is required");
        }
        List<String> files = cleanMedia(media);
        if (files.isEmpty()) {
            throw new ValidationException("A post needs at least one media file");
        }

        Post post = Post.builder()
                .accountId(accountId.trim())
                .text(text != null ? text : "")
                .media(files)
                .format(format != null ? format : PostFormat.PHOTO)
                .status(PostStatus.DRAFT)
                .createdAt(now())
                .build();

        post = postRepository.save(post);
        log.info("Created draft post {} for account {} with {} media file(s)", post.getId(), post.getAccountId(), files.size());
        return post;
    }

    @Transactional(readOnly = true)
    public Post get(UUID id) {
        return postRepository.findById(id).orElseThrow(() -> new PostNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public Optional<Post> find(UUID id) {
        return postRepository.findById(id);
    }

    /**
     * Merges the non-null fields of the request into an editable post. Supplying a
     * scheduled time without a status schedules the post.
     */
    @Transactional
    public Post update(UUID id, UpdatePostRequest request) {
        Post post = get(id);
        if (!post.getStatus().isEditable()) {
            throw new InvalidTransitionException("Post " + id + " is " + post.getStatus() + " and can no longer be edited");
        }

        if (request.getText() != null) {
            post.setText(request.getText());
        }
        if (request.getMedia() != null) {
            List<String> files = cleanMedia(request.getMedia());
            if (files.isEmpty()) {
                throw new ValidationException("A post needs at least one media file");
            }
            post.setMedia(files);
        }
        if (request.getFormat() != null) {
            post.setFormat(request.getFormat());
        }

        PostStatus target = request.getStatus();
        if (target == null && request.getScheduledTime() != null) {
            target = PostStatus.SCHEDULED;
        }

        if (target == PostStatus.PUBLISHED || target == PostStatus.ERROR) {
            throw new InvalidTransitionException("Status " + target + " cannot be set by an edit");
        }
        if (target == PostStatus.SCHEDULED) {
            OffsetDateTime time = request.getScheduledTime() != null ? request.getScheduledTime() : post.getScheduledTime();
            if (time == null) {
                throw new ValidationException("scheduledTime is required to schedule a post");
            }
            post.setStatus(PostStatus.SCHEDULED);
            post.setScheduledTime(time);
            post.setErrorMessage(null);
        } else if (target == PostStatus.DRAFT) {
            post.setStatus(PostStatus.DRAFT);
            post.setScheduledTime(null);
            post.setErrorMessage(null);
        }

        return postRepository.save(post);
    }

    @Transactional(readOnly = true)
    public List<Post> listByStatus(PostStatus status) {
        return postRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    @Transactional(readOnly = true)
    public List<Post> listByAccount(String accountId, PostStatus status) {
        if (status == null) {
            return postRepository.findByAccountIdOrderByCreatedAtDesc(accountId);
        }
        return postRepository.findByAccountIdAndStatusOrderByCreatedAtDesc(accountId, status);
    }

    @Transactional(readOnly = true)
    public List<Post> listAll(PostStatus status) {
        if (status == null) {
            return postRepository.findAllByOrderByCreatedAtDesc();
        }
        return postRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    @Transactional(readOnly = true)
    public long countByStatus(PostStatus status) {
        return postRepository.countByStatus(status);
    }

    /**
     * @return true if a post was removed
     */
    @Transactional
    public boolean delete(UUID id) {
        Optional<Post> post = postRepository.findById(id);
        if (post.isEmpty()) {
            return false;
        }
        postRepository.delete(post.get());
        log.info("Deleted post {}", id);
        return true;
    }

    @Transactional
    public Post schedule(UUID id, OffsetDateTime time) {
        if (time == null) {
            throw new ValidationException("scheduledTime is required");
        }
        Post post = get(id);
        if (post.getStatus() == PostStatus.PUBLISHED) {
            throw new InvalidTransitionException("Post " + id + " is already published");
        }
        post.setStatus(PostStatus.SCHEDULED);
        post.setScheduledTime(time);
        post.setErrorMessage(null);
        return postRepository.save(post);
    }

    @Transactional
    public Post markPublished(UUID id, String mediaId) {
        Post post = get(id);
        if (post.getStatus() != PostStatus.SCHEDULED) {
            throw new InvalidTransitionException("Only scheduled posts can be marked published, post " + id + " is " + post.getStatus());
        }
        return published(post, mediaId);
    }

    /**
     * Records a publish that bypassed the schedule.
     */
    @Transactional
    public Post forcePublished(UUID id, String mediaId) {
        Post post = get(id);
        if (post.getStatus() == PostStatus.PUBLISHED) {
            throw new InvalidTransitionException("Post " + id + " is already published");
        }
        return published(post, mediaId);
    }

    @Transactional
    public Post markError(UUID id, String message) {
        Post post = get(id);
        if (post.getStatus() == PostStatus.PUBLISHED) {
            throw new InvalidTransitionException("Post " + id + " is already published");
        }
        post.setStatus(PostStatus.ERROR);
        post.setScheduledTime(null);
        post.setErrorMessage(message != null && !message.isBlank() ? message : "Unknown publish error");
        return postRepository.save(post);
    }

    /**
     * Returns a scheduled post to draft, keeping the note as its error message. Draft posts
     * are returned unchanged.
     */
    @Transactional
    public Post demoteToDraft(UUID id, String note) {
        Post post = get(id);
        if (post.getStatus() == PostStatus.DRAFT) {
            return post;
        }
        if (post.getStatus() != PostStatus.SCHEDULED) {
            throw new InvalidTransitionException("Only scheduled posts can be returned to draft, post " + id + " is " + post.getStatus());
        }
        post.setStatus(PostStatus.DRAFT);
        post.setScheduledTime(null);
        post.setErrorMessage(note);
        return postRepository.save(post);
    }

    @Transactional(readOnly = true)
    public long countPublishedSince(String accountId, OffsetDateTime since) {
        return postRepository.countByAccountIdAndStatusSince(accountId, PostStatus.PUBLISHED, since);
    }

    @Transactional(readOnly = true)
    public Optional<OffsetDateTime> lastPublishedTime(String accountId) {
        return postRepository.findFirstByAccountIdAndStatusOrderByPublishedTimeDesc(accountId, PostStatus.PUBLISHED)
                .map(Post::getPublishedTime);
    }

    private Post published(Post post, String mediaId) {
        post.setStatus(PostStatus.PUBLISHED);
        post.setPublishedTime(now());
        post.setPublishedMediaId(mediaId);
        post.setScheduledTime(null);
        post.setErrorMessage(null);
        return postRepository.save(post);
    }

    private List<String> cleanMedia(List<String> media) {
        List<String> files = new ArrayList<>();
        if (media != null) {
            for (String file : media) {
                if (file != null && !file.isBlank()) {
                    files.add(file.trim());
                }
            }
        }
        return files;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
