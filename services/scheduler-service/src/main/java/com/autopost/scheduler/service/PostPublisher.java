package com.autopost.scheduler.service;

import com.autopost.scheduler.client.Account;
import com.autopost.scheduler.client.AccountResolver;
import com.autopost.scheduler.client.MediaHandle;
import com.autopost.scheduler.client.PublishingClient;
import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.dto.PublishOutcome;
import com.autopost.scheduler.dto.PublishResult;
import com.autopost.scheduler.entity.Post;
import com.autopost.scheduler.entity.PostFormat;
import com.autopost.scheduler.entity.PostStatus;
import com.autopost.scheduler.events.PostEventPublisher;
import com.autopost.scheduler.exception.HardPublishFailureException;
import com.autopost.scheduler.exception.InvalidTransitionException;
import com.autopost.scheduler.exception.TimingViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Publishes one post through its account's session and records the outcome.
 *
 * <p>Failures split two ways. Pacing rejections (our own limit check, or a platform
 * message containing one of the timing markers) leave the post as it was so a later
 * tick retries it. Everything else marks the post ERROR.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostPublisher {

    private final PostStore postStore;
    private final PostScheduler postScheduler;
    private final AccountResolver accountResolver;
    private final PostingLimitGuard limitGuard;
    private final MediaResolver mediaResolver;
    private final PostEventPublisher eventPublisher;
    private final AutopostProperties properties;

    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * Publish path of the loop. Never throws. The post is re-read once its publish slot is
     * held, and skipped when it is already being published, was deleted or is no longer
     * SCHEDULED.
     */
    public PublishResult publishScheduled(Post post) {
        UUID postId = post.getId();
        if (!inFlight.add(postId)) {
            log.info("Post {} is already being published, skipping", postId);
            return PublishResult.skipped(postId, "Already being published");
        }
        try {
            Optional<Post> current = postStore.find(postId);
            if (current.isEmpty()) {
                log.info("Post {} was deleted before its turn, skipping", postId);
                return PublishResult.skipped(postId, "Post no longer exists");
            }
            if (current.get().getStatus() != PostStatus.SCHEDULED) {
                log.info("Post {} is {} now, skipping", postId, current.get().getStatus());
                return PublishResult.skipped(postId, "Post is " + current.get().getStatus() + ", no longer scheduled");
            }
            return attempt(current.get(), false);
        } finally {
            inFlight.remove(postId);
        }
    }

    /**
     * Publishes any post that is not yet published, regardless of its schedule.
     *
     * @throws TimingViolationException     when the account's pacing rejects the publish
     * @throws HardPublishFailureException  when the publish failed and the post was marked ERROR
     */
    public PublishResult publishNow(UUID postId) {
        claim(postId, "is being published right now");
        PublishResult result;
        try {
            Post post = postStore.get(postId);
            if (post.getStatus() == PostStatus.PUBLISHED) {
                throw new InvalidTransitionException("Post " + postId + " is already published");
            }
            log.info("Manual publish of post {} (status {})", postId, post.getStatus());
            result = attempt(post, true);
        } finally {
            inFlight.remove(postId);
        }

        if (result.getOutcome() == PublishOutcome.DEFERRED) {
            throw new TimingViolationException(result.getErrorMessage());
        }
        if (result.getOutcome() == PublishOutcome.FAILED) {
            throw new HardPublishFailureException(result.getErrorMessage());
        }
        return result;
    }

    /**
     * Runs a change to the post while holding its publish slot, so neither the loop nor a
     * manual publish can pick it up halfway.
     *
     * @throws InvalidTransitionException if the post is being published
     */
    public <T> T whileHeld(UUID postId, String action, Supplier<T> change) {
        claim(postId, "is being published and cannot be " + action);
        try {
            return change.get();
        } finally {
            inFlight.remove(postId);
        }
    }

    public boolean isPublishing(UUID postId) {
        return inFlight.contains(postId);
    }

    private PublishResult attempt(Post post, boolean manual) {
        UUID postId = post.getId();
        try {
            PublishingClient client = sessionFor(post.getAccountId());
            limitGuard.check(post.getAccountId());
            List<Path> files = mediaResolver.resolve(post.getMedia());

            MediaHandle handle = dispatch(post, client, files);
            log.info("Post {} published for account {} (media id {})", postId, post.getAccountId(), handle.getId());

            Post published = recordPublished(postId, handle.getId(), manual);
            postScheduler.markPublished(published);
            eventPublisher.published(published);
            return PublishResult.published(postId, handle.getId());

        } catch (TimingViolationException e) {
            log.info("Post {} deferred: {}", postId, e.getMessage());
            return PublishResult.deferred(postId, e.getMessage());
        } catch (HardPublishFailureException e) {
            log.error("Failed to publish post {}: {}", postId, e.getMessage());
            return recordFailure(postId, e.getMessage());
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (isTimingRejection(message)) {
                log.info("Post {} deferred by the platform: {}", postId, message);
                return PublishResult.deferred(postId, message);
            }
            log.error("Failed to publish post {}: {}", postId, message);
            return recordFailure(postId, message);
        }
    }

    private PublishingClient sessionFor(String accountId) {
        Optional<Account> account = accountResolver.getAccount(accountId);
        if (account.isEmpty()) {
            throw new HardPublishFailureException("Account " + accountId + " not found");
        }

        Optional<PublishingClient> client = accountResolver.getClient(accountId);
        if (client.isPresent()) {
            return client.get();
        }

        log.info("No session for account {} (@{}), logging in", accountId, account.get().getUsername());
        if (!accountResolver.login(accountId)) {
            throw new HardPublishFailureException("Could not log in to account @" + account.get().getUsername());
        }
        return accountResolver.getClient(accountId)
                .orElseThrow(() -> new HardPublishFailureException("No session for account @" + account.get().getUsername() + " after login"));
    }

    private MediaHandle dispatch(Post post, PublishingClient client, List<Path> files) {
        String caption = post.getText() != null ? post.getText() : "";
        if (files.size() > 1) {
            log.info("Uploading album of {} files for post {}", files.size(), post.getId());
            return client.publishAlbum(files, caption);
        }
        Path file = files.get(0);
        if (mediaResolver.isVideo(file)) {
            log.info("Uploading video {} for post {}", file.getFileName(), post.getId());
            return client.publishVideo(file, caption);
        }
        if (post.getFormat() == PostFormat.VIDEO) {
            log.warn("Post {} is declared as video but {} is not a video file, publishing as photo", post.getId(), file.getFileName());
        }
        log.info("Uploading photo {} for post {}", file.getFileName(), post.getId());
        return client.publishSingle(file, caption);
    }

    private Post recordPublished(UUID postId, String mediaId, boolean manual) {
        return manual ? postStore.forcePublished(postId, mediaId) : postStore.markPublished(postId, mediaId);
    }

    private void claim(UUID postId, String reason) {
        if (!inFlight.add(postId)) {
            throw new InvalidTransitionException("Post " + postId + " " + reason);
        }
    }

    private PublishResult recordFailure(UUID postId, String message) {
        try {
            Post failed = postStore.markError(postId, message);
            postScheduler.unschedule(failed);
            eventPublisher.failed(failed, message);
        } catch (RuntimeException e) {
            log.error("Could not record failure of post {}: {}", postId, e.getMessage());
        }
        return PublishResult.failed(postId, message);
    }

    private boolean isTimingRejection(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return properties.getPublisher().getTimingMarkers().stream()
                .anyMatch(marker -> lower.contains(marker.toLowerCase(Locale.ROOT)));
    }
}
