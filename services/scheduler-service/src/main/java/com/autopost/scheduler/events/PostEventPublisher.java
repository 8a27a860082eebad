package com.autopost.scheduler.events;

import com.autopost.scheduler.config.RabbitConfig;
import com.autopost.scheduler.entity.Post;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Announces post lifecycle changes on the {@code post.events} queue. Delivery is best
 * effort: the post store stays authoritative.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PostEventPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final Clock clock;

    public void scheduled(Post post) {
        send(PostEventType.SCHEDULED, post, null);
    }

    public void published(Post post) {
        send(PostEventType.PUBLISHED, post, null);
    }

    public void failed(Post post, String message) {
        send(PostEventType.FAILED, post, message);
    }

    public void demoted(Post post, String note) {
        send(PostEventType.DEMOTED, post, note);
    }

    private void send(PostEventType type, Post post, String message) {
        PostEvent event = PostEvent.builder()
                .type(type)
                .postId(post.getId())
                .accountId(post.getAccountId())
                .scheduledTime(post.getScheduledTime())
                .mediaId(post.getPublishedMediaId())
                .message(message)
                .occurredAt(OffsetDateTime.now(clock))
                .build();
        try {
            rabbitTemplate.convertAndSend(RabbitConfig.POST_EVENTS_QUEUE, event);
        } catch (AmqpException e) {
            log.warn("Could not send {} event for post {}: {}", type, post.getId(), e.getMessage());
        }
    }
}
