package com.autopost.scheduler.dto;

import lombok.*;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {
    private UUID postId;
    private PublishOutcome outcome;
    private String mediaId;
    private String errorMessage;

    public boolean isSuccess() {
        return outcome == PublishOutcome.PUBLISHED;
    }

    public static PublishResult published(UUID postId, String mediaId) {
        return PublishResult.builder()
                .postId(postId)
                .outcome(PublishOutcome.PUBLISHED)
                .mediaId(mediaId)
                .build();
    }

    public static PublishResult deferred(UUID postId, String reason) {
        return PublishResult.builder()
                .postId(postId)
                .outcome(PublishOutcome.DEFERRED)
                .errorMessage(reason)
                .build();
    }

    public static PublishResult failed(UUID postId, String errorMessage) {
        return PublishResult.builder()
                .postId(postId)
                .outcome(PublishOutcome.FAILED)
                .errorMessage(errorMessage)
                .build();
    }

    public static PublishResult skipped(UUID postId, String reason) {
        return PublishResult.builder()
                .postId(postId)
                .outcome(PublishOutcome.SKIPPED)
                .errorMessage(reason)
                .build();
    }
}
