package com.autopost.scheduler.events;

import lombok.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostEvent {
    private PostEventType type;
    private UUID postId;
    private String accountId;
    private OffsetDateTime scheduledTime;
    private String mediaId;
    private String message;
    private OffsetDateTime occurredAt;
}
