package com.autopost.scheduler.dto;

import lombok.*;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Calendar entry of the per-account schedule index. Derived from posts; the post wins
 * whenever the two disagree.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleEntry {
    private String accountId;
    private UUID postId;
    private OffsetDateTime scheduledTime;
    private ScheduleMirrorStatus status;
}
