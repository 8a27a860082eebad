package com.autopost.scheduler.dto;

import lombok.*;
import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublisherStatusResponse {
    private boolean running;
    private long scheduledPostsCount;
    private OffsetDateTime lastTickAt;
    private List<PostResponse> scheduledPosts;
}
