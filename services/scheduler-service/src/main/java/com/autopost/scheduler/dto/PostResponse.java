package com.autopost.scheduler.dto;

import com.autopost.scheduler.entity.PostFormat;
import com.autopost.scheduler.entity.PostStatus;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostResponse {
    private UUID id;
    private String accountId;
    private String text;
    private List<String> media;
    private PostFormat format;
    private PostStatus status;
    private OffsetDateTime scheduledTime;
    private OffsetDateTime publishedTime;
    private String publishedMediaId;
    private String errorMessage;
    private OffsetDateTime createdAt;
}
