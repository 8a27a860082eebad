package com.autopost.scheduler.dto;

import com.autopost.scheduler.entity.PostFormat;
import com.autopost.scheduler.entity.PostStatus;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePostRequest {
    private String text;
    private List<String> media;
    private PostFormat format;
    private PostStatus status;
    private OffsetDateTime scheduledTime;
}
