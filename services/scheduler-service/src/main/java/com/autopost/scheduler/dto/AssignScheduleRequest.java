package com.autopost.scheduler.dto;

import lombok.*;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignScheduleRequest {
    private List<UUID> postIds;
    private Integer postsPerDay;
    private OffsetDateTime startTime;
}
