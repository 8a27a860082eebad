package com.autopost.scheduler.dto;

import lombok.*;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimiterStats {
    private long count;
    private OffsetDateTime lastCallTime;
    private OffsetDateTime windowResetTime;
}
