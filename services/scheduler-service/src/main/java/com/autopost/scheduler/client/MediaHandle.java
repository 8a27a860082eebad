package com.autopost.scheduler.client;

import lombok.*;

/**
 * Identifier the platform returns for a published media item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaHandle {
    private String id;
    private String code;
}
