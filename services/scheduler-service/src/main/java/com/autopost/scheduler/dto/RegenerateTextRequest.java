package com.autopost.scheduler.dto;

import lombok.*;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegenerateTextRequest {
    private String theme;
    private String language;
    private List<String> keywords;
}
