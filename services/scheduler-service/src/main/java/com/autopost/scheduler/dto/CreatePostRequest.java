package com.autopost.scheduler.dto;

import com.autopost.scheduler.entity.PostFormat;
import lombok.*;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePostRequest {
    private String accountId;
    private String text;
    private List<String> media;
    private PostFormat format;
}
