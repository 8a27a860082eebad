package com.autopost.scheduler.controller;

import com.autopost.scheduler.dto.PublisherStatusResponse;
import com.autopost.scheduler.dto.RateLimiterStats;
import com.autopost.scheduler.ratelimit.RateLimiter;
import com.autopost.scheduler.service.PostService;
import com.autopost.scheduler.service.PublishLoop;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
public class PublisherController {

    private final PublishLoop publishLoop;
    private final PostService postService;
    private final RateLimiter rateLimiter;

    @GetMapping("/publisher/status")
    public ResponseEntity<PublisherStatusResponse> status() {
        return ResponseEntity.ok(postService.getPublisherStatus());
    }

    @PostMapping("/publisher/start")
    public ResponseEntity<PublisherStatusResponse> start() {
        publishLoop.start();
        return ResponseEntity.ok(postService.getPublisherStatus());
    }

    @PostMapping("/publisher/stop")
    public ResponseEntity<PublisherStatusResponse> stop() {
        publishLoop.stop();
        return ResponseEntity.ok(postService.getPublisherStatus());
    }

    @GetMapping("/rate-limiter/stats")
    public ResponseEntity<RateLimiterStats> rateLimiterStats() {
        return ResponseEntity.ok(rateLimiter.stats());
    }
}
