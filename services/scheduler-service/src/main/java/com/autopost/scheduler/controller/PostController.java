package com.autopost.scheduler.controller;

import com.autopost.scheduler.dto.*;
import com.autopost.scheduler.entity.PostStatus;
import com.autopost.scheduler.service.PostService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
public class PostController {

    private final PostService postService;

    @PostMapping("/posts")
    public ResponseEntity<PostResponse> createPost(@RequestBody CreatePostRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(postService.createPost(request));
    }

    @GetMapping("/posts")
    public ResponseEntity<List<PostResponse>> listPosts(
            @RequestParam(required = false) PostStatus status,
            @RequestParam(required = false) String accountId
    ) {
        return ResponseEntity.ok(postService.listPosts(status, accountId));
    }

    @GetMapping("/posts/{postId}")
    public ResponseEntity<PostResponse> getPost(@PathVariable UUID postId) {
        return ResponseEntity.ok(postService.getPost(postId));
    }

    @PutMapping("/posts/{postId}")
    public ResponseEntity<PostResponse> updatePost(
            @PathVariable UUID postId,
            @RequestBody UpdatePostRequest request
    ) {
        return ResponseEntity.ok(postService.updatePost(postId, request));
    }

    @DeleteMapping("/posts/{postId}")
    public ResponseEntity<Void> deletePost(@PathVariable UUID postId) {
        postService.deletePost(postId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/posts/{postId}/publish-now")
    public ResponseEntity<PostResponse> publishNow(@PathVariable UUID postId) {
        return ResponseEntity.ok(postService.publishNow(postId));
    }

    @PostMapping("/posts/{postId}/regenerate-text")
    public ResponseEntity<PostResponse> regenerateText(
            @PathVariable UUID postId,
            @RequestBody(required = false) RegenerateTextRequest request
    ) {
        return ResponseEntity.ok(postService.regenerateText(postId,
                request != null ? request : new RegenerateTextRequest()));
    }

    @PostMapping("/accounts/{accountId}/schedule")
    public ResponseEntity<List<PostResponse>> assignSchedule(
            @PathVariable String accountId,
            @RequestBody AssignScheduleRequest request
    ) {
        return ResponseEntity.ok(postService.assignSchedule(accountId, request));
    }

    @GetMapping("/accounts/{accountId}/schedule")
    public ResponseEntity<List<ScheduleEntry>> getSchedule(@PathVariable String accountId) {
        return ResponseEntity.ok(postService.getCalendar(accountId));
    }

    @PostMapping("/schedule/rebuild")
    public ResponseEntity<Map<String, Integer>> rebuildSchedule() {
        return ResponseEntity.ok(Map.of("entries", postService.rebuildScheduleIndex()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Scheduler Service is healthy");
    }
}
