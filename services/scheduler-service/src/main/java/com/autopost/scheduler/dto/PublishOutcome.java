package com.autopost.scheduler.dto;

public enum PublishOutcome {
    PUBLISHED,
    DEFERRED,
    FAILED,
    SKIPPED
}
