package com.autopost.scheduler.events;

public enum PostEventType {
    SCHEDULED,
    PUBLISHED,
    FAILED,
    DEMOTED
}
