package com.autopost.scheduler.dto;

public enum ScheduleMirrorStatus {
    SCHEDULED,
    PUBLISHED
}
