package com.autopost.scheduler.exception;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    INVALID_TRANSITION,
    TIMING_VIOLATION,
    HARD_PUBLISH_FAILURE,
    QUOTA_EXCEEDED,
    UPSTREAM_ERROR,
    INTERNAL
}
