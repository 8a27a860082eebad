package com.autopost.scheduler.service;

public enum PublishDecision {
    /**
     * Not yet within the early tolerance.
     */
    PENDING,
    /**
     * Publish now, on time or late.
     */
    DUE,
    /**
     * Missed by more than the stale threshold.
     */
    STALE
}
