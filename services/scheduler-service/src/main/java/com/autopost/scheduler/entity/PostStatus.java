package com.autopost.scheduler.entity;

public enum PostStatus {
    DRAFT,
    SCHEDULED,
    PUBLISHED,
    ERROR;

    /**
     * Published posts are terminal; every other status can still be edited or rescheduled.
     */
    public boolean isEditable() {
        return this != PUBLISHED;
    }
}
