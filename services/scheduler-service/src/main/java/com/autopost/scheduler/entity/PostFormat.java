package com.autopost.scheduler.entity;

public enum PostFormat {
    PHOTO,
    VIDEO
}
