package com.autopost.scheduler.client;

public enum AccountStatus {
    ACTIVE,
    INACTIVE,
    LOGIN_REQUIRED
}
