package com.autopost.scheduler.exception;

import java.util.UUID;

public class PostNotFoundException extends AutopostException {

    public PostNotFoundException(UUID postId) {
        super(ErrorKind.NOT_FOUND, "Post not found: " + postId);
    }
}
