package com.autopost.scheduler.exception;

public class HardPublishFailureException extends AutopostException {

    public HardPublishFailureException(String message) {
        super(ErrorKind.HARD_PUBLISH_FAILURE, message);
    }
}
