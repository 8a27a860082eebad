package com.autopost.scheduler.exception;

public class InvalidTransitionException extends AutopostException {

    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
    }
}
