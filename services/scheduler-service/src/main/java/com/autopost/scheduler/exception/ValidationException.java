package com.autopost.scheduler.exception;

public class ValidationException extends AutopostException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
