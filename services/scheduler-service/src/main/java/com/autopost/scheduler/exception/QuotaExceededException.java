package com.autopost.scheduler.exception;

public class QuotaExceededException extends AutopostException {

    public QuotaExceededException(String message, Throwable cause) {
        super(ErrorKind.QUOTA_EXCEEDED, message, cause);
    }
}
