package com.autopost.scheduler.exception;

import lombok.Getter;

/**
 * Base type of every failure surfaced to interactive callers. The kind decides how the
 * failure is reported and whether it may be retried.
 */
@Getter
public abstract class AutopostException extends RuntimeException {

    private final ErrorKind kind;

    protected AutopostException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AutopostException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
