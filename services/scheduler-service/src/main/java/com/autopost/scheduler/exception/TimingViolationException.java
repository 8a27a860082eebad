package com.autopost.scheduler.exception;

/**
 * The account's pacing rules rejected a publish. The post stays scheduled and is retried
 * on a later tick.
 */
public class TimingViolationException extends AutopostException {

    public TimingViolationException(String message) {
        super(ErrorKind.TIMING_VIOLATION, message);
    }
}
