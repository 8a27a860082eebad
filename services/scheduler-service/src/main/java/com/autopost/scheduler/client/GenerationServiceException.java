package com.autopost.scheduler.client;

public class GenerationServiceException extends RuntimeException {

    public GenerationServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
