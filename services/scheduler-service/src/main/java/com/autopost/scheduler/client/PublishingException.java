package com.autopost.scheduler.client;

/**
 * A publish call was rejected or could not be delivered. The message is the platform's
 * own explanation.
 */
public class PublishingException extends RuntimeException {

    public PublishingException(String message) {
        super(message);
    }

    public PublishingException(String message, Throwable cause) {
        super(message, cause);
    }
}
