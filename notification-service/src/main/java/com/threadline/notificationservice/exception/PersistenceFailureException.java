package com.threadline.notificationservice.exception;

/**
 * Exception thrown when the store rejects an event or notification write.
 * HTTP Status: 503 Service Unavailable
 */
public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
