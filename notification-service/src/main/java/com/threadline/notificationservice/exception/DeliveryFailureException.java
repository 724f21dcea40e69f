package com.threadline.notificationservice.exception;

/**
 * Exception thrown when the live transport could not hand a message to the
 * broker. Always caught by the caller; live delivery is never retried.
 */
public class DeliveryFailureException extends RuntimeException {

    public DeliveryFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
