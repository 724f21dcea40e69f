package com.threadline.common.exception;

/**
 * Exception thrown when a caller acts on a tenant other than their own
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
