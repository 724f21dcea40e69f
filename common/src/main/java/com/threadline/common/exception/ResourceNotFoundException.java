package com.threadline.common.exception;

/**
 * Exception thrown when a scoped lookup matches no row for the caller.
 * A row owned by someone else is reported the same way as a missing row.
 * HTTP Status: 404 Not Found (set in GlobalExceptionHandler)
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resourceType, Object id) {
        super(resourceType + " not found: " + id);
    }
}
