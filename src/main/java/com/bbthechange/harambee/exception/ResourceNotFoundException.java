package com.bbthechange.harambee.exception;

/**
 * Base exception for lookups of members, proposals or codes that do not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
