package com.bbthechange.harambee.exception;

/**
 * Exception thrown when request input is malformed, for example a phone number
 * that is not in E.164 format or an unknown verification type.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
