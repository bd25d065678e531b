package com.bbthechange.harambee.exception;

/**
 * Exception thrown when every short code is held by an active proposal.
 */
public class ShortCodeExhaustedException extends RuntimeException {

    public ShortCodeExhaustedException(String message) {
        super(message);
    }
}
