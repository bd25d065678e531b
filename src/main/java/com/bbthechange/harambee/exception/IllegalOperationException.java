package com.bbthechange.harambee.exception;

/**
 * Exception thrown when an operation is not allowed due to the current state
 * of the resource.
 *
 * For example, starting SMS voting on a proposal that is no longer in VOTING,
 * or on a group with no verified members.
 */
public class IllegalOperationException extends RuntimeException {

    public IllegalOperationException(String message) {
        super(message);
    }

    public IllegalOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
