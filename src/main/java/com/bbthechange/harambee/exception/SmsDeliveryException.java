package com.bbthechange.harambee.exception;

/**
 * Exception raised inside an SMS gateway when the provider rejects or cannot be reached.
 * Callers of the dispatcher never see it; it is logged and converted to a failed send.
 */
public class SmsDeliveryException extends RuntimeException {

    public SmsDeliveryException(String message) {
        super(message);
    }

    public SmsDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
