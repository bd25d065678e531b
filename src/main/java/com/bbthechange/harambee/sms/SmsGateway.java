package com.bbthechange.harambee.sms;

/**
 * Outbound text message transport.
 * <p>
 * Implementations may use different providers (Twilio, AWS SNS, a logging simulator)
 * but share the same contract: a return of {@code true} means the provider accepted the
 * message. Provider failures may be reported either as {@code false} or as an
 * {@link com.bbthechange.harambee.exception.SmsDeliveryException}; callers go through
 * {@link SmsDispatcher}, which treats both as "not delivered".
 */
public interface SmsGateway {

    /**
     * Sends a text message.
     *
     * @param phoneNumber recipient in E.164 format
     * @param message message body
     * @return whether the provider accepted the message
     */
    boolean send(String phoneNumber, String message);

    /**
     * Short provider name for logs and metrics.
     */
    String providerName();
}
