package com.bbthechange.harambee.sms;

import com.bbthechange.harambee.exception.SmsDeliveryException;
import com.twilio.exception.ApiException;
import com.twilio.http.NetworkHttpClient;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import org.apache.http.client.config.RequestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Twilio Messaging API implementation of {@link SmsGateway}.
 * <p>
 * Uses a dedicated {@link TwilioRestClient} rather than the static {@code Twilio.init}
 * so several gateways (or tests) never share global credentials.
 * <p>
 * Note: Bean is created by {@link com.bbthechange.harambee.config.SmsGatewayConfig}
 */
public class TwilioSmsGateway implements SmsGateway {

    private static final Logger logger = LoggerFactory.getLogger(TwilioSmsGateway.class);

    private final TwilioRestClient client;
    private final String fromNumber;

    public TwilioSmsGateway(String accountSid, String authToken, String fromNumber, Duration timeout) {
        this(new TwilioRestClient.Builder(accountSid, authToken)
                .httpClient(new NetworkHttpClient(requestConfig(timeout)))
                .build(), fromNumber);
    }

    TwilioSmsGateway(TwilioRestClient client, String fromNumber) {
        this.client = client;
        this.fromNumber = fromNumber;
        logger.info("Twilio SMS gateway initialized for sender {}", fromNumber);
    }

    @Override
    public boolean send(String phoneNumber, String message) {
        try {
            Message sent = Message.creator(new PhoneNumber(phoneNumber), new PhoneNumber(fromNumber), message)
                    .create(client);
            logger.info("SMS sent successfully to {}, SID: {}, status: {}",
                    phoneNumber, sent.getSid(), sent.getStatus());
            return true;
        } catch (ApiException e) {
            logger.error("Twilio rejected SMS to {}: {} (code: {})", phoneNumber, e.getMessage(), e.getCode());
            throw new SmsDeliveryException("Twilio rejected SMS: " + e.getMessage(), e);
        }
    }

    /**
     * Connect, read and pool-lease timeouts all bounded by the configured send timeout, so a
     * stalled Twilio call releases its dispatch thread.
     */
    static RequestConfig requestConfig(Duration timeout) {
        int millis = Math.toIntExact(timeout.toMillis());
        return RequestConfig.custom()
                .setConnectTimeout(millis)
                .setSocketTimeout(millis)
                .setConnectionRequestTimeout(millis)
                .build();
    }

    @Override
    public String providerName() {
        return "twilio";
    }
}
