package com.bbthechange.harambee.sms;

import com.bbthechange.harambee.exception.SmsDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;
import software.amazon.awssdk.services.sns.model.SnsException;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * AWS SNS implementation of {@link SmsGateway}.
 * <p>
 * Numbers on the allowlist never reach SNS; their messages are logged instead so test
 * phones can be used in any environment.
 * <p>
 * Note: Bean is created by {@link com.bbthechange.harambee.config.SmsGatewayConfig}
 */
public class SnsSmsGateway implements SmsGateway {

    private static final Logger logger = LoggerFactory.getLogger(SnsSmsGateway.class);

    private final SnsClient snsClient;
    private final List<String> allowlist;

    public SnsSmsGateway(SnsClient snsClient, String allowlistString) {
        this.snsClient = snsClient;
        this.allowlist = allowlistString == null || allowlistString.isBlank() ?
            List.of() :
            Arrays.stream(allowlistString.split(","))
                .map(String::trim)
                .collect(Collectors.toList());

        logger.info("SNS SMS gateway initialized with allowlist: {}",
                   allowlist.isEmpty() ? "empty (production mode)" : allowlist.size() + " numbers");
    }

    @Override
    public boolean send(String phoneNumber, String message) {
        if (isInAllowlist(phoneNumber)) {
            logger.info("[SMS Bypass] Message for {}: {}", phoneNumber, message);
            return true;
        }

        try {
            Map<String, MessageAttributeValue> messageAttributes = new HashMap<>();
            messageAttributes.put("AWS.SNS.SMS.SMSType",
                MessageAttributeValue.builder()
                    .stringValue("Transactional")
                    .dataType("String")
                    .build());

            PublishRequest request = PublishRequest.builder()
                .phoneNumber(phoneNumber)
                .message(message)
                .messageAttributes(messageAttributes)
                .build();

            PublishResponse response = snsClient.publish(request);

            logger.info("SMS sent successfully to {} with messageId: {}", phoneNumber, response.messageId());
            return true;

        } catch (SnsException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Failed to send SMS to {}: {}", phoneNumber, detail, e);
            throw new SmsDeliveryException("Failed to send SMS via SNS", e);
        }
    }

    @Override
    public String providerName() {
        return "aws";
    }

    private boolean isInAllowlist(String phoneNumber) {
        return allowlist.contains(phoneNumber.trim());
    }
}
