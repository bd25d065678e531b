package com.bbthechange.harambee.config;

import com.bbthechange.harambee.sms.LoggingSmsGateway;
import com.bbthechange.harambee.sms.SmsGateway;
import com.bbthechange.harambee.sms.SnsSmsGateway;
import com.bbthechange.harambee.sms.TwilioSmsGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;

/**
 * Configuration for SMS gateway provider selection.
 * <p>
 * Selects the {@link SmsGateway} implementation from the {@code harambee.sms.provider} property:
 * - "twilio": Twilio Messaging API
 * - "aws": AWS SNS publish
 * - "log" (default): logs messages without sending them
 * <p>
 * For Twilio in staging/prod the auth token is retrieved from AWS Parameter Store. When no
 * Twilio credentials are configured at all, the logging gateway is used instead.
 */
@Configuration
public class SmsGatewayConfig {

    private static final Logger logger = LoggerFactory.getLogger(SmsGatewayConfig.class);

    @Value("${aws.region:us-west-2}")
    private String awsRegion;

    /**
     * Creates Twilio Messaging API-based gateway.
     * <p>
     * Active when {@code harambee.sms.provider=twilio}.
     */
    @Bean
    @ConditionalOnProperty(name = "harambee.sms.provider", havingValue = "twilio")
    public SmsGateway twilioSmsGateway(
            @Value("${twilio.account-sid:}") String accountSid,
            @Value("${twilio.auth-token-parameter-name:}") String authTokenParameterName,
            @Value("${twilio.auth-token:}") String authTokenDirect,
            @Value("${twilio.phone-number:}") String fromNumber,
            SmsGatewayProperties properties) {

        logger.info("Configuring Twilio SMS gateway");

        String authToken;
        if (authTokenParameterName != null && !authTokenParameterName.isEmpty()) {
            logger.info("Retrieving Twilio auth token from Parameter Store: {}", authTokenParameterName);
            authToken = retrieveFromParameterStore(authTokenParameterName);
        } else {
            logger.info("Using Twilio auth token from configuration (dev/test mode)");
            authToken = authTokenDirect;
        }

        if (isBlank(accountSid) || isBlank(authToken)) {
            logger.warn("Twilio credentials not configured, simulating SMS sends");
            return new LoggingSmsGateway();
        }

        return new TwilioSmsGateway(accountSid, authToken, fromNumber, properties.getSendTimeout());
    }

    /**
     * Creates AWS SNS-based gateway.
     * <p>
     * Active when {@code harambee.sms.provider=aws}.
     */
    @Bean
    @ConditionalOnProperty(name = "harambee.sms.provider", havingValue = "aws")
    public SmsGateway snsSmsGateway(SnsClient snsClient, SmsGatewayProperties properties) {
        logger.info("Configuring AWS SNS SMS gateway");
        return new SnsSmsGateway(snsClient, properties.getAllowlist());
    }

    /**
     * Creates the logging gateway.
     * <p>
     * Active when {@code harambee.sms.provider=log} or when the property is not set.
     */
    @Bean
    @ConditionalOnProperty(name = "harambee.sms.provider", havingValue = "log", matchIfMissing = true)
    public SmsGateway loggingSmsGateway() {
        logger.info("Configuring logging SMS gateway, messages will not be delivered");
        return new LoggingSmsGateway();
    }

    /**
     * Retrieves a parameter value from AWS Systems Manager Parameter Store.
     */
    private String retrieveFromParameterStore(String parameterName) {
        try (SsmClient ssmClient = SsmClient.builder()
                .region(Region.of(awsRegion))
                .build()) {

            GetParameterRequest parameterRequest = GetParameterRequest.builder()
                    .name(parameterName)
                    .withDecryption(true)
                    .build();

            GetParameterResponse parameterResponse = ssmClient.getParameter(parameterRequest);
            String value = parameterResponse.parameter().value();

            logger.info("Successfully retrieved parameter from Parameter Store: {}", parameterName);
            return value;

        } catch (Exception e) {
            logger.error("Failed to retrieve parameter from Parameter Store: {}", parameterName, e);
            throw new IllegalStateException("Failed to retrieve Twilio auth token from Parameter Store", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
