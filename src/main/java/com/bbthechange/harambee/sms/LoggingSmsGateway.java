package com.bbthechange.harambee.sms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulated gateway for development. Logs the message and reports success.
 * <p>
 * Note: Bean is created by {@link com.bbthechange.harambee.config.SmsGatewayConfig}
 */
public class LoggingSmsGateway implements SmsGateway {

    private static final Logger logger = LoggerFactory.getLogger(LoggingSmsGateway.class);

    @Override
    public boolean send(String phoneNumber, String message) {
        logger.info("[SMS Simulated] to {}: {}", phoneNumber, message);
        return true;
    }

    @Override
    public String providerName() {
        return "log";
    }
}
