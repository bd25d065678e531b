package com.bbthechange.harambee.config;

import com.bbthechange.harambee.sms.LoggingSmsGateway;
import com.bbthechange.harambee.sms.SmsGateway;
import com.bbthechange.harambee.sms.TwilioSmsGateway;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SmsGatewayConfigTest {

    private final SmsGatewayConfig config = new SmsGatewayConfig();

    @Test
    void twilioSmsGateway_WithoutCredentials_FallsBackToLogging() {
        SmsGateway gateway = config.twilioSmsGateway("", "", "", "+15550000000", new SmsGatewayProperties());

        assertThat(gateway).isInstanceOf(LoggingSmsGateway.class);
        assertThat(gateway.providerName()).isEqualTo("log");
    }

    @Test
    void twilioSmsGateway_WithDirectCredentials_UsesTwilio() {
        SmsGateway gateway = config.twilioSmsGateway("AC00000000000000000000000000000000", "", "secret-token",
                "+15550000000", new SmsGatewayProperties());

        assertThat(gateway).isInstanceOf(TwilioSmsGateway.class);
        assertThat(gateway.providerName()).isEqualTo("twilio");
    }

    @Test
    void loggingSmsGateway_AlwaysAccepts() {
        assertThat(config.loggingSmsGateway().send("+254712345678", "hello")).isTrue();
    }
}
