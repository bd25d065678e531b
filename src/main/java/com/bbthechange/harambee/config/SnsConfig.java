package com.bbthechange.harambee.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sns.SnsClient;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "harambee.sms.provider", havingValue = "aws")
public class SnsConfig {

    @Value("${aws.region:us-west-2}")
    private String region;

    @Bean
    public SnsClient snsClient(SmsGatewayProperties properties) {
        Duration timeout = properties.getSendTimeout();
        return SnsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(timeout)
                        .build())
                .build();
    }
}
