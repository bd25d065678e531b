package com.bbthechange.harambee.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Provider-independent SMS settings. Provider credentials are read in {@link SmsGatewayConfig}.
 */
@ConfigurationProperties(prefix = "harambee.sms")
public class SmsGatewayProperties {

    private String provider = "log";

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration sendTimeout = Duration.ofSeconds(10);

    private int dispatchThreads = 4;

    private int dispatchQueueCapacity = 500;

    private String allowlist = "";

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    public void setSendTimeout(Duration sendTimeout) {
        this.sendTimeout = sendTimeout;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    public void setDispatchThreads(int dispatchThreads) {
        this.dispatchThreads = dispatchThreads;
    }

    public int getDispatchQueueCapacity() {
        return dispatchQueueCapacity;
    }

    public void setDispatchQueueCapacity(int dispatchQueueCapacity) {
        this.dispatchQueueCapacity = dispatchQueueCapacity;
    }

    public String getAllowlist() {
        return allowlist;
    }

    public void setAllowlist(String allowlist) {
        this.allowlist = allowlist;
    }
}
