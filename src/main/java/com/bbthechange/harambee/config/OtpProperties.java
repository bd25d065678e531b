package com.bbthechange.harambee.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@ConfigurationProperties(prefix = "harambee.otp")
public class OtpProperties {

    private int codeLength = 6;

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration expiry = Duration.ofMinutes(10);

    private int maxAttempts = 3;

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration resendInterval = Duration.ofMinutes(1);

    private long maxStoredCodes = 100_000;

    public int getCodeLength() {
        return codeLength;
    }

    public void setCodeLength(int codeLength) {
        this.codeLength = codeLength;
    }

    public Duration getExpiry() {
        return expiry;
    }

    public void setExpiry(Duration expiry) {
        this.expiry = expiry;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getResendInterval() {
        return resendInterval;
    }

    public void setResendInterval(Duration resendInterval) {
        this.resendInterval = resendInterval;
    }

    public long getMaxStoredCodes() {
        return maxStoredCodes;
    }

    public void setMaxStoredCodes(long maxStoredCodes) {
        this.maxStoredCodes = maxStoredCodes;
    }
}
