package com.bbthechange.harambee.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "harambee.voting")
public class SmsVotingProperties {

    // Vote replies carry at most 4 digits
    private int maxShortCode = 9999;

    private int confirmationTitleLength = 30;

    private int broadcastTitleLength = 60;

    private String registrationUrl = "harambeedao.com";

    // Used when a proposal is created without a future voting deadline
    private Duration defaultVotingPeriod = Duration.ofDays(7);

    public int getMaxShortCode() {
        return maxShortCode;
    }

    public void setMaxShortCode(int maxShortCode) {
        this.maxShortCode = maxShortCode;
    }

    public int getConfirmationTitleLength() {
        return confirmationTitleLength;
    }

    public void setConfirmationTitleLength(int confirmationTitleLength) {
        this.confirmationTitleLength = confirmationTitleLength;
    }

    public int getBroadcastTitleLength() {
        return broadcastTitleLength;
    }

    public void setBroadcastTitleLength(int broadcastTitleLength) {
        this.broadcastTitleLength = broadcastTitleLength;
    }

    public String getRegistrationUrl() {
        return registrationUrl;
    }

    public void setRegistrationUrl(String registrationUrl) {
        this.registrationUrl = registrationUrl;
    }

    public Duration getDefaultVotingPeriod() {
        return defaultVotingPeriod;
    }

    public void setDefaultVotingPeriod(Duration defaultVotingPeriod) {
        this.defaultVotingPeriod = defaultVotingPeriod;
    }
}
