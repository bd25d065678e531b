package com.bbthechange.harambee.model;

/**
 * Outcome of one inbound SMS, used for interaction statistics.
 */
public enum SmsInteractionType {
    UNREGISTERED_PHONE("unregistered_phone"),
    UNVERIFIED_PHONE("unverified_phone"),
    INVALID_FORMAT("invalid_format"),
    INVALID_PROPOSAL("invalid_proposal"),
    DEADLINE_PASSED("deadline_passed"),
    ALREADY_VOTED("already_voted"),
    VOTE_ERROR("vote_error"),
    VOTE_RECORDED("vote_recorded");

    private final String metricTag;

    SmsInteractionType(String metricTag) {
        this.metricTag = metricTag;
    }

    public String getMetricTag() {
        return metricTag;
    }
}
