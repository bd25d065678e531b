package com.bbthechange.harambee.model;

public enum KycStatus {
    PENDING,
    VERIFIED,
    REJECTED,
    REQUIRES_REVIEW
}
