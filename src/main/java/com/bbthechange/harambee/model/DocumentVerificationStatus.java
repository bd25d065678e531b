package com.bbthechange.harambee.model;

public enum DocumentVerificationStatus {
    PENDING,
    VERIFIED,
    FAILED
}
