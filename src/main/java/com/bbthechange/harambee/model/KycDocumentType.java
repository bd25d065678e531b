package com.bbthechange.harambee.model;

public enum KycDocumentType {
    NATIONAL_ID,
    PASSPORT,
    DRIVERS_LICENSE,
    VOTER_ID,
    COMMUNITY_ATTESTATION;

    public boolean isGovernmentId() {
        return this != COMMUNITY_ATTESTATION;
    }
}
