package com.bbthechange.harambee.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class KycDocument {
    private String documentId;
    private String memberId;
    private KycDocumentType documentType;
    private String documentNumber;
    private DocumentVerificationStatus verificationStatus;
    private Instant createdAt;
    private Instant verifiedAt;

    public boolean isVerified() {
        return verificationStatus == DocumentVerificationStatus.VERIFIED;
    }
}
