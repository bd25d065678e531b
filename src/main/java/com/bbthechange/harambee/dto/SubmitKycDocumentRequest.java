package com.bbthechange.harambee.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SubmitKycDocumentRequest {

    @NotBlank(message = "Member ID is required")
    private String memberId;

    @NotBlank(message = "Document type is required")
    @Pattern(regexp = "^(NATIONAL_ID|PASSPORT|DRIVERS_LICENSE|VOTER_ID|COMMUNITY_ATTESTATION)$",
             message = "Document type must be NATIONAL_ID, PASSPORT, DRIVERS_LICENSE, VOTER_ID or COMMUNITY_ATTESTATION")
    private String documentType;

    @NotBlank(message = "Document number is required")
    @Size(max = 50, message = "Document number must be at most 50 characters")
    private String documentNumber;

    public SubmitKycDocumentRequest() {}

    public SubmitKycDocumentRequest(String memberId, String documentType, String documentNumber) {
        this.memberId = memberId;
        this.documentType = documentType;
        this.documentNumber = documentNumber;
    }
}
