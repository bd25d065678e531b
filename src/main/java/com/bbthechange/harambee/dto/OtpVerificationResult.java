package com.bbthechange.harambee.dto;

import com.bbthechange.harambee.model.VerificationType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OtpVerificationResult {
    private String phoneNumber;
    private boolean verified;
    private VerificationType verificationType;
    private Instant expiresAt;   // null when no record remains to report on

    public static OtpVerificationResult failed(String phoneNumber, VerificationType type, Instant expiresAt) {
        return new OtpVerificationResult(phoneNumber, false, type, expiresAt);
    }

    public static OtpVerificationResult verified(String phoneNumber, VerificationType type, Instant expiresAt) {
        return new OtpVerificationResult(phoneNumber, true, type, expiresAt);
    }
}
