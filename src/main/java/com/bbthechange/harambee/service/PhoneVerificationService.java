package com.bbthechange.harambee.service;

import com.bbthechange.harambee.dto.OtpRequestResult;
import com.bbthechange.harambee.dto.OtpStatus;
import com.bbthechange.harambee.dto.OtpVerificationResult;
import com.bbthechange.harambee.dto.VerificationStatistics;
import com.bbthechange.harambee.model.VerificationType;

import java.util.Optional;

/**
 * Service interface for OTP-based phone verification.
 */
public interface PhoneVerificationService {

    /**
     * Issue a new code and send it by SMS, unless a code was requested for this phone
     * within the resend interval.
     * @param phoneNumber E.164 phone number
     * @param verificationType purpose the code is issued for
     * @return whether a code was sent, and why not if it wasn't
     */
    OtpRequestResult requestOtp(String phoneNumber, VerificationType verificationType);

    /**
     * Check a submitted code. Never throws for a wrong, expired or missing code;
     * the result carries {@code verified=false} instead.
     * @param phoneNumber E.164 phone number
     * @param otpCode code as typed by the user
     * @param verificationType purpose the caller is verifying for
     * @return verification result
     */
    OtpVerificationResult verifyOtp(String phoneNumber, String otpCode, VerificationType verificationType);

    /**
     * Status of the live code for a phone number, empty if none or expired.
     */
    Optional<OtpStatus> getOtpStatus(String phoneNumber);

    boolean isPhoneVerified(String phoneNumber);

    VerificationStatistics getVerificationStatistics();

    /**
     * Remove expired codes.
     * @return number of codes removed
     */
    int cleanupExpiredOtps();
}
