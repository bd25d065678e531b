package com.bbthechange.harambee.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class OtpVerificationRequest {

    @NotBlank(message = "Phone number is required")
    @Pattern(regexp = "^\\+[1-9]\\d{8,14}$", message = "Phone number must be in E.164 format")
    private String phoneNumber;

    @NotBlank(message = "OTP code is required")
    @Size(min = 4, max = 8, message = "OTP code must be 4 to 8 characters")
    private String otpCode;

    @NotBlank(message = "Verification type is required")
    @Pattern(regexp = "^(registration|voting|password_reset)$",
             message = "Verification type must be registration, voting or password_reset")
    private String verificationType;

    public OtpVerificationRequest() {}

    public OtpVerificationRequest(String phoneNumber, String otpCode, String verificationType) {
        this.phoneNumber = phoneNumber;
        this.otpCode = otpCode;
        this.verificationType = verificationType;
    }
}
