package com.bbthechange.harambee.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Request DTO for issuing a one-time code to a phone number.
 */
@Data
public class OtpRequest {

    @NotBlank(message = "Phone number is required")
    @Pattern(regexp = "^\\+[1-9]\\d{8,14}$", message = "Phone number must be in E.164 format")
    private String phoneNumber;

    @NotBlank(message = "Verification type is required")
    @Pattern(regexp = "^(registration|voting|password_reset)$",
             message = "Verification type must be registration, voting or password_reset")
    private String verificationType;

    public OtpRequest() {}

    public OtpRequest(String phoneNumber, String verificationType) {
        this.phoneNumber = phoneNumber;
        this.verificationType = verificationType;
    }
}
