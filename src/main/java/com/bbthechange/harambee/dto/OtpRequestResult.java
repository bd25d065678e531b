package com.bbthechange.harambee.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of an OTP request. {@code sent=false} covers both rate limiting and gateway failure;
 * {@code message} tells the caller which.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OtpRequestResult {
    private String phoneNumber;
    private boolean sent;
    private Instant expiresAt;
    private String message;
}
