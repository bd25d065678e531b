package com.bbthechange.harambee.dto;

import com.bbthechange.harambee.model.VerificationType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OtpStatus {
    private String phoneNumber;
    private VerificationType verificationType;
    private Instant expiresAt;
    private int attemptsRemaining;
    private boolean canRequestNew;
}
