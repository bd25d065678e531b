package com.bbthechange.harambee.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerificationStatistics {
    private long totalMembers;
    private long verifiedPhones;
    private long activeOtps;
    private double verificationRate;
}
