package com.bbthechange.harambee.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PhoneVerificationStatus {
    private String phoneNumber;
    private boolean verified;
}
