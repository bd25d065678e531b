package com.bbthechange.harambee.controller;

import com.bbthechange.harambee.dto.OtpRequest;
import com.bbthechange.harambee.dto.OtpRequestResult;
import com.bbthechange.harambee.dto.OtpStatus;
import com.bbthechange.harambee.dto.OtpVerificationRequest;
import com.bbthechange.harambee.dto.OtpVerificationResult;
import com.bbthechange.harambee.dto.PhoneVerificationStatus;
import com.bbthechange.harambee.dto.VerificationStatistics;
import com.bbthechange.harambee.exception.ResourceNotFoundException;
import com.bbthechange.harambee.model.VerificationType;
import com.bbthechange.harambee.service.PhoneVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for OTP phone verification.
 * Rate limiting and wrong codes are reported in the response body with 200 OK, not as errors.
 */
@RestController
@RequestMapping("/verification")
@Validated
@Tag(name = "Phone Verification", description = "One-time code phone verification")
public class PhoneVerificationController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(PhoneVerificationController.class);

    private final PhoneVerificationService phoneVerificationService;

    public PhoneVerificationController(PhoneVerificationService phoneVerificationService) {
        this.phoneVerificationService = phoneVerificationService;
    }

    @PostMapping("/otp/request")
    @Operation(summary = "Request OTP", description = "Sends a one-time code to the phone number by SMS")
    public ResponseEntity<OtpRequestResult> requestOtp(@Valid @RequestBody OtpRequest request) {
        VerificationType type = VerificationType.fromValue(request.getVerificationType());
        OtpRequestResult result = phoneVerificationService.requestOtp(request.getPhoneNumber(), type);
        logger.info("OTP request for {} ({}): sent={}", request.getPhoneNumber(), type, result.isSent());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/otp/verify")
    @Operation(summary = "Verify OTP", description = "Checks a one-time code previously sent to the phone number")
    public ResponseEntity<OtpVerificationResult> verifyOtp(@Valid @RequestBody OtpVerificationRequest request) {
        VerificationType type = VerificationType.fromValue(request.getVerificationType());
        OtpVerificationResult result = phoneVerificationService.verifyOtp(
                request.getPhoneNumber(), request.getOtpCode(), type);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/otp/status/{phoneNumber}")
    @Operation(summary = "OTP status", description = "Returns the live code's expiry and remaining attempts")
    public ResponseEntity<OtpStatus> getOtpStatus(
            @PathVariable @Pattern(regexp = "^\\+[1-9]\\d{8,14}$", message = "Phone number must be in E.164 format")
            String phoneNumber) {
        return phoneVerificationService.getOtpStatus(phoneNumber)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("No active OTP for " + phoneNumber));
    }

    @GetMapping("/phone/{phoneNumber}")
    @Operation(summary = "Phone verification status", description = "Whether the member with this phone has verified it")
    public ResponseEntity<PhoneVerificationStatus> getPhoneVerificationStatus(
            @PathVariable @Pattern(regexp = "^\\+[1-9]\\d{8,14}$", message = "Phone number must be in E.164 format")
            String phoneNumber) {
        return ResponseEntity.ok(new PhoneVerificationStatus(phoneNumber,
                phoneVerificationService.isPhoneVerified(phoneNumber)));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Verification statistics")
    public ResponseEntity<VerificationStatistics> getStatistics() {
        return ResponseEntity.ok(phoneVerificationService.getVerificationStatistics());
    }
}
