package com.bbthechange.harambee.service.impl;

import com.bbthechange.harambee.config.OtpProperties;
import com.bbthechange.harambee.dto.OtpRequestResult;
import com.bbthechange.harambee.dto.OtpStatus;
import com.bbthechange.harambee.dto.OtpVerificationResult;
import com.bbthechange.harambee.dto.VerificationStatistics;
import com.bbthechange.harambee.model.Member;
import com.bbthechange.harambee.model.OtpRecord;
import com.bbthechange.harambee.model.VerificationType;
import com.bbthechange.harambee.repository.MemberDirectory;
import com.bbthechange.harambee.repository.OtpRepository;
import com.bbthechange.harambee.service.KycService;
import com.bbthechange.harambee.service.PhoneVerificationService;
import com.bbthechange.harambee.service.SmsTextGenerator;
import com.bbthechange.harambee.sms.SmsDispatcher;
import com.bbthechange.harambee.util.OtpCodeGenerator;
import com.bbthechange.harambee.util.OtpCodeHasher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * OTP issuance and verification.
 * <p>
 * Each read-check-write on a phone's record happens inside {@link OtpRepository#compute},
 * so concurrent requests and verifications for the same phone are serialized. SMS sends
 * and directory updates happen after the record has been written.
 */
@Service
public class PhoneVerificationServiceImpl implements PhoneVerificationService {

    private static final Logger logger = LoggerFactory.getLogger(PhoneVerificationServiceImpl.class);

    private final OtpRepository otpRepository;
    private final MemberDirectory memberDirectory;
    private final KycService kycService;
    private final SmsDispatcher smsDispatcher;
    private final SmsTextGenerator textGenerator;
    private final OtpProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public PhoneVerificationServiceImpl(OtpRepository otpRepository,
                                        MemberDirectory memberDirectory,
                                        KycService kycService,
                                        SmsDispatcher smsDispatcher,
                                        SmsTextGenerator textGenerator,
                                        OtpProperties properties,
                                        Clock clock,
                                        MeterRegistry meterRegistry) {
        this.otpRepository = otpRepository;
        this.memberDirectory = memberDirectory;
        this.kycService = kycService;
        this.smsDispatcher = smsDispatcher;
        this.textGenerator = textGenerator;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public OtpRequestResult requestOtp(String phoneNumber, VerificationType verificationType) {
        logger.info("OTP requested for {}, type: {}", phoneNumber, verificationType);

        Instant now = clock.instant();
        Duration resendInterval = properties.getResendInterval();
        AtomicReference<OtpRecord> throttledBy = new AtomicReference<>();
        AtomicReference<String> issuedCode = new AtomicReference<>();

        OtpRecord stored = otpRepository.compute(phoneNumber, current -> {
            if (current != null && !current.isExpired(now)
                    && Duration.between(current.getLastRequestAt(), now).compareTo(resendInterval) < 0) {
                throttledBy.set(current);
                return current;
            }
            String code = OtpCodeGenerator.generate(properties.getCodeLength());
            issuedCode.set(code);
            return OtpRecord.issue(phoneNumber, OtpCodeHasher.hash(code), verificationType, now,
                    now.plus(properties.getExpiry()));
        });

        OtpRecord previous = throttledBy.get();
        if (previous != null) {
            Duration elapsed = Duration.between(previous.getLastRequestAt(), now);
            double remainingMinutes = resendInterval.minus(elapsed).toMillis() / 60_000.0;
            logger.info("Rate limit exceeded for OTP request: {}", phoneNumber);
            meterRegistry.counter("otp_request_total", "status", "rate_limited").increment();
            return new OtpRequestResult(phoneNumber, false, previous.getExpiresAt(),
                    String.format(Locale.ROOT, "Please wait %.1f minutes before requesting another OTP", remainingMinutes));
        }

        String message = textGenerator.getOtpMessage(issuedCode.get(), properties.getExpiry().toMinutes());
        if (smsDispatcher.send(phoneNumber, message)) {
            logger.info("OTP sent successfully to {}", phoneNumber);
            meterRegistry.counter("otp_request_total", "status", "sent").increment();
            return new OtpRequestResult(phoneNumber, true, stored.getExpiresAt(), "OTP sent successfully");
        }

        // Record stays stored after a failed send
        logger.error("Failed to send OTP to {}", phoneNumber);
        meterRegistry.counter("otp_request_total", "status", "send_failed").increment();
        return new OtpRequestResult(phoneNumber, false, stored.getExpiresAt(), "Failed to send OTP. Please try again.");
    }

    @Override
    public OtpVerificationResult verifyOtp(String phoneNumber, String otpCode, VerificationType verificationType) {
        logger.info("OTP verification attempt for {}", phoneNumber);

        Instant now = clock.instant();
        String provided = otpCode == null ? "" : otpCode.trim();
        AtomicReference<OtpVerificationResult> outcome = new AtomicReference<>();
        AtomicReference<String> status = new AtomicReference<>();

        otpRepository.compute(phoneNumber, current -> {
            if (current == null) {
                logger.warn("No OTP found for {}", phoneNumber);
                status.set("not_found");
                outcome.set(OtpVerificationResult.failed(phoneNumber, verificationType, null));
                return null;
            }
            if (current.isExpired(now)) {
                logger.warn("Expired OTP for {}", phoneNumber);
                status.set("expired");
                outcome.set(OtpVerificationResult.failed(phoneNumber, verificationType, current.getExpiresAt()));
                return null;
            }
            if (current.getVerificationType() != verificationType) {
                logger.warn("Verification type mismatch for {}: expected {}, got {}",
                        phoneNumber, current.getVerificationType(), verificationType);
                status.set("type_mismatch");
                outcome.set(OtpVerificationResult.failed(phoneNumber, verificationType, current.getExpiresAt()));
                return current;
            }

            OtpRecord attempted = current.withIncrementedAttempts();
            if (attempted.getAttempts() > properties.getMaxAttempts()) {
                logger.warn("Max OTP attempts exceeded for {}", phoneNumber);
                status.set("locked");
                outcome.set(OtpVerificationResult.failed(phoneNumber, verificationType, null));
                return null;
            }
            if (OtpCodeHasher.matches(provided, attempted.getCodeHash())) {
                logger.info("OTP verified successfully for {}", phoneNumber);
                status.set("verified");
                outcome.set(OtpVerificationResult.verified(phoneNumber, verificationType, attempted.getExpiresAt()));
                return null;
            }

            logger.warn("Invalid OTP for {} (attempt {}/{})",
                    phoneNumber, attempted.getAttempts(), properties.getMaxAttempts());
            status.set("invalid");
            outcome.set(OtpVerificationResult.failed(phoneNumber, verificationType, attempted.getExpiresAt()));
            return attempted;
        });

        meterRegistry.counter("otp_verify_total", "status", status.get()).increment();

        OtpVerificationResult result = outcome.get();
        if (result.isVerified() && verificationType == VerificationType.REGISTRATION) {
            markRegistrationVerified(phoneNumber);
        }
        return result;
    }

    @Override
    public Optional<OtpStatus> getOtpStatus(String phoneNumber) {
        Instant now = clock.instant();
        Optional<OtpRecord> live = otpRepository.findByPhoneNumber(phoneNumber, now);
        if (live.isEmpty()) {
            return Optional.empty();
        }
        OtpRecord current = live.get();

        boolean canRequestNew = Duration.between(current.getLastRequestAt(), now)
                .compareTo(properties.getResendInterval()) >= 0;
        return Optional.of(new OtpStatus(phoneNumber, current.getVerificationType(), current.getExpiresAt(),
                Math.max(0, properties.getMaxAttempts() - current.getAttempts()), canRequestNew));
    }

    @Override
    public boolean isPhoneVerified(String phoneNumber) {
        return memberDirectory.findByPhoneNumber(phoneNumber)
                .map(Member::isPhoneVerified)
                .orElse(false);
    }

    @Override
    public VerificationStatistics getVerificationStatistics() {
        long totalMembers = memberDirectory.count();
        long verifiedPhones = memberDirectory.countPhoneVerified();
        double rate = totalMembers > 0 ? (double) verifiedPhones / totalMembers : 0.0;
        return new VerificationStatistics(totalMembers, verifiedPhones, otpRepository.count(), rate);
    }

    @Override
    @Scheduled(fixedDelayString = "${harambee.otp.cleanup-interval:PT5M}")
    public int cleanupExpiredOtps() {
        try {
            int removed = otpRepository.deleteExpired(clock.instant());
            if (removed > 0) {
                logger.info("Cleaned up {} expired OTPs", removed);
            }
            return removed;
        } catch (Exception e) {
            logger.error("Error during expired OTP cleanup", e);
            return 0;
        }
    }

    /**
     * Mark the member's phone verified and try KYC auto-elevation. Neither failure
     * changes the verification outcome already decided.
     */
    private void markRegistrationVerified(String phoneNumber) {
        Optional<Member> member;
        try {
            member = memberDirectory.findByPhoneNumber(phoneNumber);
        } catch (Exception e) {
            logger.error("Failed to look up member for verified phone {}", phoneNumber, e);
            return;
        }
        if (member.isEmpty()) {
            logger.info("Verified phone {} has no member record yet", phoneNumber);
            return;
        }

        String memberId = member.get().getMemberId();
        try {
            memberDirectory.setPhoneVerified(memberId);
        } catch (Exception e) {
            logger.error("Failed to mark phone verified for member {}", memberId, e);
            return;
        }

        try {
            kycService.autoElevate(memberId);
        } catch (Exception e) {
            logger.error("KYC auto-verification failed for member {}", memberId, e);
        }
    }
}
