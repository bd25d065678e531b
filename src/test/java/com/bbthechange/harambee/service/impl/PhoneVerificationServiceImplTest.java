package com.bbthechange.harambee.service.impl;

import com.bbthechange.harambee.config.OtpProperties;
import com.bbthechange.harambee.config.SmsVotingProperties;
import com.bbthechange.harambee.dto.OtpRequestResult;
import com.bbthechange.harambee.dto.OtpStatus;
import com.bbthechange.harambee.dto.OtpVerificationResult;
import com.bbthechange.harambee.dto.VerificationStatistics;
import com.bbthechange.harambee.exception.MemberNotFoundException;
import com.bbthechange.harambee.model.Member;
import com.bbthechange.harambee.model.OtpRecord;
import com.bbthechange.harambee.model.VerificationType;
import com.bbthechange.harambee.repository.MemberDirectory;
import com.bbthechange.harambee.repository.impl.CaffeineOtpRepository;
import com.bbthechange.harambee.service.KycService;
import com.bbthechange.harambee.service.SmsTextGenerator;
import com.bbthechange.harambee.sms.SmsDispatcher;
import com.bbthechange.harambee.testutil.MemberTestBuilder;
import com.bbthechange.harambee.testutil.MutableClock;
import com.bbthechange.harambee.util.OtpCodeHasher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PhoneVerificationServiceImpl.
 *
 * Uses the real Caffeine OTP store and a movable clock; SMS dispatch, the member
 * directory and KYC are mocked.
 */
@ExtendWith(MockitoExtension.class)
class PhoneVerificationServiceImplTest {

    private static final String PHONE = "+254712345678";
    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");
    private static final Pattern SENT_CODE = Pattern.compile("code is: (\\d{6})");

    @Mock
    private MemberDirectory memberDirectory;

    @Mock
    private KycService kycService;

    @Mock
    private SmsDispatcher smsDispatcher;

    private MutableClock clock;
    private CaffeineOtpRepository otpRepository;
    private SimpleMeterRegistry meterRegistry;
    private PhoneVerificationServiceImpl service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(START);
        OtpProperties properties = new OtpProperties();
        otpRepository = new CaffeineOtpRepository(properties);
        meterRegistry = new SimpleMeterRegistry();
        service = new PhoneVerificationServiceImpl(otpRepository, memberDirectory, kycService, smsDispatcher,
                new SmsTextGenerator(new SmsVotingProperties()), properties, clock, meterRegistry);
    }

    private String issueCode(VerificationType type) {
        when(smsDispatcher.send(eq(PHONE), anyString())).thenReturn(true);
        service.requestOtp(PHONE, type);
        return sentCode();
    }

    private String sentCode() {
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(smsDispatcher, atLeastOnce()).send(eq(PHONE), message.capture());
        Matcher matcher = SENT_CODE.matcher(message.getValue());
        assertThat(matcher.find()).isTrue();
        return matcher.group(1);
    }

    private Optional<OtpRecord> storedRecord() {
        return otpRepository.findByPhoneNumber(PHONE, clock.instant());
    }

    private static String wrongCode(String code) {
        return code.equals("000000") ? "111111" : "000000";
    }

    @Nested
    class RequestOtpTests {

        @Test
        void requestOtp_NewPhone_StoresAndSendsSixDigitCode() {
            when(smsDispatcher.send(eq(PHONE), anyString())).thenReturn(true);

            OtpRequestResult result = service.requestOtp(PHONE, VerificationType.REGISTRATION);

            assertThat(result.isSent()).isTrue();
            assertThat(result.getMessage()).isEqualTo("OTP sent successfully");
            assertThat(result.getExpiresAt()).isEqualTo(START.plus(Duration.ofMinutes(10)));

            ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
            verify(smsDispatcher).send(eq(PHONE), message.capture());
            String code = sentCode();
            assertThat(message.getValue()).isEqualTo("Your Harambee DAO verification code is: " + code
                    + ". Valid for 10 minutes. Do not share this code.");
            assertThat(meterRegistry.counter("otp_request_total", "status", "sent").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Only the SHA-256 hash of the issued code is stored")
        void requestOtp_StoresHashNotPlainCode() {
            String code = issueCode(VerificationType.REGISTRATION);

            OtpRecord stored = storedRecord().orElseThrow();

            assertThat(stored.getCodeHash()).isEqualTo(OtpCodeHasher.hash(code));
            assertThat(stored.getCodeHash()).hasSize(64).doesNotContain(code);
            assertThat(stored.toString()).contains("[REDACTED]");
        }

        @Test
        void requestOtp_TwiceWithinResendInterval_SecondIsRateLimited() {
            when(smsDispatcher.send(eq(PHONE), anyString())).thenReturn(true);
            service.requestOtp(PHONE, VerificationType.REGISTRATION);
            String firstHash = storedRecord().orElseThrow().getCodeHash();

            clock.advance(Duration.ofSeconds(30));
            OtpRequestResult second = service.requestOtp(PHONE, VerificationType.REGISTRATION);

            assertThat(second.isSent()).isFalse();
            assertThat(second.getMessage()).isEqualTo("Please wait 0.5 minutes before requesting another OTP");
            assertThat(storedRecord().orElseThrow().getCodeHash()).isEqualTo(firstHash);
            verify(smsDispatcher, times(1)).send(eq(PHONE), anyString());
            assertThat(meterRegistry.counter("otp_request_total", "status", "rate_limited").count()).isEqualTo(1.0);
        }

        @Test
        void requestOtp_AfterResendInterval_IssuesNewRecord() {
            when(smsDispatcher.send(eq(PHONE), anyString())).thenReturn(true);
            service.requestOtp(PHONE, VerificationType.REGISTRATION);

            clock.advance(Duration.ofSeconds(61));
            OtpRequestResult second = service.requestOtp(PHONE, VerificationType.VOTING);

            assertThat(second.isSent()).isTrue();
            assertThat(second.getExpiresAt()).isEqualTo(START.plusSeconds(61).plus(Duration.ofMinutes(10)));
            assertThat(storedRecord().orElseThrow().getVerificationType())
                    .isEqualTo(VerificationType.VOTING);
        }

        @Test
        void requestOtp_GatewayFails_ReportsNotSentButKeepsRecord() {
            when(smsDispatcher.send(eq(PHONE), anyString())).thenReturn(false);

            OtpRequestResult result = service.requestOtp(PHONE, VerificationType.REGISTRATION);

            assertThat(result.isSent()).isFalse();
            assertThat(result.getMessage()).isEqualTo("Failed to send OTP. Please try again.");
            assertThat(storedRecord()).isPresent();
            assertThat(meterRegistry.counter("otp_request_total", "status", "send_failed").count()).isEqualTo(1.0);
        }
    }

    @Nested
    class VerifyOtpTests {

        @Test
        void verifyOtp_CorrectCode_VerifiesOnceThenRecordIsGone() {
            String code = issueCode(VerificationType.VOTING);

            OtpVerificationResult first = service.verifyOtp(PHONE, code, VerificationType.VOTING);
            OtpVerificationResult second = service.verifyOtp(PHONE, code, VerificationType.VOTING);

            assertThat(first.isVerified()).isTrue();
            assertThat(first.getExpiresAt()).isEqualTo(START.plus(Duration.ofMinutes(10)));
            assertThat(second.isVerified()).isFalse();
            assertThat(second.getExpiresAt()).isNull();
            verifyNoInteractions(memberDirectory, kycService);
        }

        @Test
        void verifyOtp_CodeWithSurroundingWhitespace_IsAccepted() {
            String code = issueCode(VerificationType.VOTING);

            assertThat(service.verifyOtp(PHONE, " " + code + " ", VerificationType.VOTING).isVerified()).isTrue();
        }

        @Test
        void verifyOtp_NoRecord_FailsWithNullExpiry() {
            OtpVerificationResult result = service.verifyOtp(PHONE, "123456", VerificationType.REGISTRATION);

            assertThat(result.isVerified()).isFalse();
            assertThat(result.getExpiresAt()).isNull();
            assertThat(meterRegistry.counter("otp_verify_total", "status", "not_found").count()).isEqualTo(1.0);
        }

        @Test
        void verifyOtp_WrongCode_FailsAndKeepsRecord() {
            String code = issueCode(VerificationType.VOTING);

            OtpVerificationResult result = service.verifyOtp(PHONE, wrongCode(code), VerificationType.VOTING);

            assertThat(result.isVerified()).isFalse();
            assertThat(result.getExpiresAt()).isNotNull();
            assertThat(storedRecord().orElseThrow().getAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("Fourth attempt locks out even with the correct code")
        void verifyOtp_FourthAttemptWithCorrectCode_IsLockedOut() {
            String code = issueCode(VerificationType.VOTING);
            for (int i = 0; i < 3; i++) {
                assertThat(service.verifyOtp(PHONE, wrongCode(code), VerificationType.VOTING).isVerified()).isFalse();
            }

            OtpVerificationResult fourth = service.verifyOtp(PHONE, code, VerificationType.VOTING);

            assertThat(fourth.isVerified()).isFalse();
            assertThat(fourth.getExpiresAt()).isNull();
            assertThat(storedRecord()).isEmpty();
            assertThat(meterRegistry.counter("otp_verify_total", "status", "locked").count()).isEqualTo(1.0);
        }

        @Test
        void verifyOtp_ThirdAttemptWithCorrectCode_StillVerifies() {
            String code = issueCode(VerificationType.VOTING);
            service.verifyOtp(PHONE, wrongCode(code), VerificationType.VOTING);
            service.verifyOtp(PHONE, wrongCode(code), VerificationType.VOTING);

            assertThat(service.verifyOtp(PHONE, code, VerificationType.VOTING).isVerified()).isTrue();
        }

        @Test
        void verifyOtp_AfterExpiry_FailsAndDeletesRecord() {
            String code = issueCode(VerificationType.VOTING);
            clock.advance(Duration.ofMinutes(10).plusSeconds(1));

            OtpVerificationResult result = service.verifyOtp(PHONE, code, VerificationType.VOTING);

            assertThat(result.isVerified()).isFalse();
            assertThat(result.getExpiresAt()).isEqualTo(START.plus(Duration.ofMinutes(10)));
            assertThat(storedRecord()).isEmpty();
        }

        @Test
        void verifyOtp_ExactlyAtExpiry_StillAccepted() {
            String code = issueCode(VerificationType.VOTING);
            clock.advance(Duration.ofMinutes(10));

            assertThat(service.verifyOtp(PHONE, code, VerificationType.VOTING).isVerified()).isTrue();
        }

        @Test
        void verifyOtp_TypeMismatch_FailsWithoutConsumingAttempt() {
            String code = issueCode(VerificationType.VOTING);

            OtpVerificationResult result = service.verifyOtp(PHONE, code, VerificationType.PASSWORD_RESET);

            assertThat(result.isVerified()).isFalse();
            assertThat(result.getVerificationType()).isEqualTo(VerificationType.PASSWORD_RESET);
            assertThat(storedRecord().orElseThrow().getAttempts()).isZero();
        }

        @Test
        void verifyOtp_Registration_MarksPhoneVerifiedAndTriesKyc() {
            String code = issueCode(VerificationType.REGISTRATION);
            Member member = MemberTestBuilder.aMember().withId("m-1").withPhone(PHONE).build();
            when(memberDirectory.findByPhoneNumber(PHONE)).thenReturn(Optional.of(member));

            OtpVerificationResult result = service.verifyOtp(PHONE, code, VerificationType.REGISTRATION);

            assertThat(result.isVerified()).isTrue();
            verify(memberDirectory).setPhoneVerified("m-1");
            verify(kycService).autoElevate("m-1");
        }

        @Test
        void verifyOtp_RegistrationWhenDirectoryFails_StillVerified() {
            String code = issueCode(VerificationType.REGISTRATION);
            Member member = MemberTestBuilder.aMember().withId("m-1").withPhone(PHONE).build();
            when(memberDirectory.findByPhoneNumber(PHONE)).thenReturn(Optional.of(member));
            doThrow(new MemberNotFoundException("gone")).when(memberDirectory).setPhoneVerified("m-1");

            OtpVerificationResult result = service.verifyOtp(PHONE, code, VerificationType.REGISTRATION);

            assertThat(result.isVerified()).isTrue();
            verifyNoInteractions(kycService);
        }

        @Test
        void verifyOtp_RegistrationWhenKycFails_StillVerified() {
            String code = issueCode(VerificationType.REGISTRATION);
            Member member = MemberTestBuilder.aMember().withId("m-1").withPhone(PHONE).build();
            when(memberDirectory.findByPhoneNumber(PHONE)).thenReturn(Optional.of(member));
            when(kycService.autoElevate("m-1")).thenThrow(new IllegalStateException("kyc down"));

            assertThat(service.verifyOtp(PHONE, code, VerificationType.REGISTRATION).isVerified()).isTrue();
        }

        @Test
        void verifyOtp_RegistrationForUnknownMember_StillVerified() {
            String code = issueCode(VerificationType.REGISTRATION);
            when(memberDirectory.findByPhoneNumber(PHONE)).thenReturn(Optional.empty());

            assertThat(service.verifyOtp(PHONE, code, VerificationType.REGISTRATION).isVerified()).isTrue();
            verify(memberDirectory, never()).setPhoneVerified(anyString());
        }
    }

    @Nested
    class StatusTests {

        @Test
        void getOtpStatus_LiveRecord_ReportsAttemptsAndResendAvailability() {
            String code = issueCode(VerificationType.VOTING);
            service.verifyOtp(PHONE, wrongCode(code), VerificationType.VOTING);

            OtpStatus status = service.getOtpStatus(PHONE).orElseThrow();
            assertThat(status.getAttemptsRemaining()).isEqualTo(2);
            assertThat(status.isCanRequestNew()).isFalse();
            assertThat(status.getVerificationType()).isEqualTo(VerificationType.VOTING);

            clock.advance(Duration.ofMinutes(1));
            assertThat(service.getOtpStatus(PHONE).orElseThrow().isCanRequestNew()).isTrue();
        }

        @Test
        void getOtpStatus_ExpiredRecord_IsEmptyAndDeleted() {
            issueCode(VerificationType.VOTING);
            clock.advance(Duration.ofMinutes(11));

            assertThat(service.getOtpStatus(PHONE)).isEmpty();
            assertThat(storedRecord()).isEmpty();
        }

        @Test
        void getOtpStatus_NoRecord_IsEmpty() {
            assertThat(service.getOtpStatus(PHONE)).isEmpty();
        }
    }

    @Test
    void cleanupExpiredOtps_RemovesOnlyExpiredRecords() {
        when(smsDispatcher.send(anyString(), anyString())).thenReturn(true);
        service.requestOtp("+254700000001", VerificationType.VOTING);
        clock.advance(Duration.ofMinutes(8));
        service.requestOtp("+254700000002", VerificationType.VOTING);
        clock.advance(Duration.ofMinutes(3));

        int removed = service.cleanupExpiredOtps();

        assertThat(removed).isEqualTo(1);
        assertThat(otpRepository.findByPhoneNumber("+254700000001", clock.instant())).isEmpty();
        assertThat(otpRepository.findByPhoneNumber("+254700000002", clock.instant())).isPresent();
    }

    @Test
    void getVerificationStatistics_ComputesRate() {
        when(memberDirectory.count()).thenReturn(4L);
        when(memberDirectory.countPhoneVerified()).thenReturn(1L);

        VerificationStatistics statistics = service.getVerificationStatistics();

        assertThat(statistics.getTotalMembers()).isEqualTo(4);
        assertThat(statistics.getVerifiedPhones()).isEqualTo(1);
        assertThat(statistics.getVerificationRate()).isEqualTo(0.25);
    }

    @Test
    void getVerificationStatistics_NoMembers_RateIsZero() {
        when(memberDirectory.count()).thenReturn(0L);
        when(memberDirectory.countPhoneVerified()).thenReturn(0L);

        assertThat(service.getVerificationStatistics().getVerificationRate()).isZero();
    }

    @Test
    void isPhoneVerified_UsesDirectory() {
        Member member = MemberTestBuilder.aMember().withPhone(PHONE).verified().build();
        when(memberDirectory.findByPhoneNumber(PHONE)).thenReturn(Optional.of(member));
        when(memberDirectory.findByPhoneNumber("+254799999999")).thenReturn(Optional.empty());

        assertThat(service.isPhoneVerified(PHONE)).isTrue();
        assertThat(service.isPhoneVerified("+254799999999")).isFalse();
    }
}
