package com.bbthechange.harambee.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The single live one-time code for a phone number. Only the SHA-256 hash of the
 * code is held.
 * <p>
 * Instances are immutable; the store swaps whole records so a reader never sees
 * a half-updated attempt count.
 */
public final class OtpRecord {

    private final String phoneNumber;
    private final String codeHash;
    private final VerificationType verificationType;
    private final Instant expiresAt;
    private final Instant lastRequestAt;
    private final int attempts;

    public OtpRecord(String phoneNumber, String codeHash, VerificationType verificationType,
                     Instant expiresAt, Instant lastRequestAt, int attempts) {
        this.phoneNumber = phoneNumber;
        this.codeHash = codeHash;
        this.verificationType = verificationType;
        this.expiresAt = expiresAt;
        this.lastRequestAt = lastRequestAt;
        this.attempts = attempts;
    }

    public static OtpRecord issue(String phoneNumber, String codeHash, VerificationType verificationType,
                                  Instant now, Instant expiresAt) {
        return new OtpRecord(phoneNumber, codeHash, verificationType, expiresAt, now, 0);
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public String getCodeHash() {
        return codeHash;
    }

    public VerificationType getVerificationType() {
        return verificationType;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getLastRequestAt() {
        return lastRequestAt;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public OtpRecord withIncrementedAttempts() {
        return new OtpRecord(phoneNumber, codeHash, verificationType, expiresAt, lastRequestAt, attempts + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OtpRecord that = (OtpRecord) o;
        return attempts == that.attempts &&
                Objects.equals(phoneNumber, that.phoneNumber) &&
                Objects.equals(codeHash, that.codeHash) &&
                verificationType == that.verificationType &&
                Objects.equals(expiresAt, that.expiresAt) &&
                Objects.equals(lastRequestAt, that.lastRequestAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phoneNumber, codeHash, verificationType, expiresAt, lastRequestAt, attempts);
    }

    @Override
    public String toString() {
        return "OtpRecord{" +
                "phoneNumber='" + phoneNumber + '\'' +
                ", codeHash='[REDACTED]'" +
                ", verificationType=" + verificationType +
                ", attempts=" + attempts +
                ", expiresAt=" + expiresAt +
                ", lastRequestAt=" + lastRequestAt +
                '}';
    }
}
