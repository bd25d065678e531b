package com.bbthechange.harambee.repository;

import com.bbthechange.harambee.model.OtpRecord;

import java.time.Instant;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Holds at most one live OTP record per phone number.
 */
public interface OtpRepository {

    /**
     * The live record for a phone number. An expired record is removed and not returned.
     */
    Optional<OtpRecord> findByPhoneNumber(String phoneNumber, Instant now);

    /**
     * Atomically replaces the record for a phone number. The function receives the current
     * record, or {@code null} when there is none, and returns the new record, or {@code null}
     * to delete it. No other write to the same phone number interleaves with the call.
     *
     * @return the record stored afterwards, or {@code null} if none
     */
    OtpRecord compute(String phoneNumber, UnaryOperator<OtpRecord> remapping);

    /**
     * Removes every record that expired before {@code now}. Each removal is atomic per phone
     * number, so a concurrent request that replaces the record is never lost.
     *
     * @return number of records removed
     */
    int deleteExpired(Instant now);

    long count();
}
