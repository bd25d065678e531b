package com.bbthechange.harambee.repository.impl;

import com.bbthechange.harambee.config.OtpProperties;
import com.bbthechange.harambee.model.OtpRecord;
import com.bbthechange.harambee.repository.OtpRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Caffeine-backed OTP store.
 * <p>
 * Per-phone atomicity comes from the cache's {@code asMap().compute}. The cache also
 * bounds memory: entries are evicted some time after the OTP lifetime even if no sweep
 * runs. Callers still check {@link OtpRecord#isExpired(Instant)} on every read.
 */
@Repository
public class CaffeineOtpRepository implements OtpRepository {

    private final Cache<String, OtpRecord> otpCache;
    private final ConcurrentMap<String, OtpRecord> otps;

    public CaffeineOtpRepository(OtpProperties properties) {
        this.otpCache = Caffeine.newBuilder()
                // Longer than the OTP lifetime; expiry is decided by OtpRecord, not eviction
                .expireAfterWrite(properties.getExpiry().plus(properties.getResendInterval()))
                .maximumSize(properties.getMaxStoredCodes())
                .build();
        this.otps = otpCache.asMap();
    }

    @Override
    public Optional<OtpRecord> findByPhoneNumber(String phoneNumber, Instant now) {
        return Optional.ofNullable(otps.computeIfPresent(phoneNumber,
                (key, current) -> current.isExpired(now) ? null : current));
    }

    @Override
    public OtpRecord compute(String phoneNumber, UnaryOperator<OtpRecord> remapping) {
        return otps.compute(phoneNumber, (key, current) -> remapping.apply(current));
    }

    @Override
    public int deleteExpired(Instant now) {
        AtomicInteger removed = new AtomicInteger();
        for (String phoneNumber : new ArrayList<>(otps.keySet())) {
            otps.computeIfPresent(phoneNumber, (key, current) -> {
                if (current.isExpired(now)) {
                    removed.incrementAndGet();
                    return null;
                }
                return current;
            });
        }
        return removed.get();
    }

    @Override
    public long count() {
        return otpCache.estimatedSize();
    }
}
