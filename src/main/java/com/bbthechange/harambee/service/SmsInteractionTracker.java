package com.bbthechange.harambee.service;

import com.bbthechange.harambee.model.SmsInteractionType;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts inbound SMS outcomes for the statistics endpoint and mirrors them to
 * the {@code sms_vote_total} metric.
 */
@Component
public class SmsInteractionTracker {

    private final Map<SmsInteractionType, LongAdder> counts = new EnumMap<>(SmsInteractionType.class);
    private final MeterRegistry meterRegistry;

    public SmsInteractionTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (SmsInteractionType type : SmsInteractionType.values()) {
            counts.put(type, new LongAdder());
        }
    }

    public void record(SmsInteractionType type) {
        counts.get(type).increment();
        meterRegistry.counter("sms_vote_total", "outcome", type.getMetricTag()).increment();
    }

    public long count(SmsInteractionType type) {
        return counts.get(type).sum();
    }

    public long total() {
        return counts.values().stream().mapToLong(LongAdder::sum).sum();
    }

    /**
     * Non-zero counts keyed by metric tag.
     */
    public Map<String, Long> breakdown() {
        Map<String, Long> breakdown = new LinkedHashMap<>();
        counts.forEach((type, count) -> {
            long value = count.sum();
            if (value > 0) {
                breakdown.put(type.getMetricTag(), value);
            }
        });
        return breakdown;
    }
}
