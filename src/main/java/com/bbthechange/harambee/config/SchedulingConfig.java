package com.bbthechange.harambee.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the OTP sweep and the voting deadline check. Disabled in tests via
 * {@code harambee.scheduling.enabled=false}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "harambee.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
