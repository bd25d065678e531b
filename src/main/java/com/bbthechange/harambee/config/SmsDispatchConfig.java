package com.bbthechange.harambee.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Dedicated pool for SMS gateway calls so a slow provider never holds a request thread
 * past the send timeout.
 */
@Configuration
public class SmsDispatchConfig {

    @Bean(name = "smsDispatchExecutor")
    public ThreadPoolTaskExecutor smsDispatchExecutor(SmsGatewayProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDispatchThreads());
        executor.setMaxPoolSize(properties.getDispatchThreads());
        executor.setQueueCapacity(properties.getDispatchQueueCapacity());
        executor.setThreadNamePrefix("sms-dispatch-");
        // Full queue rejects; SmsDispatcher logs the dropped message
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        return executor;
    }
}
