package com.bbthechange.harambee.sms;

import com.bbthechange.harambee.config.SmsGatewayProperties;
import com.bbthechange.harambee.dto.BroadcastResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@link SmsGateway} calls off the caller's thread.
 * <p>
 * Every send is attempted after the caller has committed its state change. A failed,
 * rejected or timed-out send is logged and counted, never thrown.
 */
@Service
public class SmsDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(SmsDispatcher.class);

    private final SmsGateway smsGateway;
    private final Executor executor;
    private final Duration sendTimeout;
    private final MeterRegistry meterRegistry;

    public SmsDispatcher(SmsGateway smsGateway,
                         @Qualifier("smsDispatchExecutor") Executor executor,
                         SmsGatewayProperties properties,
                         MeterRegistry meterRegistry) {
        this.smsGateway = smsGateway;
        this.executor = executor;
        this.sendTimeout = properties.getSendTimeout();
        this.meterRegistry = meterRegistry;
    }

    /**
     * Sends and waits for the provider's answer, at most the configured send timeout.
     *
     * @return whether the message was accepted in time
     */
    public boolean send(String phoneNumber, String message) {
        CompletableFuture<Boolean> future;
        try {
            future = CompletableFuture.supplyAsync(() -> attempt(phoneNumber, message), executor);
        } catch (RejectedExecutionException e) {
            logger.error("SMS dispatch queue full, dropping message to {}", phoneNumber);
            record("rejected");
            return false;
        }
        return await(future, phoneNumber);
    }

    /**
     * Fire-and-forget send. Returns immediately; the outcome is only logged.
     */
    public void sendAsync(String phoneNumber, String message) {
        try {
            executor.execute(() -> attempt(phoneNumber, message));
        } catch (RejectedExecutionException e) {
            logger.error("SMS dispatch queue full, dropping message to {}", phoneNumber);
            record("rejected");
        }
    }

    /**
     * Sends the same message to every recipient in parallel and waits for all of them.
     */
    public BroadcastResult broadcast(List<String> phoneNumbers, String message) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        List<String> recipients = new ArrayList<>();
        int failed = 0;
        for (String phoneNumber : phoneNumbers) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> attempt(phoneNumber, message), executor));
                recipients.add(phoneNumber);
            } catch (RejectedExecutionException e) {
                logger.error("SMS dispatch queue full, dropping broadcast to {}", phoneNumber);
                record("rejected");
                failed++;
            }
        }

        int sent = 0;
        for (int i = 0; i < futures.size(); i++) {
            if (await(futures.get(i), recipients.get(i))) {
                sent++;
            } else {
                failed++;
            }
        }

        logger.info("Broadcast completed: {} sent, {} failed out of {} total", sent, failed, phoneNumbers.size());
        return new BroadcastResult(sent, failed, phoneNumbers.size());
    }

    private boolean attempt(String phoneNumber, String message) {
        try {
            boolean accepted = smsGateway.send(phoneNumber, message);
            if (accepted) {
                record("success");
            } else {
                logger.warn("{} gateway did not accept SMS to {}", smsGateway.providerName(), phoneNumber);
                record("failed");
            }
            return accepted;
        } catch (Exception e) {
            logger.error("Error sending SMS to {} via {}: {}",
                    phoneNumber, smsGateway.providerName(), e.getMessage(), e);
            record("error");
            return false;
        }
    }

    private boolean await(CompletableFuture<Boolean> future, String target) {
        try {
            return future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("SMS to {} not confirmed within {} ms", target, sendTimeout.toMillis());
            future.cancel(true);
            record("timeout");
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for SMS to {}", target);
            return false;
        } catch (ExecutionException e) {
            logger.error("SMS to {} failed: {}", target, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        }
    }

    private void record(String status) {
        meterRegistry.counter("sms_send_total", "provider", smsGateway.providerName(), "status", status).increment();
    }
}
