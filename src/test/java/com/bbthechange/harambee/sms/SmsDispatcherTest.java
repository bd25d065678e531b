package com.bbthechange.harambee.sms;

import com.bbthechange.harambee.config.SmsGatewayProperties;
import com.bbthechange.harambee.dto.BroadcastResult;
import com.bbthechange.harambee.exception.SmsDeliveryException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SmsDispatcherTest {

    private static final String PHONE = "+254712345678";

    @Mock
    private SmsGateway smsGateway;

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private SmsGatewayProperties properties;
    private SmsDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
        properties = new SmsGatewayProperties();
        properties.setSendTimeout(Duration.ofMillis(500));
        lenient().when(smsGateway.providerName()).thenReturn("test");
        dispatcher = new SmsDispatcher(smsGateway, executor, properties, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private double sendCount(String status) {
        return meterRegistry.counter("sms_send_total", "provider", "test", "status", status).count();
    }

    @Nested
    class SendTests {

        @Test
        void send_GatewayAccepts_ReturnsTrue() {
            when(smsGateway.send(PHONE, "hello")).thenReturn(true);

            assertThat(dispatcher.send(PHONE, "hello")).isTrue();
            assertThat(sendCount("success")).isEqualTo(1.0);
        }

        @Test
        void send_GatewayRefuses_ReturnsFalse() {
            when(smsGateway.send(PHONE, "hello")).thenReturn(false);

            assertThat(dispatcher.send(PHONE, "hello")).isFalse();
            assertThat(sendCount("failed")).isEqualTo(1.0);
        }

        @Test
        void send_GatewayThrows_ReturnsFalse() {
            when(smsGateway.send(PHONE, "hello")).thenThrow(new SmsDeliveryException("provider down"));

            assertThat(dispatcher.send(PHONE, "hello")).isFalse();
            assertThat(sendCount("error")).isEqualTo(1.0);
        }

        @Test
        void send_GatewaySlowerThanTimeout_ReturnsFalseWithoutWaiting() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            when(smsGateway.send(PHONE, "hello")).thenAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return true;
            });

            long started = System.nanoTime();
            boolean sent = dispatcher.send(PHONE, "hello");
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            release.countDown();

            assertThat(sent).isFalse();
            assertThat(elapsedMillis).isLessThan(3000);
            assertThat(sendCount("timeout")).isEqualTo(1.0);
        }

        @Test
        void send_QueueFull_ReturnsFalse() {
            Executor rejecting = command -> {
                throw new RejectedExecutionException("full");
            };
            dispatcher = new SmsDispatcher(smsGateway, rejecting, properties, meterRegistry);

            assertThat(dispatcher.send(PHONE, "hello")).isFalse();
            assertThat(sendCount("rejected")).isEqualTo(1.0);
            verify(smsGateway, never()).send(anyString(), anyString());
        }
    }

    @Nested
    class SendAsyncTests {

        @Test
        void sendAsync_DeliversOnExecutor() {
            when(smsGateway.send(PHONE, "hello")).thenReturn(true);

            dispatcher.sendAsync(PHONE, "hello");

            verify(smsGateway, timeout(2000)).send(PHONE, "hello");
        }

        @Test
        void sendAsync_QueueFull_DoesNotThrow() {
            Executor rejecting = command -> {
                throw new RejectedExecutionException("full");
            };
            dispatcher = new SmsDispatcher(smsGateway, rejecting, properties, meterRegistry);

            assertThatCode(() -> dispatcher.sendAsync(PHONE, "hello")).doesNotThrowAnyException();
            assertThat(sendCount("rejected")).isEqualTo(1.0);
        }
    }

    @Test
    void broadcast_CountsSentAndFailed() {
        when(smsGateway.send(eq("+254700000001"), anyString())).thenReturn(true);
        when(smsGateway.send(eq("+254700000002"), anyString())).thenReturn(false);
        when(smsGateway.send(eq("+254700000003"), anyString())).thenThrow(new SmsDeliveryException("boom"));

        BroadcastResult result = dispatcher.broadcast(
                List.of("+254700000001", "+254700000002", "+254700000003"), "vote now");

        assertThat(result.getSentCount()).isEqualTo(1);
        assertThat(result.getFailedCount()).isEqualTo(2);
        assertThat(result.getTotalRecipients()).isEqualTo(3);
    }
}
