package com.bbthechange.harambee.service;

import com.bbthechange.harambee.config.SmsVotingProperties;
import com.bbthechange.harambee.exception.ShortCodeExhaustedException;
import com.bbthechange.harambee.model.SmsVotingProposal;
import com.bbthechange.harambee.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShortCodeRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant DEADLINE = NOW.plusSeconds(3600);

    private SmsVotingProperties properties;
    private ShortCodeRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new SmsVotingProperties();
        registry = new ShortCodeRegistry(properties, MutableClock.at(NOW));
    }

    @Nested
    class RegisterTests {

        @Test
        void register_FirstProposal_GetsCode001() {
            String code = registry.register("p-1", "Buy a water tank", "group-1", DEADLINE);

            assertThat(code).isEqualTo("001");
            assertThat(registry.resolve("001")).contains("p-1");
        }

        @Test
        void register_SequentialProposals_GetIncreasingCodes() {
            assertThat(registry.register("p-1", "A", "g", DEADLINE)).isEqualTo("001");
            assertThat(registry.register("p-2", "B", "g", DEADLINE)).isEqualTo("002");
            assertThat(registry.register("p-3", "C", "g", DEADLINE)).isEqualTo("003");
            assertThat(registry.activeCount()).isEqualTo(3);
        }

        @Test
        void register_SameProposalTwice_ReturnsExistingCode() {
            String first = registry.register("p-1", "A", "g", DEADLINE);
            String second = registry.register("p-1", "A", "g", DEADLINE);

            assertThat(second).isEqualTo(first);
            assertThat(registry.activeCount()).isEqualTo(1);
        }

        @Test
        void register_AfterEarlierCodeClosed_NeverCollidesWithActiveCode() {
            registry.register("p-1", "A", "g", DEADLINE);   // 001
            registry.register("p-2", "B", "g", DEADLINE);   // 002
            registry.close("p-1");

            // One active proposal, so the naive candidate is 002, which p-2 still holds
            String code = registry.register("p-3", "C", "g", DEADLINE);

            assertThat(code).isNotEqualTo("002");
            assertThat(registry.resolve("002")).contains("p-2");
            assertThat(registry.resolve(code)).contains("p-3");
        }

        @Test
        void register_StoresProposalDetails() {
            registry.register("p-1", "Buy a water tank", "group-1", DEADLINE);

            SmsVotingProposal proposal = registry.find("p-1").orElseThrow();
            assertThat(proposal.getTitle()).isEqualTo("Buy a water tank");
            assertThat(proposal.getGroupId()).isEqualTo("group-1");
            assertThat(proposal.getVotingDeadline()).isEqualTo(DEADLINE);
            assertThat(proposal.getCreatedAt()).isEqualTo(NOW);
        }

        @Test
        void register_WhenAllCodesTaken_Throws() {
            properties.setMaxShortCode(2);
            registry = new ShortCodeRegistry(properties, MutableClock.at(NOW));
            registry.register("p-1", "A", "g", DEADLINE);
            registry.register("p-2", "B", "g", DEADLINE);

            assertThatThrownBy(() -> registry.register("p-3", "C", "g", DEADLINE))
                    .isInstanceOf(ShortCodeExhaustedException.class);
            assertThat(registry.find("p-3")).isEmpty();
        }

        @Test
        void register_ConcurrentRegistrations_AssignDistinctCodes() throws Exception {
            int proposals = 200;
            ExecutorService executor = Executors.newFixedThreadPool(16);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < proposals; i++) {
                    String proposalId = "p-" + i;
                    futures.add(executor.submit(() -> {
                        start.await();
                        return registry.register(proposalId, "T", "g", DEADLINE);
                    }));
                }
                start.countDown();

                Set<String> codes = new HashSet<>();
                for (Future<String> future : futures) {
                    codes.add(future.get(10, TimeUnit.SECONDS));
                }
                assertThat(codes).hasSize(proposals);
                assertThat(registry.activeCount()).isEqualTo(proposals);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    class CloseTests {

        @Test
        void close_ActiveProposal_FreesCode() {
            registry.register("p-1", "A", "g", DEADLINE);

            assertThat(registry.close("p-1")).isTrue();
            assertThat(registry.resolve("001")).isEmpty();
            assertThat(registry.find("p-1")).isEmpty();
            assertThat(registry.activeCount()).isZero();
        }

        @Test
        void close_UnknownProposal_ReturnsFalse() {
            assertThat(registry.close("missing")).isFalse();
        }

        @Test
        void close_ThenRegisterAgain_CodeCanBeReused() {
            registry.register("p-1", "A", "g", DEADLINE);
            registry.close("p-1");

            assertThat(registry.register("p-2", "B", "g", DEADLINE)).isEqualTo("001");
        }
    }

    @Test
    void activeProposals_AreOrderedByCode() {
        registry.register("p-b", "B", "g", DEADLINE);
        registry.register("p-a", "A", "g", DEADLINE);

        assertThat(registry.activeProposals())
                .extracting(SmsVotingProposal::getShortCode)
                .containsExactly("001", "002");
    }
}
