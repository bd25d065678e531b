package com.bbthechange.harambee.service.impl;

import com.bbthechange.harambee.config.SmsVotingProperties;
import com.bbthechange.harambee.model.Proposal;
import com.bbthechange.harambee.model.ProposalStatus;
import com.bbthechange.harambee.model.VoteTally;
import com.bbthechange.harambee.repository.impl.InMemoryProposalRegistry;
import com.bbthechange.harambee.repository.impl.InMemoryVoteRepository;
import com.bbthechange.harambee.service.ProposalVotingGuard;
import com.bbthechange.harambee.service.ShortCodeRegistry;
import com.bbthechange.harambee.service.VoteService;
import com.bbthechange.harambee.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProposalLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant DEADLINE = NOW.plus(Duration.ofHours(1));

    private MutableClock clock;
    private InMemoryProposalRegistry proposalRegistry;
    private VoteService voteService;
    private ShortCodeRegistry shortCodeRegistry;
    private SimpleMeterRegistry meterRegistry;
    private ProposalLifecycleService lifecycleService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(NOW);
        proposalRegistry = new InMemoryProposalRegistry();
        voteService = new VoteServiceImpl(new InMemoryVoteRepository(), clock);
        shortCodeRegistry = new ShortCodeRegistry(new SmsVotingProperties(), clock);
        meterRegistry = new SimpleMeterRegistry();
        lifecycleService = new ProposalLifecycleService(proposalRegistry, voteService, shortCodeRegistry,
                new ProposalVotingGuard(), clock, meterRegistry);
    }

    private void createProposalWithVotes(String proposalId, int yes, int no) {
        proposalRegistry.save(new Proposal(proposalId, "group-1", "Proposal " + proposalId, DEADLINE));
        for (int i = 0; i < yes; i++) {
            voteService.recordVote(proposalId + "-yes-" + i, proposalId, true);
        }
        for (int i = 0; i < no; i++) {
            voteService.recordVote(proposalId + "-no-" + i, proposalId, false);
        }
    }

    private ProposalStatus statusOf(String proposalId) {
        return proposalRegistry.findById(proposalId).orElseThrow().getStatus();
    }

    @Test
    void checkVotingDeadlines_MajorityYes_Passes() {
        createProposalWithVotes("p-1", 6, 4);
        clock.advance(Duration.ofHours(2));

        assertThat(lifecycleService.checkVotingDeadlines()).isEqualTo(1);

        Proposal proposal = proposalRegistry.findById("p-1").orElseThrow();
        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.PASSED);
        assertThat(proposal.getVoteCount()).isEqualTo(new VoteTally(6, 4, 10));
        assertThat(meterRegistry.counter("proposal_resolved_total", "status", "passed").count()).isEqualTo(1.0);
    }

    @Test
    void checkVotingDeadlines_Tie_Fails() {
        createProposalWithVotes("p-1", 5, 5);
        clock.advance(Duration.ofHours(2));

        lifecycleService.checkVotingDeadlines();

        assertThat(statusOf("p-1")).isEqualTo(ProposalStatus.FAILED);
    }

    @Test
    void checkVotingDeadlines_NoVotes_Fails() {
        createProposalWithVotes("p-1", 0, 0);
        clock.advance(Duration.ofHours(2));

        lifecycleService.checkVotingDeadlines();

        assertThat(statusOf("p-1")).isEqualTo(ProposalStatus.FAILED);
        assertThat(proposalRegistry.findById("p-1").orElseThrow().getVoteCount()).isEqualTo(VoteTally.EMPTY);
    }

    @Test
    void checkVotingDeadlines_BeforeDeadline_LeavesProposalOpen() {
        createProposalWithVotes("p-1", 3, 0);
        clock.set(DEADLINE);

        assertThat(lifecycleService.checkVotingDeadlines()).isZero();
        assertThat(statusOf("p-1")).isEqualTo(ProposalStatus.VOTING);
    }

    @Test
    void checkVotingDeadlines_RunTwice_SecondRunIsNoOp() {
        createProposalWithVotes("p-1", 6, 4);
        clock.advance(Duration.ofHours(2));
        lifecycleService.checkVotingDeadlines();

        // A vote arriving through another channel after resolution must not flip the result
        voteService.recordVote("late-no-1", "p-1", false);
        voteService.recordVote("late-no-2", "p-1", false);
        voteService.recordVote("late-no-3", "p-1", false);

        assertThat(lifecycleService.checkVotingDeadlines()).isZero();
        assertThat(statusOf("p-1")).isEqualTo(ProposalStatus.PASSED);
        assertThat(proposalRegistry.findById("p-1").orElseThrow().getVoteCount()).isEqualTo(new VoteTally(6, 4, 10));
    }

    @Test
    void checkVotingDeadlines_IgnoresProposalsNotInVoting() {
        createProposalWithVotes("p-draft", 3, 0);
        proposalRegistry.transitionStatus("p-draft", ProposalStatus.VOTING, ProposalStatus.DRAFT);
        clock.advance(Duration.ofHours(2));

        assertThat(lifecycleService.checkVotingDeadlines()).isZero();
        assertThat(statusOf("p-draft")).isEqualTo(ProposalStatus.DRAFT);
    }

    @Test
    void checkVotingDeadlines_ClosesShortCode() {
        createProposalWithVotes("p-1", 1, 0);
        String code = shortCodeRegistry.register("p-1", "Proposal p-1", "group-1", DEADLINE);
        clock.advance(Duration.ofHours(2));

        lifecycleService.checkVotingDeadlines();

        assertThat(shortCodeRegistry.resolve(code)).isEmpty();
    }
}
