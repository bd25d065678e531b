package com.bbthechange.harambee.service.impl;

import com.bbthechange.harambee.model.Proposal;
import com.bbthechange.harambee.model.ProposalStatus;
import com.bbthechange.harambee.model.VoteTally;
import com.bbthechange.harambee.repository.ProposalRegistry;
import com.bbthechange.harambee.service.ProposalVotingGuard;
import com.bbthechange.harambee.service.ShortCodeRegistry;
import com.bbthechange.harambee.service.VoteService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Scheduled service that resolves proposals whose voting deadline has passed.
 * <p>
 * A proposal passes on a strict majority of votes cast; ties and proposals with no
 * votes fail. Only proposals still in VOTING are touched, so repeated runs are no-ops.
 */
@Service
public class ProposalLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(ProposalLifecycleService.class);

    private final ProposalRegistry proposalRegistry;
    private final VoteService voteService;
    private final ShortCodeRegistry shortCodeRegistry;
    private final ProposalVotingGuard votingGuard;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public ProposalLifecycleService(ProposalRegistry proposalRegistry,
                                    VoteService voteService,
                                    ShortCodeRegistry shortCodeRegistry,
                                    ProposalVotingGuard votingGuard,
                                    Clock clock,
                                    MeterRegistry meterRegistry) {
        this.proposalRegistry = proposalRegistry;
        this.voteService = voteService;
        this.shortCodeRegistry = shortCodeRegistry;
        this.votingGuard = votingGuard;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Resolve every VOTING proposal whose deadline is in the past.
     * Runs every minute by default (configurable via harambee.voting.deadline-check-interval).
     *
     * @return number of proposals resolved by this run
     */
    @Scheduled(fixedDelayString = "${harambee.voting.deadline-check-interval:PT1M}")
    public int checkVotingDeadlines() {
        Instant now = clock.instant();
        int resolved = 0;

        for (Proposal proposal : proposalRegistry.findByStatus(ProposalStatus.VOTING)) {
            if (!now.isAfter(proposal.getVotingDeadline())) {
                continue;
            }
            try {
                if (resolve(proposal)) {
                    resolved++;
                }
            } catch (Exception e) {
                logger.error("Error resolving proposal {}", proposal.getProposalId(), e);
                meterRegistry.counter("proposal_resolved_total", "status", "error").increment();
            }
        }

        if (resolved > 0) {
            logger.info("Updated {} proposals that passed voting deadline", resolved);
        }
        return resolved;
    }

    /**
     * Tally, transition and store the final count under the proposal's voting lock, so no
     * vote can be recorded between the tally and the status change.
     */
    private boolean resolve(Proposal proposal) {
        String proposalId = proposal.getProposalId();
        Optional<VoteTally> resolvedWith = votingGuard.withLock(proposalId, () -> {
            VoteTally tally = voteService.getTally(proposalId);
            ProposalStatus outcome = tally.hasStrictMajority() ? ProposalStatus.PASSED : ProposalStatus.FAILED;

            // Another run may have resolved it since findByStatus
            if (!proposalRegistry.transitionStatus(proposalId, ProposalStatus.VOTING, outcome)) {
                return Optional.empty();
            }
            proposalRegistry.updateVoteCount(proposalId, tally);
            return Optional.of(tally);
        });
        if (resolvedWith.isEmpty()) {
            return false;
        }
        shortCodeRegistry.close(proposalId);

        VoteTally tally = resolvedWith.get();
        ProposalStatus outcome = tally.hasStrictMajority() ? ProposalStatus.PASSED : ProposalStatus.FAILED;
        logger.info("Proposal {} {} with {} yes / {} no of {} votes",
                proposalId, outcome, tally.yes(), tally.no(), tally.total());
        meterRegistry.counter("proposal_resolved_total", "status", outcome.name().toLowerCase(Locale.ROOT)).increment();
        return true;
    }
}
