package com.bbthechange.harambee.service.impl;

import com.bbthechange.harambee.dto.BroadcastResult;
import com.bbthechange.harambee.dto.SmsStatistics;
import com.bbthechange.harambee.dto.SmsVoteResult;
import com.bbthechange.harambee.dto.SmsVotingStartResponse;
import com.bbthechange.harambee.dto.VoteResult;
import com.bbthechange.harambee.dto.VotingStatus;
import com.bbthechange.harambee.exception.AlreadyVotedException;
import com.bbthechange.harambee.exception.IllegalOperationException;
import com.bbthechange.harambee.exception.ProposalNotFoundException;
import com.bbthechange.harambee.model.Member;
import com.bbthechange.harambee.model.Proposal;
import com.bbthechange.harambee.model.ProposalStatus;
import com.bbthechange.harambee.model.SmsInteractionType;
import com.bbthechange.harambee.model.SmsVotingProposal;
import com.bbthechange.harambee.repository.MemberDirectory;
import com.bbthechange.harambee.repository.ProposalRegistry;
import com.bbthechange.harambee.service.ProposalVotingGuard;
import com.bbthechange.harambee.service.ShortCodeRegistry;
import com.bbthechange.harambee.service.SmsInteractionTracker;
import com.bbthechange.harambee.service.SmsTextGenerator;
import com.bbthechange.harambee.service.SmsVotingService;
import com.bbthechange.harambee.service.VoteMessageParser;
import com.bbthechange.harambee.service.VoteMessageParser.ParsedVote;
import com.bbthechange.harambee.service.VoteService;
import com.bbthechange.harambee.sms.SmsDispatcher;
import com.bbthechange.harambee.util.PhoneNumberFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Inbound SMS vote pipeline and SMS voting administration.
 * <p>
 * Webhook processing never throws for member input: each rejection is reported in the
 * {@link SmsVoteResult} and counted. Confirmation SMS are sent after the vote is stored
 * and their failure does not affect the result.
 */
@Service
public class SmsVotingServiceImpl implements SmsVotingService {

    private static final Logger logger = LoggerFactory.getLogger(SmsVotingServiceImpl.class);

    private final MemberDirectory memberDirectory;
    private final ProposalRegistry proposalRegistry;
    private final ShortCodeRegistry shortCodeRegistry;
    private final VoteMessageParser voteMessageParser;
    private final VoteService voteService;
    private final SmsDispatcher smsDispatcher;
    private final SmsTextGenerator textGenerator;
    private final SmsInteractionTracker interactionTracker;
    private final ProposalVotingGuard votingGuard;
    private final Clock clock;

    public SmsVotingServiceImpl(MemberDirectory memberDirectory,
                                ProposalRegistry proposalRegistry,
                                ShortCodeRegistry shortCodeRegistry,
                                VoteMessageParser voteMessageParser,
                                VoteService voteService,
                                SmsDispatcher smsDispatcher,
                                SmsTextGenerator textGenerator,
                                SmsInteractionTracker interactionTracker,
                                ProposalVotingGuard votingGuard,
                                Clock clock) {
        this.memberDirectory = memberDirectory;
        this.proposalRegistry = proposalRegistry;
        this.shortCodeRegistry = shortCodeRegistry;
        this.voteMessageParser = voteMessageParser;
        this.voteService = voteService;
        this.smsDispatcher = smsDispatcher;
        this.textGenerator = textGenerator;
        this.interactionTracker = interactionTracker;
        this.votingGuard = votingGuard;
        this.clock = clock;
    }

    @Override
    public SmsVoteResult processWebhook(String from, String to, String body, String messageSid) {
        String phoneNumber = PhoneNumberFormatter.format(from).orElse(from == null ? "" : from.trim());
        logger.info("Processing SMS {} from {}", messageSid, phoneNumber);

        Optional<Member> member = memberDirectory.findByPhoneNumber(phoneNumber);
        if (member.isEmpty()) {
            interactionTracker.record(SmsInteractionType.UNREGISTERED_PHONE);
            logger.warn("SMS from unregistered phone {}", phoneNumber);
            return SmsVoteResult.rejected(phoneNumber, null, null,
                    "Phone number not registered", textGenerator.getUnregisteredPhone());
        }

        String memberId = member.get().getMemberId();
        if (!member.get().isPhoneVerified()) {
            interactionTracker.record(SmsInteractionType.UNVERIFIED_PHONE);
            logger.warn("SMS from unverified phone {} (member {})", phoneNumber, memberId);
            return SmsVoteResult.rejected(phoneNumber, memberId, null,
                    "Phone number not verified", textGenerator.getUnverifiedPhone());
        }

        Optional<ParsedVote> parsed = voteMessageParser.parse(body);
        if (parsed.isEmpty()) {
            interactionTracker.record(SmsInteractionType.INVALID_FORMAT);
            logger.info("Invalid vote format from member {}", memberId);
            return SmsVoteResult.rejected(phoneNumber, memberId, null,
                    "Invalid vote format", textGenerator.getInvalidFormat());
        }

        String shortCode = parsed.get().shortCode();
        Optional<SmsVotingProposal> target = shortCodeRegistry.findByShortCode(shortCode);
        if (target.isEmpty()) {
            interactionTracker.record(SmsInteractionType.INVALID_PROPOSAL);
            logger.info("Member {} voted on unknown code {}", memberId, shortCode);
            return SmsVoteResult.rejected(phoneNumber, memberId, null,
                    "Invalid proposal code", textGenerator.getInvalidProposalCode(shortCode));
        }

        SmsVotingProposal proposal = target.get();
        String proposalId = proposal.getProposalId();
        if (!proposal.isOpenAt(clock.instant())) {
            interactionTracker.record(SmsInteractionType.DEADLINE_PASSED);
            logger.info("Member {} voted on proposal {} after its deadline", memberId, proposalId);
            return SmsVoteResult.rejected(phoneNumber, memberId, proposalId,
                    "Voting deadline passed", textGenerator.getDeadlinePassed(shortCode));
        }

        boolean inFavour = parsed.get().inFavour();
        Optional<VoteResult> recorded;
        try {
            recorded = votingGuard.withLock(proposalId, () -> recordWhileVoting(memberId, proposal, inFavour));
        } catch (AlreadyVotedException e) {
            interactionTracker.record(SmsInteractionType.ALREADY_VOTED);
            return SmsVoteResult.rejected(phoneNumber, memberId, proposalId,
                    e.getMessage(), textGenerator.getAlreadyVoted(shortCode));
        } catch (Exception e) {
            interactionTracker.record(SmsInteractionType.VOTE_ERROR);
            logger.error("Error recording SMS vote from member {} on proposal {}", memberId, proposalId, e);
            return SmsVoteResult.rejected(phoneNumber, memberId, proposalId,
                    e.getMessage() != null ? e.getMessage() : "Error recording vote", textGenerator.getVoteError());
        }

        if (recorded.isEmpty()) {
            interactionTracker.record(SmsInteractionType.DEADLINE_PASSED);
            logger.info("Member {} voted on proposal {} after it closed", memberId, proposalId);
            return SmsVoteResult.rejected(phoneNumber, memberId, proposalId,
                    "Voting deadline passed", textGenerator.getDeadlinePassed(shortCode));
        }
        VoteResult voteResult = recorded.get();

        interactionTracker.record(SmsInteractionType.VOTE_RECORDED);

        String confirmation = textGenerator.getVoteConfirmation(inFavour, proposal.getTitle(), voteResult.tally());
        smsDispatcher.sendAsync(phoneNumber, confirmation);

        logger.info("Processed SMS vote: member {} voted {} on proposal {}",
                memberId, inFavour ? "YES" : "NO", proposalId);
        return SmsVoteResult.accepted(phoneNumber, memberId, proposalId, inFavour, confirmation);
    }

    @Override
    public SmsVotingStartResponse startSmsVoting(String proposalId) {
        Proposal proposal = proposalRegistry.findById(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException("Proposal " + proposalId + " not found"));

        if (proposal.getStatus() != ProposalStatus.VOTING) {
            throw new IllegalOperationException("Proposal " + proposalId + " is not open for voting (status "
                    + proposal.getStatus() + ")");
        }

        List<String> phoneNumbers = memberDirectory.findByGroupId(proposal.getGroupId()).stream()
                .filter(Member::isPhoneVerified)
                .map(Member::getPhoneNumber)
                .collect(Collectors.toList());
        if (phoneNumbers.isEmpty()) {
            throw new IllegalOperationException("No verified members found in group " + proposal.getGroupId());
        }

        String shortCode = shortCodeRegistry.register(proposalId, proposal.getTitle(), proposal.getGroupId(),
                proposal.getVotingDeadline());

        String message = textGenerator.getVotingBroadcast(proposal.getTitle(), proposal.getVotingDeadline(), shortCode);
        BroadcastResult broadcastResult = smsDispatcher.broadcast(phoneNumbers, message);

        logger.info("Started SMS voting for proposal {} with code {}: {} sent, {} failed",
                proposalId, shortCode, broadcastResult.getSentCount(), broadcastResult.getFailedCount());
        return new SmsVotingStartResponse(proposalId, shortCode, broadcastResult, phoneNumbers.size());
    }

    @Override
    public Optional<VotingStatus> getVotingStatus(String proposalId) {
        return shortCodeRegistry.find(proposalId)
                .map(active -> new VotingStatus(proposalId, active.getShortCode(), active.getTitle(),
                        active.getVotingDeadline(), active.isOpenAt(clock.instant()),
                        voteService.getTally(proposalId)));
    }

    @Override
    public boolean closeVoting(String proposalId) {
        return shortCodeRegistry.close(proposalId);
    }

    @Override
    public SmsStatistics getSmsStatistics() {
        long total = interactionTracker.total();
        long successful = interactionTracker.count(SmsInteractionType.VOTE_RECORDED);
        double successRate = total > 0 ? (double) successful / total : 0.0;
        return new SmsStatistics(total, successful, shortCodeRegistry.activeCount(),
                interactionTracker.breakdown(), successRate);
    }

    /**
     * Record the vote only while the proposal is still VOTING and inside its deadline.
     * Runs under the proposal's {@link ProposalVotingGuard} lock, so deadline resolution
     * cannot tally the proposal between this check and the insert.
     *
     * @return empty if the proposal no longer accepts votes
     */
    private Optional<VoteResult> recordWhileVoting(String memberId, SmsVotingProposal proposal, boolean inFavour) {
        String proposalId = proposal.getProposalId();
        boolean voting = proposalRegistry.findById(proposalId)
                .map(current -> current.getStatus() == ProposalStatus.VOTING)
                .orElse(false);
        if (!voting || !proposal.isOpenAt(clock.instant())) {
            return Optional.empty();
        }

        VoteResult voteResult = voteService.recordVote(memberId, proposalId, inFavour);
        syncVoteCount(proposalId, voteResult);
        return Optional.of(voteResult);
    }

    /**
     * Store the recomputed tally on the proposal while it is still VOTING. The vote is
     * already recorded, so a failure here is only logged; the deadline check writes the
     * final count.
     */
    private void syncVoteCount(String proposalId, VoteResult voteResult) {
        try {
            if (!proposalRegistry.updateVoteCountIfStatus(proposalId, ProposalStatus.VOTING, voteResult.tally())) {
                logger.warn("Proposal {} left VOTING before its vote count was updated", proposalId);
            }
        } catch (ProposalNotFoundException e) {
            logger.warn("Proposal {} missing from registry while updating vote count", proposalId);
        } catch (Exception e) {
            logger.error("Failed to update vote count for proposal {}", proposalId, e);
        }
    }
}
