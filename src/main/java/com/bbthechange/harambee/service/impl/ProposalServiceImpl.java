package com.bbthechange.harambee.service.impl;

import com.bbthechange.harambee.config.SmsVotingProperties;
import com.bbthechange.harambee.dto.CreateProposalRequest;
import com.bbthechange.harambee.dto.ProposalStatistics;
import com.bbthechange.harambee.dto.VotingHistoryEntry;
import com.bbthechange.harambee.exception.MemberNotFoundException;
import com.bbthechange.harambee.exception.ProposalNotFoundException;
import com.bbthechange.harambee.exception.ValidationException;
import com.bbthechange.harambee.model.Member;
import com.bbthechange.harambee.model.Proposal;
import com.bbthechange.harambee.model.ProposalStatus;
import com.bbthechange.harambee.model.Vote;
import com.bbthechange.harambee.repository.MemberDirectory;
import com.bbthechange.harambee.repository.ProposalRegistry;
import com.bbthechange.harambee.service.ProposalService;
import com.bbthechange.harambee.service.VoteService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
public class ProposalServiceImpl implements ProposalService {

    private static final Logger logger = LoggerFactory.getLogger(ProposalServiceImpl.class);

    private final ProposalRegistry proposalRegistry;
    private final MemberDirectory memberDirectory;
    private final VoteService voteService;
    private final SmsVotingProperties properties;
    private final Clock clock;

    public ProposalServiceImpl(ProposalRegistry proposalRegistry,
                               MemberDirectory memberDirectory,
                               VoteService voteService,
                               SmsVotingProperties properties,
                               Clock clock) {
        this.proposalRegistry = proposalRegistry;
        this.memberDirectory = memberDirectory;
        this.voteService = voteService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Proposal createProposal(CreateProposalRequest request) {
        logger.info("Creating proposal for group {}: {}", request.getGroupId(), request.getTitle());

        Member creator = memberDirectory.findById(request.getCreatedBy())
                .orElseThrow(() -> new MemberNotFoundException("Member " + request.getCreatedBy() + " does not exist"));
        if (!request.getGroupId().equals(creator.getGroupId())) {
            throw new ValidationException("Member " + creator.getMemberId() + " is not in group " + request.getGroupId());
        }

        Instant now = clock.instant();
        Instant deadline = request.getVotingDeadline();
        if (deadline == null || !deadline.isAfter(now)) {
            deadline = now.plus(properties.getDefaultVotingPeriod());
        }

        Proposal proposal = new Proposal(UUID.randomUUID().toString(), request.getGroupId(), request.getTitle(), deadline);
        proposal.setDescription(request.getDescription());
        proposal.setCreatedBy(creator.getMemberId());
        proposal.setCreatedAt(now);
        proposalRegistry.save(proposal);

        logger.info("Created proposal {} with voting deadline {}", proposal.getProposalId(), deadline);
        return proposal;
    }

    @Override
    public Proposal getProposal(String proposalId) {
        return proposalRegistry.findById(proposalId)
                .orElseThrow(() -> new ProposalNotFoundException("Proposal " + proposalId + " not found"));
    }

    @Override
    public List<Proposal> getGroupProposals(String groupId) {
        return proposalRegistry.findByGroupId(groupId);
    }

    @Override
    public List<Proposal> getActiveProposals() {
        return proposalRegistry.findByStatus(ProposalStatus.VOTING);
    }

    @Override
    public List<Proposal> getProposalsByStatus(ProposalStatus status) {
        return proposalRegistry.findAll().stream()
                .filter(proposal -> proposal.getStatus() == status)
                .collect(Collectors.toList());
    }

    @Override
    public List<Vote> getProposalVotes(String proposalId) {
        getProposal(proposalId);
        return voteService.getVotes(proposalId);
    }

    @Override
    public ProposalStatistics getProposalStatistics() {
        List<Proposal> proposals = proposalRegistry.findAll();
        Map<String, Long> breakdown = proposals.stream()
                .collect(Collectors.groupingBy(proposal -> proposal.getStatus().name(), TreeMap::new,
                        Collectors.counting()));
        return new ProposalStatistics(proposals.size(), breakdown,
                breakdown.getOrDefault(ProposalStatus.VOTING.name(), 0L),
                breakdown.getOrDefault(ProposalStatus.PASSED.name(), 0L),
                breakdown.getOrDefault(ProposalStatus.FAILED.name(), 0L));
    }

    @Override
    public List<VotingHistoryEntry> getMemberVotingHistory(String memberId) {
        if (memberDirectory.findById(memberId).isEmpty()) {
            throw new MemberNotFoundException("Member " + memberId + " does not exist");
        }

        List<VotingHistoryEntry> history = new ArrayList<>();
        for (Vote vote : voteService.getMemberVotingHistory(memberId)) {
            Optional<Proposal> proposal = proposalRegistry.findById(vote.getProposalId());
            if (proposal.isEmpty()) {
                logger.warn("Vote by member {} references missing proposal {}", memberId, vote.getProposalId());
                continue;
            }
            history.add(new VotingHistoryEntry(proposal.get(), vote.isInFavour(), vote.getCastAt()));
        }
        return history;
    }
}
