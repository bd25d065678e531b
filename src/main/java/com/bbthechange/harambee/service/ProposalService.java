package com.bbthechange.harambee.service;

import com.bbthechange.harambee.dto.CreateProposalRequest;
import com.bbthechange.harambee.dto.ProposalStatistics;
import com.bbthechange.harambee.dto.VotingHistoryEntry;
import com.bbthechange.harambee.model.Proposal;
import com.bbthechange.harambee.model.ProposalStatus;
import com.bbthechange.harambee.model.Vote;

import java.util.List;

/**
 * Service interface for proposal creation and queries.
 */
public interface ProposalService {

    /**
     * Create a proposal in VOTING. A missing or past voting deadline is replaced by
     * now plus the default voting period.
     * @throws com.bbthechange.harambee.exception.MemberNotFoundException if the creator does not exist
     * @throws com.bbthechange.harambee.exception.ValidationException if the creator is not in the group
     */
    Proposal createProposal(CreateProposalRequest request);

    /**
     * @throws com.bbthechange.harambee.exception.ProposalNotFoundException if the proposal does not exist
     */
    Proposal getProposal(String proposalId);

    /**
     * Proposals of a group, newest first.
     */
    List<Proposal> getGroupProposals(String groupId);

    /**
     * Proposals still in VOTING, soonest deadline first.
     */
    List<Proposal> getActiveProposals();

    /**
     * Proposals in the given status, newest first.
     */
    List<Proposal> getProposalsByStatus(ProposalStatus status);

    List<Vote> getProposalVotes(String proposalId);

    ProposalStatistics getProposalStatistics();

    /**
     * Votes cast by a member with their proposals, newest vote first.
     * @throws com.bbthechange.harambee.exception.MemberNotFoundException if the member does not exist
     */
    List<VotingHistoryEntry> getMemberVotingHistory(String memberId);
}
