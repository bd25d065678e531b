package com.bbthechange.harambee.repository;

import com.bbthechange.harambee.model.Proposal;
import com.bbthechange.harambee.model.ProposalStatus;
import com.bbthechange.harambee.model.VoteTally;

import java.util.List;
import java.util.Optional;

public interface ProposalRegistry {

    Proposal save(Proposal proposal);

    Optional<Proposal> findById(String proposalId);

    List<Proposal> findByStatus(ProposalStatus status);

    List<Proposal> findByGroupId(String groupId);

    List<Proposal> findAll();

    /**
     * Sets the status only if the proposal is currently in {@code expected}.
     *
     * @return true if the status changed
     */
    boolean transitionStatus(String proposalId, ProposalStatus expected, ProposalStatus next);

    void updateVoteCount(String proposalId, VoteTally voteCount);

    /**
     * Stores the vote count only if the proposal is currently in {@code expected}.
     *
     * @return true if the count was written
     */
    boolean updateVoteCountIfStatus(String proposalId, ProposalStatus expected, VoteTally voteCount);
}
