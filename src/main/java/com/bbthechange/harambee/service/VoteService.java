package com.bbthechange.harambee.service;

import com.bbthechange.harambee.dto.VoteResult;
import com.bbthechange.harambee.model.Vote;
import com.bbthechange.harambee.model.VoteTally;

import java.util.List;

/**
 * Service interface for the vote ledger.
 */
public interface VoteService {

    /**
     * Record a member's vote. A member votes at most once per proposal.
     * @return the stored vote and the tally including it
     * @throws com.bbthechange.harambee.exception.AlreadyVotedException if the member already voted
     */
    VoteResult recordVote(String memberId, String proposalId, boolean inFavour);

    VoteTally getTally(String proposalId);

    List<Vote> getVotes(String proposalId);

    /**
     * All votes cast by a member, newest first.
     */
    List<Vote> getMemberVotingHistory(String memberId);
}
