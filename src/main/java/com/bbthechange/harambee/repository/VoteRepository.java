package com.bbthechange.harambee.repository;

import com.bbthechange.harambee.model.Vote;

import java.util.List;

public interface VoteRepository {

    /**
     * Atomically inserts the vote unless one already exists for the same (member, proposal).
     *
     * @return true if this call inserted the vote
     */
    boolean saveIfAbsent(Vote vote);

    List<Vote> findByProposalId(String proposalId);

    List<Vote> findByMemberId(String memberId);
}
