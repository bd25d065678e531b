package com.bbthechange.harambee.repository.impl;

import com.bbthechange.harambee.model.Vote;
import com.bbthechange.harambee.repository.VoteRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Vote ledger keyed proposal -> member -> vote. Insert-if-absent uses {@code putIfAbsent}
 * on the per-proposal map, which is atomic per (member, proposal).
 */
@Repository
public class InMemoryVoteRepository implements VoteRepository {

    private final Map<String, Map<String, Vote>> votesByProposal = new ConcurrentHashMap<>();

    @Override
    public boolean saveIfAbsent(Vote vote) {
        Map<String, Vote> proposalVotes =
                votesByProposal.computeIfAbsent(vote.getProposalId(), id -> new ConcurrentHashMap<>());
        return proposalVotes.putIfAbsent(vote.getMemberId(), vote) == null;
    }

    @Override
    public List<Vote> findByProposalId(String proposalId) {
        Map<String, Vote> proposalVotes = votesByProposal.get(proposalId);
        return proposalVotes == null ? List.of() : new ArrayList<>(proposalVotes.values());
    }

    @Override
    public List<Vote> findByMemberId(String memberId) {
        return votesByProposal.values().stream()
                .map(proposalVotes -> proposalVotes.get(memberId))
                .filter(vote -> vote != null)
                .collect(Collectors.toList());
    }
}
