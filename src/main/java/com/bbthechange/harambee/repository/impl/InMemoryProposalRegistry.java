package com.bbthechange.harambee.repository.impl;

import com.bbthechange.harambee.exception.ProposalNotFoundException;
import com.bbthechange.harambee.model.Proposal;
import com.bbthechange.harambee.model.ProposalStatus;
import com.bbthechange.harambee.model.VoteTally;
import com.bbthechange.harambee.repository.ProposalRegistry;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@Repository
public class InMemoryProposalRegistry implements ProposalRegistry {

    private static final Comparator<Proposal> NEWEST_FIRST =
            Comparator.comparing(Proposal::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final Map<String, Proposal> proposals = new ConcurrentHashMap<>();

    @Override
    public Proposal save(Proposal proposal) {
        proposals.put(proposal.getProposalId(), proposal.copy());
        return proposal;
    }

    @Override
    public Optional<Proposal> findById(String proposalId) {
        return Optional.ofNullable(proposals.get(proposalId)).map(Proposal::copy);
    }

    /**
     * Matching proposals ordered by voting deadline, soonest first.
     */
    @Override
    public List<Proposal> findByStatus(ProposalStatus status) {
        return proposals.values().stream()
                .filter(proposal -> proposal.getStatus() == status)
                .sorted(Comparator.comparing(Proposal::getVotingDeadline))
                .map(Proposal::copy)
                .collect(Collectors.toList());
    }

    /**
     * Proposals of one group, newest first.
     */
    @Override
    public List<Proposal> findByGroupId(String groupId) {
        return proposals.values().stream()
                .filter(proposal -> groupId.equals(proposal.getGroupId()))
                .sorted(NEWEST_FIRST)
                .map(Proposal::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<Proposal> findAll() {
        return proposals.values().stream()
                .sorted(NEWEST_FIRST)
                .map(Proposal::copy)
                .collect(Collectors.toList());
    }

    @Override
    public boolean transitionStatus(String proposalId, ProposalStatus expected, ProposalStatus next) {
        AtomicBoolean changed = new AtomicBoolean(false);
        update(proposalId, proposal -> {
            if (proposal.getStatus() == expected) {
                proposal.setStatus(next);
                changed.set(true);
            }
        });
        return changed.get();
    }

    @Override
    public void updateVoteCount(String proposalId, VoteTally voteCount) {
        update(proposalId, proposal -> proposal.setVoteCount(voteCount));
    }

    @Override
    public boolean updateVoteCountIfStatus(String proposalId, ProposalStatus expected, VoteTally voteCount) {
        AtomicBoolean changed = new AtomicBoolean(false);
        update(proposalId, proposal -> {
            if (proposal.getStatus() == expected) {
                proposal.setVoteCount(voteCount);
                changed.set(true);
            }
        });
        return changed.get();
    }

    private void update(String proposalId, Consumer<Proposal> change) {
        Proposal updated = proposals.computeIfPresent(proposalId, (id, current) -> {
            Proposal copy = current.copy();
            change.accept(copy);
            return copy;
        });
        if (updated == null) {
            throw new ProposalNotFoundException("Proposal not found: " + proposalId);
        }
    }
}
