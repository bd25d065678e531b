package com.bbthechange.harambee.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registry view of a governance proposal. {@code voteCount} holds the last reconciled tally.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Proposal {
    private String proposalId;
    private String groupId;
    private String title;
    private String description;
    private String createdBy;
    private Instant createdAt;
    private Instant votingDeadline;
    private ProposalStatus status;
    private VoteTally voteCount;

    public Proposal(String proposalId, String groupId, String title, Instant votingDeadline) {
        this.proposalId = proposalId;
        this.groupId = groupId;
        this.title = title;
        this.votingDeadline = votingDeadline;
        this.createdAt = Instant.now();
        this.status = ProposalStatus.VOTING;
        this.voteCount = VoteTally.EMPTY;
    }

    public Proposal copy() {
        return new Proposal(proposalId, groupId, title, description, createdBy, createdAt,
                votingDeadline, status, voteCount);
    }
}
