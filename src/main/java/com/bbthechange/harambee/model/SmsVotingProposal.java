package com.bbthechange.harambee.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A proposal currently open for SMS voting, together with the short code members reply with.
 */
public final class SmsVotingProposal {

    private final String proposalId;
    private final String shortCode;
    private final String title;
    private final String groupId;
    private final Instant votingDeadline;
    private final Instant createdAt;

    public SmsVotingProposal(String proposalId, String shortCode, String title, String groupId,
                             Instant votingDeadline, Instant createdAt) {
        this.proposalId = proposalId;
        this.shortCode = shortCode;
        this.title = title;
        this.groupId = groupId;
        this.votingDeadline = votingDeadline;
        this.createdAt = createdAt;
    }

    public String getProposalId() {
        return proposalId;
    }

    public String getShortCode() {
        return shortCode;
    }

    public String getTitle() {
        return title;
    }

    public String getGroupId() {
        return groupId;
    }

    public Instant getVotingDeadline() {
        return votingDeadline;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Voting stays open up to and including the deadline instant.
     */
    public boolean isOpenAt(Instant now) {
        return !now.isAfter(votingDeadline);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SmsVotingProposal that = (SmsVotingProposal) o;
        return Objects.equals(proposalId, that.proposalId) && Objects.equals(shortCode, that.shortCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proposalId, shortCode);
    }

    @Override
    public String toString() {
        return "SmsVotingProposal{proposalId='" + proposalId + "', shortCode='" + shortCode + "'}";
    }
}
