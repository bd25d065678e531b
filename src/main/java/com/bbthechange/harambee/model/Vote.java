package com.bbthechange.harambee.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A member's yes/no vote on a proposal. Identified by (memberId, proposalId) and never changed once cast.
 */
public final class Vote {

    private final String memberId;
    private final String proposalId;
    private final boolean inFavour;
    private final Instant castAt;

    public Vote(String memberId, String proposalId, boolean inFavour, Instant castAt) {
        this.memberId = memberId;
        this.proposalId = proposalId;
        this.inFavour = inFavour;
        this.castAt = castAt;
    }

    public String getMemberId() {
        return memberId;
    }

    public String getProposalId() {
        return proposalId;
    }

    public boolean isInFavour() {
        return inFavour;
    }

    public Instant getCastAt() {
        return castAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Vote vote = (Vote) o;
        return Objects.equals(memberId, vote.memberId) && Objects.equals(proposalId, vote.proposalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(memberId, proposalId);
    }

    @Override
    public String toString() {
        return "Vote{memberId='" + memberId + "', proposalId='" + proposalId + "', inFavour=" + inFavour + "}";
    }
}
