package com.bbthechange.harambee.exception;

/**
 * Exception thrown when a member tries to vote twice on the same proposal.
 * The first vote is permanent; the second attempt is rejected, never applied.
 */
public class AlreadyVotedException extends RuntimeException {

    private final String memberId;
    private final String proposalId;

    public AlreadyVotedException(String memberId, String proposalId) {
        super("Member " + memberId + " already voted on proposal " + proposalId);
        this.memberId = memberId;
        this.proposalId = proposalId;
    }

    public String getMemberId() {
        return memberId;
    }

    public String getProposalId() {
        return proposalId;
    }
}
