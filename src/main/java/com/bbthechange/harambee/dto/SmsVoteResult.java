package com.bbthechange.harambee.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured answer to an inbound SMS webhook. Every outcome, accepted or rejected, is
 * reported through this payload; {@code responseMessage} is the text shown to the member.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SmsVoteResult {
    private String phoneNumber;
    private String memberId;
    private String proposalId;
    private Boolean vote;
    private boolean processed;
    private String errorMessage;
    private String responseMessage;

    public static SmsVoteResult rejected(String phoneNumber, String memberId, String proposalId,
                                         String errorMessage, String responseMessage) {
        return new SmsVoteResult(phoneNumber, memberId, proposalId, null, false, errorMessage, responseMessage);
    }

    public static SmsVoteResult accepted(String phoneNumber, String memberId, String proposalId,
                                         boolean vote, String responseMessage) {
        return new SmsVoteResult(phoneNumber, memberId, proposalId, vote, true, null, responseMessage);
    }
}
