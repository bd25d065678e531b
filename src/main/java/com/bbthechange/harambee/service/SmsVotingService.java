package com.bbthechange.harambee.service;

import com.bbthechange.harambee.dto.SmsStatistics;
import com.bbthechange.harambee.dto.SmsVoteResult;
import com.bbthechange.harambee.dto.SmsVotingStartResponse;
import com.bbthechange.harambee.dto.VotingStatus;

import java.util.Optional;

/**
 * Service interface for voting on proposals by SMS.
 */
public interface SmsVotingService {

    /**
     * Handle one inbound SMS. Every outcome is reported in the result; nothing is thrown
     * for bad input.
     * @param from sender phone number
     * @param to receiving number
     * @param body message text
     * @param messageSid provider message id, for logging
     */
    SmsVoteResult processWebhook(String from, String to, String body, String messageSid);

    /**
     * Assign a short code to a proposal in VOTING and broadcast it to the group's
     * verified members.
     * @throws com.bbthechange.harambee.exception.ProposalNotFoundException if the proposal does not exist
     * @throws com.bbthechange.harambee.exception.IllegalOperationException if the proposal is not in VOTING
     *         or the group has no verified members
     */
    SmsVotingStartResponse startSmsVoting(String proposalId);

    Optional<VotingStatus> getVotingStatus(String proposalId);

    /**
     * Stop accepting SMS votes for a proposal and free its short code.
     * @return true if the proposal was open for SMS voting
     */
    boolean closeVoting(String proposalId);

    SmsStatistics getSmsStatistics();
}
