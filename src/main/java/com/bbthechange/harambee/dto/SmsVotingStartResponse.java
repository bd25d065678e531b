package com.bbthechange.harambee.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SmsVotingStartResponse {
    private String proposalId;
    private String shortCode;
    private BroadcastResult broadcastResult;
    private int eligibleVoters;
}
