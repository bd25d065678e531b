package com.bbthechange.harambee.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SmsStatistics {
    private long totalInteractions;
    private long successfulVotes;
    private int activeProposals;
    private Map<String, Long> interactionBreakdown;
    private double successRate;
}
