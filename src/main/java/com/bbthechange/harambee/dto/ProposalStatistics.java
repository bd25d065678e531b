package com.bbthechange.harambee.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProposalStatistics {
    private long totalProposals;
    private Map<String, Long> statusBreakdown;
    private long activeVoting;
    private long passedProposals;
    private long failedProposals;
}
