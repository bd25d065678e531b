package com.bbthechange.harambee.dto;

import com.bbthechange.harambee.model.VoteTally;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VotingStatus {
    private String proposalId;
    private String shortCode;
    private String title;
    private Instant votingDeadline;
    private boolean active;
    private VoteTally tally;
}
