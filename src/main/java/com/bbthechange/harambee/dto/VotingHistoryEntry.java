package com.bbthechange.harambee.dto;

import com.bbthechange.harambee.model.Proposal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One vote in a member's history, with the proposal it was cast on.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VotingHistoryEntry {
    private Proposal proposal;
    private boolean vote;
    private Instant votedAt;
}
