package com.bbthechange.harambee.dto;

import com.bbthechange.harambee.model.Vote;
import com.bbthechange.harambee.model.VoteTally;

/**
 * A freshly recorded vote and the proposal's tally right after it.
 */
public record VoteResult(Vote vote, VoteTally tally) {
}
