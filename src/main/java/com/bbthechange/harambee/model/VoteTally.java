package com.bbthechange.harambee.model;

import java.util.Collection;

/**
 * Yes/no counts for a proposal. Always derived from the vote set, never stored independently.
 */
public record VoteTally(int yes, int no, int total) {

    public static final VoteTally EMPTY = new VoteTally(0, 0, 0);

    public static VoteTally of(Collection<Vote> votes) {
        int yes = 0;
        int no = 0;
        for (Vote vote : votes) {
            if (vote.isInFavour()) {
                yes++;
            } else {
                no++;
            }
        }
        return new VoteTally(yes, no, yes + no);
    }

    /**
     * Strict majority of votes cast. Ties and empty tallies do not pass.
     */
    public boolean hasStrictMajority() {
        return total > 0 && yes > total / 2.0;
    }
}
