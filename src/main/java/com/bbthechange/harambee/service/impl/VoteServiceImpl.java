package com.bbthechange.harambee.service.impl;

import com.bbthechange.harambee.dto.VoteResult;
import com.bbthechange.harambee.exception.AlreadyVotedException;
import com.bbthechange.harambee.model.Vote;
import com.bbthechange.harambee.model.VoteTally;
import com.bbthechange.harambee.repository.VoteRepository;
import com.bbthechange.harambee.service.VoteService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class VoteServiceImpl implements VoteService {

    private static final Logger logger = LoggerFactory.getLogger(VoteServiceImpl.class);

    private final VoteRepository voteRepository;
    private final Clock clock;

    public VoteServiceImpl(VoteRepository voteRepository, Clock clock) {
        this.voteRepository = voteRepository;
        this.clock = clock;
    }

    @Override
    public VoteResult recordVote(String memberId, String proposalId, boolean inFavour) {
        Vote vote = new Vote(memberId, proposalId, inFavour, clock.instant());
        if (!voteRepository.saveIfAbsent(vote)) {
            logger.warn("Member {} attempted to vote again on proposal {}", memberId, proposalId);
            throw new AlreadyVotedException(memberId, proposalId);
        }

        VoteTally tally = getTally(proposalId);
        logger.info("Recorded {} vote from member {} on proposal {}, tally {} yes / {} no",
                inFavour ? "YES" : "NO", memberId, proposalId, tally.yes(), tally.no());
        return new VoteResult(vote, tally);
    }

    @Override
    public VoteTally getTally(String proposalId) {
        return VoteTally.of(voteRepository.findByProposalId(proposalId));
    }

    @Override
    public List<Vote> getVotes(String proposalId) {
        return voteRepository.findByProposalId(proposalId);
    }

    @Override
    public List<Vote> getMemberVotingHistory(String memberId) {
        return voteRepository.findByMemberId(memberId).stream()
                .sorted(Comparator.comparing(Vote::getCastAt).reversed())
                .collect(Collectors.toList());
    }
}
