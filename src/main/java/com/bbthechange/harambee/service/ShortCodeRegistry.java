package com.bbthechange.harambee.service;

import com.bbthechange.harambee.config.SmsVotingProperties;
import com.bbthechange.harambee.exception.ShortCodeExhaustedException;
import com.bbthechange.harambee.model.SmsVotingProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps proposals open for SMS voting to the short numeric codes members reply with.
 * <p>
 * Codes are unique among active proposals. A code is claimed with {@code putIfAbsent}
 * on the code index, so concurrent registrations never share one. Closing a proposal
 * frees its code for reuse.
 */
@Component
public class ShortCodeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ShortCodeRegistry.class);

    private final ConcurrentMap<String, SmsVotingProposal> activeByProposalId = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> proposalIdsByCode = new ConcurrentHashMap<>();
    private final int maxShortCode;
    private final Clock clock;

    public ShortCodeRegistry(SmsVotingProperties properties, Clock clock) {
        this.maxShortCode = properties.getMaxShortCode();
        this.clock = clock;
    }

    /**
     * Assign a short code to a proposal. Registering a proposal that is already active
     * returns its existing code.
     *
     * @return the short code, at least 3 digits
     * @throws ShortCodeExhaustedException if every code up to the maximum is in use
     */
    public String register(String proposalId, String title, String groupId, Instant votingDeadline) {
        SmsVotingProposal registered = activeByProposalId.compute(proposalId, (id, existing) -> {
            if (existing != null) {
                return existing;
            }
            String shortCode = claimCode(id);
            return new SmsVotingProposal(id, shortCode, title, groupId, votingDeadline, clock.instant());
        });
        logger.info("Registered proposal {} for SMS voting with code {}", proposalId, registered.getShortCode());
        return registered.getShortCode();
    }

    public Optional<String> resolve(String shortCode) {
        return Optional.ofNullable(proposalIdsByCode.get(shortCode));
    }

    public Optional<SmsVotingProposal> find(String proposalId) {
        return Optional.ofNullable(activeByProposalId.get(proposalId));
    }

    public Optional<SmsVotingProposal> findByShortCode(String shortCode) {
        return resolve(shortCode).flatMap(this::find);
    }

    /**
     * @return true if the proposal was active
     */
    public boolean close(String proposalId) {
        SmsVotingProposal removed = activeByProposalId.remove(proposalId);
        if (removed == null) {
            return false;
        }
        proposalIdsByCode.remove(removed.getShortCode(), proposalId);
        logger.info("Closed SMS voting for proposal {}, code {} released", proposalId, removed.getShortCode());
        return true;
    }

    /**
     * Active proposals ordered by short code.
     */
    public List<SmsVotingProposal> activeProposals() {
        List<SmsVotingProposal> proposals = new ArrayList<>(activeByProposalId.values());
        proposals.sort(Comparator.comparing(SmsVotingProposal::getShortCode));
        return proposals;
    }

    public int activeCount() {
        return activeByProposalId.size();
    }

    private String claimCode(String proposalId) {
        int candidate = proposalIdsByCode.size() + 1;
        for (int attempts = 0; attempts < maxShortCode; attempts++) {
            if (candidate > maxShortCode) {
                candidate = 1;
            }
            String code = String.format(Locale.ROOT, "%03d", candidate);
            if (proposalIdsByCode.putIfAbsent(code, proposalId) == null) {
                return code;
            }
            candidate++;
        }
        throw new ShortCodeExhaustedException("All " + maxShortCode + " SMS voting codes are in use");
    }
}
