package com.bbthechange.harambee.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Per-proposal mutual exclusion between vote recording and deadline resolution.
 * <p>
 * A vote is checked against the proposal's status, stored and counted while holding the
 * proposal's lock; resolution tallies and transitions the proposal under the same lock.
 * A vote therefore either lands before the final tally or sees the resolved status.
 * Lock objects live as long as the proposals they guard, which are never deleted.
 */
@Component
public class ProposalVotingGuard {

    private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String proposalId, Supplier<T> action) {
        Object lock = locks.computeIfAbsent(proposalId, id -> new Object());
        synchronized (lock) {
            return action.get();
        }
    }
}
