package com.bbthechange.harambee.repository.impl;

import com.bbthechange.harambee.exception.MemberNotFoundException;
import com.bbthechange.harambee.exception.ValidationException;
import com.bbthechange.harambee.model.KycStatus;
import com.bbthechange.harambee.model.Member;
import com.bbthechange.harambee.repository.MemberDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryMemberDirectory implements MemberDirectory {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryMemberDirectory.class);

    private final Map<String, Member> members = new ConcurrentHashMap<>();
    private final Map<String, String> memberIdsByPhone = new ConcurrentHashMap<>();

    @Override
    public Member save(Member member) {
        String owner = memberIdsByPhone.putIfAbsent(member.getPhoneNumber(), member.getMemberId());
        if (owner != null && !owner.equals(member.getMemberId())) {
            throw new ValidationException("Phone number " + member.getPhoneNumber() + " is already registered");
        }
        members.put(member.getMemberId(), member.copy());
        logger.debug("Saved member {} in group {}", member.getMemberId(), member.getGroupId());
        return member;
    }

    @Override
    public Optional<Member> findById(String memberId) {
        return Optional.ofNullable(members.get(memberId)).map(Member::copy);
    }

    @Override
    public Optional<Member> findByPhoneNumber(String phoneNumber) {
        String memberId = memberIdsByPhone.get(phoneNumber);
        return memberId == null ? Optional.empty() : findById(memberId);
    }

    @Override
    public List<Member> findByGroupId(String groupId) {
        return members.values().stream()
                .filter(member -> groupId.equals(member.getGroupId()))
                .map(Member::copy)
                .collect(Collectors.toList());
    }

    @Override
    public void setPhoneVerified(String memberId) {
        update(memberId, member -> member.setPhoneVerified(true));
        logger.info("Updated phone verification status for member {}", memberId);
    }

    @Override
    public void updateKycStatus(String memberId, KycStatus kycStatus) {
        update(memberId, member -> member.setKycStatus(kycStatus));
    }

    @Override
    public long count() {
        return members.size();
    }

    @Override
    public long countPhoneVerified() {
        return members.values().stream().filter(Member::isPhoneVerified).count();
    }

    private void update(String memberId, java.util.function.Consumer<Member> change) {
        Member updated = members.computeIfPresent(memberId, (id, current) -> {
            Member copy = current.copy();
            change.accept(copy);
            return copy;
        });
        if (updated == null) {
            throw new MemberNotFoundException("Member not found: " + memberId);
        }
    }
}
