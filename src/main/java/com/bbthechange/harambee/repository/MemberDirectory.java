package com.bbthechange.harambee.repository;

import com.bbthechange.harambee.model.KycStatus;
import com.bbthechange.harambee.model.Member;

import java.util.List;
import java.util.Optional;

/**
 * Member lookups needed by phone verification and SMS voting.
 * Returned members are snapshots; changes go through the update methods.
 */
public interface MemberDirectory {

    Member save(Member member);

    Optional<Member> findById(String memberId);

    Optional<Member> findByPhoneNumber(String phoneNumber);

    List<Member> findByGroupId(String groupId);

    /**
     * @throws com.bbthechange.harambee.exception.MemberNotFoundException if the member does not exist
     */
    void setPhoneVerified(String memberId);

    /**
     * @throws com.bbthechange.harambee.exception.MemberNotFoundException if the member does not exist
     */
    void updateKycStatus(String memberId, KycStatus kycStatus);

    long count();

    long countPhoneVerified();
}
