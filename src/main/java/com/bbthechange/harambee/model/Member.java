package com.bbthechange.harambee.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Directory view of a group member.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Member {
    private String memberId;
    private String phoneNumber;
    private String fullName;
    private String groupId;
    private MemberRole role;
    private boolean phoneVerified;
    private KycStatus kycStatus;
    private Instant createdAt;

    public Member(String memberId, String phoneNumber, String fullName, String groupId) {
        this.memberId = memberId;
        this.phoneNumber = phoneNumber;
        this.fullName = fullName;
        this.groupId = groupId;
        this.role = MemberRole.MEMBER;
        this.phoneVerified = false;
        this.kycStatus = KycStatus.PENDING;
        this.createdAt = Instant.now();
    }

    public Member copy() {
        return new Member(memberId, phoneNumber, fullName, groupId, role, phoneVerified, kycStatus, createdAt);
    }
}
