package com.bbthechange.harambee.service.impl;

import com.bbthechange.harambee.dto.RegisterMemberRequest;
import com.bbthechange.harambee.exception.MemberNotFoundException;
import com.bbthechange.harambee.model.Member;
import com.bbthechange.harambee.model.MemberRole;
import com.bbthechange.harambee.repository.MemberDirectory;
import com.bbthechange.harambee.service.MemberService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

@Service
public class MemberServiceImpl implements MemberService {

    private static final Logger logger = LoggerFactory.getLogger(MemberServiceImpl.class);

    private final MemberDirectory memberDirectory;
    private final Clock clock;

    public MemberServiceImpl(MemberDirectory memberDirectory, Clock clock) {
        this.memberDirectory = memberDirectory;
        this.clock = clock;
    }

    @Override
    public Member registerMember(RegisterMemberRequest request) {
        logger.info("Registering member {} to group {}", request.getPhoneNumber(), request.getGroupId());

        Member member = new Member(UUID.randomUUID().toString(), request.getPhoneNumber(),
                request.getFullName(), request.getGroupId());
        if (request.getRole() != null) {
            member.setRole(MemberRole.valueOf(request.getRole()));
        }
        member.setCreatedAt(clock.instant());

        memberDirectory.save(member);
        logger.info("Registered member {}", member.getMemberId());
        return member;
    }

    @Override
    public Member getMember(String memberId) {
        return memberDirectory.findById(memberId)
                .orElseThrow(() -> new MemberNotFoundException("Member " + memberId + " does not exist"));
    }
}
