package com.bbthechange.harambee.service;

import com.bbthechange.harambee.dto.RegisterMemberRequest;
import com.bbthechange.harambee.model.Member;

public interface MemberService {

    /**
     * Add a member with an unverified phone and pending KYC.
     * @throws com.bbthechange.harambee.exception.ValidationException if the phone number is already registered
     */
    Member registerMember(RegisterMemberRequest request);

    /**
     * @throws com.bbthechange.harambee.exception.MemberNotFoundException if the member does not exist
     */
    Member getMember(String memberId);
}
