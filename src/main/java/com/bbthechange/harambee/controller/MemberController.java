package com.bbthechange.harambee.controller;

import com.bbthechange.harambee.dto.RegisterMemberRequest;
import com.bbthechange.harambee.dto.VotingHistoryEntry;
import com.bbthechange.harambee.model.Member;
import com.bbthechange.harambee.service.MemberService;
import com.bbthechange.harambee.service.ProposalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/members")
@Tag(name = "Members", description = "Member registration and voting history")
public class MemberController extends BaseController {

    private final MemberService memberService;
    private final ProposalService proposalService;

    public MemberController(MemberService memberService, ProposalService proposalService) {
        this.memberService = memberService;
        this.proposalService = proposalService;
    }

    @PostMapping
    @Operation(summary = "Register member",
               description = "Adds a member to a group; the phone is verified afterwards with a registration OTP")
    public ResponseEntity<Member> registerMember(@Valid @RequestBody RegisterMemberRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(memberService.registerMember(request));
    }

    @GetMapping("/{memberId}")
    @Operation(summary = "Get member")
    public ResponseEntity<Member> getMember(@PathVariable String memberId) {
        return ResponseEntity.ok(memberService.getMember(memberId));
    }

    @GetMapping("/{memberId}/voting-history")
    @Operation(summary = "Member voting history", description = "Votes with their proposals, newest first")
    public ResponseEntity<List<VotingHistoryEntry>> getVotingHistory(@PathVariable String memberId) {
        return ResponseEntity.ok(proposalService.getMemberVotingHistory(memberId));
    }
}
