package com.bbthechange.harambee.controller;

import com.bbthechange.harambee.dto.CreateProposalRequest;
import com.bbthechange.harambee.dto.ProposalStatistics;
import com.bbthechange.harambee.exception.ValidationException;
import com.bbthechange.harambee.model.Proposal;
import com.bbthechange.harambee.model.ProposalStatus;
import com.bbthechange.harambee.model.Vote;
import com.bbthechange.harambee.service.ProposalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

/**
 * REST controller for proposal creation and queries.
 * SMS voting on a proposal is started through {@link SmsVotingController}.
 */
@RestController
@Tag(name = "Proposals", description = "Group proposals and their votes")
public class ProposalController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ProposalController.class);

    private final ProposalService proposalService;

    public ProposalController(ProposalService proposalService) {
        this.proposalService = proposalService;
    }

    @PostMapping("/proposals")
    @Operation(summary = "Create proposal", description = "Opens a proposal for voting by its group")
    public ResponseEntity<Proposal> createProposal(@Valid @RequestBody CreateProposalRequest request) {
        Proposal proposal = proposalService.createProposal(request);
        logger.info("Proposal {} created in group {}", proposal.getProposalId(), proposal.getGroupId());
        return ResponseEntity.status(HttpStatus.CREATED).body(proposal);
    }

    @GetMapping("/proposals/{proposalId}")
    @Operation(summary = "Get proposal")
    public ResponseEntity<Proposal> getProposal(@PathVariable String proposalId) {
        return ResponseEntity.ok(proposalService.getProposal(proposalId));
    }

    @GetMapping("/proposals")
    @Operation(summary = "List active proposals", description = "Proposals still in VOTING, soonest deadline first")
    public ResponseEntity<List<Proposal>> getActiveProposals() {
        return ResponseEntity.ok(proposalService.getActiveProposals());
    }

    @GetMapping("/proposals/status/{status}")
    @Operation(summary = "List proposals by status")
    public ResponseEntity<List<Proposal>> getProposalsByStatus(@PathVariable String status) {
        return ResponseEntity.ok(proposalService.getProposalsByStatus(parseStatus(status)));
    }

    @GetMapping("/groups/{groupId}/proposals")
    @Operation(summary = "List group proposals", description = "Newest first")
    public ResponseEntity<List<Proposal>> getGroupProposals(@PathVariable String groupId) {
        return ResponseEntity.ok(proposalService.getGroupProposals(groupId));
    }

    @GetMapping("/proposals/{proposalId}/votes")
    @Operation(summary = "List votes on a proposal")
    public ResponseEntity<List<Vote>> getProposalVotes(@PathVariable String proposalId) {
        return ResponseEntity.ok(proposalService.getProposalVotes(proposalId));
    }

    @GetMapping("/proposals/statistics")
    @Operation(summary = "Proposal statistics")
    public ResponseEntity<ProposalStatistics> getStatistics() {
        return ResponseEntity.ok(proposalService.getProposalStatistics());
    }

    private static ProposalStatus parseStatus(String status) {
        try {
            return ProposalStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown proposal status: " + status, e);
        }
    }
}
