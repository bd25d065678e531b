package com.bbthechange.harambee.controller;

import com.bbthechange.harambee.dto.SmsStatistics;
import com.bbthechange.harambee.dto.SmsVoteResult;
import com.bbthechange.harambee.dto.SmsVotingStartResponse;
import com.bbthechange.harambee.dto.VotingStatus;
import com.bbthechange.harambee.exception.ResourceNotFoundException;
import com.bbthechange.harambee.service.SmsVotingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for SMS voting.
 * The webhook endpoint always answers 200 so the SMS provider does not retry rejected votes.
 */
@RestController
@Tag(name = "SMS Voting", description = "Vote on proposals by SMS reply")
public class SmsVotingController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(SmsVotingController.class);

    private final SmsVotingService smsVotingService;

    public SmsVotingController(SmsVotingService smsVotingService) {
        this.smsVotingService = smsVotingService;
    }

    /**
     * Inbound SMS webhook.
     * POST /sms/webhook with form fields From, To, Body, MessageSid
     */
    @PostMapping(value = "/sms/webhook", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Inbound SMS webhook", description = "Processes a vote reply such as YES001 or NO001")
    public ResponseEntity<SmsVoteResult> webhook(
            @RequestParam(name = "From", required = false) String from,
            @RequestParam(name = "To", required = false) String to,
            @RequestParam(name = "Body", required = false) String body,
            @RequestParam(name = "MessageSid", required = false) String messageSid) {
        try {
            return ResponseEntity.ok(smsVotingService.processWebhook(from, to, body, messageSid));
        } catch (Exception e) {
            logger.error("Error processing SMS webhook {} from {}", messageSid, from, e);
            return ResponseEntity.ok(SmsVoteResult.rejected(from, null, null,
                    "Webhook processing failed", "❌ Error recording vote. Please try again."));
        }
    }

    @PostMapping("/proposals/{proposalId}/sms-voting")
    @Operation(summary = "Start SMS voting",
               description = "Assigns a short code to the proposal and broadcasts it to verified group members")
    public ResponseEntity<SmsVotingStartResponse> startSmsVoting(@PathVariable String proposalId) {
        SmsVotingStartResponse response = smsVotingService.startSmsVoting(proposalId);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/proposals/{proposalId}/sms-voting")
    @Operation(summary = "SMS voting status")
    public ResponseEntity<VotingStatus> getVotingStatus(@PathVariable String proposalId) {
        return smsVotingService.getVotingStatus(proposalId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Proposal " + proposalId + " is not open for SMS voting"));
    }

    @DeleteMapping("/proposals/{proposalId}/sms-voting")
    @Operation(summary = "Close SMS voting", description = "Stops accepting SMS votes and frees the short code")
    public ResponseEntity<Map<String, Object>> closeVoting(@PathVariable String proposalId) {
        boolean closed = smsVotingService.closeVoting(proposalId);
        if (!closed) {
            throw new ResourceNotFoundException("Proposal " + proposalId + " is not open for SMS voting");
        }
        return ResponseEntity.ok(Map.of("proposalId", proposalId, "closed", true));
    }

    @GetMapping("/sms/statistics")
    @Operation(summary = "SMS interaction statistics")
    public ResponseEntity<SmsStatistics> getSmsStatistics() {
        return ResponseEntity.ok(smsVotingService.getSmsStatistics());
    }
}
