package com.bbthechange.harambee.controller;

import com.bbthechange.harambee.dto.SubmitKycDocumentRequest;
import com.bbthechange.harambee.model.KycDocument;
import com.bbthechange.harambee.model.KycDocumentType;
import com.bbthechange.harambee.service.KycService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for KYC document submission.
 * Community attestations are accepted on submission; other documents stay pending.
 */
@RestController
@RequestMapping("/kyc")
@Tag(name = "KYC", description = "Know-your-customer documents")
public class KycController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(KycController.class);

    private final KycService kycService;

    public KycController(KycService kycService) {
        this.kycService = kycService;
    }

    @PostMapping("/documents")
    @Operation(summary = "Submit KYC document")
    public ResponseEntity<KycDocument> submitDocument(@Valid @RequestBody SubmitKycDocumentRequest request) {
        KycDocument document = kycService.submitDocument(request.getMemberId(),
                KycDocumentType.valueOf(request.getDocumentType()), request.getDocumentNumber());
        logger.info("KYC document {} submitted for member {}: {}",
                document.getDocumentId(), document.getMemberId(), document.getVerificationStatus());
        return ResponseEntity.status(HttpStatus.CREATED).body(document);
    }

    @GetMapping("/members/{memberId}/documents")
    @Operation(summary = "List a member's KYC documents")
    public ResponseEntity<List<KycDocument>> getMemberDocuments(@PathVariable String memberId) {
        return ResponseEntity.ok(kycService.getMemberDocuments(memberId));
    }

    @GetMapping("/documents/{documentId}")
    @Operation(summary = "Get KYC document")
    public ResponseEntity<KycDocument> getDocument(@PathVariable String documentId) {
        return ResponseEntity.ok(kycService.getDocument(documentId));
    }
}
