package com.bbthechange.harambee.service;

import com.bbthechange.harambee.model.KycDocument;
import com.bbthechange.harambee.model.KycDocumentType;

import java.util.List;

/**
 * Service interface for KYC documents and automatic KYC elevation.
 */
public interface KycService {

    /**
     * Store a document for a member. Community attestations are verified on submission,
     * and a document verified on submission triggers an auto-elevation attempt.
     * @throws com.bbthechange.harambee.exception.MemberNotFoundException if the member does not exist
     */
    KycDocument submitDocument(String memberId, KycDocumentType documentType, String documentNumber);

    List<KycDocument> getMemberDocuments(String memberId);

    /**
     * @throws com.bbthechange.harambee.exception.ResourceNotFoundException if the document does not exist
     */
    KycDocument getDocument(String documentId);

    /**
     * Mark the member's KYC as verified if their phone is verified and they hold a
     * verified community attestation or government ID.
     * @return true if the member was elevated
     */
    boolean autoElevate(String memberId);
}
