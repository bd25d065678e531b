package com.bbthechange.harambee.repository;

import com.bbthechange.harambee.model.KycDocument;

import java.util.List;
import java.util.Optional;

public interface KycDocumentRepository {

    KycDocument save(KycDocument document);

    Optional<KycDocument> findById(String documentId);

    List<KycDocument> findByMemberId(String memberId);
}
