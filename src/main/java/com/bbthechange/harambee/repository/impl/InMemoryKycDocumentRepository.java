package com.bbthechange.harambee.repository.impl;

import com.bbthechange.harambee.model.KycDocument;
import com.bbthechange.harambee.repository.KycDocumentRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryKycDocumentRepository implements KycDocumentRepository {

    private final Map<String, KycDocument> documents = new ConcurrentHashMap<>();

    @Override
    public KycDocument save(KycDocument document) {
        documents.put(document.getDocumentId(), document);
        return document;
    }

    @Override
    public Optional<KycDocument> findById(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public List<KycDocument> findByMemberId(String memberId) {
        return documents.values().stream()
                .filter(document -> memberId.equals(document.getMemberId()))
                .sorted(Comparator.comparing(KycDocument::getCreatedAt))
                .collect(Collectors.toList());
    }
}
