package com.nevis.docsearch.repository;

import com.nevis.docsearch.model.Document;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface DocumentRepository {
    Document save(Document document);
    Optional<Document> findById(Long id);
    Optional<Document> findByIdAndTenant(Long id, Long tenantId);
    Optional<Document> update(Document document);
    boolean deleteByIdAndTenant(Long id, Long tenantId);
    List<Long> findIdsByTenant(Long tenantId);
    long countByTenant(Long tenantId);

    /**
     * Stamps {@code indexed_at} without touching {@code updated_at}. Applies only if the row
     * was not modified after {@code expectedUpdatedAt}.
     */
    boolean markIndexed(Long id, OffsetDateTime expectedUpdatedAt);

    List<Document> searchByText(Long tenantId, String query, int limit, int offset);
    long countByText(Long tenantId, String query);
}
