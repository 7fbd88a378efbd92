package com.nevis.docsearch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.nevis.docsearch.controller.DocumentRequest;
import com.nevis.docsearch.controller.DocumentResponse;
import com.nevis.docsearch.event.DocumentChangedEvent;
import com.nevis.docsearch.exception.EntityNotFoundException;
import com.nevis.docsearch.exception.QuotaExceededException;
import com.nevis.docsearch.model.Document;
import com.nevis.docsearch.model.IndexAction;
import com.nevis.docsearch.model.Tenant;
import com.nevis.docsearch.repository.DocumentRepository;
import com.nevis.docsearch.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private static final String DOCUMENT = "Document";

    private final DocumentRepository documentRepository;
    private final TenantRepository tenantRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public DocumentResponse create(long tenantId, DocumentRequest request) {
        log.debug("Creating document for tenant {}: {}", tenantId, request.title());

        Tenant tenant = tenantRepository.findById(tenantId)
            .orElseThrow(() -> new EntityNotFoundException("Tenant", tenantId));
        long current = documentRepository.countByTenant(tenantId);
        if (current >= tenant.documentQuota()) {
            log.warn("Tenant {} reached its document quota ({}/{})", tenantId, current, tenant.documentQuota());
            throw new QuotaExceededException(current, tenant.documentQuota());
        }

        Map<String, Object> metadata = metadataOf(request);
        Document saved = documentRepository.save(new Document(
            null,
            tenantId,
            request.title(),
            request.content(),
            metadata,
            contentHash(request.title(), request.content(), metadata),
            null,
            null,
            null
        ));

        eventPublisher.publishEvent(new DocumentChangedEvent(saved.id(), tenantId, IndexAction.INDEX));
        log.info("Created document {} for tenant {}", saved.id(), tenantId);
        return DocumentResponse.from(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentResponse getById(long tenantId, long id) {
        return documentRepository.findByIdAndTenant(id, tenantId)
            .map(DocumentResponse::from)
            .orElseThrow(() -> {
                log.warn("Document {} not found for tenant {}", id, tenantId);
                return new EntityNotFoundException(DOCUMENT, id);
            });
    }

    /**
     * Re-indexing is triggered only when a searchable field actually changed; an identical
     * update leaves the row, and its indexed state, untouched.
     */
    @Override
    @Transactional
    public DocumentResponse update(long tenantId, long id, DocumentRequest request) {
        Document existing = documentRepository.findByIdAndTenant(id, tenantId)
            .orElseThrow(() -> new EntityNotFoundException(DOCUMENT, id));

        Map<String, Object> metadata = metadataOf(request);
        String hash = contentHash(request.title(), request.content(), metadata);
        if (hash.equals(existing.contentHash())) {
            log.debug("Document {} unchanged, skipping update", id);
            return DocumentResponse.from(existing);
        }

        Document updated = documentRepository.update(new Document(
                id,
                tenantId,
                request.title(),
                request.content(),
                metadata,
                hash,
                existing.indexedAt(),
                existing.createdAt(),
                existing.updatedAt()
            ))
            .orElseThrow(() -> new EntityNotFoundException(DOCUMENT, id));

        eventPublisher.publishEvent(new DocumentChangedEvent(id, tenantId, IndexAction.INDEX));
        log.info("Updated document {} for tenant {}, re-indexing", id, tenantId);
        return DocumentResponse.from(updated);
    }

    @Override
    @Transactional
    public void delete(long tenantId, long id) {
        if (!documentRepository.deleteByIdAndTenant(id, tenantId)) {
            throw new EntityNotFoundException(DOCUMENT, id);
        }
        eventPublisher.publishEvent(new DocumentChangedEvent(id, tenantId, IndexAction.DELETE));
        log.info("Deleted document {} of tenant {}", id, tenantId);
    }

    private static Map<String, Object> metadataOf(DocumentRequest request) {
        return request.metadata() != null ? request.metadata() : Map.of();
    }

    String contentHash(String title, String content, Map<String, Object> metadata) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(title.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(content.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(objectMapper.writer()
                .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .writeValueAsBytes(metadata));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException | JsonProcessingException e) {
            throw new IllegalStateException("Cannot hash document content", e);
        }
    }
}
