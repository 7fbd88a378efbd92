package com.nevis.docsearch.job;

import com.nevis.docsearch.config.IndexingProperties;
import com.nevis.docsearch.engine.IndexableFields;
import com.nevis.docsearch.engine.SearchEngine;
import com.nevis.docsearch.infra.CircuitBreakerGuard;
import com.nevis.docsearch.model.Document;
import com.nevis.docsearch.model.IndexAction;
import com.nevis.docsearch.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pushes one document to the search engine. Safe to run repeatedly for the same document:
 * the engine write is an upsert keyed by document id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexDocumentJob {

    private final DocumentRepository documentRepository;
    private final SearchEngine searchEngine;
    private final CircuitBreakerGuard circuitBreaker;
    private final DeadLetterSink deadLetterSink;
    private final IndexingProperties indexingProperties;

    /**
     * @param attempt 1-based number of this attempt
     * @throws RuntimeException when loading or writing the document fails, after dead-lettering on the last attempt
     */
    public void perform(Long documentId, Long tenantId, int attempt) {
        try {
            Optional<Document> found = documentId == null ? Optional.empty() : documentRepository.findById(documentId);
            if (found.isEmpty()) {
                log.warn("Document {} not found, skipping indexing", documentId);
                return;
            }

            Document document = found.get();
            if (!Objects.equals(document.tenantId(), tenantId)) {
                log.error("Tenant mismatch for document {}: owned by tenant {}, message for tenant {}; not indexing",
                    documentId, document.tenantId(), tenantId);
                return;
            }

            Map<String, Object> fields = IndexableFields.of(document);
            circuitBreaker.run(CircuitBreakerGuard.SEARCH_ENGINE, () -> {
                searchEngine.ensureSchema();
                searchEngine.write(searchEngine.collection(), document.id(), fields);
            });

            if (documentRepository.markIndexed(document.id(), document.updatedAt())) {
                log.info("Indexed document {} for tenant {}", document.id(), tenantId);
            } else {
                log.info("Document {} changed while indexing; leaving indexed_at to the newer task", document.id());
            }
        } catch (RuntimeException e) {
            log.error("Failed to index document {} (attempt {}/{}): {}",
                documentId, attempt, indexingProperties.maxAttempts(), e.getMessage());
            if (attempt >= indexingProperties.maxAttempts()) {
                deadLetterSink.record(IndexAction.INDEX.jobKind(), documentId, tenantId, e.getMessage());
            }
            throw e;
        }
    }
}
