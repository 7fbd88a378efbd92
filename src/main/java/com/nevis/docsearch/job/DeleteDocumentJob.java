package com.nevis.docsearch.job;

import com.nevis.docsearch.config.IndexingProperties;
import com.nevis.docsearch.engine.SearchEngine;
import com.nevis.docsearch.infra.CircuitBreakerGuard;
import com.nevis.docsearch.model.IndexAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Removes a document from the search engine. The row is usually gone already, so the
 * delete goes straight to the engine, scoped by both document id and tenant id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeleteDocumentJob {

    private final SearchEngine searchEngine;
    private final CircuitBreakerGuard circuitBreaker;
    private final DeadLetterSink deadLetterSink;
    private final IndexingProperties indexingProperties;

    public void perform(Long documentId, Long tenantId, int attempt) {
        if (documentId == null || tenantId == null) {
            log.warn("Deletion message without document or tenant id (document {}, tenant {}), skipping",
                documentId, tenantId);
            return;
        }

        try {
            circuitBreaker.run(CircuitBreakerGuard.SEARCH_ENGINE, () -> {
                searchEngine.ensureSchema();
                searchEngine.delete(searchEngine.collection(), documentId, tenantId);
            });
            log.info("Removed document {} of tenant {} from the search engine", documentId, tenantId);
        } catch (RuntimeException e) {
            log.error("Failed to delete document {} from the search engine (attempt {}/{}): {}",
                documentId, attempt, indexingProperties.maxAttempts(), e.getMessage());
            if (attempt >= indexingProperties.maxAttempts()) {
                deadLetterSink.record(IndexAction.DELETE.jobKind(), documentId, tenantId, e.getMessage());
            }
            throw e;
        }
    }
}
