package com.nevis.docsearch.engine;

import java.util.Map;

/**
 * Write/query capability of the full-text search backend. One implementation is
 * selected at startup through {@code app.search-engine.backend}.
 * <p>
 * Every method signals backend failures with
 * {@link com.nevis.docsearch.exception.SearchEngineException}.
 */
public interface SearchEngine {

    String name();

    /**
     * Name of the index/class documents are written to.
     */
    String collection();

    boolean schemaExists();

    /**
     * Creates the collection and its mapping when missing. Safe to call repeatedly and concurrently.
     */
    void ensureSchema();

    /**
     * Upserts a document under its database id.
     */
    void write(String collection, long documentId, Map<String, Object> fields);

    /**
     * Removes a document, matching on both its id and its tenant.
     */
    void delete(String collection, long documentId, long tenantId);

    EngineResult query(EngineQuery query);
}
