package com.nevis.docsearch.service;

import com.nevis.docsearch.model.SearchResult;

public interface SearchService {

    /**
     * Tenant-scoped full-text search. Served from cache when possible, from the search engine
     * otherwise, and from a substring match on the database when the engine is unavailable.
     *
     * @throws com.nevis.docsearch.exception.WrongQueryException for a blank query
     */
    SearchResult search(long tenantId, String query, Integer page, Integer perPage);
}
