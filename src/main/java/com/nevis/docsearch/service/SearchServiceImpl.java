package com.nevis.docsearch.service;

import com.nevis.docsearch.config.SearchProperties;
import com.nevis.docsearch.engine.EngineHit;
import com.nevis.docsearch.engine.EngineQuery;
import com.nevis.docsearch.engine.EngineResult;
import com.nevis.docsearch.engine.IndexableFields;
import com.nevis.docsearch.engine.SearchEngine;
import com.nevis.docsearch.exception.WrongQueryException;
import com.nevis.docsearch.infra.CacheStore;
import com.nevis.docsearch.infra.CircuitBreakerGuard;
import com.nevis.docsearch.model.Document;
import com.nevis.docsearch.model.SearchHit;
import com.nevis.docsearch.model.SearchResult;
import com.nevis.docsearch.model.SearchSource;
import com.nevis.docsearch.repository.DocumentRepository;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    static final int SNIPPET_LENGTH = 200;

    private final SearchEngine searchEngine;
    private final CircuitBreakerGuard circuitBreaker;
    private final CacheStore cacheStore;
    private final DocumentRepository documentRepository;
    private final AnalyticsSink analyticsSink;
    private final SearchProperties searchProperties;

    @Override
    public SearchResult search(long tenantId, String query, Integer page, Integer perPage) {
        if (query == null || query.isBlank()) {
            throw new WrongQueryException("Query parameter 'q' is required");
        }

        long started = System.nanoTime();
        String text = query.strip();
        SearchPaging paging = SearchPaging.of(page, perPage, searchProperties.defaultPerPage(), searchProperties.maxPerPage());
        String cacheKey = CacheKeys.search(tenantId, text, paging.page(), paging.perPage());

        SearchResult result;
        SearchSource source;
        Optional<SearchResult> cached = cacheStore.get(cacheKey, SearchResult.class);
        if (cached.isPresent()) {
            result = cached.get();
            source = SearchSource.CACHE;
        } else {
            Optional<SearchResult> fromEngine = queryEngine(tenantId, text, paging);
            if (fromEngine.isPresent()) {
                result = fromEngine.get();
                source = SearchSource.ENGINE;
                cacheStore.set(cacheKey, result, searchProperties.cacheTtl());
            } else {
                result = queryDatabase(tenantId, text, paging);
                source = SearchSource.FALLBACK;
            }
        }

        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        log.debug("Search for tenant {} served from {} in {} ms", tenantId, source, tookMs);
        recordAnalytics(tenantId, text, result.total(), tookMs);
        return result.withTiming(tookMs, source);
    }

    private Optional<SearchResult> queryEngine(long tenantId, String text, SearchPaging paging) {
        EngineQuery engineQuery = new EngineQuery(searchEngine.collection(), text, tenantId, paging.perPage(), paging.offset());
        try {
            EngineResult engineResult = circuitBreaker.call(CircuitBreakerGuard.SEARCH_ENGINE,
                () -> searchEngine.query(engineQuery));

            List<SearchHit> hits = engineResult.hits().stream()
                .filter(hit -> belongsToTenant(hit, tenantId))
                .map(this::fromEngineHit)
                .toList();
            return Optional.of(new SearchResult(engineResult.total(), 0, hits, SearchSource.ENGINE));
        } catch (CallNotPermittedException e) {
            log.warn("Search engine circuit is open, falling back to database for tenant {}", tenantId);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Search engine query failed for tenant {}, falling back to database: {}", tenantId, e.getMessage());
            return Optional.empty();
        }
    }

    private SearchResult queryDatabase(long tenantId, String text, SearchPaging paging) {
        List<SearchHit> hits = documentRepository.searchByText(tenantId, text, paging.perPage(), paging.offset())
            .stream()
            .map(this::fromDocument)
            .toList();
        long total = documentRepository.countByText(tenantId, text);
        return new SearchResult(total, 0, hits, SearchSource.FALLBACK);
    }

    private boolean belongsToTenant(EngineHit hit, long tenantId) {
        Object owner = hit.fields() != null ? hit.fields().get(IndexableFields.TENANT_ID) : null;
        if (owner == null || Objects.equals(String.valueOf(owner), String.valueOf(tenantId))) {
            return true;
        }
        log.error("Search engine returned document {} of tenant {} to tenant {}; dropping it", hit.documentId(), owner, tenantId);
        return false;
    }

    private SearchHit fromEngineHit(EngineHit hit) {
        String snippet = hit.highlights() != null && !hit.highlights().isEmpty()
            ? String.join(" ... ", hit.highlights())
            : truncate((String) hit.fields().get(IndexableFields.CONTENT));
        return new SearchHit(
            hit.documentId(),
            hit.title(),
            snippet,
            hit.score(),
            parseTimestamp(hit.fields().get(IndexableFields.CREATED_AT))
        );
    }

    private SearchHit fromDocument(Document document) {
        return new SearchHit(document.id(), document.title(), truncate(document.content()), null, document.createdAt());
    }

    private void recordAnalytics(long tenantId, String text, long total, long tookMs) {
        try {
            analyticsSink.record(tenantId, text, total, tookMs);
        } catch (RuntimeException e) {
            log.warn("Search analytics not recorded for tenant {}: {}", tenantId, e.getMessage());
        }
    }

    static String truncate(String content) {
        if (content == null || content.length() <= SNIPPET_LENGTH) {
            return content;
        }
        return content.substring(0, SNIPPET_LENGTH - 3) + "...";
    }

    private static OffsetDateTime parseTimestamp(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.toString());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparsable created_at '{}'", value);
            return null;
        }
    }
}
