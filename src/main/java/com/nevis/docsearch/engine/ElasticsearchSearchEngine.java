package com.nevis.docsearch.engine;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.TermVectorOption;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.nevis.docsearch.exception.SearchEngineException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public class ElasticsearchSearchEngine implements SearchEngine {

    private static final String ANALYZER = "custom_analyzer";

    private final ElasticsearchClient client;
    private final String index;
    private final AtomicBoolean schemaReady = new AtomicBoolean(false);

    public ElasticsearchSearchEngine(ElasticsearchClient client, String index) {
        this.client = client;
        this.index = index;
    }

    @Override
    public String name() {
        return "elasticsearch";
    }

    @Override
    public String collection() {
        return index;
    }

    @Override
    public boolean schemaExists() {
        try {
            return client.indices().exists(e -> e.index(index)).value();
        } catch (IOException | ElasticsearchException e) {
            throw new SearchEngineException("Failed to check index " + index, e);
        }
    }

    @Override
    public void ensureSchema() {
        if (schemaReady.get()) {
            return;
        }
        if (schemaExists()) {
            schemaReady.set(true);
            return;
        }

        try {
            client.indices().create(c -> c
                .index(index)
                .settings(s -> s
                    .numberOfShards("10")
                    .numberOfReplicas("2")
                    .refreshInterval(t -> t.time("5s"))
                    .analysis(a -> a.analyzer(ANALYZER, an -> an.custom(cu -> cu
                        .tokenizer("standard")
                        .filter("lowercase", "asciifolding", "snowball")))))
                .mappings(m -> m
                    .dynamic(DynamicMapping.False)
                    .properties(IndexableFields.TENANT_ID, p -> p.keyword(k -> k))
                    .properties(IndexableFields.TITLE, p -> p.text(t -> t
                        .analyzer(ANALYZER)
                        .fields("keyword", f -> f.keyword(k -> k))))
                    .properties(IndexableFields.CONTENT, p -> p.text(t -> t
                        .analyzer(ANALYZER)
                        .termVector(TermVectorOption.WithPositionsOffsets)))
                    .properties(IndexableFields.CREATED_AT, p -> p.date(d -> d))
                    .properties(IndexableFields.METADATA, p -> p.object(o -> o.enabled(false)))));
            log.info("Created search index {}", index);
        } catch (ElasticsearchException e) {
            if (!"resource_already_exists_exception".equals(e.error().type())) {
                throw new SearchEngineException("Failed to create index " + index, e);
            }
            log.debug("Index {} was created concurrently", index);
        } catch (IOException e) {
            throw new SearchEngineException("Failed to create index " + index, e);
        }
        schemaReady.set(true);
    }

    @Override
    public void write(String collection, long documentId, Map<String, Object> fields) {
        try {
            client.index(i -> i
                .index(collection)
                .id(String.valueOf(documentId))
                .document(fields));
        } catch (IOException | ElasticsearchException e) {
            throw new SearchEngineException("Failed to index document " + documentId, e);
        }
    }

    @Override
    public void delete(String collection, long documentId, long tenantId) {
        try {
            var response = client.deleteByQuery(d -> d
                .index(collection)
                .query(q -> q.bool(b -> b
                    .filter(f -> f.ids(ids -> ids.values(String.valueOf(documentId))))
                    .filter(f -> f.term(t -> t.field(IndexableFields.TENANT_ID).value(tenantId))))));
            log.debug("Deleted {} engine entries for document {}", response.deleted(), documentId);
        } catch (IOException | ElasticsearchException e) {
            throw new SearchEngineException("Failed to delete document " + documentId, e);
        }
    }

    @Override
    public EngineResult query(EngineQuery query) {
        SearchResponse<IndexedDocument> response;
        try {
            response = client.search(s -> s
                    .index(query.collection())
                    .from(query.offset())
                    .size(query.limit())
                    .trackTotalHits(t -> t.enabled(true))
                    .query(q -> q.bool(b -> b
                        .must(m -> m.multiMatch(mm -> mm
                            .query(query.text())
                            .fields(IndexableFields.TITLE + "^2", IndexableFields.CONTENT)
                            .type(TextQueryType.BestFields)
                            .fuzziness("AUTO")))
                        .filter(f -> f.term(t -> t.field(IndexableFields.TENANT_ID).value(query.tenantId())))))
                    .highlight(h -> h.fields(IndexableFields.CONTENT, hf -> hf
                        .fragmentSize(150)
                        .numberOfFragments(3)))
                    .sort(so -> so.score(sc -> sc.order(SortOrder.Desc)))
                    .sort(so -> so.field(f -> f.field(IndexableFields.CREATED_AT).order(SortOrder.Desc))),
                IndexedDocument.class);
        } catch (IOException | ElasticsearchException e) {
            throw new SearchEngineException("Search request failed", e);
        }

        List<EngineHit> hits = response.hits().hits().stream()
            .map(this::toEngineHit)
            .toList();

        long total = response.hits().total() != null ? response.hits().total().value() : hits.size();
        return new EngineResult(total, hits);
    }

    private EngineHit toEngineHit(Hit<IndexedDocument> hit) {
        IndexedDocument source = hit.source();
        List<String> highlights = hit.highlight() != null
            ? hit.highlight().getOrDefault(IndexableFields.CONTENT, List.of())
            : List.of();

        return new EngineHit(
            Long.valueOf(hit.id()),
            source != null ? source.title() : null,
            hit.score(),
            source != null ? source.toFields() : Map.of(),
            highlights
        );
    }
}
