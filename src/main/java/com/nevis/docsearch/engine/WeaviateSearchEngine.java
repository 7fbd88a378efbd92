package com.nevis.docsearch.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.docsearch.exception.SearchEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BM25 search over Weaviate's REST and GraphQL endpoints. Weaviate objects are keyed by a
 * name-based UUID derived from the document id, so repeated writes overwrite the same object.
 */
@Slf4j
public class WeaviateSearchEngine implements SearchEngine {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String className;
    private final AtomicBoolean schemaReady = new AtomicBoolean(false);

    public WeaviateSearchEngine(RestClient restClient, ObjectMapper objectMapper, String className) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.className = className;
    }

    @Override
    public String name() {
        return "weaviate";
    }

    @Override
    public String collection() {
        return className;
    }

    @Override
    public boolean schemaExists() {
        try {
            restClient.get()
                .uri("/v1/schema/{className}", className)
                .retrieve()
                .toBodilessEntity();
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            return false;
        } catch (RestClientException e) {
            throw new SearchEngineException("Failed to read schema of " + className, e);
        }
    }

    @Override
    public void ensureSchema() {
        if (schemaReady.get()) {
            return;
        }
        if (!schemaExists()) {
            Map<String, Object> schema = Map.of(
                "class", className,
                "properties", List.of(
                    property(IndexableFields.DOCUMENT_ID, "int"),
                    property(IndexableFields.TENANT_ID, "int"),
                    property(IndexableFields.TITLE, "text"),
                    property(IndexableFields.CONTENT, "text"),
                    property(IndexableFields.CREATED_AT, "date"),
                    property(IndexableFields.METADATA, "text")
                )
            );
            try {
                restClient.post()
                    .uri("/v1/schema")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(schema)
                    .retrieve()
                    .toBodilessEntity();
                log.info("Created Weaviate class {}", className);
            } catch (HttpClientErrorException.UnprocessableEntity e) {
                log.debug("Weaviate class {} was created concurrently", className);
            } catch (RestClientException e) {
                throw new SearchEngineException("Failed to create class " + className, e);
            }
        }
        schemaReady.set(true);
    }

    @Override
    public void write(String collection, long documentId, Map<String, Object> fields) {
        Map<String, Object> properties = new LinkedHashMap<>(fields);
        properties.put(IndexableFields.DOCUMENT_ID, documentId);
        properties.put(IndexableFields.METADATA, writeJson(fields.get(IndexableFields.METADATA)));

        Map<String, Object> object = Map.of(
            "class", collection,
            "id", objectId(documentId).toString(),
            "properties", properties
        );

        JsonNode response;
        try {
            response = restClient.post()
                .uri("/v1/batch/objects")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("objects", List.of(object)))
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new SearchEngineException("Failed to write document " + documentId, e);
        }

        if (response != null) {
            for (JsonNode item : response) {
                JsonNode errors = item.path("result").path("errors");
                if (!errors.isMissingNode() && !errors.isNull()) {
                    throw new SearchEngineException("Weaviate rejected document " + documentId + ": " + errors);
                }
            }
        }
    }

    @Override
    public void delete(String collection, long documentId, long tenantId) {
        Map<String, Object> match = Map.of(
            "class", collection,
            "where", Map.of(
                "operator", "And",
                "operands", List.of(
                    equalInt(IndexableFields.DOCUMENT_ID, documentId),
                    equalInt(IndexableFields.TENANT_ID, tenantId)
                )
            )
        );

        try {
            restClient.method(HttpMethod.DELETE)
                .uri("/v1/batch/objects")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("match", match))
                .retrieve()
                .toBodilessEntity();
        } catch (RestClientException e) {
            throw new SearchEngineException("Failed to delete document " + documentId, e);
        }
    }

    @Override
    public EngineResult query(EngineQuery query) {
        String graphql = """
            { Get { %s(bm25: {query: %s, properties: ["title^2", "content"]}, \
            where: {path: ["tenant_id"], operator: Equal, valueInt: %d}, limit: %d, offset: %d) \
            { document_id title content created_at _additional { id score } } } }
            """.formatted(query.collection(), writeJson(query.text()), query.tenantId(), query.limit(), query.offset());

        JsonNode response;
        try {
            response = restClient.post()
                .uri("/v1/graphql")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("query", graphql))
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new SearchEngineException("Search request failed", e);
        }

        if (response == null) {
            throw new SearchEngineException("Empty Weaviate response");
        }
        if (response.hasNonNull("errors") && response.get("errors").size() > 0) {
            throw new SearchEngineException("Weaviate query error: " + response.get("errors"));
        }

        List<EngineHit> hits = new ArrayList<>();
        for (JsonNode node : response.path("data").path("Get").path(query.collection())) {
            JsonNode additional = node.path("_additional");
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(IndexableFields.TITLE, node.path("title").asText(null));
            fields.put(IndexableFields.CONTENT, node.path("content").asText(null));
            fields.put(IndexableFields.CREATED_AT, node.path("created_at").asText(null));

            hits.add(new EngineHit(
                node.path(IndexableFields.DOCUMENT_ID).isNumber() ? node.path(IndexableFields.DOCUMENT_ID).asLong() : null,
                node.path("title").asText(null),
                additional.hasNonNull("score") ? additional.get("score").asDouble() : null,
                fields,
                List.of()
            ));
        }

        // Get{} does not report a match count; the page size is the best available total
        return new EngineResult(hits.size(), hits);
    }

    static UUID objectId(long documentId) {
        return UUID.nameUUIDFromBytes(("document:" + documentId).getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, Object> property(String name, String dataType) {
        return Map.of("name", name, "dataType", List.of(dataType));
    }

    private static Map<String, Object> equalInt(String path, long value) {
        return Map.of("path", List.of(path), "operator", "Equal", "valueInt", value);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SearchEngineException("Failed to serialize value for Weaviate", e);
        }
    }
}
