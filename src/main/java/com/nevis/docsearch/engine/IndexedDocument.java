package com.nevis.docsearch.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored source of a document in the Elasticsearch index, as written from {@link IndexableFields}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexedDocument(
    @JsonProperty(IndexableFields.TENANT_ID) Long tenantId,
    @JsonProperty(IndexableFields.TITLE) String title,
    @JsonProperty(IndexableFields.CONTENT) String content,
    @JsonProperty(IndexableFields.CREATED_AT) String createdAt,
    @JsonProperty(IndexableFields.METADATA) Map<String, Object> metadata
) {

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(IndexableFields.TENANT_ID, tenantId);
        fields.put(IndexableFields.TITLE, title);
        fields.put(IndexableFields.CONTENT, content);
        fields.put(IndexableFields.CREATED_AT, createdAt);
        fields.put(IndexableFields.METADATA, metadata != null ? metadata : Map.of());
        return fields;
    }
}
