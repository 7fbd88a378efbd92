package com.nevis.docsearch.engine;

import com.nevis.docsearch.model.Document;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

public final class IndexableFields {

    public static final String TENANT_ID = "tenant_id";
    public static final String DOCUMENT_ID = "document_id";
    public static final String TITLE = "title";
    public static final String CONTENT = "content";
    public static final String CREATED_AT = "created_at";
    public static final String METADATA = "metadata";

    private IndexableFields() {
    }

    public static Map<String, Object> of(Document document) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TENANT_ID, document.tenantId());
        fields.put(TITLE, document.title());
        fields.put(CONTENT, document.content());
        fields.put(CREATED_AT, document.createdAt() != null
            ? DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(document.createdAt())
            : null);
        fields.put(METADATA, document.metadata() != null ? document.metadata() : Map.of());
        return fields;
    }
}
