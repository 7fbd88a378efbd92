package com.nevis.docsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IndexMessage(
    @JsonProperty("document_id") Long documentId,
    @JsonProperty("tenant_id") Long tenantId,
    IndexAction action
) {
    public static IndexMessage index(Document document) {
        return new IndexMessage(document.id(), document.tenantId(), IndexAction.INDEX);
    }

    public static IndexMessage delete(Long documentId, Long tenantId) {
        return new IndexMessage(documentId, tenantId, IndexAction.DELETE);
    }
}
