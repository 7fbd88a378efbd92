package com.nevis.docsearch.event;

import com.nevis.docsearch.model.IndexAction;

public record DocumentChangedEvent(Long documentId, Long tenantId, IndexAction action) {}
