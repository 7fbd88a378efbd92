package com.nevis.docsearch.service;

import com.nevis.docsearch.controller.DocumentRequest;
import com.nevis.docsearch.controller.DocumentResponse;

public interface DocumentService {
    DocumentResponse create(long tenantId, DocumentRequest request);
    DocumentResponse getById(long tenantId, long id);
    DocumentResponse update(long tenantId, long id, DocumentRequest request);
    void delete(long tenantId, long id);
}
