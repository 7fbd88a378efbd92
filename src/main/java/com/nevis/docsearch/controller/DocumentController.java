package com.nevis.docsearch.controller;

import com.nevis.docsearch.security.TenantPrincipal;
import com.nevis.docsearch.service.DocumentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @PostMapping
    public ResponseEntity<DocumentResponse> createDocument(
        @AuthenticationPrincipal TenantPrincipal tenant,
        @Valid @RequestBody DocumentRequest request) {

        DocumentResponse response = documentService.create(tenant.tenantId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(
        @AuthenticationPrincipal TenantPrincipal tenant,
        @PathVariable long id) {

        return ResponseEntity.ok(documentService.getById(tenant.tenantId(), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<DocumentResponse> updateDocument(
        @AuthenticationPrincipal TenantPrincipal tenant,
        @PathVariable long id,
        @Valid @RequestBody DocumentRequest request) {

        return ResponseEntity.ok(documentService.update(tenant.tenantId(), id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDocument(
        @AuthenticationPrincipal TenantPrincipal tenant,
        @PathVariable long id) {

        documentService.delete(tenant.tenantId(), id);
        return ResponseEntity.noContent().build();
    }
}
