package com.nevis.docsearch.controller;

import com.nevis.docsearch.model.DeadLetter;
import com.nevis.docsearch.repository.DeadLetterRepository;
import com.nevis.docsearch.service.TenantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class TenantAdminController {

    private static final int MAX_DEAD_LETTERS = 500;

    private final TenantService tenantService;
    private final DeadLetterRepository deadLetterRepository;

    @PostMapping("/tenants")
    public ResponseEntity<TenantResponse> createTenant(@Valid @RequestBody TenantRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tenantService.create(request));
    }

    @GetMapping("/tenants/{id}")
    public ResponseEntity<TenantResponse> getTenant(@PathVariable long id) {
        return ResponseEntity.ok(tenantService.getById(id));
    }

    @DeleteMapping("/tenants/{id}")
    public ResponseEntity<Void> destroyTenant(@PathVariable long id) {
        tenantService.destroy(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/tenants/{id}/rate-limit/reset")
    public ResponseEntity<Void> resetRateLimit(@PathVariable long id) {
        tenantService.resetRateLimit(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/dead-letters")
    public ResponseEntity<List<DeadLetter>> deadLetters(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        int resolved = Math.max(1, Math.min(limit, MAX_DEAD_LETTERS));
        return ResponseEntity.ok(deadLetterRepository.findRecent(resolved));
    }
}
