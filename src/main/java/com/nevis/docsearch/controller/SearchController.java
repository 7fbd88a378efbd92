package com.nevis.docsearch.controller;

import com.nevis.docsearch.config.SearchProperties;
import com.nevis.docsearch.exception.WrongQueryException;
import com.nevis.docsearch.model.SearchResult;
import com.nevis.docsearch.security.TenantPrincipal;
import com.nevis.docsearch.service.SearchPaging;
import com.nevis.docsearch.service.SearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/v1/search")
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;
    private final SearchProperties searchProperties;

    @GetMapping
    public ResponseEntity<?> search(
        @AuthenticationPrincipal TenantPrincipal tenant,
        @RequestParam(name = "q", required = false) String query,
        @RequestParam(name = "page", required = false) String page,
        @RequestParam(name = "per_page", required = false) String perPage) {

        SearchPaging paging = SearchPaging.of(SearchPaging.parse(page), SearchPaging.parse(perPage),
            searchProperties.defaultPerPage(), searchProperties.maxPerPage());

        try {
            SearchResult result = searchService.search(tenant.tenantId(), query, paging.page(), paging.perPage());
            return ResponseEntity.ok(new SearchResponse(
                query.strip(),
                result.total(),
                paging.page(),
                paging.perPage(),
                result.tookMs(),
                result.results()
            ));
        } catch (WrongQueryException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Search failed for tenant {}: {}", tenant.tenantId(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("Search failed", e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR));
        }
    }
}
