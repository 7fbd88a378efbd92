package com.nevis.docsearch.controller;

import com.nevis.docsearch.config.SearchProperties;
import com.nevis.docsearch.config.SecurityConfig;
import com.nevis.docsearch.config.WebConfig;
import com.nevis.docsearch.exception.WrongQueryException;
import com.nevis.docsearch.infra.RateLimiter;
import com.nevis.docsearch.model.SearchHit;
import com.nevis.docsearch.model.SearchResult;
import com.nevis.docsearch.model.SearchSource;
import com.nevis.docsearch.model.Tenant;
import com.nevis.docsearch.security.TenantApiKeyFilter;
import com.nevis.docsearch.service.SearchService;
import com.nevis.docsearch.service.TenantService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static com.nevis.docsearch.controller.TenantAuthentication.tenant;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SearchController.class)
@Import({SecurityConfig.class, WebConfig.class})
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SearchService searchService;

    @MockitoBean
    private SearchProperties searchProperties;

    @MockitoBean
    private TenantService tenantService;

    @MockitoBean
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        when(searchProperties.defaultPerPage()).thenReturn(20);
        when(searchProperties.maxPerPage()).thenReturn(100);
    }

    private static SearchResult result() {
        return new SearchResult(1, 12, List.of(
            new SearchHit(42L, "Quarterly report", "revenue grew", 2.5, OffsetDateTime.parse("2026-01-01T10:00:00Z"))
        ), SearchSource.ENGINE);
    }

    @Test
    @DisplayName("GET /v1/search should return results with the resolved paging")
    void search_ShouldReturnResults() throws Exception {
        when(searchService.search(9L, "revenue", 2, 100)).thenReturn(result());

        mockMvc.perform(get("/v1/search")
                .param("q", "revenue")
                .param("page", "2")
                .param("per_page", "500")
                .with(tenant(9L, 100)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query").value("revenue"))
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.page").value(2))
            .andExpect(jsonPath("$.per_page").value(100))
            .andExpect(jsonPath("$.took_ms").value(12))
            .andExpect(jsonPath("$.results[0].id").value(42))
            .andExpect(jsonPath("$.results[0].snippet").value("revenue grew"))
            .andExpect(jsonPath("$.results[0].created_at").exists());
    }

    @Test
    @DisplayName("Non-numeric paging should fall back to defaults")
    void search_ShouldDefaultInvalidPaging() throws Exception {
        when(searchService.search(9L, "q", 1, 20)).thenReturn(result());

        mockMvc.perform(get("/v1/search").param("q", "q").param("page", "abc").with(tenant(9L, 100)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.page").value(1))
            .andExpect(jsonPath("$.per_page").value(20));
    }

    @Test
    @DisplayName("A blank query should return 400")
    void search_ShouldReturn400_WhenQueryBlank() throws Exception {
        when(searchService.search(eq(9L), any(), any(), any()))
            .thenThrow(new WrongQueryException("Query parameter 'q' is required"));

        mockMvc.perform(get("/v1/search").param("q", " ").with(tenant(9L, 100)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Query parameter 'q' is required"));
    }

    @Test
    @DisplayName("An unexpected failure should return 500 'Search failed'")
    void search_ShouldReturn500_OnUnexpectedFailure() throws Exception {
        when(searchService.search(anyLong(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/v1/search").param("q", "q").with(tenant(9L, 100)))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Search failed"))
            .andExpect(jsonPath("$.message").value("boom"));
    }

    @Nested
    @DisplayName("Authentication and rate limiting")
    class GateTest {

        @Test
        @DisplayName("A request without an API key should return 401")
        void search_ShouldReturn401_WithoutKey() throws Exception {
            mockMvc.perform(get("/v1/search").param("q", "q"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));

            verifyNoInteractions(searchService);
        }

        @Test
        @DisplayName("An unknown API key should return 401")
        void search_ShouldReturn401_WithUnknownKey() throws Exception {
            when(tenantService.authenticate("tk_9_bad")).thenReturn(Optional.empty());

            mockMvc.perform(get("/v1/search").param("q", "q").header(TenantApiKeyFilter.HEADER, "tk_9_bad"))
                .andExpect(status().isUnauthorized());

            verifyNoInteractions(searchService);
        }

        @Test
        @DisplayName("A valid API key should authenticate the tenant")
        void search_ShouldAcceptValidKey() throws Exception {
            when(tenantService.authenticate("tk_9_good")).thenReturn(Optional.of(
                new Tenant(9L, "Acme", "acme", "hash", 100, 60, null, null)));
            when(searchService.search(9L, "q", 1, 20)).thenReturn(result());

            mockMvc.perform(get("/v1/search").param("q", "q").header(TenantApiKeyFilter.HEADER, "tk_9_good"))
                .andExpect(status().isOk());

            verify(rateLimiter).check(9L);
        }

        @Test
        @DisplayName("Exceeding the per-minute limit should return 429 with a retry hint")
        void search_ShouldReturn429_WhenLimitExceeded() throws Exception {
            when(rateLimiter.check(9L)).thenReturn(11L);

            mockMvc.perform(get("/v1/search").param("q", "q").with(tenant(9L, 10)))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "60"))
                .andExpect(jsonPath("$.error").value("Rate limit exceeded"))
                .andExpect(jsonPath("$.retry_after").value(60));

            verifyNoInteractions(searchService);
        }

        @Test
        @DisplayName("The request that reaches the limit exactly should still pass")
        void search_ShouldAllowRequestAtLimit() throws Exception {
            when(rateLimiter.check(9L)).thenReturn(10L);
            when(searchService.search(9L, "q", 1, 20)).thenReturn(result());

            mockMvc.perform(get("/v1/search").param("q", "q").with(tenant(9L, 10)))
                .andExpect(status().isOk());
        }
    }
}
