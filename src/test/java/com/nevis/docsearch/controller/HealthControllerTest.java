package com.nevis.docsearch.controller;

import com.nevis.docsearch.config.SecurityConfig;
import com.nevis.docsearch.config.WebConfig;
import com.nevis.docsearch.infra.RateLimiter;
import com.nevis.docsearch.service.HealthReport;
import com.nevis.docsearch.service.HealthService;
import com.nevis.docsearch.service.TenantService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@Import({SecurityConfig.class, WebConfig.class})
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthService healthService;

    @MockitoBean
    private TenantService tenantService;

    @MockitoBean
    private RateLimiter rateLimiter;

    @Test
    @DisplayName("GET /health should be public and return 200 when every dependency is up")
    void health_ShouldReturn200_WhenHealthy() throws Exception {
        when(healthService.check()).thenReturn(new HealthReport(HealthReport.HEALTHY, "1.0.0",
            Map.of("postgres", "up", "elasticsearch", "up", "cache", "up"),
            Map.of("search-engine", "closed")));

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.services.postgres").value("up"))
            .andExpect(jsonPath("$.circuit_breakers['search-engine']").value("closed"));
    }

    @Test
    @DisplayName("GET /health should return 503 when a dependency is down")
    void health_ShouldReturn503_WhenDegraded() throws Exception {
        when(healthService.check()).thenReturn(new HealthReport(HealthReport.DEGRADED, "1.0.0",
            Map.of("postgres", "up", "elasticsearch", "down", "cache", "up"),
            Map.of("search-engine", "open")));

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("degraded"));
    }

    @Test
    @DisplayName("Unknown paths should be denied")
    void unknownPath_ShouldBeDenied() throws Exception {
        mockMvc.perform(get("/internal/secrets"))
            .andExpect(status().is4xxClientError());
    }
}
