package com.nevis.docsearch.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.docsearch.engine.ElasticsearchSearchEngine;
import com.nevis.docsearch.engine.SearchEngine;
import com.nevis.docsearch.engine.WeaviateSearchEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Picks the search backend once, at startup. The Elasticsearch client itself comes from
 * Spring Boot ({@code spring.elasticsearch.*}); Weaviate is reached over plain HTTP.
 */
@Slf4j
@Configuration
public class SearchEngineConfig {

    @Bean
    @ConditionalOnProperty(name = "app.search-engine.backend", havingValue = "elasticsearch", matchIfMissing = true)
    public SearchEngine elasticsearchSearchEngine(ElasticsearchClient client, SearchEngineProperties properties) {
        log.info("Using Elasticsearch index {}", properties.collection());
        return new ElasticsearchSearchEngine(client, properties.collection());
    }

    @Bean
    @ConditionalOnProperty(name = "app.search-engine.backend", havingValue = "weaviate")
    public SearchEngine weaviateSearchEngine(
        RestClient.Builder restClientBuilder,
        ObjectMapper objectMapper,
        SearchEngineProperties properties
    ) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.connectTimeout());
        requestFactory.setReadTimeout(properties.requestTimeout());

        RestClient.Builder builder = restClientBuilder
            .baseUrl(properties.url())
            .requestFactory(requestFactory);
        if (StringUtils.hasText(properties.apiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
        }

        log.info("Using Weaviate class {} at {}", properties.collection(), properties.url());
        return new WeaviateSearchEngine(builder.build(), objectMapper, properties.collection());
    }
}
