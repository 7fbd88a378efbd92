package com.nevis.docsearch.service;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

public final class CacheKeys {

    private CacheKeys() {
    }

    public static String search(long tenantId, String query, int page, int perPage) {
        String digest = DigestUtils.md5DigestAsHex(query.getBytes(StandardCharsets.UTF_8));
        return "search:" + tenantId + ":" + digest + ":" + page + ":" + perPage;
    }

    public static String tenantSearches(long tenantId) {
        return "search:" + tenantId + ":*";
    }
}
