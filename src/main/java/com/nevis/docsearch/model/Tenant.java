package com.nevis.docsearch.model;

import java.time.OffsetDateTime;

public record Tenant(
	Long id,
	String name,
	String subdomain,
	String apiKeyHash,
	int documentQuota,
	int rateLimitPerMinute,
	OffsetDateTime createdAt,
	OffsetDateTime updatedAt
) {}
