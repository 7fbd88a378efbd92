package com.nevis.docsearch.event;

import java.util.List;

public record TenantDestroyedEvent(Long tenantId, List<Long> documentIds) {}
