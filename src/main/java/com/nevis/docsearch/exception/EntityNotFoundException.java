package com.nevis.docsearch.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final String entity;
    private final Long entityId;

    public EntityNotFoundException(String entity, Long entityId) {
        super(entity + " not found: " + entityId);
        this.entity = entity;
        this.entityId = entityId;
    }
}
