package com.musicgroups.service;

import java.util.UUID;

public class NotFoundException extends PersistenceException {

    private final String entityKind;
    private final UUID id;

    public NotFoundException(String entityKind, UUID id) {
        super(entityKind + " not found: " + id);
        this.entityKind = entityKind;
        this.id = id;
    }

    public String getEntityKind() {
        return entityKind;
    }

    public UUID getId() {
        return id;
    }
}
