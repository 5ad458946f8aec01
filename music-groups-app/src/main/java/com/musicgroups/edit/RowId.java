package com.musicgroups.edit;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.UUID;

/**
 * Client-visible identifier of an editable record. A {@link TemporaryId} only addresses a
 * row inside the edit session; a {@link PersistedId} was assigned by the backend.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TemporaryId.class, name = "temporary"),
    @JsonSubTypes.Type(value = PersistedId.class, name = "persisted")
})
public sealed interface RowId permits TemporaryId, PersistedId {

    UUID value();
}
