package com.musicgroups.edit;

import java.util.Objects;
import java.util.UUID;

public record PersistedId(UUID value) implements RowId {

    public PersistedId {
        Objects.requireNonNull(value, "value");
    }
}
