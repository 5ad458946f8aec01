package com.musicgroups.edit;

import java.util.Objects;
import java.util.UUID;

public record TemporaryId(UUID value) implements RowId {

    public TemporaryId {
        Objects.requireNonNull(value, "value");
    }

    public static TemporaryId generate() {
        return new TemporaryId(UUID.randomUUID());
    }
}
