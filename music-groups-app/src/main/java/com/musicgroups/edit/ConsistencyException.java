package com.musicgroups.edit;

import java.util.UUID;

/**
 * A modified row is no longer in storage when its update is due, typically because
 * another session deleted it.
 */
public class ConsistencyException extends RuntimeException {

    private final ChildKind kind;
    private final UUID rowId;

    public ConsistencyException(ChildKind kind, UUID rowId) {
        super("Modified " + kind.name().toLowerCase() + " " + rowId + " no longer exists in storage");
        this.kind = kind;
        this.rowId = rowId;
    }

    public ChildKind getKind() {
        return kind;
    }

    public UUID getRowId() {
        return rowId;
    }
}
