package com.musicgroups.edit;

/**
 * Lifecycle marker of an editable record. The transition methods are total: every
 * (state, operation) pair either yields the next state or is rejected with an
 * {@link IllegalStateException}.
 */
public enum ChangeTag {
    /** A blank form that has not been added to a collection yet. */
    UNKNOWN,
    /** Loaded from storage and not touched since. */
    UNCHANGED,
    /** Created in this session, never persisted. */
    INSERTED,
    /** Loaded from storage and edited in place. */
    MODIFIED,
    /** Staged for deletion. Terminal. */
    DELETED;

    public ChangeTag afterInsert() {
        if (this != UNKNOWN) {
            throw new IllegalStateException("Only a new record can be inserted, tag is " + this);
        }
        return INSERTED;
    }

    public ChangeTag afterDelete() {
        if (this == UNKNOWN) {
            throw new IllegalStateException("A record that was never added cannot be deleted");
        }
        return DELETED;
    }

    public ChangeTag afterEdit() {
        return switch (this) {
            case UNKNOWN -> throw new IllegalStateException("A record that was never added cannot be edited");
            case INSERTED -> INSERTED;
            case DELETED -> DELETED;
            case UNCHANGED, MODIFIED -> MODIFIED;
        };
    }
}
