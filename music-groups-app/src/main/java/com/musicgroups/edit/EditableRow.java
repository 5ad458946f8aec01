package com.musicgroups.edit;

import java.util.Objects;
import java.util.UUID;

/**
 * One item of a child collection inside an edit session. {@code current} holds the values
 * that will be saved, {@code pending} the values of an in-place edit being composed.
 */
public class EditableRow<F extends ChildFields<F>> {

    private RowId id;
    private ChangeTag tag = ChangeTag.UNKNOWN;
    private F current;
    private F pending;

    public EditableRow() {
    }

    private EditableRow(RowId id, ChangeTag tag, F current) {
        this.id = id;
        this.tag = tag;
        this.current = current;
        this.pending = current.copy();
    }

    /**
     * A row read from storage.
     */
    public static <F extends ChildFields<F>> EditableRow<F> loaded(PersistedId id, F fields) {
        return new EditableRow<>(Objects.requireNonNull(id, "id"), ChangeTag.UNCHANGED, fields);
    }

    /**
     * A row built from the "new row" form; it still has to be {@link #markInserted() inserted}.
     */
    public static <F extends ChildFields<F>> EditableRow<F> fromDraft(F draft) {
        return new EditableRow<>(null, ChangeTag.UNKNOWN, draft.copy());
    }

    /**
     * Tag the row as new and give it a temporary id so the edit surface can address it.
     * Allowed exactly once, before the row is exposed.
     */
    public void markInserted() {
        tag = tag.afterInsert();
        id = TemporaryId.generate();
    }

    /**
     * Stage the row for deletion. Nothing is written until the aggregate is saved.
     */
    public void markDeleted() {
        tag = tag.afterDelete();
    }

    /**
     * Commit the pending edit onto the current fields. An inserted row stays inserted;
     * a deleted row ignores the edit.
     */
    public void markModifiedIfNeeded() {
        ChangeTag next = tag.afterEdit();
        if (next != ChangeTag.DELETED) {
            current = pending.copy();
        }
        tag = next;
    }

    /**
     * Replace the temporary id with the one the backend assigned on creation.
     */
    public void markPersisted(PersistedId persistedId) {
        if (tag != ChangeTag.INSERTED) {
            throw new IllegalStateException("Only an inserted row receives a backend id, tag is " + tag);
        }
        id = Objects.requireNonNull(persistedId, "persistedId");
        tag = ChangeTag.UNCHANGED;
    }

    public PersistedId requirePersistedId() {
        if (id instanceof PersistedId persisted) {
            return persisted;
        }
        throw new IllegalStateException("Row " + id + " has not been persisted");
    }

    public boolean hasId(UUID value) {
        return id != null && id.value().equals(value);
    }

    public RowId getId() {
        return id;
    }

    public void setId(RowId id) {
        this.id = id;
    }

    public ChangeTag getTag() {
        return tag;
    }

    public void setTag(ChangeTag tag) {
        this.tag = tag;
    }

    public F getCurrent() {
        return current;
    }

    public void setCurrent(F current) {
        this.current = current;
    }

    public F getPending() {
        return pending;
    }

    public void setPending(F pending) {
        this.pending = pending;
    }

    @Override
    public String toString() {
        return "EditableRow[id=" + id + ", tag=" + tag + ", current=" + current + "]";
    }
}
