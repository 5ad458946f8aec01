package com.musicgroups.edit;

import com.musicgroups.edit.validation.FieldPath;
import com.musicgroups.edit.validation.FormField;

import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The two child collections of a music group. Declaration order is the order in which
 * they are reconciled on save.
 */
public enum ChildKind {
    ALBUM("albums",
        List.of(FormField.NEW_ALBUM_NAME, FormField.NEW_ALBUM_RELEASE_YEAR),
        List.of(FormField.ALBUM_NAME, FormField.ALBUM_RELEASE_YEAR)),
    ARTIST("artists",
        List.of(FormField.NEW_ARTIST_FIRST_NAME, FormField.NEW_ARTIST_LAST_NAME),
        List.of(FormField.ARTIST_FIRST_NAME, FormField.ARTIST_LAST_NAME));

    private final String segment;
    private final List<FormField> newRowFields;
    private final List<FormField> rowFields;

    ChildKind(String segment, List<FormField> newRowFields, List<FormField> rowFields) {
        this.segment = segment;
        this.newRowFields = newRowFields;
        this.rowFields = rowFields;
    }

    /** Plural name used in URLs and messages. */
    public String segment() {
        return segment;
    }

    public List<FieldPath> insertPaths() {
        return newRowFields.stream().map(FieldPath::of).toList();
    }

    public List<FieldPath> editPaths(int rowIndex) {
        return rowFields.stream().map(field -> FieldPath.row(field, rowIndex)).toList();
    }

    public static ChildKind fromSegment(String segment) {
        return Arrays.stream(values())
            .filter(kind -> kind.segment.equalsIgnoreCase(segment))
            .findFirst()
            .orElseThrow(() -> new NoSuchElementException("Unknown child collection: " + segment));
    }
}
