package com.musicgroups.edit.validation;

import java.util.Objects;

/**
 * Typed address of one form field, e.g. the pending release year of the third album.
 */
public record FieldPath(FormField field, Integer index) {

    public FieldPath {
        Objects.requireNonNull(field, "field");
        if (field.scope().isIndexed()) {
            if (index == null || index < 0) {
                throw new IllegalArgumentException(field + " needs a row index, got " + index);
            }
        } else if (index != null) {
            throw new IllegalArgumentException(field + " does not take a row index");
        }
    }

    public static FieldPath of(FormField field) {
        return new FieldPath(field, null);
    }

    public static FieldPath row(FormField field, int index) {
        return new FieldPath(field, index);
    }

    @Override
    public String toString() {
        return switch (field.scope()) {
            case GROUP -> field.property();
            case NEW_ALBUM -> "newAlbum." + field.property();
            case NEW_ARTIST -> "newArtist." + field.property();
            case ALBUM_ROW -> "albums[" + index + "].pending." + field.property();
            case ARTIST_ROW -> "artists[" + index + "].pending." + field.property();
        };
    }
}
