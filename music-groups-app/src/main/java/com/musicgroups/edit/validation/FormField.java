package com.musicgroups.edit.validation;

/**
 * Every validated input on the group edit form. Row-scoped fields address the pending
 * edit of one album or artist and need a row index.
 */
public enum FormField {
    GROUP_NAME(Scope.GROUP, "name"),
    GROUP_ESTABLISHED_YEAR(Scope.GROUP, "establishedYear"),
    GROUP_GENRE(Scope.GROUP, "genre"),

    NEW_ALBUM_NAME(Scope.NEW_ALBUM, "name"),
    NEW_ALBUM_RELEASE_YEAR(Scope.NEW_ALBUM, "releaseYear"),
    NEW_ARTIST_FIRST_NAME(Scope.NEW_ARTIST, "firstName"),
    NEW_ARTIST_LAST_NAME(Scope.NEW_ARTIST, "lastName"),

    ALBUM_NAME(Scope.ALBUM_ROW, "name"),
    ALBUM_RELEASE_YEAR(Scope.ALBUM_ROW, "releaseYear"),
    ARTIST_FIRST_NAME(Scope.ARTIST_ROW, "firstName"),
    ARTIST_LAST_NAME(Scope.ARTIST_ROW, "lastName");

    public enum Scope {
        GROUP,
        NEW_ALBUM,
        NEW_ARTIST,
        ALBUM_ROW,
        ARTIST_ROW;

        public boolean isIndexed() {
            return this == ALBUM_ROW || this == ARTIST_ROW;
        }
    }

    private final Scope scope;
    private final String property;

    FormField(Scope scope, String property) {
        this.scope = scope;
        this.property = property;
    }

    public Scope scope() {
        return scope;
    }

    /** Bean property validated for this field. */
    public String property() {
        return property;
    }
}
