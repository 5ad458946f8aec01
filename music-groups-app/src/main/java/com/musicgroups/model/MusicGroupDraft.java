package com.musicgroups.model;

/**
 * Create/update payload for a music group. Carries no identifier; the backend assigns it.
 */
public record MusicGroupDraft(
    String name,
    int establishedYear,
    MusicGenre genre,
    boolean seeded
) {
}
