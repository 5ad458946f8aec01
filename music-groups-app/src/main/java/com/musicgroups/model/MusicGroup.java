package com.musicgroups.model;

import java.util.List;
import java.util.UUID;

public record MusicGroup(
    UUID id,
    String name,
    int establishedYear,
    MusicGenre genre,
    boolean seeded,
    List<Album> albums,
    List<Artist> artists
) {
    public MusicGroup {
        albums = albums != null ? List.copyOf(albums) : List.of();
        artists = artists != null ? List.copyOf(artists) : List.of();
    }

    public MusicGroup withChildren(List<Album> albums, List<Artist> artists) {
        return new MusicGroup(id, name, establishedYear, genre, seeded, albums, artists);
    }

    public String displayName() {
        if (name == null || name.isBlank()) {
            return "Group #" + id;
        }
        return establishedYear > 0 ? name + " (" + establishedYear + ")" : name;
    }
}
