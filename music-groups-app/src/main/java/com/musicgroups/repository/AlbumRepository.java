package com.musicgroups.repository;

import com.musicgroups.model.Album;
import com.musicgroups.model.AlbumDraft;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class AlbumRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Album> ALBUM_MAPPER = (rs, rowNum) -> new Album(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        rs.getInt("release_year"),
        rs.getObject("music_group_id", UUID.class)
    );

    public AlbumRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Album> findById(UUID id) {
        List<Album> results = jdbc.query(
            "SELECT * FROM album WHERE id = ?",
            ALBUM_MAPPER,
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Album> findByMusicGroupId(UUID musicGroupId) {
        return jdbc.query(
            "SELECT * FROM album WHERE music_group_id = ? ORDER BY release_year, name",
            ALBUM_MAPPER,
            musicGroupId
        );
    }

    public UUID insert(AlbumDraft draft) {
        UUID id = UUID.randomUUID();
        jdbc.update(
            "INSERT INTO album (id, name, release_year, music_group_id) VALUES (?, ?, ?, ?)",
            id, draft.name(), draft.releaseYear(), draft.musicGroupId()
        );
        return id;
    }

    public int update(UUID id, AlbumDraft draft) {
        return jdbc.update(
            "UPDATE album SET name = ?, release_year = ?, music_group_id = ? WHERE id = ?",
            draft.name(), draft.releaseYear(), draft.musicGroupId(), id
        );
    }

    public int delete(UUID id) {
        return jdbc.update("DELETE FROM album WHERE id = ?", id);
    }
}
