package com.musicgroups.repository;

import com.musicgroups.model.Artist;
import com.musicgroups.model.ArtistDraft;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class ArtistRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Artist> ARTIST_MAPPER = (rs, rowNum) -> new Artist(
        rs.getObject("id", UUID.class),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getObject("music_group_id", UUID.class)
    );

    public ArtistRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Artist> findById(UUID id) {
        List<Artist> results = jdbc.query(
            "SELECT * FROM artist WHERE id = ?",
            ARTIST_MAPPER,
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Artist> findByMusicGroupId(UUID musicGroupId) {
        return jdbc.query(
            "SELECT * FROM artist WHERE music_group_id = ? ORDER BY last_name, first_name",
            ARTIST_MAPPER,
            musicGroupId
        );
    }

    public UUID insert(ArtistDraft draft) {
        UUID id = UUID.randomUUID();
        jdbc.update(
            "INSERT INTO artist (id, first_name, last_name, music_group_id) VALUES (?, ?, ?, ?)",
            id, draft.firstName(), draft.lastName(), draft.musicGroupId()
        );
        return id;
    }

    public int update(UUID id, ArtistDraft draft) {
        return jdbc.update(
            "UPDATE artist SET first_name = ?, last_name = ?, music_group_id = ? WHERE id = ?",
            draft.firstName(), draft.lastName(), draft.musicGroupId(), id
        );
    }

    public int delete(UUID id) {
        return jdbc.update("DELETE FROM artist WHERE id = ?", id);
    }
}
