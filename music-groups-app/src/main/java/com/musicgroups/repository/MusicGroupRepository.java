package com.musicgroups.repository;

import com.musicgroups.model.MusicGenre;
import com.musicgroups.model.MusicGroup;
import com.musicgroups.model.MusicGroupDraft;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class MusicGroupRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<MusicGroup> GROUP_MAPPER = (rs, rowNum) -> new MusicGroup(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        rs.getInt("established_year"),
        rs.getString("genre") != null ? MusicGenre.valueOf(rs.getString("genre")) : null,
        rs.getBoolean("seeded"),
        List.of(),
        List.of()
    );

    public MusicGroupRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<MusicGroup> findById(UUID id) {
        List<MusicGroup> results = jdbc.query(
            "SELECT * FROM music_group WHERE id = ?",
            GROUP_MAPPER,
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<MusicGroup> search(Boolean seeded, String filter, int offset, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM music_group WHERE 1=1");
        List<Object> params = new ArrayList<>();
        appendCriteria(sql, params, seeded, filter);

        sql.append(" ORDER BY name, id LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);

        return jdbc.query(sql.toString(), GROUP_MAPPER, params.toArray());
    }

    public int count(Boolean seeded, String filter) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM music_group WHERE 1=1");
        List<Object> params = new ArrayList<>();
        appendCriteria(sql, params, seeded, filter);

        Integer count = jdbc.queryForObject(sql.toString(), Integer.class, params.toArray());
        return count != null ? count : 0;
    }

    public UUID insert(MusicGroupDraft draft) {
        UUID id = UUID.randomUUID();
        jdbc.update("""
            INSERT INTO music_group (id, name, established_year, genre, seeded)
            VALUES (?, ?, ?, ?, ?)
            """,
            id, draft.name(), draft.establishedYear(),
            draft.genre() != null ? draft.genre().name() : null,
            draft.seeded()
        );
        return id;
    }

    public int update(UUID id, MusicGroupDraft draft) {
        return jdbc.update("""
            UPDATE music_group
            SET name = ?, established_year = ?, genre = ?, seeded = ?
            WHERE id = ?
            """,
            draft.name(), draft.establishedYear(),
            draft.genre() != null ? draft.genre().name() : null,
            draft.seeded(), id
        );
    }

    public int delete(UUID id) {
        return jdbc.update("DELETE FROM music_group WHERE id = ?", id);
    }

    public int deleteBySeeded(boolean seeded) {
        return jdbc.update("DELETE FROM music_group WHERE seeded = ?", seeded);
    }

    private static void appendCriteria(StringBuilder sql, List<Object> params, Boolean seeded, String filter) {
        if (seeded != null) {
            sql.append(" AND seeded = ?");
            params.add(seeded);
        }
        if (filter != null && !filter.isBlank()) {
            sql.append(" AND (LOWER(name) LIKE ? OR LOWER(genre) LIKE ?)");
            String pattern = "%" + filter.trim().toLowerCase() + "%";
            params.add(pattern);
            params.add(pattern);
        }
    }
}
