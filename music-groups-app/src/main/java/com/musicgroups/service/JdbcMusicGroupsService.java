package com.musicgroups.service;

import com.musicgroups.config.MusicGroupsConfig;
import com.musicgroups.model.MusicGroup;
import com.musicgroups.model.MusicGroupDraft;
import com.musicgroups.model.PageResult;
import com.musicgroups.repository.AlbumRepository;
import com.musicgroups.repository.ArtistRepository;
import com.musicgroups.repository.MusicGroupRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class JdbcMusicGroupsService implements MusicGroupsService {

    private static final Logger log = LoggerFactory.getLogger(JdbcMusicGroupsService.class);

    private static final String KIND = "MusicGroup";

    private final MusicGroupRepository groupRepository;
    private final AlbumRepository albumRepository;
    private final ArtistRepository artistRepository;
    private final MusicGroupsConfig config;

    public JdbcMusicGroupsService(MusicGroupRepository groupRepository,
                                  AlbumRepository albumRepository,
                                  ArtistRepository artistRepository,
                                  MusicGroupsConfig config) {
        this.groupRepository = groupRepository;
        this.albumRepository = albumRepository;
        this.artistRepository = artistRepository;
        this.config = config;
    }

    @Override
    public MusicGroup create(MusicGroupDraft draft) {
        return DataAccessTranslator.call("create " + KIND, () -> {
            UUID id = groupRepository.insert(draft);
            log.debug("Created music group {} '{}'", id, draft.name());
            return groupRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(KIND, id));
        });
    }

    @Override
    public MusicGroup read(UUID id) {
        return DataAccessTranslator.call("read " + KIND, () -> groupRepository.findById(id)
            .orElseThrow(() -> new NotFoundException(KIND, id)));
    }

    @Override
    public MusicGroup readMusicGroupAggregate(UUID id) {
        return DataAccessTranslator.call("read " + KIND + " aggregate", () -> {
            MusicGroup group = groupRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(KIND, id));
            return group.withChildren(
                albumRepository.findByMusicGroupId(id),
                artistRepository.findByMusicGroupId(id)
            );
        });
    }

    @Override
    public PageResult<MusicGroup> readMusicGroups(Boolean seeded, String search, int pageNr, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        // Past the last reachable offset every page is empty anyway
        int page = Math.min(Math.max(0, pageNr), Integer.MAX_VALUE / pageSize);
        return DataAccessTranslator.call("list " + KIND, () -> {
            int total = groupRepository.count(seeded, search);
            List<MusicGroup> items = groupRepository.search(seeded, search, page * pageSize, pageSize);
            return new PageResult<>(items, total, page, pageSize, config.getMaxVisiblePages());
        });
    }

    @Override
    public MusicGroup update(UUID id, MusicGroupDraft draft) {
        return DataAccessTranslator.call("update " + KIND, () -> {
            if (groupRepository.update(id, draft) == 0) {
                throw new NotFoundException(KIND, id);
            }
            log.debug("Updated music group {}", id);
            return groupRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(KIND, id));
        });
    }

    @Override
    public void delete(UUID id) {
        DataAccessTranslator.call("delete " + KIND, () -> {
            int rows = groupRepository.delete(id);
            log.debug("Deleted music group {} ({} row(s))", id, rows);
            return rows;
        });
    }
}
