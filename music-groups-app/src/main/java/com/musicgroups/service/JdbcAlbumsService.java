package com.musicgroups.service;

import com.musicgroups.model.Album;
import com.musicgroups.model.AlbumDraft;
import com.musicgroups.repository.AlbumRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
public class JdbcAlbumsService implements AlbumsService {

    private static final Logger log = LoggerFactory.getLogger(JdbcAlbumsService.class);

    private static final String KIND = "Album";

    private final AlbumRepository albumRepository;

    public JdbcAlbumsService(AlbumRepository albumRepository) {
        this.albumRepository = albumRepository;
    }

    @Override
    public Album create(AlbumDraft draft) {
        return DataAccessTranslator.call("create " + KIND, () -> {
            UUID id = albumRepository.insert(draft);
            log.debug("Created album {} for group {}", id, draft.musicGroupId());
            return albumRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(KIND, id));
        });
    }

    @Override
    public Album read(UUID id) {
        return DataAccessTranslator.call("read " + KIND, () -> albumRepository.findById(id)
            .orElseThrow(() -> new NotFoundException(KIND, id)));
    }

    @Override
    public Album update(UUID id, AlbumDraft draft) {
        return DataAccessTranslator.call("update " + KIND, () -> {
            if (albumRepository.update(id, draft) == 0) {
                throw new NotFoundException(KIND, id);
            }
            log.debug("Updated album {}", id);
            return albumRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(KIND, id));
        });
    }

    @Override
    public void delete(UUID id) {
        DataAccessTranslator.call("delete " + KIND, () -> {
            int rows = albumRepository.delete(id);
            log.debug("Deleted album {} ({} row(s))", id, rows);
            return rows;
        });
    }
}
