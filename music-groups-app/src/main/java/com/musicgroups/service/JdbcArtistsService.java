package com.musicgroups.service;

import com.musicgroups.model.Artist;
import com.musicgroups.model.ArtistDraft;
import com.musicgroups.repository.ArtistRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
public class JdbcArtistsService implements ArtistsService {

    private static final Logger log = LoggerFactory.getLogger(JdbcArtistsService.class);

    private static final String KIND = "Artist";

    private final ArtistRepository artistRepository;

    public JdbcArtistsService(ArtistRepository artistRepository) {
        this.artistRepository = artistRepository;
    }

    @Override
    public Artist create(ArtistDraft draft) {
        return DataAccessTranslator.call("create " + KIND, () -> {
            UUID id = artistRepository.insert(draft);
            log.debug("Created artist {} for group {}", id, draft.musicGroupId());
            return artistRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(KIND, id));
        });
    }

    @Override
    public Artist read(UUID id) {
        return DataAccessTranslator.call("read " + KIND, () -> artistRepository.findById(id)
            .orElseThrow(() -> new NotFoundException(KIND, id)));
    }

    @Override
    public Artist update(UUID id, ArtistDraft draft) {
        return DataAccessTranslator.call("update " + KIND, () -> {
            if (artistRepository.update(id, draft) == 0) {
                throw new NotFoundException(KIND, id);
            }
            log.debug("Updated artist {}", id);
            return artistRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(KIND, id));
        });
    }

    @Override
    public void delete(UUID id) {
        DataAccessTranslator.call("delete " + KIND, () -> {
            int rows = artistRepository.delete(id);
            log.debug("Deleted artist {} ({} row(s))", id, rows);
            return rows;
        });
    }
}
