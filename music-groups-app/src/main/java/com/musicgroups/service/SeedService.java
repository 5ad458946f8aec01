package com.musicgroups.service;

import com.musicgroups.model.AlbumDraft;
import com.musicgroups.model.ArtistDraft;
import com.musicgroups.model.MusicGenre;
import com.musicgroups.model.MusicGroup;
import com.musicgroups.model.MusicGroupDraft;
import com.musicgroups.repository.MusicGroupRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;

/**
 * Fills the database with generated groups for demos and tests. Generated groups are
 * flagged as seeded so they can be listed and removed separately from real ones.
 */
@Service
public class SeedService {

    private static final Logger log = LoggerFactory.getLogger(SeedService.class);

    private static final List<String> ADJECTIVES = List.of(
        "Electric", "Silent", "Crimson", "Velvet", "Iron", "Golden", "Midnight", "Wild", "Hollow", "Lunar");
    private static final List<String> NOUNS = List.of(
        "Wolves", "Echoes", "Harbor", "Pilots", "Garden", "Machines", "Tides", "Saints", "Lanterns", "Rivers");
    private static final List<String> FIRST_NAMES = List.of(
        "Anna", "Erik", "Maja", "Johan", "Sara", "Lars", "Emma", "Nils", "Karin", "Oskar");
    private static final List<String> LAST_NAMES = List.of(
        "Berg", "Lind", "Holm", "Ek", "Strand", "Dahl", "Sjöberg", "Nyström", "Falk", "Wall");
    private static final List<String> ALBUM_WORDS = List.of(
        "Dawn", "Static", "Northern Lights", "Paper Moon", "Undertow", "Glass", "Afterglow", "Fault Lines");

    private final MusicGroupsService groups;
    private final AlbumsService albums;
    private final ArtistsService artists;
    private final MusicGroupRepository groupRepository;
    private final Random random = new Random();

    public SeedService(MusicGroupsService groups,
                       AlbumsService albums,
                       ArtistsService artists,
                       MusicGroupRepository groupRepository) {
        this.groups = groups;
        this.albums = albums;
        this.artists = artists;
        this.groupRepository = groupRepository;
    }

    /**
     * Insert {@code count} generated groups, each with one to three albums and two to
     * four artists.
     */
    public SeedInfo seed(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        for (int i = 0; i < count; i++) {
            MusicGroup group = groups.create(new MusicGroupDraft(
                pick(ADJECTIVES) + " " + pick(NOUNS),
                1950 + random.nextInt(70),
                pick(List.of(MusicGenre.values())),
                true
            ));

            int nrAlbums = 1 + random.nextInt(3);
            for (int a = 0; a < nrAlbums; a++) {
                albums.create(new AlbumDraft(pick(ALBUM_WORDS),
                    Math.max(group.establishedYear(), 1950) + random.nextInt(5), group.id()));
            }
            int nrArtists = 2 + random.nextInt(3);
            for (int a = 0; a < nrArtists; a++) {
                artists.create(new ArtistDraft(pick(FIRST_NAMES), pick(LAST_NAMES), group.id()));
            }
        }
        log.info("Seeded {} music group(s)", count);
        return info();
    }

    /**
     * Delete all seeded groups, or all user-created ones. Albums and artists go with them.
     */
    public int removeSeeds(boolean seeded) {
        int removed = DataAccessTranslator.call("remove seeds", () -> groupRepository.deleteBySeeded(seeded));
        log.info("Removed {} {} music group(s)", removed, seeded ? "seeded" : "user-created");
        return removed;
    }

    public SeedInfo info() {
        int seeded = groups.readMusicGroups(true, null, 0, 1).totalCount();
        int unseeded = groups.readMusicGroups(false, null, 0, 1).totalCount();
        return new SeedInfo(seeded, unseeded);
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    public record SeedInfo(int nrSeededGroups, int nrUnseededGroups) {
        public int nrOfGroups() {
            return nrSeededGroups + nrUnseededGroups;
        }
    }
}
