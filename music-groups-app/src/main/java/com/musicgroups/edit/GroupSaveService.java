package com.musicgroups.edit;

import com.musicgroups.edit.validation.FieldPath;
import com.musicgroups.edit.validation.FormField;
import com.musicgroups.edit.validation.ValidationGate;
import com.musicgroups.edit.validation.ValidationResult;
import com.musicgroups.model.Album;
import com.musicgroups.model.AlbumDraft;
import com.musicgroups.model.Artist;
import com.musicgroups.model.ArtistDraft;
import com.musicgroups.model.MusicGroup;
import com.musicgroups.service.AlbumsService;
import com.musicgroups.service.ArtistsService;
import com.musicgroups.service.MusicGroupsService;
import com.musicgroups.service.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Saves an edited music group with its albums and artists.
 * <p>
 * The steps run one after the other in the calling thread: create the group if it is
 * new, reconcile albums, reconcile artists, re-read the group and update its own
 * fields. Nothing is rolled back when a step fails. There is no version check either,
 * so two sessions saving the same group overwrite each other.
 */
@Service
public class GroupSaveService {

    private static final Logger log = LoggerFactory.getLogger(GroupSaveService.class);

    private static final List<FieldPath> GROUP_FIELDS = List.of(
        FieldPath.of(FormField.GROUP_NAME),
        FieldPath.of(FormField.GROUP_ESTABLISHED_YEAR),
        FieldPath.of(FormField.GROUP_GENRE)
    );

    private final MusicGroupsService groups;
    private final ValidationGate validationGate;
    private final ChildCollectionReconciler<AlbumFields, AlbumDraft, Album> albumReconciler;
    private final ChildCollectionReconciler<ArtistFields, ArtistDraft, Artist> artistReconciler;

    public GroupSaveService(MusicGroupsService groups,
                            AlbumsService albums,
                            ArtistsService artists,
                            ValidationGate validationGate) {
        this.groups = groups;
        this.validationGate = validationGate;
        this.albumReconciler = ChildCollectionReconciler.forAlbums(albums, groups);
        this.artistReconciler = ChildCollectionReconciler.forArtists(artists, groups);
    }

    /**
     * Start editing an existing group.
     *
     * @throws com.musicgroups.service.NotFoundException if the group does not exist
     */
    public MusicGroupInput open(UUID groupId) {
        return MusicGroupInput.fromModel(groups.readMusicGroupAggregate(groupId));
    }

    public MusicGroupInput openNew() {
        return MusicGroupInput.blank();
    }

    /**
     * Throw away every staged edit and reload the group as stored. A group that was
     * never saved starts over blank.
     */
    public MusicGroupInput undo(PersistedId groupId) {
        if (groupId == null) {
            return openNew();
        }
        log.debug("Discarding staged edits of group {}", groupId.value());
        return open(groupId.value());
    }

    /**
     * @return {@link SaveResult.Invalid} when the group's own fields fail validation,
     *         otherwise {@link SaveResult.Saved}
     *         with the working copy's rows replaced by the stored ones
     * @throws IllegalArgumentException if a collection cannot be reconciled; nothing is written
     * @throws SaveIncompleteException if a backend call fails or a modified row vanished;
     *         steps already applied are not undone
     */
    public SaveResult save(MusicGroupInput input) {
        ValidationResult validation = validationGate.validatePartial(input, GROUP_FIELDS);
        if (!validation.isValid()) {
            log.debug("Save rejected, {} field error(s)", validation.errors().size());
            return new SaveResult.Invalid(validation);
        }

        boolean created = input.isNew();
        UUID groupId = input.getGroupId() != null ? input.getGroupId().value() : null;
        if (!created && groupId == null) {
            throw new IllegalArgumentException("An existing group must carry its id");
        }
        // Nothing is written until both collections are known to be reconcilable
        albumReconciler.checkStaged(input.getAlbums());
        artistReconciler.checkStaged(input.getArtists());

        SavePhase phase = SavePhase.CREATE_GROUP;
        try {
            if (created) {
                MusicGroup group = groups.create(input.toDraft());
                groupId = group.id();
                input.setGroupId(new PersistedId(groupId));
                input.setTag(ChangeTag.UNCHANGED);
                log.info("Created music group {} {}", groupId, group.displayName());
            }

            phase = SavePhase.ALBUMS;
            input.setAlbums(albumReconciler.reconcile(input.getAlbums(), groupId));

            phase = SavePhase.ARTISTS;
            input.setArtists(artistReconciler.reconcile(input.getArtists(), groupId));

            phase = SavePhase.UPDATE_GROUP;
            MusicGroup fresh = groups.readMusicGroupAggregate(groupId);
            MusicGroup updated = groups.update(groupId, input.overlayOnto(fresh));
            MusicGroupInput stored = MusicGroupInput.fromModel(fresh);
            input.setAlbums(stored.getAlbums());
            input.setArtists(stored.getArtists());

            log.info("Saved music group {} ({} albums, {} artists)",
                groupId, fresh.albums().size(), fresh.artists().size());
            return new SaveResult.Saved(groupId, created,
                updated.withChildren(fresh.albums(), fresh.artists()));
        } catch (PersistenceException | ConsistencyException e) {
            log.error("Save of music group {} failed during {}", groupId, phase, e);
            throw new SaveIncompleteException(groupId, phase, e);
        }
    }
}
