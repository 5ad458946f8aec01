package com.musicgroups.edit;

import com.musicgroups.model.Album;
import com.musicgroups.model.AlbumDraft;
import com.musicgroups.model.Artist;
import com.musicgroups.model.ArtistDraft;
import com.musicgroups.model.MusicGroup;
import com.musicgroups.service.AlbumsService;
import com.musicgroups.service.ArtistsService;
import com.musicgroups.service.EntityService;
import com.musicgroups.service.MusicGroupsService;
import com.musicgroups.service.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Writes the staged changes of one child collection to storage.
 * <p>
 * The backend only offers per-record create/read/update/delete without a transaction,
 * so the order is fixed: deletes, then inserts, then a re-read of the group, then
 * updates matched against that re-read. A failure stops the remaining steps and leaves
 * what was already written in place.
 *
 * @param <F> the editable fields of one row
 * @param <D> the create/update payload sent to the backend
 * @param <M> the stored record
 */
public class ChildCollectionReconciler<F extends ChildFields<F>, D, M> {

    private static final Logger log = LoggerFactory.getLogger(ChildCollectionReconciler.class);

    /**
     * How rows of one kind map onto the backend's payloads and records.
     */
    public interface ChildMapping<F, D, M> {

        D createPayload(F fields, UUID parentId);

        /** Edited fields laid over the freshly read record; the stored foreign key is kept. */
        D updatePayload(M stored, F edited);

        UUID idOf(M stored);

        F fieldsOf(M stored);

        List<M> childrenOf(MusicGroup group);
    }

    private final ChildKind kind;
    private final EntityService<D, M> service;
    private final MusicGroupsService groups;
    private final ChildMapping<F, D, M> mapping;

    public ChildCollectionReconciler(ChildKind kind,
                                     EntityService<D, M> service,
                                     MusicGroupsService groups,
                                     ChildMapping<F, D, M> mapping) {
        this.kind = kind;
        this.service = service;
        this.groups = groups;
        this.mapping = mapping;
    }

    public static ChildCollectionReconciler<AlbumFields, AlbumDraft, Album> forAlbums(
            AlbumsService albums, MusicGroupsService groups) {
        return new ChildCollectionReconciler<>(ChildKind.ALBUM, albums, groups, new ChildMapping<AlbumFields, AlbumDraft, Album>() {
            @Override
            public AlbumDraft createPayload(AlbumFields fields, UUID parentId) {
                return fields.toDraft(parentId);
            }

            @Override
            public AlbumDraft updatePayload(Album stored, AlbumFields edited) {
                return edited.toDraft(stored.musicGroupId());
            }

            @Override
            public UUID idOf(Album stored) {
                return stored.id();
            }

            @Override
            public AlbumFields fieldsOf(Album stored) {
                return AlbumFields.of(stored);
            }

            @Override
            public List<Album> childrenOf(MusicGroup group) {
                return group.albums();
            }
        });
    }

    public static ChildCollectionReconciler<ArtistFields, ArtistDraft, Artist> forArtists(
            ArtistsService artists, MusicGroupsService groups) {
        return new ChildCollectionReconciler<>(ChildKind.ARTIST, artists, groups, new ChildMapping<ArtistFields, ArtistDraft, Artist>() {
            @Override
            public ArtistDraft createPayload(ArtistFields fields, UUID parentId) {
                return fields.toDraft(parentId);
            }

            @Override
            public ArtistDraft updatePayload(Artist stored, ArtistFields edited) {
                return edited.toDraft(stored.musicGroupId());
            }

            @Override
            public UUID idOf(Artist stored) {
                return stored.id();
            }

            @Override
            public ArtistFields fieldsOf(Artist stored) {
                return ArtistFields.of(stored);
            }

            @Override
            public List<Artist> childrenOf(MusicGroup group) {
                return group.artists();
            }
        });
    }

    /**
     * Reject a collection that cannot be reconciled, so a save can refuse it before the
     * first write: a missing list or row, a row without a tag or never added, or a loaded
     * row that does not carry a backend id.
     *
     * @throws IllegalArgumentException naming the first offending row
     */
    public void checkStaged(List<EditableRow<F>> edited) {
        if (edited == null) {
            throw new IllegalArgumentException("No " + kind.segment() + " collection given");
        }
        for (int i = 0; i < edited.size(); i++) {
            EditableRow<F> row = edited.get(i);
            String where = kind.segment() + "[" + i + "]";
            if (row == null || row.getTag() == null) {
                throw new IllegalArgumentException(where + " has no change tag");
            }
            switch (row.getTag()) {
                case UNKNOWN -> throw new IllegalArgumentException(where + " was never added");
                case UNCHANGED, MODIFIED -> {
                    if (!(row.getId() instanceof PersistedId)) {
                        throw new IllegalArgumentException(where + " is " + row.getTag() + " without a stored id");
                    }
                }
                case INSERTED, DELETED -> {
                    if (row.getId() == null) {
                        throw new IllegalArgumentException(where + " has no id");
                    }
                }
            }
            if (row.getTag() != ChangeTag.DELETED && row.getCurrent() == null) {
                throw new IllegalArgumentException(where + " has no values");
            }
        }
    }

    /**
     * Apply the staged changes of {@code edited} to the children of group {@code parentId}.
     * Inserted rows receive the backend id as a side effect.
     *
     * @param parentId id of a group that already exists in storage
     * @return the collection as stored after deletes and inserts, every row unchanged;
     *         {@code edited} itself when nothing was staged
     * @throws ConsistencyException if a modified row is missing after the re-read
     * @throws com.musicgroups.service.PersistenceException if a backend call fails
     */
    public List<EditableRow<F>> reconcile(List<EditableRow<F>> edited, UUID parentId) {
        Objects.requireNonNull(parentId, "parentId");
        Map<ChangeTag, List<EditableRow<F>>> byTag = partition(edited);

        List<EditableRow<F>> deleted = byTag.get(ChangeTag.DELETED);
        List<EditableRow<F>> inserted = byTag.get(ChangeTag.INSERTED);
        List<EditableRow<F>> modified = byTag.get(ChangeTag.MODIFIED);

        if (deleted.isEmpty() && inserted.isEmpty() && modified.isEmpty()) {
            log.debug("No staged {} changes for group {}", kind.segment(), parentId);
            return edited;
        }
        log.debug("Reconciling {} of group {}: {} deleted, {} inserted, {} modified",
            kind.segment(), parentId, deleted.size(), inserted.size(), modified.size());

        applyDeletes(deleted);
        applyInserts(inserted, parentId);

        // Creates and deletes do not return the collection, so re-read before updating
        MusicGroup fresh = groups.readMusicGroupAggregate(parentId);
        List<M> stored = mapping.childrenOf(fresh);

        applyUpdates(modified, stored);

        List<EditableRow<F>> result = new ArrayList<>(stored.size());
        for (M record : stored) {
            result.add(EditableRow.loaded(new PersistedId(mapping.idOf(record)), mapping.fieldsOf(record)));
        }
        return result;
    }

    private Map<ChangeTag, List<EditableRow<F>>> partition(List<EditableRow<F>> edited) {
        Map<ChangeTag, List<EditableRow<F>>> byTag = new EnumMap<>(ChangeTag.class);
        for (ChangeTag tag : ChangeTag.values()) {
            byTag.put(tag, new ArrayList<>());
        }
        for (EditableRow<F> row : edited) {
            byTag.get(row.getTag()).add(row);
        }
        if (!byTag.get(ChangeTag.UNKNOWN).isEmpty()) {
            throw new IllegalArgumentException(
                byTag.get(ChangeTag.UNKNOWN).size() + " " + kind.segment() + " row(s) were never added");
        }
        return byTag;
    }

    private void applyDeletes(List<EditableRow<F>> deleted) {
        for (EditableRow<F> row : deleted) {
            if (!(row.getId() instanceof PersistedId persisted)) {
                log.debug("Dropping {} row {} that was never stored", kind.segment(), row.getId());
                continue;
            }
            try {
                service.delete(persisted.value());
            } catch (NotFoundException e) {
                log.warn("{} {} was already gone, delete treated as done", kind, persisted.value());
            }
        }
    }

    private void applyInserts(List<EditableRow<F>> inserted, UUID parentId) {
        for (EditableRow<F> row : inserted) {
            M created = service.create(mapping.createPayload(row.getCurrent(), parentId));
            row.markPersisted(new PersistedId(mapping.idOf(created)));
        }
    }

    private void applyUpdates(List<EditableRow<F>> modified, List<M> stored) {
        Map<UUID, M> storedById = new LinkedHashMap<>();
        for (M record : stored) {
            storedById.put(mapping.idOf(record), record);
        }

        // Resolve every match first so a missing row stops the save before any update
        Map<UUID, D> payloads = new LinkedHashMap<>();
        for (EditableRow<F> row : modified) {
            UUID id = row.requirePersistedId().value();
            M match = storedById.get(id);
            if (match == null) {
                throw new ConsistencyException(kind, id);
            }
            payloads.put(id, mapping.updatePayload(match, row.getCurrent()));
        }

        payloads.forEach(service::update);
    }
}
