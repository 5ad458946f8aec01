package com.musicgroups.edit;

import com.musicgroups.model.Album;
import com.musicgroups.model.AlbumDraft;
import com.musicgroups.model.MusicGenre;
import com.musicgroups.model.MusicGroup;
import com.musicgroups.service.AlbumsService;
import com.musicgroups.service.MusicGroupsService;
import com.musicgroups.service.NotFoundException;
import com.musicgroups.service.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChildCollectionReconcilerTest {

    private static final UUID GROUP_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID FIRST_LIGHT = UUID.fromString("a1111111-0000-0000-0000-000000000001");
    private static final UUID UNDERTOW = UUID.fromString("a1111111-0000-0000-0000-000000000002");
    private static final UUID AFTERGLOW = UUID.fromString("a1111111-0000-0000-0000-000000000003");

    @Mock
    private AlbumsService albums;

    @Mock
    private MusicGroupsService groups;

    private ChildCollectionReconciler<AlbumFields, AlbumDraft, Album> reconciler;

    @BeforeEach
    void setUp() {
        reconciler = ChildCollectionReconciler.forAlbums(albums, groups);
    }

    private static EditableRow<AlbumFields> loaded(UUID id, String name, int year) {
        return EditableRow.loaded(new PersistedId(id), new AlbumFields(name, year));
    }

    private static EditableRow<AlbumFields> inserted(String name, int year) {
        EditableRow<AlbumFields> row = EditableRow.fromDraft(new AlbumFields(name, year));
        row.markInserted();
        return row;
    }

    private static MusicGroup groupWith(Album... stored) {
        return new MusicGroup(GROUP_ID, "Velvet Harbor", 1985, MusicGenre.ROCK, false, List.of(stored), List.of());
    }

    @Nested
    @DisplayName("nothing staged")
    class NothingStaged {

        @Test
        void makesNoBackendCalls() {
            List<EditableRow<AlbumFields>> edited = new ArrayList<>(List.of(
                loaded(FIRST_LIGHT, "First Light", 1986),
                loaded(UNDERTOW, "Undertow", 1990)));

            List<EditableRow<AlbumFields>> result = reconciler.reconcile(edited, GROUP_ID);

            assertThat(result).isSameAs(edited);
            verifyNoInteractions(albums, groups);
        }

        @Test
        void repeatedReconcileOfUnchangedRowsStaysSilent() {
            List<EditableRow<AlbumFields>> edited = new ArrayList<>(List.of(
                loaded(FIRST_LIGHT, "First Light", 1986),
                loaded(UNDERTOW, "Undertow", 1990)));

            List<EditableRow<AlbumFields>> first = reconciler.reconcile(edited, GROUP_ID);
            List<EditableRow<AlbumFields>> second = reconciler.reconcile(first, GROUP_ID);

            assertThat(second).isSameAs(edited);
            assertThat(second).allSatisfy(row -> assertThat(row.getTag()).isEqualTo(ChangeTag.UNCHANGED));
            verifyNoInteractions(albums, groups);
        }

        @Test
        void emptyCollectionMakesNoBackendCalls() {
            assertThat(reconciler.reconcile(new ArrayList<>(), GROUP_ID)).isEmpty();
            verifyNoInteractions(albums, groups);
        }
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        void deletesThenInsertsThenReadsThenUpdates() {
            EditableRow<AlbumFields> deleted = loaded(FIRST_LIGHT, "First Light", 1986);
            deleted.markDeleted();
            EditableRow<AlbumFields> modified = loaded(UNDERTOW, "Undertow", 1990);
            modified.getPending().setName("Undertow (Remastered)");
            modified.markModifiedIfNeeded();
            EditableRow<AlbumFields> added = inserted("Afterglow", 2001);

            when(albums.create(any())).thenReturn(new Album(AFTERGLOW, "Afterglow", 2001, GROUP_ID));
            when(groups.readMusicGroupAggregate(GROUP_ID)).thenReturn(groupWith(
                new Album(UNDERTOW, "Undertow", 1990, GROUP_ID),
                new Album(AFTERGLOW, "Afterglow", 2001, GROUP_ID)));

            List<EditableRow<AlbumFields>> result =
                reconciler.reconcile(new ArrayList<>(List.of(modified, added, deleted)), GROUP_ID);

            InOrder order = inOrder(albums, groups);
            order.verify(albums).delete(FIRST_LIGHT);
            order.verify(albums).create(new AlbumDraft("Afterglow", 2001, GROUP_ID));
            order.verify(groups).readMusicGroupAggregate(GROUP_ID);
            order.verify(albums).update(UNDERTOW, new AlbumDraft("Undertow (Remastered)", 1990, GROUP_ID));
            order.verifyNoMoreInteractions();

            assertThat(result).extracting(row -> row.getId().value()).containsExactly(UNDERTOW, AFTERGLOW);
            assertThat(result).allSatisfy(row -> assertThat(row.getTag()).isEqualTo(ChangeTag.UNCHANGED));
        }

        @Test
        void deleteRunsBeforeInsertEvenWhenIdsShareTheSameValue() {
            EditableRow<AlbumFields> deleted = loaded(FIRST_LIGHT, "First Light", 1986);
            deleted.markDeleted();
            EditableRow<AlbumFields> added = inserted("First Light", 1986);
            added.setId(new TemporaryId(FIRST_LIGHT));

            when(albums.create(any())).thenReturn(new Album(AFTERGLOW, "First Light", 1986, GROUP_ID));
            when(groups.readMusicGroupAggregate(GROUP_ID))
                .thenReturn(groupWith(new Album(AFTERGLOW, "First Light", 1986, GROUP_ID)));

            List<EditableRow<AlbumFields>> result =
                reconciler.reconcile(new ArrayList<>(List.of(added, deleted)), GROUP_ID);

            InOrder order = inOrder(albums, groups);
            order.verify(albums).delete(FIRST_LIGHT);
            order.verify(albums).create(new AlbumDraft("First Light", 1986, GROUP_ID));
            order.verify(groups).readMusicGroupAggregate(GROUP_ID);
            order.verifyNoMoreInteractions();

            assertThat(result).singleElement()
                .satisfies(row -> assertThat(row.getId()).isEqualTo(new PersistedId(AFTERGLOW)));
        }
    }

    @Nested
    @DisplayName("deletes")
    class Deletes {

        @Test
        void rowInsertedAndDeletedInSameSessionNeverReachesBackend() {
            EditableRow<AlbumFields> row = inserted("Afterglow", 2001);
            row.markDeleted();
            when(groups.readMusicGroupAggregate(GROUP_ID)).thenReturn(groupWith());

            reconciler.reconcile(new ArrayList<>(List.of(row)), GROUP_ID);

            verify(albums, never()).delete(any());
            verify(albums, never()).create(any());
        }

        @Test
        void alreadyMissingRowCountsAsDeleted() {
            EditableRow<AlbumFields> row = loaded(FIRST_LIGHT, "First Light", 1986);
            row.markDeleted();
            doThrow(new NotFoundException("Album", FIRST_LIGHT)).when(albums).delete(FIRST_LIGHT);
            when(groups.readMusicGroupAggregate(GROUP_ID)).thenReturn(groupWith());

            List<EditableRow<AlbumFields>> result = reconciler.reconcile(new ArrayList<>(List.of(row)), GROUP_ID);

            assertThat(result).isEmpty();
        }

        @Test
        void backendFailureStopsBeforeInserts() {
            EditableRow<AlbumFields> row = loaded(FIRST_LIGHT, "First Light", 1986);
            row.markDeleted();
            doThrow(new PersistenceException("backend unavailable")).when(albums).delete(FIRST_LIGHT);

            assertThatThrownBy(() -> reconciler.reconcile(
                new ArrayList<>(List.of(row, inserted("Afterglow", 2001))), GROUP_ID))
                .isInstanceOf(PersistenceException.class);

            verify(albums, never()).create(any());
            verifyNoInteractions(groups);
        }
    }

    @Nested
    @DisplayName("inserts")
    class Inserts {

        @Test
        void insertedRowTakesBackendIdSoRetryDoesNotInsertAgain() {
            EditableRow<AlbumFields> added = inserted("Afterglow", 2001);
            EditableRow<AlbumFields> second = inserted("Glass", 2003);
            when(albums.create(new AlbumDraft("Afterglow", 2001, GROUP_ID)))
                .thenReturn(new Album(AFTERGLOW, "Afterglow", 2001, GROUP_ID));
            when(albums.create(new AlbumDraft("Glass", 2003, GROUP_ID)))
                .thenThrow(new PersistenceException("backend unavailable"));
            List<EditableRow<AlbumFields>> edited = new ArrayList<>(List.of(added, second));

            assertThatThrownBy(() -> reconciler.reconcile(edited, GROUP_ID))
                .isInstanceOf(PersistenceException.class);

            assertThat(added.getId()).isEqualTo(new PersistedId(AFTERGLOW));
            assertThat(added.getTag()).isEqualTo(ChangeTag.UNCHANGED);
            assertThat(second.getTag()).isEqualTo(ChangeTag.INSERTED);
        }
    }

    @Nested
    @DisplayName("updates")
    class Updates {

        @Test
        void missingModifiedRowStopsBeforeAnyUpdate() {
            EditableRow<AlbumFields> stillThere = loaded(FIRST_LIGHT, "First Light", 1986);
            stillThere.getPending().setReleaseYear(1987);
            stillThere.markModifiedIfNeeded();
            EditableRow<AlbumFields> gone = loaded(UNDERTOW, "Undertow", 1990);
            gone.getPending().setName("Undertow II");
            gone.markModifiedIfNeeded();
            when(groups.readMusicGroupAggregate(GROUP_ID))
                .thenReturn(groupWith(new Album(FIRST_LIGHT, "First Light", 1986, GROUP_ID)));

            assertThatThrownBy(() -> reconciler.reconcile(new ArrayList<>(List.of(stillThere, gone)), GROUP_ID))
                .isInstanceOfSatisfying(ConsistencyException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ChildKind.ALBUM);
                    assertThat(e.getRowId()).isEqualTo(UNDERTOW);
                });

            verify(albums, never()).update(any(), any());
        }

        @Test
        void updateKeepsStoredForeignKey() {
            UUID otherGroup = UUID.randomUUID();
            EditableRow<AlbumFields> row = loaded(UNDERTOW, "Undertow", 1990);
            row.getPending().setReleaseYear(1991);
            row.markModifiedIfNeeded();
            when(groups.readMusicGroupAggregate(GROUP_ID))
                .thenReturn(groupWith(new Album(UNDERTOW, "Undertow", 1990, otherGroup)));

            reconciler.reconcile(new ArrayList<>(List.of(row)), GROUP_ID);

            verify(albums).update(UNDERTOW, new AlbumDraft("Undertow", 1991, otherGroup));
        }
    }

    @Nested
    @DisplayName("preconditions")
    class Preconditions {

        @Test
        void wellFormedCollectionPassesCheck() {
            EditableRow<AlbumFields> deleted = inserted("Glass", 2003);
            deleted.markDeleted();

            List<EditableRow<AlbumFields>> edited = new ArrayList<>(List.of(
                loaded(FIRST_LIGHT, "First Light", 1986), inserted("Afterglow", 2001), deleted));

            assertThatCode(() -> reconciler.checkStaged(edited)).doesNotThrowAnyException();
            verifyNoInteractions(albums, groups);
        }

        @Test
        void checkRejectsUnchangedRowWithTemporaryId() {
            EditableRow<AlbumFields> row = inserted("Afterglow", 2001);
            row.setTag(ChangeTag.UNCHANGED);

            assertThatThrownBy(() -> reconciler.checkStaged(new ArrayList<>(List.of(row))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("albums[0]");
        }

        @Test
        void checkRejectsMissingCollection() {
            assertThatThrownBy(() -> reconciler.checkStaged(null))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void parentIdIsRequired() {
            assertThatThrownBy(() -> reconciler.reconcile(new ArrayList<>(), null))
                .isInstanceOf(NullPointerException.class);
        }

        @Test
        void rowThatWasNeverAddedIsRejected() {
            List<EditableRow<AlbumFields>> edited = new ArrayList<>(List.of(
                EditableRow.fromDraft(new AlbumFields("Afterglow", 2001))));

            assertThatThrownBy(() -> reconciler.reconcile(edited, GROUP_ID))
                .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(albums, groups);
        }
    }
}
