package com.musicgroups.edit;

import com.musicgroups.edit.validation.ValidationGate;
import com.musicgroups.edit.validation.ValidationResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Per-row actions of the edit form. They only change the working copy; nothing reaches
 * storage until the group is saved.
 */
@Service
public class GroupStagingService {

    private final ValidationGate validationGate;

    public GroupStagingService(ValidationGate validationGate) {
        this.validationGate = validationGate;
    }

    /**
     * Add the contents of the "new row" form as an inserted row and clear the form.
     */
    public EditOutcome stageInsertChild(MusicGroupInput input, ChildKind kind) {
        if (input.getNewAlbum() == null) {
            input.setNewAlbum(new AlbumFields());
        }
        if (input.getNewArtist() == null) {
            input.setNewArtist(new ArtistFields());
        }

        ValidationResult result = validationGate.validatePartial(input, kind.insertPaths());
        if (!result.isValid()) {
            return EditOutcome.rejected(input, result);
        }

        switch (kind) {
            case ALBUM -> input.setNewAlbum(insert(input.getAlbums(), input.getNewAlbum(), AlbumFields::new));
            case ARTIST -> input.setNewArtist(insert(input.getArtists(), input.getNewArtist(), ArtistFields::new));
        }
        return EditOutcome.accepted(input);
    }

    /**
     * Stage a row for deletion.
     *
     * @throws NoSuchElementException if no row of this kind has the id
     */
    public EditOutcome stageDeleteChild(MusicGroupInput input, ChildKind kind, UUID rowId) {
        switch (kind) {
            case ALBUM -> input.getAlbums().get(indexOf(input.getAlbums(), kind, rowId)).markDeleted();
            case ARTIST -> input.getArtists().get(indexOf(input.getArtists(), kind, rowId)).markDeleted();
        }
        return EditOutcome.accepted(input);
    }

    /**
     * Commit the pending values of a row after validating just that row.
     *
     * @throws NoSuchElementException if no row of this kind has the id
     */
    public EditOutcome stageEditChild(MusicGroupInput input, ChildKind kind, UUID rowId) {
        int index = switch (kind) {
            case ALBUM -> indexOf(input.getAlbums(), kind, rowId);
            case ARTIST -> indexOf(input.getArtists(), kind, rowId);
        };

        ValidationResult result = validationGate.validatePartial(input, kind.editPaths(index));
        if (!result.isValid()) {
            return EditOutcome.rejected(input, result);
        }

        switch (kind) {
            case ALBUM -> input.getAlbums().get(index).markModifiedIfNeeded();
            case ARTIST -> input.getArtists().get(index).markModifiedIfNeeded();
        }
        return EditOutcome.accepted(input);
    }

    private static <F extends ChildFields<F>> F insert(List<EditableRow<F>> rows, F draft, Supplier<F> blank) {
        EditableRow<F> row = EditableRow.fromDraft(draft);
        row.markInserted();
        rows.add(row);
        return blank.get();
    }

    private static int indexOf(List<? extends EditableRow<?>> rows, ChildKind kind, UUID rowId) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).hasId(rowId)) {
                return i;
            }
        }
        throw new NoSuchElementException("No row " + rowId + " among " + kind.segment());
    }
}
