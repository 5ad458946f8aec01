package com.musicgroups.edit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.musicgroups.model.MusicGenre;
import com.musicgroups.model.MusicGroup;
import com.musicgroups.model.MusicGroupDraft;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Working copy of a music group and its albums and artists for one edit session.
 * It travels back and forth with every round trip of the edit surface and is discarded
 * once the group is saved or the session is abandoned.
 */
public class MusicGroupInput {

    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 2024;
    public static final String YEAR_MESSAGE = "You must provide a year between 1900 and 2024";

    private ChangeTag tag = ChangeTag.UNCHANGED;

    private PersistedId groupId;

    @NotBlank(message = "You must provide a group name")
    private String name;

    @Min(value = MIN_YEAR, message = YEAR_MESSAGE)
    @Max(value = MAX_YEAR, message = YEAR_MESSAGE)
    private int establishedYear;

    // Nullable so a new group forces an explicit choice
    @NotNull(message = "You must select a music genre")
    private MusicGenre genre;

    private List<EditableRow<AlbumFields>> albums = new ArrayList<>();
    private List<EditableRow<ArtistFields>> artists = new ArrayList<>();

    private AlbumFields newAlbum = new AlbumFields();
    private ArtistFields newArtist = new ArtistFields();

    public MusicGroupInput() {
    }

    public static MusicGroupInput fromModel(MusicGroup group) {
        MusicGroupInput input = new MusicGroupInput();
        input.tag = ChangeTag.UNCHANGED;
        input.groupId = new PersistedId(group.id());
        input.name = group.name();
        input.establishedYear = group.establishedYear();
        input.genre = group.genre();
        group.albums().forEach(album ->
            input.albums.add(EditableRow.loaded(new PersistedId(album.id()), AlbumFields.of(album))));
        group.artists().forEach(artist ->
            input.artists.add(EditableRow.loaded(new PersistedId(artist.id()), ArtistFields.of(artist))));
        return input;
    }

    public static MusicGroupInput blank() {
        MusicGroupInput input = new MusicGroupInput();
        input.tag = ChangeTag.INSERTED;
        input.genre = null;
        return input;
    }

    public MusicGroupDraft toDraft() {
        return new MusicGroupDraft(name, establishedYear, genre, false);
    }

    /**
     * The group's own edited fields laid over a freshly read group. Children and the
     * seeded flag stay as stored.
     */
    public MusicGroupDraft overlayOnto(MusicGroup fresh) {
        return new MusicGroupDraft(name, establishedYear, genre, fresh.seeded());
    }

    @JsonIgnore
    public boolean isNew() {
        return tag == ChangeTag.INSERTED;
    }

    public ChangeTag getTag() { return tag; }
    public void setTag(ChangeTag tag) { this.tag = tag; }

    public PersistedId getGroupId() { return groupId; }
    public void setGroupId(PersistedId groupId) { this.groupId = groupId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getEstablishedYear() { return establishedYear; }
    public void setEstablishedYear(int establishedYear) { this.establishedYear = establishedYear; }

    public MusicGenre getGenre() { return genre; }
    public void setGenre(MusicGenre genre) { this.genre = genre; }

    public List<EditableRow<AlbumFields>> getAlbums() { return albums; }
    public void setAlbums(List<EditableRow<AlbumFields>> albums) { this.albums = albums; }

    public List<EditableRow<ArtistFields>> getArtists() { return artists; }
    public void setArtists(List<EditableRow<ArtistFields>> artists) { this.artists = artists; }

    public AlbumFields getNewAlbum() { return newAlbum; }
    public void setNewAlbum(AlbumFields newAlbum) { this.newAlbum = newAlbum; }

    public ArtistFields getNewArtist() { return newArtist; }
    public void setNewArtist(ArtistFields newArtist) { this.newArtist = newArtist; }
}
