package com.musicgroups.edit;

import com.musicgroups.model.Album;
import com.musicgroups.model.AlbumDraft;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.Objects;
import java.util.UUID;

public class AlbumFields implements ChildFields<AlbumFields> {

    @NotBlank(message = "You must enter an album name")
    private String name;

    @Min(value = MusicGroupInput.MIN_YEAR, message = MusicGroupInput.YEAR_MESSAGE)
    @Max(value = MusicGroupInput.MAX_YEAR, message = MusicGroupInput.YEAR_MESSAGE)
    private int releaseYear;

    public AlbumFields() {
    }

    public AlbumFields(String name, int releaseYear) {
        this.name = name;
        this.releaseYear = releaseYear;
    }

    public static AlbumFields of(Album album) {
        return new AlbumFields(album.name(), album.releaseYear());
    }

    public AlbumDraft toDraft(UUID musicGroupId) {
        return new AlbumDraft(name, releaseYear, musicGroupId);
    }

    @Override
    public AlbumFields copy() {
        return new AlbumFields(name, releaseYear);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getReleaseYear() {
        return releaseYear;
    }

    public void setReleaseYear(int releaseYear) {
        this.releaseYear = releaseYear;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlbumFields other)) return false;
        return releaseYear == other.releaseYear && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, releaseYear);
    }

    @Override
    public String toString() {
        return "AlbumFields[name=" + name + ", releaseYear=" + releaseYear + "]";
    }
}
