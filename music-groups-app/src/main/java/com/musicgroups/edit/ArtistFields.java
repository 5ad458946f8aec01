package com.musicgroups.edit;

import com.musicgroups.model.Artist;
import com.musicgroups.model.ArtistDraft;
import jakarta.validation.constraints.NotBlank;

import java.util.Objects;
import java.util.UUID;

public class ArtistFields implements ChildFields<ArtistFields> {

    @NotBlank(message = "You must provide a first name")
    private String firstName;

    @NotBlank(message = "You must provide a last name")
    private String lastName;

    public ArtistFields() {
    }

    public ArtistFields(String firstName, String lastName) {
        this.firstName = firstName;
        this.lastName = lastName;
    }

    public static ArtistFields of(Artist artist) {
        return new ArtistFields(artist.firstName(), artist.lastName());
    }

    public ArtistDraft toDraft(UUID musicGroupId) {
        return new ArtistDraft(firstName, lastName, musicGroupId);
    }

    @Override
    public ArtistFields copy() {
        return new ArtistFields(firstName, lastName);
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArtistFields other)) return false;
        return Objects.equals(firstName, other.firstName) && Objects.equals(lastName, other.lastName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(firstName, lastName);
    }

    @Override
    public String toString() {
        return "ArtistFields[firstName=" + firstName + ", lastName=" + lastName + "]";
    }
}
