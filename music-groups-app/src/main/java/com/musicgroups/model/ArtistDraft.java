package com.musicgroups.model;

import java.util.UUID;

public record ArtistDraft(
    String firstName,
    String lastName,
    UUID musicGroupId
) {}
