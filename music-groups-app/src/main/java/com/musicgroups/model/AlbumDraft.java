package com.musicgroups.model;

import java.util.UUID;

/**
 * Create/update payload for an album. The owning group is always set explicitly.
 */
public record AlbumDraft(
    String name,
    int releaseYear,
    UUID musicGroupId
) {}
