package com.musicgroups.model;

import java.util.UUID;

public record Album(
    UUID id,
    String name,
    int releaseYear,
    UUID musicGroupId
) {}
