package com.musicgroups.model;

import java.util.UUID;

public record Artist(
    UUID id,
    String firstName,
    String lastName,
    UUID musicGroupId
) {
}
