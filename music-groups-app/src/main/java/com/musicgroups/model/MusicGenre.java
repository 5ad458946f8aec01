package com.musicgroups.model;

public enum MusicGenre {
    ROCK,
    BLUES,
    JAZZ,
    METAL,
    POP,
    FOLK,
    HIPHOP,
    ELECTRONIC
}
