package com.musicgroups.edit;

/**
 * Steps of a save, in order. When a save fails, every step before the failing one has
 * been applied and stays applied.
 */
public enum SavePhase {
    CREATE_GROUP,
    ALBUMS,
    ARTISTS,
    UPDATE_GROUP
}
