package com.musicgroups.edit;

import java.util.UUID;

/**
 * A save stopped part way. There is no rollback: the steps before {@link #getPhase()}
 * are stored, and within the failing phase some deletes or inserts may be stored too.
 */
public class SaveIncompleteException extends RuntimeException {

    private final UUID groupId;
    private final SavePhase phase;

    public SaveIncompleteException(UUID groupId, SavePhase phase, RuntimeException cause) {
        super("Save of music group " + (groupId != null ? groupId : "(new)")
            + " stopped during " + phase + ": " + cause.getMessage(), cause);
        this.groupId = groupId;
        this.phase = phase;
    }

    /** Id of the group, or null if it was never created. */
    public UUID getGroupId() {
        return groupId;
    }

    public SavePhase getPhase() {
        return phase;
    }
}
