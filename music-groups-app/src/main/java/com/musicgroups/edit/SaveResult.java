package com.musicgroups.edit;

import com.musicgroups.edit.validation.ValidationResult;
import com.musicgroups.model.MusicGroup;

import java.util.UUID;

public sealed interface SaveResult permits SaveResult.Saved, SaveResult.Invalid {

    /**
     * The group as stored after the save. {@code created} tells an insert cycle from an
     * edit cycle.
     */
    record Saved(UUID groupId, boolean created, MusicGroup group) implements SaveResult {}

    /**
     * The group's own fields failed validation; nothing was written.
     */
    record Invalid(ValidationResult validation) implements SaveResult {}
}
