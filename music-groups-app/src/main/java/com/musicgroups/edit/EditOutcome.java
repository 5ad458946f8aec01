package com.musicgroups.edit;

import com.musicgroups.edit.validation.ValidationResult;

/**
 * Result of one staged edit: the working copy to re-display and the field errors, if any.
 * A rejected edit leaves the working copy exactly as it was submitted.
 */
public record EditOutcome(MusicGroupInput input, ValidationResult validation) {

    public static EditOutcome accepted(MusicGroupInput input) {
        return new EditOutcome(input, ValidationResult.valid());
    }

    public static EditOutcome rejected(MusicGroupInput input, ValidationResult validation) {
        return new EditOutcome(input, validation);
    }
}
