package com.musicgroups.edit.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ValidationResult(List<FieldError> errors) {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ValidationResult valid() {
        return VALID;
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> messagesFor(FieldPath path) {
        String key = path.toString();
        return errors.stream()
            .filter(error -> error.path().equals(key))
            .map(FieldError::message)
            .toList();
    }
}
