package com.musicgroups.edit.validation;

public record FieldError(String path, String message) {}
