package com.musicgroups.service;

public class ConflictException extends PersistenceException {

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
