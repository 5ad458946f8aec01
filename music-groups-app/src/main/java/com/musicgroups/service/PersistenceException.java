package com.musicgroups.service;

/**
 * Base class for failures reported by the persistence services. Used as-is when the
 * backend itself is unavailable.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
