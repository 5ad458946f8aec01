package com.musicgroups.service;

/**
 * The backend rejected a payload, e.g. a missing required column or a child pointing at
 * a group that does not exist.
 */
public class InvalidPayloadException extends PersistenceException {

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
