package com.musicgroups.service;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import java.util.function.Supplier;

/**
 * Runs one backend call and turns Spring's {@link DataAccessException}s into the
 * persistence exceptions the edit engine understands.
 */
final class DataAccessTranslator {

    private DataAccessTranslator() {
    }

    static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DuplicateKeyException e) {
            throw new ConflictException(operation + " conflicts with an existing record", e);
        } catch (DataIntegrityViolationException e) {
            throw new InvalidPayloadException(operation + " was rejected: " + e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException e) {
            throw new PersistenceException(operation + " failed, backend unavailable", e);
        }
    }
}
