package com.musicgroups.service;

import java.util.UUID;

/**
 * Coarse-grained, non-transactional CRUD contract for one entity kind.
 *
 * @param <D> the create/update payload, which never carries an identifier
 * @param <M> the persisted record
 */
public interface EntityService<D, M> {

    /**
     * @throws ConflictException       if the backend refuses a duplicate
     * @throws InvalidPayloadException if the backend rejects the payload
     */
    M create(D draft);

    /**
     * @throws NotFoundException if no record has this id
     */
    M read(UUID id);

    /**
     * @throws NotFoundException if the id no longer exists
     */
    M update(UUID id, D draft);

    /**
     * Succeeds even if the id is already absent.
     */
    void delete(UUID id);
}
