package com.musicgroups.service;

import com.musicgroups.model.MusicGroup;
import com.musicgroups.model.MusicGroupDraft;
import com.musicgroups.model.PageResult;

import java.util.UUID;

public interface MusicGroupsService extends EntityService<MusicGroupDraft, MusicGroup> {

    /**
     * Read a group with both its albums and artists populated.
     *
     * @throws NotFoundException if the group does not exist
     */
    MusicGroup readMusicGroupAggregate(UUID id);

    /**
     * Read one page of groups without their children.
     *
     * @param seeded  only seeded (true) or only user-created (false) groups; null for all
     * @param search  case-insensitive match on name or genre; null or blank for no filter
     * @param pageNr  zero-based page number
     * @param pageSize number of groups per page
     */
    PageResult<MusicGroup> readMusicGroups(Boolean seeded, String search, int pageNr, int pageSize);
}
