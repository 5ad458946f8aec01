package com.musicgroups.service;

import com.musicgroups.model.Artist;
import com.musicgroups.model.ArtistDraft;

public interface ArtistsService extends EntityService<ArtistDraft, Artist> {
}
