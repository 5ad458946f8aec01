package com.musicgroups.service;

import com.musicgroups.model.Album;
import com.musicgroups.model.AlbumDraft;

public interface AlbumsService extends EntityService<AlbumDraft, Album> {
}
