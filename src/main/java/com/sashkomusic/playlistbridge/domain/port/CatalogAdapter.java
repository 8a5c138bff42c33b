package com.sashkomusic.playlistbridge.domain.port;

import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Song;

import java.util.List;

/**
 * Read-only search contract shared by the local media server and remote streaming platforms.
 * Returned songs are resolved: {@code platform}, {@code platformId} and, where known, {@code url} are set.
 * Implementations throw {@link com.sashkomusic.playlistbridge.domain.exception.CatalogException} on failure.
 */
public interface CatalogAdapter {

    Platform platform();

    List<Song> search(String query, int start, int limit);

    List<Song> searchByIsrc(String isrc);

    List<Song> getByIds(List<String> ids);
}
