package com.sashkomusic.playlistbridge.infrastructure.client.navidrome;

import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.port.CatalogAdapter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class NavidromeCatalogAdapter implements CatalogAdapter {

    static final String STREAM_PATH = "/api/navidrome/stream/";

    private final NavidromeClient client;

    @Override
    public Platform platform() {
        return Platform.NAVIDROME;
    }

    @Override
    public List<Song> search(String query, int start, int limit) {
        return client.searchSongs(query, start, limit).stream()
                .map(NavidromeCatalogAdapter::toSong)
                .toList();
    }

    /**
     * The native API has no ISRC lookup.
     */
    @Override
    public List<Song> searchByIsrc(String isrc) {
        return List.of();
    }

    @Override
    public List<Song> getByIds(List<String> ids) {
        List<Song> songs = new ArrayList<>();
        for (String id : ids) {
            client.getSong(id).map(NavidromeCatalogAdapter::toSong).ifPresent(songs::add);
        }
        return songs;
    }

    static Song toSong(NavidromeSong song) {
        String title = song.displayTitle() != null ? song.displayTitle() : Song.UNKNOWN_TITLE;
        String artist = song.artist() != null ? song.artist() : Song.UNKNOWN_ARTIST;
        Integer duration = song.duration() != null ? (int) Math.round(song.duration()) : null;
        return new Song(title, artist, song.album(), duration, song.track(), null,
                Platform.NAVIDROME, song.id(), STREAM_PATH + song.id());
    }
}
