package com.sashkomusic.playlistbridge.infrastructure.client.spotify;

import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.port.CatalogAdapter;
import com.sashkomusic.playlistbridge.domain.port.UserCatalogAdapterFactory;
import com.sashkomusic.playlistbridge.infrastructure.client.spotify.dto.SpotifyTrack;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class SpotifyCatalogAdapterFactory implements UserCatalogAdapterFactory {

    private final SpotifyClient client;

    @Override
    public Platform platform() {
        return Platform.SPOTIFY;
    }

    @Override
    public CatalogAdapter forUser(String userId) {
        return new SpotifyCatalogAdapter(userId);
    }

    static Song toSong(SpotifyTrack track) {
        String artist = track.artists() == null || track.artists().isEmpty()
                ? Song.UNKNOWN_ARTIST
                : track.artists().stream().map(SpotifyTrack.Artist::name).collect(Collectors.joining(", "));
        String album = track.album() != null ? track.album().name() : null;
        Integer duration = track.durationMs() != null ? track.durationMs() / 1000 : null;
        String isrc = track.externalIds() != null ? track.externalIds().get("isrc") : null;
        String url = track.externalUrls() != null ? track.externalUrls().get("spotify") : null;
        return new Song(track.name(), artist, album, duration, track.trackNumber(), isrc,
                Platform.SPOTIFY, track.id(), url);
    }

    private class SpotifyCatalogAdapter implements CatalogAdapter {

        private final String userId;

        SpotifyCatalogAdapter(String userId) {
            this.userId = userId;
        }

        @Override
        public Platform platform() {
            return Platform.SPOTIFY;
        }

        @Override
        public List<Song> search(String query, int start, int limit) {
            return client.searchTracks(userId, query, start, limit).stream()
                    .map(SpotifyCatalogAdapterFactory::toSong)
                    .toList();
        }

        @Override
        public List<Song> searchByIsrc(String isrc) {
            return client.searchByIsrc(userId, isrc).stream()
                    .map(SpotifyCatalogAdapterFactory::toSong)
                    .toList();
        }

        @Override
        public List<Song> getByIds(List<String> ids) {
            return client.getTracks(userId, ids).stream()
                    .map(SpotifyCatalogAdapterFactory::toSong)
                    .toList();
        }
    }
}
