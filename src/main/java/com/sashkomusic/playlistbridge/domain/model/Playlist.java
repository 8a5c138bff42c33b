package com.sashkomusic.playlistbridge.domain.model;

import java.time.Instant;
import java.util.List;

public record Playlist(
        String name,
        String description,
        String creator,
        Platform platform,
        Instant createdAt,
        List<Song> songs
) {

    public static final String DEFAULT_NAME = "Imported Playlist";

    public Playlist {
        songs = songs == null ? List.of() : List.copyOf(songs);
    }

    public Playlist withName(String newName) {
        return new Playlist(newName, description, creator, platform, createdAt, songs);
    }
}
