package com.sashkomusic.playlistbridge.domain.model;

import java.util.List;

public record ParsedPlaylist(
        Playlist playlist,
        PlaylistFormat format,
        List<String> warnings
) {
}
