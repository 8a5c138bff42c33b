package com.sashkomusic.playlistbridge.web.dto;

import com.sashkomusic.playlistbridge.domain.entity.UserPlaylist;

import java.time.Instant;

public record PlaylistResponse(
        String id,
        String name,
        String description,
        int songCount,
        Instant createdAt,
        Instant updatedAt
) {

    public static PlaylistResponse from(UserPlaylist playlist) {
        return new PlaylistResponse(playlist.getId(), playlist.getName(), playlist.getDescription(),
                playlist.getSongCount(), playlist.getCreatedAt(), playlist.getUpdatedAt());
    }
}
