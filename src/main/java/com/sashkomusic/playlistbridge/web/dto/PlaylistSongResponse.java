package com.sashkomusic.playlistbridge.web.dto;

import com.sashkomusic.playlistbridge.domain.entity.PlaylistSong;
import com.sashkomusic.playlistbridge.domain.model.Platform;

import java.time.Instant;

public record PlaylistSongResponse(
        int position,
        Platform platform,
        String songId,
        String songArtistTitle,
        Instant addedAt
) {

    public static PlaylistSongResponse from(PlaylistSong song) {
        return new PlaylistSongResponse(song.getPosition(), song.getPlatform(), song.getSongId(),
                song.getSongArtistTitle(), song.getAddedAt());
    }
}
