package com.sashkomusic.playlistbridge.domain.model;

public record ImportRequest(
        String userId,
        String content,
        PlaylistFormat format,
        String filename,
        String playlistName,
        String targetPlaylistId,
        Platform targetPlatform
) {

    public Platform targetPlatformOrDefault() {
        return targetPlatform != null ? targetPlatform : Platform.NAVIDROME;
    }
}
