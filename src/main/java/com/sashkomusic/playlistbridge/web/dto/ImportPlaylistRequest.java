package com.sashkomusic.playlistbridge.web.dto;

import com.sashkomusic.playlistbridge.domain.model.ImportRequest;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;

public record ImportPlaylistRequest(
        String content,
        PlaylistFormat format,
        String filename,
        String playlistName,
        String targetPlaylistId,
        Platform targetPlatform
) {

    public ImportRequest toRequest(String userId) {
        return new ImportRequest(userId, content, format, filename, playlistName, targetPlaylistId, targetPlatform);
    }
}
