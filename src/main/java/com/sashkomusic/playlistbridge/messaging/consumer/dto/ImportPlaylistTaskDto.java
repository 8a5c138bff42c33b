package com.sashkomusic.playlistbridge.messaging.consumer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.playlistbridge.domain.model.ImportRequest;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;

@JsonTypeName("import_playlist")
public record ImportPlaylistTaskDto(
        String userId,
        String content,
        String format,
        String filename,
        String playlistName,
        String targetPlaylistId,
        String targetPlatform
) {

    public ImportRequest toRequest() {
        return new ImportRequest(
                userId,
                content,
                format != null ? PlaylistFormat.fromValue(format) : null,
                filename,
                playlistName,
                targetPlaylistId,
                targetPlatform != null ? Platform.fromValue(targetPlatform) : null
        );
    }
}
