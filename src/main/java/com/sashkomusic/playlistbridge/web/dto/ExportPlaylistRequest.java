package com.sashkomusic.playlistbridge.web.dto;

import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.RenderOptions;

public record ExportPlaylistRequest(
        PlaylistFormat format,
        Boolean includeMetadata,
        String basePath
) {

    public RenderOptions toOptions() {
        return new RenderOptions(includeMetadata == null || includeMetadata, basePath);
    }
}
