package com.sashkomusic.playlistbridge.infrastructure.client.metube;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MetubeDownload(
        String id,
        String title,
        String url,
        String status,
        String msg,
        Double percent,
        String filename,
        String folder
) {
}
