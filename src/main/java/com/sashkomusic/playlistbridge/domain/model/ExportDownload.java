package com.sashkomusic.playlistbridge.domain.model;

public record ExportDownload(
        String filename,
        String mimeType,
        byte[] content
) {
}
