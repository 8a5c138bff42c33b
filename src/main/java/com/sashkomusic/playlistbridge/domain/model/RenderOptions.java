package com.sashkomusic.playlistbridge.domain.model;

public record RenderOptions(
        boolean includeMetadata,
        String basePath
) {

    public static RenderOptions defaults() {
        return new RenderOptions(true, null);
    }
}
