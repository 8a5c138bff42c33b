package com.sashkomusic.playlistbridge.domain.model;

public record DownloadPreferences(
        DownloadService defaultService,
        boolean preferCatalogForAlbums,
        boolean preferFetcherForSingles,
        String fetcherFormat,
        String fetcherQuality
) {
}
