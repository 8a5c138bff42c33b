package com.sashkomusic.playlistbridge.domain.model;

/**
 * One acquisition request. {@code sourceVideoId} pins the fetcher to a known video;
 * {@code albumContext} asks for the whole album or artist rather than a single track.
 */
public record DownloadRequest(
        Song song,
        String sourceVideoId,
        boolean albumContext,
        String format,
        String quality
) {

    public static DownloadRequest of(Song song) {
        return new DownloadRequest(song, null, false, null, null);
    }
}
