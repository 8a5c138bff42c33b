package com.sashkomusic.playlistbridge.web.dto;

import com.sashkomusic.playlistbridge.domain.model.DownloadPreferences;
import com.sashkomusic.playlistbridge.domain.model.DownloadRequest;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.model.Song;

import java.util.List;

/**
 * Songs to acquire. Each song may carry a video id for the fetcher and ask for its whole album.
 */
public record DownloadBatchRequest(
        List<Item> items,
        DownloadService service,
        DownloadPreferences preferences
) {

    public List<DownloadRequest> toRequests() {
        if (items == null) {
            return List.of();
        }
        return items.stream().map(Item::toRequest).toList();
    }

    public record Item(
            Song song,
            String sourceVideoId,
            Boolean albumContext,
            String format,
            String quality
    ) {

        public DownloadRequest toRequest() {
            if (song == null || song.title() == null || song.title().isBlank()) {
                throw new IllegalArgumentException("Every download item needs a song title");
            }
            boolean album = albumContext != null ? albumContext : song.hasAlbum();
            return new DownloadRequest(song, sourceVideoId, album, format, quality);
        }
    }
}
