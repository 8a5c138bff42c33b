package com.sashkomusic.playlistbridge.infrastructure.client.navidrome;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Song as returned by the Navidrome native {@code /api/song} endpoints. Search responses
 * fill {@code title}, older responses only {@code name}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NavidromeSong(
        String id,
        String title,
        String name,
        String artist,
        String album,
        String albumId,
        Double duration,
        Integer trackNumber,
        Integer track,
        String path
) {

    public String displayTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return name;
    }

    public Integer track() {
        return trackNumber != null ? trackNumber : track;
    }
}
