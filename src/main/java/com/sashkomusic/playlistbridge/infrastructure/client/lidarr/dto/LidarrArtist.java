package com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Artist from {@code /api/v1/artist/lookup} or {@code /api/v1/artist}. Lookup results that are
 * not in the library yet have no {@code id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LidarrArtist(
        Long id,
        String foreignArtistId,
        String artistName
) {
}
