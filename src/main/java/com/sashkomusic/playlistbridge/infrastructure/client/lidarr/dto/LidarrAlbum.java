package com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LidarrAlbum(
        Long id,
        Long artistId,
        String title,
        boolean monitored
) {
}
