package com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LidarrQueueRecord(
        Long id,
        Long artistId,
        Long albumId,
        String title,
        String status,
        String trackedDownloadState,
        Double size,
        Double sizeleft,
        String errorMessage,
        String outputPath
) {

    public Integer progress() {
        if (size == null || size <= 0 || sizeleft == null) {
            return null;
        }
        return (int) Math.round((size - sizeleft) / size * 100);
    }
}
