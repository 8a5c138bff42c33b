package com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LidarrHistoryRecord(
        Long id,
        Long artistId,
        Long albumId,
        String sourceTitle,
        String eventType,
        Map<String, String> data
) {

    public String dataValue(String key) {
        return data == null ? null : data.get(key);
    }
}
