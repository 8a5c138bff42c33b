package com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LidarrPage<T>(
        int page,
        int pageSize,
        int totalRecords,
        List<T> records
) {

    public List<T> recordsOrEmpty() {
        return records == null ? List.of() : records;
    }
}
