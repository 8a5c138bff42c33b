package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Acquisition back-ends. The catalog manager (Lidarr) monitors whole artists and
 * albums; the single-track fetcher (MeTube) pulls one track at a time.
 */
public enum DownloadService {
    CATALOG_MANAGER("catalog-manager"),
    SINGLE_TRACK_FETCHER("single-track-fetcher");

    private final String value;

    DownloadService(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DownloadService fromValue(String value) {
        return Arrays.stream(values())
                .filter(service -> service.value.equalsIgnoreCase(value) || service.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown download service: " + value));
    }
}
