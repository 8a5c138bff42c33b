package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum PlaylistFormat {
    M3U("m3u", ".m3u8", "audio/x-mpegurl"),
    XSPF("xspf", ".xspf", "application/xspf+xml"),
    JSON("json", ".json", "application/json"),
    CSV("csv", ".csv", "text/csv");

    private final String value;
    private final String fileExtension;
    private final String mimeType;

    PlaylistFormat(String value, String fileExtension, String mimeType) {
        this.value = value;
        this.fileExtension = fileExtension;
        this.mimeType = mimeType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public String getMimeType() {
        return mimeType;
    }

    @JsonCreator
    public static PlaylistFormat fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown playlist format: " + value));
    }

    public static Optional<PlaylistFormat> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(format -> format.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
