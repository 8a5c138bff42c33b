package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Platform {
    NAVIDROME("navidrome"),
    SPOTIFY("spotify"),
    YOUTUBE_MUSIC("youtube_music"),
    LOCAL("local");

    private final String value;

    Platform(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Platform fromValue(String value) {
        return Arrays.stream(values())
                .filter(platform -> platform.value.equalsIgnoreCase(value) || platform.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown platform: " + value));
    }
}
