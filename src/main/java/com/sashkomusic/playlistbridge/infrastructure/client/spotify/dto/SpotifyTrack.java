package com.sashkomusic.playlistbridge.infrastructure.client.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyTrack(
        String id,
        String name,
        List<Artist> artists,
        Album album,
        @JsonProperty("duration_ms") Integer durationMs,
        @JsonProperty("track_number") Integer trackNumber,
        @JsonProperty("external_ids") Map<String, String> externalIds,
        @JsonProperty("external_urls") Map<String, String> externalUrls
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Artist(String id, String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Album(String id, String name) {
    }
}
