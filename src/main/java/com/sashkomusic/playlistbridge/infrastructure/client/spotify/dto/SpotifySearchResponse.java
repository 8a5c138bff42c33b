package com.sashkomusic.playlistbridge.infrastructure.client.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifySearchResponse(Tracks tracks) {

    public List<SpotifyTrack> items() {
        return tracks == null || tracks.items() == null ? List.of() : tracks.items();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Tracks(List<SpotifyTrack> items, int total) {
    }
}
