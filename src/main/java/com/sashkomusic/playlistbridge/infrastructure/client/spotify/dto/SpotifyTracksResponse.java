package com.sashkomusic.playlistbridge.infrastructure.client.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response of {@code GET /tracks?ids=...}; unknown ids come back as {@code null} entries.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyTracksResponse(List<SpotifyTrack> tracks) {
}
