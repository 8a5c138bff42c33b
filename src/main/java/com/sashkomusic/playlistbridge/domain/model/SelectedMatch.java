package com.sashkomusic.playlistbridge.domain.model;

public record SelectedMatch(
        Platform platform,
        String platformId
) {
}
