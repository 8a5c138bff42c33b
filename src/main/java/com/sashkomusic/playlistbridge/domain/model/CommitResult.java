package com.sashkomusic.playlistbridge.domain.model;

public record CommitResult(
        String playlistId,
        int added,
        int duplicates
) {
}
