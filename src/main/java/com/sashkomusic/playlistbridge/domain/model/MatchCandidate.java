package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchCandidate(
        Platform platform,
        String platformId,
        String title,
        String artist,
        String album,
        Integer duration,
        String url,
        MatchConfidence confidence,
        int matchScore,
        String matchReason
) {

    public boolean isSameAs(SelectedMatch selection) {
        return selection != null
                && platform == selection.platform()
                && platformId != null
                && platformId.equals(selection.platformId());
    }
}
