package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MatchStatus {
    @JsonProperty("matched") MATCHED,
    @JsonProperty("pending_review") PENDING_REVIEW,
    @JsonProperty("no_match") NO_MATCH,
    @JsonProperty("skipped") SKIPPED
}
