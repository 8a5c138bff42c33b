package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MatchConfidence {
    @JsonProperty("exact") EXACT,
    @JsonProperty("high") HIGH,
    @JsonProperty("low") LOW,
    @JsonProperty("none") NONE;

    /**
     * Buckets a 0-100 score. Scores below the low threshold have no tier and
     * yield {@code null}; such candidates are dropped by the matcher.
     */
    public static MatchConfidence fromScore(int score) {
        if (score >= 90) {
            return EXACT;
        }
        if (score >= 70) {
            return HIGH;
        }
        if (score >= 40) {
            return LOW;
        }
        return null;
    }

    public boolean isAutoAcceptable() {
        return this == EXACT || this == HIGH;
    }
}
