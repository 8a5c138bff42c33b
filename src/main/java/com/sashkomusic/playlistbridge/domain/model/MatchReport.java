package com.sashkomusic.playlistbridge.domain.model;

import java.util.List;
import java.util.Map;

public record MatchReport(
        Summary summary,
        Map<MatchConfidence, Integer> byConfidence,
        List<Song> unmatchedSongs,
        List<PendingSong> pendingReviewSongs
) {

    public record Summary(int total, int matched, int pendingReview, int noMatch, int skipped) {
    }

    public record PendingSong(Song song, int topMatchScore, String topMatchReason) {
    }
}
