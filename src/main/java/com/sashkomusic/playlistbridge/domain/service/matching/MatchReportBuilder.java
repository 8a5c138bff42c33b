package com.sashkomusic.playlistbridge.domain.service.matching;

import com.sashkomusic.playlistbridge.domain.model.MatchCandidate;
import com.sashkomusic.playlistbridge.domain.model.MatchConfidence;
import com.sashkomusic.playlistbridge.domain.model.MatchReport;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.model.SongMatchResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
public class MatchReportBuilder {

    public MatchReport build(List<SongMatchResult> results) {
        Map<MatchConfidence, Integer> byConfidence = new EnumMap<>(MatchConfidence.class);
        for (MatchConfidence confidence : MatchConfidence.values()) {
            byConfidence.put(confidence, 0);
        }

        List<Song> unmatched = new ArrayList<>();
        List<MatchReport.PendingSong> pending = new ArrayList<>();
        int matched = 0;
        int pendingCount = 0;
        int noMatch = 0;
        int skipped = 0;

        List<SongMatchResult> processed = results.stream().filter(Objects::nonNull).toList();
        for (SongMatchResult result : processed) {
            MatchCandidate best = result.selectedCandidate().or(result::topCandidate).orElse(null);
            byConfidence.merge(best != null ? best.confidence() : MatchConfidence.NONE, 1, Integer::sum);

            switch (result.status()) {
                case MATCHED -> matched++;
                case SKIPPED -> skipped++;
                case NO_MATCH -> {
                    noMatch++;
                    unmatched.add(result.originalSong());
                }
                case PENDING_REVIEW -> {
                    pendingCount++;
                    pending.add(new MatchReport.PendingSong(result.originalSong(),
                            best != null ? best.matchScore() : 0,
                            best != null ? best.matchReason() : null));
                }
            }
        }

        MatchReport.Summary summary = new MatchReport.Summary(processed.size(), matched, pendingCount, noMatch, skipped);
        return new MatchReport(summary, byConfidence, unmatched, pending);
    }
}
