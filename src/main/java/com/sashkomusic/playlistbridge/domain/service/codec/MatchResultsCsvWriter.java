package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.model.MatchCandidate;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.model.SongMatchResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Flat CSV of an import job's match results, one row per playlist entry.
 */
@Component
public class MatchResultsCsvWriter {

    private static final String[] HEADER = {
            "Position", "Original Title", "Original Artist", "Original Album", "Status",
            "Match Platform", "Match Title", "Match Artist", "Confidence", "Score", "Reason"
    };

    public String write(List<SongMatchResult> results) {
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(HEADER).build())) {
            int position = 1;
            for (SongMatchResult result : results) {
                if (result == null) {
                    position++;
                    continue;
                }
                Song song = result.originalSong();
                MatchCandidate match = result.selectedCandidate().or(result::topCandidate).orElse(null);
                printer.printRecord(
                        position++,
                        song.title(),
                        song.artist(),
                        song.album(),
                        result.status().name().toLowerCase(),
                        match != null ? match.platform().getValue() : null,
                        match != null ? match.title() : null,
                        match != null ? match.artist() : null,
                        match != null ? match.confidence().name().toLowerCase() : null,
                        match != null ? match.matchScore() : null,
                        match != null ? match.matchReason() : null);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render match results CSV", e);
        }
        return out.toString();
    }
}
