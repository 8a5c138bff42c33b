package com.sashkomusic.playlistbridge.domain.service.matching;

import com.sashkomusic.playlistbridge.domain.model.MatchCandidate;
import com.sashkomusic.playlistbridge.domain.model.MatchConfidence;
import com.sashkomusic.playlistbridge.domain.model.Song;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scores a catalog hit against a playlist entry on a 0-100 scale.
 * Weights: title 0.5, artist 0.35, album 0.1 (only when both sides have one) and
 * duration 0.05 (full within 3 seconds, linearly down to nothing at 15 seconds).
 */
@Component
public class MatchScorer {

    static final double TITLE_WEIGHT = 0.5;
    static final double ARTIST_WEIGHT = 0.35;
    static final double ALBUM_WEIGHT = 0.1;
    static final double DURATION_WEIGHT = 0.05;

    static final int DURATION_FULL_BONUS_SECONDS = 3;
    static final int DURATION_NO_BONUS_SECONDS = 15;

    public static final String ISRC_REASON = "ISRC code match";

    public int score(Song source, Song hit) {
        return (int) Math.round(weightedScore(source, hit));
    }

    /**
     * Scores the hit and turns it into a candidate, or empty when it falls below the lowest tier.
     */
    public Optional<MatchCandidate> toCandidate(Song source, Song hit) {
        int score = score(source, hit);
        MatchConfidence confidence = MatchConfidence.fromScore(score);
        if (confidence == null) {
            return Optional.empty();
        }
        return Optional.of(candidate(hit, confidence, score, reason(source, hit)));
    }

    public MatchCandidate isrcCandidate(Song hit) {
        return candidate(hit, MatchConfidence.EXACT, 100, ISRC_REASON);
    }

    private double weightedScore(Song source, Song hit) {
        double total = TITLE_WEIGHT * titleSimilarity(source, hit)
                + ARTIST_WEIGHT * artistSimilarity(source, hit);
        if (source.hasAlbum() && hit.hasAlbum()) {
            total += ALBUM_WEIGHT * albumSimilarity(source, hit);
        }
        total += DURATION_WEIGHT * durationBonus(source.duration(), hit.duration());
        return total * 100;
    }

    static double durationBonus(Integer sourceDuration, Integer hitDuration) {
        if (sourceDuration == null || hitDuration == null || sourceDuration <= 0 || hitDuration <= 0) {
            return 0;
        }
        int diff = Math.abs(sourceDuration - hitDuration);
        if (diff <= DURATION_FULL_BONUS_SECONDS) {
            return 1;
        }
        if (diff >= DURATION_NO_BONUS_SECONDS) {
            return 0;
        }
        return (double) (DURATION_NO_BONUS_SECONDS - diff) / (DURATION_NO_BONUS_SECONDS - DURATION_FULL_BONUS_SECONDS);
    }

    private String reason(Song source, Song hit) {
        List<String> reasons = new ArrayList<>();
        double title = titleSimilarity(source, hit);
        if (title > 0.9) {
            reasons.add("Title matches closely");
        } else if (title > 0.7) {
            reasons.add("Title similar");
        }
        double artist = artistSimilarity(source, hit);
        if (artist > 0.9) {
            reasons.add("Artist matches closely");
        } else if (artist > 0.7) {
            reasons.add("Artist similar");
        }
        if (source.hasAlbum() && hit.hasAlbum() && albumSimilarity(source, hit) > 0.8) {
            reasons.add("Album matches");
        }
        double duration = durationBonus(source.duration(), hit.duration());
        if (duration == 1) {
            reasons.add("Duration matches");
        } else if (duration > 0) {
            reasons.add("Duration close");
        }
        return reasons.isEmpty() ? "Partial match" : String.join(", ", reasons);
    }

    private static double titleSimilarity(Song source, Song hit) {
        return TextNormalizer.similarity(TextNormalizer.normalizeTitle(source.title()),
                TextNormalizer.normalizeTitle(hit.title()));
    }

    private static double artistSimilarity(Song source, Song hit) {
        return TextNormalizer.similarity(TextNormalizer.normalizeArtist(source.artist()),
                TextNormalizer.normalizeArtist(hit.artist()));
    }

    private static double albumSimilarity(Song source, Song hit) {
        return TextNormalizer.similarity(TextNormalizer.normalize(source.album()), TextNormalizer.normalize(hit.album()));
    }

    private static MatchCandidate candidate(Song hit, MatchConfidence confidence, int score, String reason) {
        return new MatchCandidate(hit.platform(), hit.platformId(), hit.title(), hit.artist(), hit.album(),
                hit.duration(), hit.url(), confidence, score, reason);
    }
}
