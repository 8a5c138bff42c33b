package com.sashkomusic.playlistbridge.domain.service.matching;

import com.sashkomusic.playlistbridge.domain.model.MatchCandidate;
import com.sashkomusic.playlistbridge.domain.model.MatchConfidence;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Song;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class MatchScorerTest {

    private MatchScorer scorer;

    @BeforeEach
    public void setup() {
        scorer = new MatchScorer();
    }

    @Test
    public void testScore_TitleAndArtistOnly() {
        Song source = Song.of("Teardrop", "Massive Attack");
        Song hit = hit("Teardrop", "Massive Attack", null, null);

        assertThat(scorer.score(source, hit)).isEqualTo(85);
    }

    @Test
    public void testScore_AllFieldsAgree() {
        Song source = new Song("Teardrop", "Massive Attack", "Mezzanine", 330, null, null, null, null, null);
        Song hit = hit("Teardrop", "Massive Attack", "Mezzanine", 332);

        assertThat(scorer.score(source, hit)).isEqualTo(100);
    }

    @Test
    public void testScore_AlbumOnlyCountsWhenBothSidesHaveOne() {
        Song source = new Song("Teardrop", "Massive Attack", null, 330, null, null, null, null, null);
        Song hit = hit("Teardrop", "Massive Attack", "Some Other Album", 330);

        assertThat(scorer.score(source, hit)).isEqualTo(90);
    }

    @Test
    public void testDurationBonus() {
        assertThat(MatchScorer.durationBonus(200, 203)).isEqualTo(1.0);
        assertThat(MatchScorer.durationBonus(200, 209)).isCloseTo(0.5, within(1e-9));
        assertThat(MatchScorer.durationBonus(200, 215)).isEqualTo(0.0);
        assertThat(MatchScorer.durationBonus(null, 215)).isEqualTo(0.0);
        assertThat(MatchScorer.durationBonus(0, 0)).isEqualTo(0.0);
    }

    @Test
    public void testToCandidate_ReasonAndTier() {
        Song source = new Song("Teardrop", "Massive Attack", null, 330, null, null, null, null, null);

        MatchCandidate candidate = scorer.toCandidate(source, hit("Teardrop (Remastered)", "Massive Attack", null, 331)).orElseThrow();

        assertThat(candidate.matchScore()).isEqualTo(90);
        assertThat(candidate.confidence()).isEqualTo(MatchConfidence.EXACT);
        assertThat(candidate.matchReason()).isEqualTo("Title matches closely, Artist matches closely, Duration matches");
        assertThat(candidate.platform()).isEqualTo(Platform.NAVIDROME);
        assertThat(candidate.platformId()).isEqualTo("nd-1");
    }

    @Test
    public void testToCandidate_BelowLowestTierIsDropped() {
        Optional<MatchCandidate> candidate = scorer.toCandidate(Song.of("Teardrop", "Massive Attack"),
                hit("Paranoid Android", "Radiohead", null, null));

        assertThat(candidate).isEmpty();
    }

    @Test
    public void testIsrcCandidate() {
        MatchCandidate candidate = scorer.isrcCandidate(hit("Whatever", "Anyone", null, null));

        assertThat(candidate.matchScore()).isEqualTo(100);
        assertThat(candidate.confidence()).isEqualTo(MatchConfidence.EXACT);
        assertThat(candidate.matchReason()).isEqualTo(MatchScorer.ISRC_REASON);
    }

    @Test
    public void testConfidenceTiers() {
        assertThat(MatchConfidence.fromScore(90)).isEqualTo(MatchConfidence.EXACT);
        assertThat(MatchConfidence.fromScore(89)).isEqualTo(MatchConfidence.HIGH);
        assertThat(MatchConfidence.fromScore(70)).isEqualTo(MatchConfidence.HIGH);
        assertThat(MatchConfidence.fromScore(69)).isEqualTo(MatchConfidence.LOW);
        assertThat(MatchConfidence.fromScore(40)).isEqualTo(MatchConfidence.LOW);
        assertThat(MatchConfidence.fromScore(39)).isNull();
    }

    private static Song hit(String title, String artist, String album, Integer duration) {
        return new Song(title, artist, album, duration, null, null, Platform.NAVIDROME, "nd-1", null);
    }
}
