package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.sashkomusic.playlistbridge.domain.exception.InvalidReviewException;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of matching one playlist entry. {@code matches} is ordered by descending score.
 * Only {@link MatchStatus#PENDING_REVIEW} results may be changed by a reviewer.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SongMatchResult(
        Song originalSong,
        List<MatchCandidate> matches,
        SelectedMatch selectedMatch,
        MatchStatus status,
        List<String> adapterErrors
) {

    public SongMatchResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
        adapterErrors = adapterErrors == null ? List.of() : List.copyOf(adapterErrors);
    }

    public static SongMatchResult noMatch(Song song, List<String> adapterErrors) {
        return new SongMatchResult(song, List.of(), null, MatchStatus.NO_MATCH, adapterErrors);
    }

    public SongMatchResult select(SelectedMatch selection) {
        boolean known = matches.stream().anyMatch(candidate -> candidate.isSameAs(selection));
        if (!known) {
            throw new InvalidReviewException("Selected match " + selection.platform().getValue() + ":"
                    + selection.platformId() + " is not a candidate for '" + originalSong.displayName() + "'");
        }
        return new SongMatchResult(originalSong, matches, selection, MatchStatus.MATCHED, adapterErrors);
    }

    public SongMatchResult skip() {
        return new SongMatchResult(originalSong, matches, null, MatchStatus.SKIPPED, adapterErrors);
    }

    @JsonIgnore
    public Optional<MatchCandidate> topCandidate() {
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    @JsonIgnore
    public Optional<MatchCandidate> selectedCandidate() {
        if (selectedMatch == null) {
            return Optional.empty();
        }
        return matches.stream().filter(candidate -> candidate.isSameAs(selectedMatch)).findFirst();
    }

    @JsonIgnore
    public boolean isMatched() {
        return status == MatchStatus.MATCHED && selectedMatch != null;
    }
}
