package com.sashkomusic.playlistbridge.domain.service.matching;

import com.sashkomusic.playlistbridge.config.PlaylistTransferConfig;
import com.sashkomusic.playlistbridge.domain.model.MatchCandidate;
import com.sashkomusic.playlistbridge.domain.model.MatchStatus;
import com.sashkomusic.playlistbridge.domain.model.SelectedMatch;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.model.SongMatchResult;
import com.sashkomusic.playlistbridge.domain.port.CatalogAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Resolves one playlist entry against a set of catalogs.
 * <p>
 * ISRC lookup runs first; text search is only tried when no catalog knows the ISRC.
 * Catalogs are queried in parallel and a failing catalog only contributes an error message.
 * The song ends as {@link MatchStatus#NO_MATCH} when every catalog failed.
 */
@Slf4j
@Service
public class SongMatcher {

    private final MatchScorer scorer;
    private final PlaylistTransferConfig.Matching config;
    private final Executor executor;

    public SongMatcher(MatchScorer scorer,
                       PlaylistTransferConfig transferConfig,
                       @Qualifier("matchingExecutor") Executor executor) {
        this.scorer = scorer;
        this.config = transferConfig.getMatching();
        this.executor = executor;
    }

    public SongMatchResult match(Song song, List<CatalogAdapter> adapters) {
        return attempt(song, adapters).result();
    }

    /**
     * Like {@link #match} but also reports whether no catalog could be reached at all.
     */
    public MatchAttempt attempt(Song song, List<CatalogAdapter> adapters) {
        if (adapters.isEmpty()) {
            return new MatchAttempt(SongMatchResult.noMatch(song, List.of("no catalog adapters configured")), true);
        }

        List<String> errors = new ArrayList<>();
        boolean anyAdapterAnswered = false;

        if (song.hasIsrc()) {
            SearchRound isrcRound = searchAll(adapters, adapter -> adapter.searchByIsrc(song.isrc()));
            errors.addAll(isrcRound.errors());
            anyAdapterAnswered = isrcRound.answered() > 0;

            List<MatchCandidate> candidates = isrcRound.hits().stream()
                    .filter(hit -> hit.platformId() != null)
                    .map(scorer::isrcCandidate)
                    .limit(config.getMaxCandidates())
                    .toList();
            if (!candidates.isEmpty()) {
                MatchCandidate top = candidates.get(0);
                log.debug("ISRC {} resolved '{}' to {}:{}", song.isrc(), song.displayName(), top.platform(), top.platformId());
                return new MatchAttempt(new SongMatchResult(song, candidates,
                        new SelectedMatch(top.platform(), top.platformId()), MatchStatus.MATCHED, errors), false);
            }
        }

        String query = song.artist() + " " + song.title();
        SearchRound textRound = searchAll(adapters, adapter -> adapter.search(query, 0, config.getSearchLimit()));
        errors.addAll(textRound.errors());
        anyAdapterAnswered = anyAdapterAnswered || textRound.answered() > 0;

        if (!anyAdapterAnswered) {
            log.warn("All catalogs failed for '{}': {}", song.displayName(), errors);
            return new MatchAttempt(SongMatchResult.noMatch(song, errors), true);
        }

        List<MatchCandidate> candidates = textRound.hits().stream()
                .filter(hit -> hit.platformId() != null)
                .map(hit -> scorer.toCandidate(song, hit))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingInt(MatchCandidate::matchScore).reversed())
                .limit(config.getMaxCandidates())
                .toList();

        return new MatchAttempt(classify(song, candidates, errors), false);
    }

    /**
     * Auto-accepts the top candidate when it is exact or high and leads the runner-up
     * by at least the configured gap.
     */
    SongMatchResult classify(Song song, List<MatchCandidate> candidates, List<String> errors) {
        if (candidates.isEmpty()) {
            return SongMatchResult.noMatch(song, errors);
        }
        MatchCandidate top = candidates.get(0);
        boolean unambiguous = candidates.size() == 1
                || top.matchScore() - candidates.get(1).matchScore() >= config.getAmbiguityGap();

        if (top.confidence().isAutoAcceptable() && unambiguous) {
            return new SongMatchResult(song, candidates, new SelectedMatch(top.platform(), top.platformId()),
                    MatchStatus.MATCHED, errors);
        }
        return new SongMatchResult(song, candidates, null, MatchStatus.PENDING_REVIEW, errors);
    }

    private SearchRound searchAll(List<CatalogAdapter> adapters, Function<CatalogAdapter, List<Song>> search) {
        Duration timeout = config.getSearchTimeout();
        List<CompletableFuture<List<Song>>> futures = adapters.stream()
                .map(adapter -> CompletableFuture.supplyAsync(() -> search.apply(adapter), executor)
                        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS))
                .toList();

        List<Song> hits = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int answered = 0;
        for (int i = 0; i < adapters.size(); i++) {
            CatalogAdapter adapter = adapters.get(i);
            try {
                List<Song> result = futures.get(i).join();
                if (result != null) {
                    hits.addAll(result);
                }
                answered++;
            } catch (CompletionException e) {
                String message = describe(e.getCause() != null ? e.getCause() : e, timeout);
                log.warn("Catalog {} search failed: {}", adapter.platform().getValue(), message);
                log.debug("Catalog search error details", e);
                errors.add(adapter.platform().getValue() + ": " + message);
            }
        }
        return new SearchRound(hits, errors, answered);
    }

    private static String describe(Throwable error, Duration timeout) {
        if (error instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + "ms";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    public record MatchAttempt(SongMatchResult result, boolean catalogsUnavailable) {
    }

    private record SearchRound(List<Song> hits, List<String> errors, int answered) {
    }
}
