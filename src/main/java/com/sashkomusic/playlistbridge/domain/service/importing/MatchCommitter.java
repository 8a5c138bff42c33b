package com.sashkomusic.playlistbridge.domain.service.importing;

import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.model.CommitResult;
import com.sashkomusic.playlistbridge.domain.model.MatchCandidate;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.model.SongMatchResult;
import com.sashkomusic.playlistbridge.domain.service.playlist.PlaylistStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Writes the matched songs of an import job into its target playlist, in original order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchCommitter {

    private final PlaylistStorageService playlistStorage;

    public CommitResult commit(ImportJob job) {
        List<Song> songs = job.getMatchResults().stream()
                .filter(Objects::nonNull)
                .filter(SongMatchResult::isMatched)
                .map(this::resolvedSong)
                .toList();

        log.info("Committing {} matched songs for importJobId={} into playlist {}",
                songs.size(), job.getId(), job.getTargetPlaylistId());
        return playlistStorage.appendSongs(job.getTargetPlaylistId(), songs);
    }

    private Song resolvedSong(SongMatchResult result) {
        Song original = result.originalSong();
        MatchCandidate candidate = result.selectedCandidate().orElse(null);
        if (candidate == null) {
            return original.withResolution(result.selectedMatch().platform(),
                    result.selectedMatch().platformId(), null);
        }
        return new Song(candidate.title(), candidate.artist(), candidate.album(), candidate.duration(),
                original.trackNumber(), original.isrc(), candidate.platform(), candidate.platformId(), candidate.url());
    }
}
