package com.sashkomusic.playlistbridge.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.SongMatchResult;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportJobResponse(
        String id,
        JobStatus status,
        PlaylistFormat format,
        Platform targetPlatform,
        String originalFilename,
        String playlistName,
        String targetPlaylistId,
        int totalSongs,
        int processedSongs,
        int matchedSongs,
        int unmatchedSongs,
        int pendingReviewSongs,
        int addedSongs,
        int duplicateSongs,
        List<SongMatchResult> matchResults,
        List<String> warnings,
        String errorMessage,
        Instant startedAt,
        Instant completedAt
) {

    public static ImportJobResponse from(ImportJob job) {
        return new ImportJobResponse(
                job.getId(),
                job.getStatus(),
                job.getFormat(),
                job.getTargetPlatform(),
                job.getOriginalFilename(),
                job.getPlaylistName(),
                job.getTargetPlaylistId(),
                job.getTotalSongs(),
                job.getProcessedSongs(),
                job.getMatchedSongs(),
                job.getUnmatchedSongs(),
                job.getPendingReviewSongs(),
                job.getAddedSongs(),
                job.getDuplicateSongs(),
                job.getMatchResults(),
                job.getWarnings(),
                job.getErrorMessage(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }
}
