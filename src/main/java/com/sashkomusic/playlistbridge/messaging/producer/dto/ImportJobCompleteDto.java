package com.sashkomusic.playlistbridge.messaging.producer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;

@JsonTypeName("import_complete")
public record ImportJobCompleteDto(
        String jobId,
        String userId,
        String playlistId,
        JobStatus status,
        int totalSongs,
        int matchedSongs,
        int unmatchedSongs,
        int pendingReviewSongs,
        int addedSongs,
        int duplicateSongs,
        String errorMessage
) {

    public static ImportJobCompleteDto from(ImportJob job) {
        return new ImportJobCompleteDto(
                job.getId(),
                job.getUserId(),
                job.getTargetPlaylistId(),
                job.getStatus(),
                job.getTotalSongs(),
                job.getMatchedSongs(),
                job.getUnmatchedSongs(),
                job.getPendingReviewSongs(),
                job.getAddedSongs(),
                job.getDuplicateSongs(),
                job.getErrorMessage()
        );
    }

    /**
     * An import request that was refused before any job existed.
     */
    public static ImportJobCompleteDto rejected(String userId, String playlistId, String errorMessage) {
        return new ImportJobCompleteDto(null, userId, playlistId, JobStatus.FAILED,
                0, 0, 0, 0, 0, 0, errorMessage);
    }
}
