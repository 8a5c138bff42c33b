package com.sashkomusic.playlistbridge.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sashkomusic.playlistbridge.domain.entity.ExportJob;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportJobResponse(
        String id,
        String playlistId,
        PlaylistFormat format,
        JobStatus status,
        int totalSongs,
        int processedSongs,
        int enrichedSongs,
        String filename,
        String errorMessage,
        Instant completedAt
) {

    public static ExportJobResponse from(ExportJob job) {
        return new ExportJobResponse(
                job.getId(),
                job.getPlaylistId(),
                job.getFormat(),
                job.getStatus(),
                job.getTotalSongs(),
                job.getProcessedSongs(),
                job.getEnrichedSongs(),
                job.getFilename(),
                job.getErrorMessage(),
                job.getCompletedAt()
        );
    }
}
