package com.sashkomusic.playlistbridge.messaging.producer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.playlistbridge.domain.entity.DownloadJob;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;

@JsonTypeName("download_complete")
public record DownloadJobCompleteDto(
        String jobId,
        String userId,
        String importJobId,
        JobStatus status,
        int totalItems,
        int completedItems,
        int failedItems,
        int needsManualOrganization
) {

    public static DownloadJobCompleteDto from(DownloadJob job) {
        int manual = (int) job.getDownloadQueue().stream()
                .filter(DownloadQueueItem::needsManualOrganization)
                .count();
        return new DownloadJobCompleteDto(
                job.getId(),
                job.getUserId(),
                job.getImportJobId(),
                job.getStatus(),
                job.getTotalItems(),
                job.getCompletedItems(),
                job.getFailedItems(),
                manual
        );
    }
}
