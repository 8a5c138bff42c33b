package com.sashkomusic.playlistbridge.domain.model;

/**
 * A download back-end's own view of one queued or finished request. {@code groupId} is set when
 * the back-end also tracks the request under a coarser key, such as the artist an album belongs to.
 */
public record BackendQueueEntry(
        DownloadService service,
        String serviceJobId,
        String groupId,
        String title,
        DownloadItemStatus status,
        Integer progress,
        String path,
        String error
) {
}
