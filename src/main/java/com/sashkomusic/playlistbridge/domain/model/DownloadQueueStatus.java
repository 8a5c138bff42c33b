package com.sashkomusic.playlistbridge.domain.model;

import java.util.List;
import java.util.Map;

public record DownloadQueueStatus(
        List<BackendQueueEntry> catalogManagerQueue,
        List<BackendQueueEntry> catalogManagerHistory,
        List<BackendQueueEntry> fetcherQueue,
        List<BackendQueueEntry> fetcherDone,
        Map<DownloadService, String> unavailable
) {
}
