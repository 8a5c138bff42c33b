package com.sashkomusic.playlistbridge.domain.model;

import java.util.List;
import java.util.Map;

public record DownloadReport(
        Summary summary,
        Map<DownloadService, ServiceCounts> byService,
        List<DownloadQueueItem> failedItems,
        List<DownloadQueueItem> pendingOrganization
) {

    public record Summary(int total, int queued, int downloading, int completed, int failed) {
    }

    public record ServiceCounts(int queued, int downloading, int completed, int failed) {
    }
}
