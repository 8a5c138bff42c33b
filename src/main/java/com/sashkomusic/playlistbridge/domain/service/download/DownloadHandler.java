package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;
import com.sashkomusic.playlistbridge.domain.model.DownloadPreferences;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.DownloadRequest;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;

import java.util.List;

/**
 * Submits download requests to one back-end and reads its state back.
 */
public interface DownloadHandler {

    DownloadService service();

    int maxBatchSize();

    boolean isAvailable();

    /**
     * Submits one request. Implementations return a failed item for terminal failures
     * they can explain and let back-end exceptions propagate.
     */
    DownloadQueueItem submit(String itemId, DownloadRequest request, DownloadPreferences preferences);

    boolean cancel(String serviceJobId);

    List<BackendQueueEntry> activeEntries();

    List<BackendQueueEntry> finishedEntries();
}
