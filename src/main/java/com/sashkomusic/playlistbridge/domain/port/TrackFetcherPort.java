package com.sashkomusic.playlistbridge.domain.port;

import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;

import java.util.List;

/**
 * Back-end that fetches single tracks from a video platform into a download folder
 * outside the managed library.
 */
public interface TrackFetcherPort {

    /**
     * @return the back-end's identifier for the queued fetch
     */
    String enqueue(FetchRequest request);

    boolean cancel(String serviceJobId);

    List<BackendQueueEntry> getQueue();

    List<BackendQueueEntry> getDone();

    boolean isAvailable();

    int maxBatchSize();

    /**
     * @param source a video URL or a search expression understood by the fetcher
     */
    record FetchRequest(
            String source,
            String format,
            String quality,
            String folder,
            String namePrefix
    ) {
    }
}
