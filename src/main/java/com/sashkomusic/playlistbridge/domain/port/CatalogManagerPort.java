package com.sashkomusic.playlistbridge.domain.port;

import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;

import java.util.List;

/**
 * Back-end that manages a monitored music catalog and downloads whole artists or albums.
 */
public interface CatalogManagerPort {

    List<ArtistCandidate> searchArtist(String term);

    /**
     * Adds the artist (if needed) and starts a monitored search.
     *
     * @return the back-end's identifier for the queued work
     */
    String enqueueDownload(CatalogDownloadRequest request);

    boolean cancel(String serviceJobId);

    List<BackendQueueEntry> getQueue();

    List<BackendQueueEntry> getHistory();

    boolean isAvailable();

    int maxBatchSize();

    record ArtistCandidate(
            Long id,
            String foreignArtistId,
            String artistName
    ) {

        public boolean isInLibrary() {
            return id != null && id > 0;
        }
    }

    record CatalogDownloadRequest(
            ArtistCandidate artist,
            String albumTitle,
            boolean wholeArtist
    ) {
    }
}
