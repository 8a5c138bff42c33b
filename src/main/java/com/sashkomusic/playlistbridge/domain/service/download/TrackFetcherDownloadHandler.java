package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;
import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadPreferences;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.DownloadRequest;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.port.TrackFetcherPort;
import com.sashkomusic.playlistbridge.domain.port.TrackFetcherPort.FetchRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fetched files land outside the managed library, so every item is flagged for manual organization.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrackFetcherDownloadHandler implements DownloadHandler {

    private static final String WATCH_URL = "https://www.youtube.com/watch?v=";
    private static final String SEARCH_PREFIX = "ytsearch1:";

    private final TrackFetcherPort fetcher;

    @Override
    public DownloadService service() {
        return DownloadService.SINGLE_TRACK_FETCHER;
    }

    @Override
    public int maxBatchSize() {
        return fetcher.maxBatchSize();
    }

    @Override
    public boolean isAvailable() {
        return fetcher.isAvailable();
    }

    @Override
    public DownloadQueueItem submit(String itemId, DownloadRequest request, DownloadPreferences preferences) {
        Song song = request.song();
        String source = source(request);
        String format = request.format() != null ? request.format() : preferences.fetcherFormat();
        String quality = request.quality() != null ? request.quality() : preferences.fetcherQuality();

        String serviceJobId = fetcher.enqueue(new FetchRequest(source, format, quality, null, null));
        log.info("Queued fetch for '{}' from {}", song.displayName(), source);

        return DownloadQueueItem.builder()
                .id(itemId)
                .songId(song.platformId())
                .title(song.title())
                .artist(song.artist())
                .album(song.album())
                .service(service())
                .status(DownloadItemStatus.QUEUED)
                .serviceJobId(serviceJobId)
                .needsManualOrganization(true)
                .build();
    }

    @Override
    public boolean cancel(String serviceJobId) {
        return fetcher.cancel(serviceJobId);
    }

    @Override
    public List<BackendQueueEntry> activeEntries() {
        return fetcher.getQueue();
    }

    @Override
    public List<BackendQueueEntry> finishedEntries() {
        return fetcher.getDone();
    }

    static String source(DownloadRequest request) {
        String videoId = request.sourceVideoId();
        if (videoId != null && !videoId.isBlank()) {
            return videoId.startsWith("http") ? videoId : WATCH_URL + videoId;
        }
        if (isVideoUrl(request.song().url())) {
            return request.song().url();
        }
        return SEARCH_PREFIX + request.song().artist() + " - " + request.song().title();
    }

    /**
     * True for ids of search requests. MeTube tracks those under the video URL it resolved.
     */
    static boolean isSearchSource(String serviceJobId) {
        return serviceJobId != null && serviceJobId.startsWith(SEARCH_PREFIX);
    }

    static boolean hasVideoSource(DownloadRequest request) {
        return (request.sourceVideoId() != null && !request.sourceVideoId().isBlank())
                || isVideoUrl(request.song().url());
    }

    private static boolean isVideoUrl(String url) {
        return url != null && (url.contains("youtube.com/") || url.contains("youtu.be/"));
    }
}
