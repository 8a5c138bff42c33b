package com.sashkomusic.playlistbridge.infrastructure.client.lidarr;

import com.sashkomusic.playlistbridge.config.LidarrConfig;
import com.sashkomusic.playlistbridge.domain.exception.DownloadBackendException;
import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;
import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.port.CatalogManagerPort;
import com.sashkomusic.playlistbridge.domain.service.matching.TextNormalizer;
import com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto.LidarrAlbum;
import com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto.LidarrArtist;
import com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto.LidarrHistoryRecord;
import com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto.LidarrPage;
import com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto.LidarrQueueRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Lidarr v1 API. Queued work is identified as {@code album:<id>} when a single album was
 * requested and {@code artist:<id>} when the whole discography was.
 */
@Slf4j
@Component
public class LidarrClient implements CatalogManagerPort {

    static final String ALBUM_PREFIX = "album:";
    static final String ARTIST_PREFIX = "artist:";
    private static final double ALBUM_TITLE_THRESHOLD = 0.8;
    private static final int PAGE_SIZE = 50;

    private static final ParameterizedTypeReference<List<LidarrArtist>> ARTIST_LIST = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<List<LidarrAlbum>> ALBUM_LIST = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<LidarrPage<LidarrQueueRecord>> QUEUE_PAGE = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<LidarrPage<LidarrHistoryRecord>> HISTORY_PAGE = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;
    private final LidarrConfig config;

    public LidarrClient(RestClient.Builder restClientBuilder, LidarrConfig config) {
        this.restClient = restClientBuilder.build();
        this.config = config;
    }

    @Override
    public List<ArtistCandidate> searchArtist(String term) {
        URI uri = uri("/api/v1/artist/lookup").queryParam("term", term).encode().build().toUri();
        List<LidarrArtist> artists = call("search artist '" + term + "'", () -> restClient.get()
                .uri(uri)
                .header("X-Api-Key", config.getApiKey())
                .retrieve()
                .body(ARTIST_LIST));
        if (artists == null) {
            return List.of();
        }
        return artists.stream()
                .map(artist -> new ArtistCandidate(artist.id(), artist.foreignArtistId(), artist.artistName()))
                .toList();
    }

    @Override
    public String enqueueDownload(CatalogDownloadRequest request) {
        ArtistCandidate artist = request.artist();
        long artistId = artist.isInLibrary() ? artist.id() : addArtist(artist, request.wholeArtist());

        if (!request.wholeArtist() && request.albumTitle() != null) {
            Optional<LidarrAlbum> album = findAlbum(artistId, request.albumTitle());
            if (album.isPresent()) {
                long albumId = album.get().id();
                monitorAlbum(albumId);
                runCommand(Map.of("name", "AlbumSearch", "albumIds", List.of(albumId)));
                log.info("Started Lidarr album search for '{}' by {}", album.get().title(), artist.artistName());
                return ALBUM_PREFIX + albumId;
            }
            log.info("Album '{}' not found for {}, searching whole artist", request.albumTitle(), artist.artistName());
        }

        runCommand(Map.of("name", "ArtistSearch", "artistId", artistId));
        log.info("Started Lidarr artist search for {}", artist.artistName());
        return ARTIST_PREFIX + artistId;
    }

    /**
     * Removes the album's download from the queue. Returns false when nothing is queued for it.
     */
    @Override
    public boolean cancel(String serviceJobId) {
        List<LidarrQueueRecord> records = queueRecords().stream()
                .filter(record -> serviceJobId.equals(albumKey(record.albumId()))
                        || serviceJobId.equals(artistKey(record.artistId())))
                .toList();
        if (records.isEmpty()) {
            return false;
        }

        for (LidarrQueueRecord record : records) {
            URI uri = uri("/api/v1/queue/{id}").queryParam("removeFromClient", true).buildAndExpand(record.id()).toUri();
            call("remove queue item " + record.id(), () -> restClient.delete()
                    .uri(uri)
                    .header("X-Api-Key", config.getApiKey())
                    .retrieve()
                    .toBodilessEntity());
        }
        log.info("Removed {} Lidarr queue item(s) for {}", records.size(), serviceJobId);
        return true;
    }

    @Override
    public List<BackendQueueEntry> getQueue() {
        return queueRecords().stream()
                .map(record -> new BackendQueueEntry(
                        DownloadService.CATALOG_MANAGER,
                        albumKey(record.albumId()),
                        artistKey(record.artistId()),
                        record.title(),
                        queueStatus(record),
                        record.progress(),
                        record.outputPath(),
                        record.errorMessage()))
                .toList();
    }

    /**
     * Latest outcome per album from the most recent history page.
     */
    @Override
    public List<BackendQueueEntry> getHistory() {
        URI uri = uri("/api/v1/history")
                .queryParam("page", 1)
                .queryParam("pageSize", PAGE_SIZE)
                .queryParam("sortKey", "date")
                .queryParam("sortDirection", "descending")
                .build()
                .toUri();
        LidarrPage<LidarrHistoryRecord> page = call("read history", () -> restClient.get()
                .uri(uri)
                .header("X-Api-Key", config.getApiKey())
                .retrieve()
                .body(HISTORY_PAGE));
        if (page == null) {
            return List.of();
        }

        Map<String, BackendQueueEntry> latest = new LinkedHashMap<>();
        for (LidarrHistoryRecord record : page.recordsOrEmpty()) {
            DownloadItemStatus status = historyStatus(record.eventType());
            String key = albumKey(record.albumId());
            if (status == null || key == null || latest.containsKey(key)) {
                continue;
            }
            latest.put(key, new BackendQueueEntry(
                    DownloadService.CATALOG_MANAGER,
                    key,
                    artistKey(record.artistId()),
                    record.sourceTitle(),
                    status,
                    status == DownloadItemStatus.COMPLETED ? 100 : null,
                    record.dataValue("importedPath"),
                    status == DownloadItemStatus.FAILED ? record.dataValue("message") : null));
        }
        return List.copyOf(latest.values());
    }

    @Override
    public boolean isAvailable() {
        if (config.getBaseUrl() == null || config.getApiKey() == null || config.getApiKey().isEmpty()) {
            return false;
        }
        try {
            restClient.get()
                    .uri(uri("/api/v1/system/status").build().toUri())
                    .header("X-Api-Key", config.getApiKey())
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            log.warn("Lidarr is not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public int maxBatchSize() {
        return config.getBatchSize();
    }

    private long addArtist(ArtistCandidate artist, boolean monitorAll) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("foreignArtistId", artist.foreignArtistId());
        body.put("artistName", artist.artistName());
        body.put("qualityProfileId", config.getQualityProfileId());
        body.put("metadataProfileId", config.getMetadataProfileId());
        body.put("rootFolderPath", config.getRootFolderPath());
        body.put("monitored", true);
        body.put("addOptions", Map.of("monitor", monitorAll ? "all" : "none", "searchForMissingAlbums", false));

        LidarrArtist added = call("add artist " + artist.artistName(), () -> restClient.post()
                .uri(uri("/api/v1/artist").build().toUri())
                .header("X-Api-Key", config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(LidarrArtist.class));
        if (added == null || added.id() == null) {
            throw new DownloadBackendException("Lidarr did not return an id for artist " + artist.artistName());
        }
        log.info("Added artist {} to Lidarr (id={})", artist.artistName(), added.id());
        return added.id();
    }

    private Optional<LidarrAlbum> findAlbum(long artistId, String albumTitle) {
        URI uri = uri("/api/v1/album").queryParam("artistId", artistId).build().toUri();
        List<LidarrAlbum> albums = call("list albums of artist " + artistId, () -> restClient.get()
                .uri(uri)
                .header("X-Api-Key", config.getApiKey())
                .retrieve()
                .body(ALBUM_LIST));
        if (albums == null) {
            return Optional.empty();
        }

        String wanted = TextNormalizer.normalizeTitle(albumTitle);
        return albums.stream()
                .filter(album -> album.title() != null)
                .filter(album -> titleSimilarity(wanted, album) >= ALBUM_TITLE_THRESHOLD)
                .max(Comparator.comparingDouble(album -> titleSimilarity(wanted, album)));
    }

    private void monitorAlbum(long albumId) {
        call("monitor album " + albumId, () -> restClient.put()
                .uri(uri("/api/v1/album/monitor").build().toUri())
                .header("X-Api-Key", config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("albumIds", List.of(albumId), "monitored", true))
                .retrieve()
                .toBodilessEntity());
    }

    private void runCommand(Map<String, Object> command) {
        call("run command " + command.get("name"), () -> restClient.post()
                .uri(uri("/api/v1/command").build().toUri())
                .header("X-Api-Key", config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(command)
                .retrieve()
                .toBodilessEntity());
    }

    private List<LidarrQueueRecord> queueRecords() {
        URI uri = uri("/api/v1/queue")
                .queryParam("page", 1)
                .queryParam("pageSize", PAGE_SIZE)
                .build()
                .toUri();
        LidarrPage<LidarrQueueRecord> page = call("read queue", () -> restClient.get()
                .uri(uri)
                .header("X-Api-Key", config.getApiKey())
                .retrieve()
                .body(QUEUE_PAGE));
        return page == null ? List.of() : page.recordsOrEmpty();
    }

    private <T> T call(String action, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientException e) {
            throw new DownloadBackendException("Lidarr failed to " + action + ": " + e.getMessage(), e);
        }
    }

    private UriComponentsBuilder uri(String path) {
        if (config.getBaseUrl() == null) {
            throw new DownloadBackendException("Lidarr URL not configured");
        }
        return UriComponentsBuilder.fromUriString(config.getBaseUrl()).path(path);
    }

    static DownloadItemStatus queueStatus(LidarrQueueRecord record) {
        String tracked = record.trackedDownloadState() == null ? "" : record.trackedDownloadState();
        String status = record.status() == null ? "" : record.status();
        if (tracked.startsWith("failed") || status.equalsIgnoreCase("failed")) {
            return DownloadItemStatus.FAILED;
        }
        if (tracked.equals("imported")) {
            return DownloadItemStatus.COMPLETED;
        }
        if (status.equalsIgnoreCase("downloading") || status.equalsIgnoreCase("completed")
                || tracked.equals("importPending") || tracked.equals("importing")) {
            return DownloadItemStatus.DOWNLOADING;
        }
        return DownloadItemStatus.QUEUED;
    }

    static DownloadItemStatus historyStatus(String eventType) {
        if (eventType == null) {
            return null;
        }
        return switch (eventType) {
            case "downloadImported", "trackFileImported" -> DownloadItemStatus.COMPLETED;
            case "downloadFailed", "albumImportIncomplete" -> DownloadItemStatus.FAILED;
            case "grabbed" -> DownloadItemStatus.DOWNLOADING;
            default -> null;
        };
    }

    private static double titleSimilarity(String wanted, LidarrAlbum album) {
        return TextNormalizer.similarity(wanted, TextNormalizer.normalizeTitle(album.title()));
    }

    private static String albumKey(Long albumId) {
        return albumId == null ? null : ALBUM_PREFIX + albumId;
    }

    private static String artistKey(Long artistId) {
        return artistId == null ? null : ARTIST_PREFIX + artistId;
    }
}
