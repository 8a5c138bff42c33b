package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;
import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadPreferences;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.DownloadRequest;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.port.CatalogManagerPort;
import com.sashkomusic.playlistbridge.domain.port.CatalogManagerPort.ArtistCandidate;
import com.sashkomusic.playlistbridge.domain.port.CatalogManagerPort.CatalogDownloadRequest;
import com.sashkomusic.playlistbridge.domain.service.matching.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogManagerDownloadHandler implements DownloadHandler {

    static final double ARTIST_SIMILARITY_THRESHOLD = 0.8;

    private final CatalogManagerPort catalogManager;

    @Override
    public DownloadService service() {
        return DownloadService.CATALOG_MANAGER;
    }

    @Override
    public int maxBatchSize() {
        return catalogManager.maxBatchSize();
    }

    @Override
    public boolean isAvailable() {
        return catalogManager.isAvailable();
    }

    @Override
    public DownloadQueueItem submit(String itemId, DownloadRequest request, DownloadPreferences preferences) {
        Song song = request.song();
        Optional<ArtistCandidate> artist = resolveArtist(song.artist());
        if (artist.isEmpty()) {
            log.warn("Catalog manager could not resolve artist '{}' for '{}'", song.artist(), song.title());
            return DownloadQueueItem.failed(itemId, song, service(), "Artist not found: " + song.artist());
        }

        boolean wholeArtist = !song.hasAlbum();
        String serviceJobId = catalogManager.enqueueDownload(
                new CatalogDownloadRequest(artist.get(), song.album(), wholeArtist));
        log.info("Queued catalog download for '{}' ({}), serviceJobId={}",
                artist.get().artistName(), wholeArtist ? "all albums" : song.album(), serviceJobId);

        return DownloadQueueItem.builder()
                .id(itemId)
                .songId(song.platformId())
                .title(song.title())
                .artist(song.artist())
                .album(song.album())
                .service(service())
                .status(DownloadItemStatus.QUEUED)
                .serviceJobId(serviceJobId)
                .needsManualOrganization(false)
                .build();
    }

    @Override
    public boolean cancel(String serviceJobId) {
        return catalogManager.cancel(serviceJobId);
    }

    @Override
    public List<BackendQueueEntry> activeEntries() {
        return catalogManager.getQueue();
    }

    @Override
    public List<BackendQueueEntry> finishedEntries() {
        return catalogManager.getHistory();
    }

    private Optional<ArtistCandidate> resolveArtist(String artistName) {
        if (artistName == null || artistName.isBlank() || Song.UNKNOWN_ARTIST.equals(artistName)) {
            return Optional.empty();
        }
        String wanted = TextNormalizer.normalizeArtist(artistName);
        return catalogManager.searchArtist(artistName).stream()
                .filter(candidate -> candidate.artistName() != null)
                .filter(candidate -> similarity(wanted, candidate) >= ARTIST_SIMILARITY_THRESHOLD)
                .max(Comparator.comparingDouble(candidate -> similarity(wanted, candidate)));
    }

    private static double similarity(String wanted, ArtistCandidate candidate) {
        return TextNormalizer.similarity(wanted, TextNormalizer.normalizeArtist(candidate.artistName()));
    }
}
