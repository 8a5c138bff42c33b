package com.sashkomusic.playlistbridge.domain.service.exporting;

import com.sashkomusic.playlistbridge.domain.entity.ExportJob;
import com.sashkomusic.playlistbridge.domain.entity.PlaylistSong;
import com.sashkomusic.playlistbridge.domain.entity.UserPlaylist;
import com.sashkomusic.playlistbridge.domain.exception.CatalogException;
import com.sashkomusic.playlistbridge.domain.exception.ExportNotReadyException;
import com.sashkomusic.playlistbridge.domain.exception.JobNotFoundException;
import com.sashkomusic.playlistbridge.domain.model.ExportDownload;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Playlist;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.RenderOptions;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.port.CatalogAdapter;
import com.sashkomusic.playlistbridge.domain.repository.ExportJobRepository;
import com.sashkomusic.playlistbridge.domain.service.codec.PlaylistCodec;
import com.sashkomusic.playlistbridge.domain.service.importing.CatalogAdapterRegistry;
import com.sashkomusic.playlistbridge.domain.service.playlist.PlaylistStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders stored playlists into downloadable files. Songs are refreshed from the local
 * catalog where possible; an unreachable catalog never fails the export.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportJobService {

    private static final String ARTIST_TITLE_SEPARATOR = " - ";

    private final PlaylistStorageService playlistStorage;
    private final CatalogAdapterRegistry adapterRegistry;
    private final PlaylistCodec codec;
    private final ExportJobRepository jobRepository;

    public ExportJob exportPlaylist(String userId, String playlistId, PlaylistFormat format, RenderOptions options) {
        UserPlaylist playlist = playlistStorage.getPlaylist(userId, playlistId);
        List<PlaylistSong> entries = playlistStorage.listSongs(playlistId);

        ExportJob job = new ExportJob(userId, playlistId, format);
        job.setStatus(JobStatus.PROCESSING);
        job.setStartedAt(Instant.now());
        job.setTotalSongs(entries.size());
        jobRepository.save(job);
        log.info("Started exportJobId={} for playlist '{}' ({} songs) as {}", job.getId(), playlist.getName(),
                entries.size(), format.getValue());

        try {
            Map<String, Song> live = lookupLocal(entries);
            List<Song> songs = new ArrayList<>(entries.size());
            for (PlaylistSong entry : entries) {
                Song song = entry.getPlatform() == Platform.NAVIDROME ? live.get(entry.getSongId()) : null;
                if (song != null && !song.hasIsrc() && entry.getIsrc() != null) {
                    song = song.withDetails(song.album(), song.duration(), entry.getIsrc());
                }
                songs.add(song != null ? song : fromStoredName(entry));
            }

            Playlist rendered = new Playlist(playlist.getName(), playlist.getDescription(), userId,
                    Platform.NAVIDROME, playlist.getCreatedAt(), songs);
            job.setExportedData(codec.render(rendered, format, options != null ? options : RenderOptions.defaults()));
            job.setFilename(codec.exportFilename(playlist.getName(), format));
            job.setProcessedSongs(songs.size());
            job.setEnrichedSongs((int) entries.stream()
                    .filter(entry -> entry.getPlatform() == Platform.NAVIDROME && live.containsKey(entry.getSongId()))
                    .count());
            job.setStatus(JobStatus.COMPLETED);
            job.setCompletedAt(Instant.now());
            log.info("Completed exportJobId={}: {} songs, {} refreshed from catalog", job.getId(),
                    job.getProcessedSongs(), job.getEnrichedSongs());
        } catch (RuntimeException e) {
            log.error("exportJobId={} failed: {}", job.getId(), e.getMessage(), e);
            job.setStatus(JobStatus.FAILED);
            job.setErrorMessage(e.getMessage());
            job.setCompletedAt(Instant.now());
        }
        return jobRepository.save(job);
    }

    public ExportJob getExportJob(String userId, String exportId) {
        return jobRepository.findByIdAndUserId(exportId, userId)
                .orElseThrow(() -> new JobNotFoundException("Export job not found: " + exportId));
    }

    /**
     * Returns the bytes rendered when the export ran.
     */
    public ExportDownload downloadExport(String userId, String exportId) {
        ExportJob job = getExportJob(userId, exportId);
        if (job.getStatus() != JobStatus.COMPLETED || job.getExportedData() == null) {
            throw new ExportNotReadyException("Export " + exportId + " is " + job.getStatus().name().toLowerCase());
        }
        return new ExportDownload(job.getFilename(), job.getFormat().getMimeType(),
                job.getExportedData().getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, Song> lookupLocal(List<PlaylistSong> entries) {
        List<String> ids = entries.stream()
                .filter(entry -> entry.getPlatform() == Platform.NAVIDROME)
                .map(PlaylistSong::getSongId)
                .distinct()
                .toList();
        Optional<CatalogAdapter> catalog = adapterRegistry.localCatalog();
        if (ids.isEmpty() || catalog.isEmpty()) {
            return Map.of();
        }

        try {
            return catalog.get().getByIds(ids).stream()
                    .filter(song -> song.platformId() != null)
                    .collect(Collectors.toMap(Song::platformId, Function.identity(), (a, b) -> a));
        } catch (CatalogException e) {
            log.warn("Catalog unavailable during export, using stored song names: {}", e.getMessage());
            log.debug("Catalog error details", e);
            return Map.of();
        }
    }

    static Song fromStoredName(PlaylistSong entry) {
        String stored = entry.getSongArtistTitle();
        String artist = Song.UNKNOWN_ARTIST;
        String title = stored != null && !stored.isBlank() ? stored.trim() : Song.UNKNOWN_TITLE;

        if (stored != null) {
            int separator = stored.indexOf(ARTIST_TITLE_SEPARATOR);
            if (separator > 0) {
                artist = stored.substring(0, separator).trim();
                title = stored.substring(separator + ARTIST_TITLE_SEPARATOR.length()).trim();
            }
        }
        return Song.of(title, artist)
                .withDetails(null, null, entry.getIsrc())
                .withResolution(entry.getPlatform(), entry.getSongId(), null);
    }
}
