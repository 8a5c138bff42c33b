package com.sashkomusic.playlistbridge.domain.service.exporting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.playlistbridge.domain.entity.ExportJob;
import com.sashkomusic.playlistbridge.domain.entity.PlaylistSong;
import com.sashkomusic.playlistbridge.domain.entity.UserPlaylist;
import com.sashkomusic.playlistbridge.domain.exception.CatalogException;
import com.sashkomusic.playlistbridge.domain.exception.ExportNotReadyException;
import com.sashkomusic.playlistbridge.domain.model.ExportDownload;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.port.CatalogAdapter;
import com.sashkomusic.playlistbridge.domain.repository.ExportJobRepository;
import com.sashkomusic.playlistbridge.domain.service.codec.CsvFormatHandler;
import com.sashkomusic.playlistbridge.domain.service.codec.FormatDetector;
import com.sashkomusic.playlistbridge.domain.service.codec.JsonFormatHandler;
import com.sashkomusic.playlistbridge.domain.service.codec.M3uFormatHandler;
import com.sashkomusic.playlistbridge.domain.service.codec.PlaylistCodec;
import com.sashkomusic.playlistbridge.domain.service.codec.XspfFormatHandler;
import com.sashkomusic.playlistbridge.domain.service.importing.CatalogAdapterRegistry;
import com.sashkomusic.playlistbridge.domain.service.playlist.PlaylistStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

public class ExportJobServiceTest {

    private static final String USER = "user-1";

    @Mock
    private PlaylistStorageService playlistStorage;

    @Mock
    private CatalogAdapterRegistry adapterRegistry;

    @Mock
    private CatalogAdapter navidrome;

    @Mock
    private ExportJobRepository jobRepository;

    private ExportJobService service;
    private UserPlaylist playlist;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        PlaylistCodec codec = new PlaylistCodec(
                List.of(new M3uFormatHandler(), new XspfFormatHandler(), new JsonFormatHandler(new ObjectMapper()), new CsvFormatHandler()),
                new FormatDetector(),
                Clock.fixed(Instant.parse("2024-03-05T10:15:00Z"), ZoneOffset.UTC));
        service = new ExportJobService(playlistStorage, adapterRegistry, codec, jobRepository);

        playlist = new UserPlaylist(USER, "Chill", "late evenings");
        when(playlistStorage.getPlaylist(USER, playlist.getId())).thenReturn(playlist);
        when(playlistStorage.listSongs(playlist.getId())).thenReturn(List.of(
                new PlaylistSong(playlist.getId(), Platform.NAVIDROME, "nd-1", "Massive Attack - Teardrop", 1),
                new PlaylistSong(playlist.getId(), Platform.NAVIDROME, "nd-2", "Portishead - Roads", 2)));
        when(jobRepository.save(any(ExportJob.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(adapterRegistry.localCatalog()).thenReturn(Optional.of(navidrome));
    }

    @Test
    public void testExportPlaylist_RefreshesFromCatalog() {
        when(navidrome.getByIds(List.of("nd-1", "nd-2"))).thenReturn(List.of(
                new Song("Teardrop", "Massive Attack", "Mezzanine", 330, null, null, Platform.NAVIDROME, "nd-1", null)));

        ExportJob job = service.exportPlaylist(USER, playlist.getId(), PlaylistFormat.M3U, null);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getFilename()).isEqualTo("Chill_2024-03-05.m3u8");
        assertThat(job.getTotalSongs()).isEqualTo(2);
        assertThat(job.getProcessedSongs()).isEqualTo(2);
        assertThat(job.getEnrichedSongs()).isEqualTo(1);
        assertThat(job.getExportedData())
                .contains("#PLAYLIST:Chill")
                .contains("#EXTINF:330,Massive Attack - Teardrop")
                .contains("#EXTALB:Mezzanine")
                .contains("#EXTINF:-1,Portishead - Roads");
    }

    @Test
    public void testExportPlaylist_CatalogDownUsesStoredNames() {
        when(navidrome.getByIds(anyList())).thenThrow(new CatalogException("connection refused"));

        ExportJob job = service.exportPlaylist(USER, playlist.getId(), PlaylistFormat.M3U, null);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getEnrichedSongs()).isZero();
        assertThat(job.getExportedData())
                .contains("#EXTINF:-1,Massive Attack - Teardrop")
                .contains("#EXTPID:navidrome:nd-2");
    }

    @Test
    public void testExportPlaylist_UnexpectedErrorFailsJob() {
        when(navidrome.getByIds(anyList())).thenThrow(new IllegalStateException("adapter closed"));

        ExportJob job = service.exportPlaylist(USER, playlist.getId(), PlaylistFormat.M3U, null);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("adapter closed");
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(job.getExportedData()).isNull();
    }

    @Test
    public void testFromStoredName() {
        PlaylistSong plain = new PlaylistSong("p", Platform.NAVIDROME, "nd-9", "Just A Title", 1);
        PlaylistSong blank = new PlaylistSong("p", Platform.NAVIDROME, "nd-9", " ", 1);
        PlaylistSong dashed = new PlaylistSong("p", Platform.NAVIDROME, "nd-9", "Sigur Rós - Hoppípolla - Live", 1);

        assertThat(ExportJobService.fromStoredName(plain).artist()).isEqualTo(Song.UNKNOWN_ARTIST);
        assertThat(ExportJobService.fromStoredName(plain).title()).isEqualTo("Just A Title");
        assertThat(ExportJobService.fromStoredName(blank).title()).isEqualTo(Song.UNKNOWN_TITLE);
        assertThat(ExportJobService.fromStoredName(dashed).artist()).isEqualTo("Sigur Rós");
        assertThat(ExportJobService.fromStoredName(dashed).title()).isEqualTo("Hoppípolla - Live");
        assertThat(ExportJobService.fromStoredName(dashed).platformId()).isEqualTo("nd-9");
        assertThat(ExportJobService.fromStoredName(dashed).isrc()).isNull();
    }

    @Test
    public void testFromStoredName_CarriesStoredIsrc() {
        PlaylistSong stored = new PlaylistSong("p", Platform.NAVIDROME, "nd-1", "Massive Attack - Teardrop", 1);
        stored.setIsrc("GBAAA9800300");

        assertThat(ExportJobService.fromStoredName(stored).isrc()).isEqualTo("GBAAA9800300");
    }

    @Test
    public void testDownloadExport() {
        ExportJob job = service.exportPlaylist(USER, playlist.getId(), PlaylistFormat.CSV, null);
        when(jobRepository.findByIdAndUserId(job.getId(), USER)).thenReturn(Optional.of(job));

        ExportDownload download = service.downloadExport(USER, job.getId());

        assertThat(download.filename()).isEqualTo("Chill_2024-03-05.csv");
        assertThat(download.mimeType()).isEqualTo("text/csv");
        assertThat(new String(download.content(), StandardCharsets.UTF_8)).contains("Teardrop");
    }

    @Test
    public void testDownloadExport_NotReady() {
        ExportJob job = new ExportJob(USER, playlist.getId(), PlaylistFormat.M3U);
        job.setStatus(JobStatus.PROCESSING);
        when(jobRepository.findByIdAndUserId(job.getId(), USER)).thenReturn(Optional.of(job));

        assertThatThrownBy(() -> service.downloadExport(USER, job.getId()))
                .isInstanceOf(ExportNotReadyException.class)
                .hasMessageContaining("processing");
    }
}
