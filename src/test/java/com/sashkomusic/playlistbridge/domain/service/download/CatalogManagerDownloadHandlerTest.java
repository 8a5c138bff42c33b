package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadPreferences;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.DownloadRequest;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.port.CatalogManagerPort;
import com.sashkomusic.playlistbridge.domain.port.CatalogManagerPort.ArtistCandidate;
import com.sashkomusic.playlistbridge.domain.port.CatalogManagerPort.CatalogDownloadRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CatalogManagerDownloadHandlerTest {

    private static final DownloadPreferences PREFERENCES =
            new DownloadPreferences(DownloadService.CATALOG_MANAGER, true, true, "mp3", "best");

    @Mock
    private CatalogManagerPort catalogManager;

    @InjectMocks
    private CatalogManagerDownloadHandler handler;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        when(catalogManager.enqueueDownload(any())).thenReturn("album:42");
    }

    @Test
    public void testSubmit_AlbumDownloadPicksClosestArtist() {
        when(catalogManager.searchArtist("Massive Attack")).thenReturn(List.of(
                new ArtistCandidate(null, "mb-tribute", "Massive Attack Tribute"),
                new ArtistCandidate(null, "mb-typo", "Massive Atack"),
                new ArtistCandidate(7L, "mb-real", "Massive Attack")));
        Song song = new Song("Teardrop", "Massive Attack", "Mezzanine", null, null, null, null, "sp-1", null);

        DownloadQueueItem item = handler.submit("item-1", new DownloadRequest(song, null, true, null, null), PREFERENCES);

        ArgumentCaptor<CatalogDownloadRequest> captor = ArgumentCaptor.forClass(CatalogDownloadRequest.class);
        verify(catalogManager).enqueueDownload(captor.capture());
        assertThat(captor.getValue().artist().foreignArtistId()).isEqualTo("mb-real");
        assertThat(captor.getValue().albumTitle()).isEqualTo("Mezzanine");
        assertThat(captor.getValue().wholeArtist()).isFalse();

        assertThat(item.id()).isEqualTo("item-1");
        assertThat(item.songId()).isEqualTo("sp-1");
        assertThat(item.status()).isEqualTo(DownloadItemStatus.QUEUED);
        assertThat(item.serviceJobId()).isEqualTo("album:42");
        assertThat(item.needsManualOrganization()).isFalse();
    }

    @Test
    public void testSubmit_NoAlbumRequestsWholeArtist() {
        when(catalogManager.searchArtist("Portishead"))
                .thenReturn(List.of(new ArtistCandidate(null, "mb-portishead", "Portishead")));

        handler.submit("item-1", DownloadRequest.of(Song.of("Roads", "Portishead")), PREFERENCES);

        ArgumentCaptor<CatalogDownloadRequest> captor = ArgumentCaptor.forClass(CatalogDownloadRequest.class);
        verify(catalogManager).enqueueDownload(captor.capture());
        assertThat(captor.getValue().wholeArtist()).isTrue();
        assertThat(captor.getValue().albumTitle()).isNull();
    }

    @Test
    public void testSubmit_ArtistNotFound() {
        when(catalogManager.searchArtist("Massive Attack"))
                .thenReturn(List.of(new ArtistCandidate(null, "mb-tribute", "Massive Attack Tribute")));

        DownloadQueueItem item = handler.submit("item-1", DownloadRequest.of(Song.of("Teardrop", "Massive Attack")), PREFERENCES);

        assertThat(item.status()).isEqualTo(DownloadItemStatus.FAILED);
        assertThat(item.error()).isEqualTo("Artist not found: Massive Attack");
        assertThat(item.service()).isEqualTo(DownloadService.CATALOG_MANAGER);
        verify(catalogManager, never()).enqueueDownload(any());
    }

    @Test
    public void testSubmit_UnknownArtistIsNotSearched() {
        DownloadQueueItem item = handler.submit("item-1",
                DownloadRequest.of(Song.of("Track 1", Song.UNKNOWN_ARTIST)), PREFERENCES);

        assertThat(item.status()).isEqualTo(DownloadItemStatus.FAILED);
        verify(catalogManager, never()).searchArtist(anyString());
    }
}
