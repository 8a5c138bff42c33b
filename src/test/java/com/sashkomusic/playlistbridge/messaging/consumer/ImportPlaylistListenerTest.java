package com.sashkomusic.playlistbridge.messaging.consumer;

import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.exception.EmptyPlaylistException;
import com.sashkomusic.playlistbridge.domain.model.ImportRequest;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.service.importing.ImportJobService;
import com.sashkomusic.playlistbridge.messaging.consumer.dto.ImportPlaylistTaskDto;
import com.sashkomusic.playlistbridge.messaging.producer.ImportJobResultProducer;
import com.sashkomusic.playlistbridge.messaging.producer.dto.ImportJobCompleteDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ImportPlaylistListenerTest {

    @Mock
    private ImportJobService importJobService;

    @Mock
    private ImportJobResultProducer resultProducer;

    @InjectMocks
    private ImportPlaylistListener listener;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    public void testHandleImportTask_Accepted() {
        ImportJob job = new ImportJob("user-1", PlaylistFormat.M3U, Platform.NAVIDROME);
        when(importJobService.startImport(any())).thenReturn(job);

        listener.handleImportTask(new ImportPlaylistTaskDto("user-1", "#EXTM3U\n", "m3u", "mix.m3u", null, null, "spotify"));

        ArgumentCaptor<ImportRequest> captor = ArgumentCaptor.forClass(ImportRequest.class);
        verify(importJobService).startImport(captor.capture());
        assertThat(captor.getValue().format()).isEqualTo(PlaylistFormat.M3U);
        assertThat(captor.getValue().targetPlatform()).isEqualTo(Platform.SPOTIFY);
        assertThat(captor.getValue().filename()).isEqualTo("mix.m3u");
        verify(resultProducer, never()).send(any());
    }

    @Test
    public void testHandleImportTask_RejectedTaskIsReported() {
        when(importJobService.startImport(any())).thenThrow(new EmptyPlaylistException("Playlist contains no songs"));

        listener.handleImportTask(new ImportPlaylistTaskDto("user-1", "#EXTM3U\n", null, null, null, "pl-1", null));

        ArgumentCaptor<ImportJobCompleteDto> captor = ArgumentCaptor.forClass(ImportJobCompleteDto.class);
        verify(resultProducer).send(captor.capture());
        assertThat(captor.getValue().jobId()).isNull();
        assertThat(captor.getValue().userId()).isEqualTo("user-1");
        assertThat(captor.getValue().playlistId()).isEqualTo("pl-1");
        assertThat(captor.getValue().status()).isEqualTo(JobStatus.FAILED);
        assertThat(captor.getValue().errorMessage()).isEqualTo("Playlist contains no songs");
    }

    @Test
    public void testHandleImportTask_UnknownFormatIsRejected() {
        listener.handleImportTask(new ImportPlaylistTaskDto("user-1", "x", "wpl", null, null, null, null));

        ArgumentCaptor<ImportJobCompleteDto> captor = ArgumentCaptor.forClass(ImportJobCompleteDto.class);
        verify(resultProducer).send(captor.capture());
        assertThat(captor.getValue().errorMessage()).isEqualTo("Unknown playlist format: wpl");
        verify(importJobService, never()).startImport(any());
    }
}
