package com.sashkomusic.playlistbridge.web;

import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.exception.InvalidJobStateException;
import com.sashkomusic.playlistbridge.domain.exception.JobNotFoundException;
import com.sashkomusic.playlistbridge.domain.model.ImportRequest;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.ReviewDecision;
import com.sashkomusic.playlistbridge.domain.service.importing.ImportJobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ImportControllerTest {

    @Mock
    private ImportJobService importJobService;

    private MockMvc mockMvc;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new ImportController(importJobService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    public void testStartImport_Accepted() throws Exception {
        ImportJob job = new ImportJob("user-1", PlaylistFormat.M3U, Platform.NAVIDROME);
        job.setStatus(JobStatus.PROCESSING);
        job.setTotalSongs(2);
        when(importJobService.startImport(any())).thenReturn(job);

        mockMvc.perform(post("/api/playlists/imports")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content": "#EXTM3U\\nMassive Attack - Teardrop\\n", "format": "m3u", "playlistName": "Chill"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(header().string("Location", endsWith("/api/playlists/imports/" + job.getId())))
                .andExpect(jsonPath("$.id").value(job.getId()))
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.totalSongs").value(2));

        ArgumentCaptor<ImportRequest> captor = ArgumentCaptor.forClass(ImportRequest.class);
        verify(importJobService).startImport(captor.capture());
        assertThat(captor.getValue().userId()).isEqualTo("user-1");
        assertThat(captor.getValue().format()).isEqualTo(PlaylistFormat.M3U);
        assertThat(captor.getValue().playlistName()).isEqualTo("Chill");
    }

    @Test
    public void testStartImport_MissingUserHeader() throws Exception {
        mockMvc.perform(post("/api/playlists/imports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    public void testGetImportJob_NotFound() throws Exception {
        when(importJobService.getImportJob("user-1", "missing"))
                .thenThrow(new JobNotFoundException("Import job not found: missing"));

        mockMvc.perform(get("/api/playlists/imports/missing").header("X-User-Id", "user-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("JOB_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Import job not found: missing"));
    }

    @Test
    public void testFinalizeReview_PassesDecisions() throws Exception {
        ImportJob job = new ImportJob("user-1", PlaylistFormat.M3U, Platform.NAVIDROME);
        when(importJobService.finalizeReview(eq("user-1"), eq(job.getId()), anyList())).thenReturn(job);

        mockMvc.perform(post("/api/playlists/imports/" + job.getId() + "/review")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"decisions": [
                                  {"position": 1, "selection": {"platform": "navidrome", "platformId": "nd-a"}},
                                  {"position": 3}
                                ]}
                                """))
                .andExpect(status().isOk());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ReviewDecision>> captor = ArgumentCaptor.forClass(List.class);
        verify(importJobService).finalizeReview(eq("user-1"), eq(job.getId()), captor.capture());
        assertThat(captor.getValue()).containsExactly(
                ReviewDecision.accept(1, Platform.NAVIDROME, "nd-a"),
                ReviewDecision.decline(3));
    }

    @Test
    public void testFinalizeReview_StillMatching() throws Exception {
        when(importJobService.finalizeReview(eq("user-1"), eq("job-1"), anyList()))
                .thenThrow(new InvalidJobStateException("Matching still in progress (0/2 songs processed)"));

        mockMvc.perform(post("/api/playlists/imports/job-1/review")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_JOB_STATE"));
    }

    @Test
    public void testExportMatchResults() throws Exception {
        when(importJobService.exportMatchResults("user-1", "job-1")).thenReturn("Position,Title\n1,Teardrop\n");

        mockMvc.perform(get("/api/playlists/imports/job-1/results.csv").header("X-User-Id", "user-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=match-results-job-1.csv"))
                .andExpect(content().string("Position,Title\n1,Teardrop\n"));
    }
}
